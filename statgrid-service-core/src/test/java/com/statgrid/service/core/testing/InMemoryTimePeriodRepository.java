package com.statgrid.service.core.testing;

import com.statgrid.core.model.TimePeriod;
import com.statgrid.service.core.time.ParsedTimePeriod;
import com.statgrid.service.core.time.TimePeriodRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryTimePeriodRepository implements TimePeriodRepository {

    private final Map<ParsedTimePeriod, TimePeriod> rows = new LinkedHashMap<>();

    @Override
    public synchronized Optional<TimePeriod> find(ParsedTimePeriod period) {
        return Optional.ofNullable(rows.get(period));
    }

    @Override
    public synchronized Optional<TimePeriod> insertIfAbsent(ParsedTimePeriod period, String label, String labelEn) {
        if (rows.containsKey(period)) {
            return Optional.empty();
        }
        TimePeriod row = new TimePeriod(
                rows.size() + 100L,
                period.year(),
                period.quarter(),
                period.month(),
                period.periodicity(),
                label,
                labelEn,
                period.periodStart(),
                period.periodEnd());
        rows.put(period, row);
        return Optional.of(row);
    }

    public synchronized List<TimePeriod> all() {
        return List.copyOf(rows.values());
    }
}
