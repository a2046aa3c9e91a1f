package com.statgrid.service.core.testing;

import com.statgrid.core.model.UnitOfMeasure;
import com.statgrid.service.core.unit.UnitRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryUnitRepository implements UnitRepository {

    private final Map<String, UnitOfMeasure> byCode = new LinkedHashMap<>();

    @Override
    public synchronized Optional<UnitOfMeasure> findByCode(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    @Override
    public synchronized Optional<UnitOfMeasure> insertIfAbsent(
            String code, String name, String symbol, String sourceLabel) {
        if (byCode.containsKey(code)) {
            return Optional.empty();
        }
        UnitOfMeasure unit = new UnitOfMeasure(byCode.size() + 500L, code, name, symbol, List.of(sourceLabel));
        byCode.put(code, unit);
        return Optional.of(unit);
    }

    @Override
    public synchronized void addSourceLabel(long unitId, String sourceLabel) {
        byCode.replaceAll((code, unit) -> {
            if (unit.id() != unitId || unit.sourceLabels().contains(sourceLabel)) {
                return unit;
            }
            List<String> labels = new ArrayList<>(unit.sourceLabels());
            labels.add(sourceLabel);
            return new UnitOfMeasure(unit.id(), unit.code(), unit.name(), unit.symbol(), labels);
        });
    }

    public synchronized List<UnitOfMeasure> all() {
        return List.copyOf(byCode.values());
    }
}
