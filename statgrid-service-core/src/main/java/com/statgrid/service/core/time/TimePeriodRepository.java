package com.statgrid.service.core.time;

import com.statgrid.core.model.TimePeriod;
import java.util.Optional;

public interface TimePeriodRepository {

    Optional<TimePeriod> find(ParsedTimePeriod period);

    /** Creates the row unless an equal period exists; returns the created row only. */
    Optional<TimePeriod> insertIfAbsent(ParsedTimePeriod period, String label, String labelEn);
}
