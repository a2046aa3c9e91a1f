package com.statgrid.service.core.unit;

import com.statgrid.core.model.UnitOfMeasure;
import java.util.Optional;

public interface UnitRepository {

    Optional<UnitOfMeasure> findByCode(String code);

    /** Returns the created unit, or empty when the code already exists. */
    Optional<UnitOfMeasure> insertIfAbsent(String code, String name, String symbol, String sourceLabel);

    /** Records another source label for the unit; no-op when already known. */
    void addSourceLabel(long unitId, String sourceLabel);
}
