package com.statgrid.service.core.ingest;

import com.statgrid.service.core.resolve.ContextType;
import java.util.Objects;

/**
 * How one label column of a matrix is resolved. A classification column names its type either by
 * id or by the dimension heading, from which the type is inferred.
 */
public record DimensionBinding(ContextType contextType, String dimensionLabel, Long classificationTypeId) {

    public DimensionBinding {
        Objects.requireNonNull(contextType, "contextType");
        if (contextType == ContextType.CLASSIFICATION && dimensionLabel == null && classificationTypeId == null) {
            throw new IllegalArgumentException("Classification dimension needs a type id or a dimension label");
        }
    }

    public static DimensionBinding territory() {
        return new DimensionBinding(ContextType.TERRITORY, null, null);
    }

    public static DimensionBinding timePeriod() {
        return new DimensionBinding(ContextType.TIME_PERIOD, null, null);
    }

    public static DimensionBinding unit() {
        return new DimensionBinding(ContextType.UNIT, null, null);
    }

    public static DimensionBinding classification(String dimensionLabel) {
        return new DimensionBinding(ContextType.CLASSIFICATION, dimensionLabel, null);
    }

    public static DimensionBinding classification(long typeId) {
        return new DimensionBinding(ContextType.CLASSIFICATION, null, typeId);
    }
}
