package com.statgrid.core.model;

import java.util.List;

public record UnitOfMeasure(long id, String code, String name, String symbol, List<String> sourceLabels) {
    public UnitOfMeasure {
        sourceLabels = sourceLabels == null ? List.of() : List.copyOf(sourceLabels);
    }
}
