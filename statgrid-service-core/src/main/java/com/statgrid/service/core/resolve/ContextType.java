package com.statgrid.service.core.resolve;

/** Kind of canonical entity a label is resolved to. Persisted by name in label_mappings. */
public enum ContextType {
    TERRITORY,
    TIME_PERIOD,
    CLASSIFICATION,
    UNIT
}
