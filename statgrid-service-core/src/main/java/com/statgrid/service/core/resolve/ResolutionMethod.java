package com.statgrid.service.core.resolve;

/** Audit tag recorded with each mapping. Never influences resolution. */
public enum ResolutionMethod {
    EXACT,
    PATTERN,
    FUZZY,
    MANUAL,
    CODE
}
