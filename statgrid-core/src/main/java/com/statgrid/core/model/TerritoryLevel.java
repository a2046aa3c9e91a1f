package com.statgrid.core.model;

/** Administrative level of a territory, coarsest first. */
public enum TerritoryLevel {
    NATIONAL,
    NUTS1,
    NUTS2,
    NUTS3,
    LAU
}
