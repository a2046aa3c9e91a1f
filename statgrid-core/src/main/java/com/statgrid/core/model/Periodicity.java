package com.statgrid.core.model;

public enum Periodicity {
    ANNUAL,
    QUARTERLY,
    MONTHLY
}
