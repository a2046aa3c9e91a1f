package com.statgrid.core.model;

public record ClassificationType(long id, String code, String name, boolean hierarchical) {}
