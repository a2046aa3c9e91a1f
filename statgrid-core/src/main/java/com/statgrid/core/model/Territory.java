package com.statgrid.core.model;

/** Pre-seeded administrative unit. Read-only for the ingestion core. */
public record Territory(
        long id,
        String code,
        String externalCode,
        TerritoryLevel level,
        Long parentId,
        String path,
        String name,
        String nameNormalized) {}
