package com.statgrid.core.model;

/** A category under a {@link ClassificationType}, deduplicated by the hash of its normalized name. */
public record ClassificationValue(
        long id,
        long typeId,
        String code,
        String contentHash,
        String name,
        String nameNormalized,
        Long parentId,
        String path,
        int level,
        int sortOrder) {}
