package com.statgrid.service.core.resolve;

/** Where a newly created classification value sits in its type's tree. */
public record ClassificationPlacement(Long parentId, int level, int sortOrder) {

    public static final ClassificationPlacement ROOT = new ClassificationPlacement(null, 0, 0);
}
