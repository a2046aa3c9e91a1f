package com.statgrid.service.core.statistic;

public record BatchCounts(int inserted, int updated) {

    public int total() {
        return inserted + updated;
    }
}
