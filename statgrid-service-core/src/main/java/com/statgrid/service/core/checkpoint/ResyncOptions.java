package com.statgrid.service.core.checkpoint;

import java.time.Duration;

/**
 * @param maxAge null means a synced chunk never expires
 */
public record ResyncOptions(boolean forceRefresh, Duration maxAge) {

    public static final ResyncOptions DEFAULT = new ResyncOptions(false, null);

    public static ResyncOptions force() {
        return new ResyncOptions(true, null);
    }

    public static ResyncOptions maxAge(Duration maxAge) {
        return new ResyncOptions(false, maxAge);
    }
}
