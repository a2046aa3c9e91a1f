package com.statgrid.service.core.checkpoint;

import java.time.Instant;

public record CheckpointInfo(Instant lastSyncedAt, long rowCount) {}
