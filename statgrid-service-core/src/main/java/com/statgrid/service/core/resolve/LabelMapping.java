package com.statgrid.service.core.resolve;

import java.time.Instant;

/** A durable row of label_mappings. */
public record LabelMapping(
        String labelNormalized,
        ContextType contextType,
        String contextHint,
        String labelOriginal,
        Long entityId,
        ResolutionMethod method,
        Double confidence,
        boolean unresolvable,
        String unresolvableReason,
        Long matrixId,
        Instant createdAt,
        Instant resolvedAt) {}
