package com.statgrid.service.core.resolve;

/** Result of a type-specific resolver. {@code entityId} is null when the label is unresolved. */
public record ResolverOutcome(Long entityId, ResolutionMethod method, double confidence, String reason) {

    public static ResolverOutcome resolved(long entityId, ResolutionMethod method) {
        return new ResolverOutcome(entityId, method, 1.0d, null);
    }

    public static ResolverOutcome unresolved(String reason) {
        return new ResolverOutcome(null, null, 0.0d, reason);
    }

    public boolean isResolved() {
        return entityId != null;
    }
}
