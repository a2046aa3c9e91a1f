package com.statgrid.service.core.resolve;

/**
 * Resolves a label of one {@link ContextType} to a canonical entity id. Implementations may create
 * rows, except for territories which are lookup-only.
 */
public interface EntityResolver {

    ContextType contextType();

    ResolverOutcome resolve(LabelRequest request);
}
