package com.statgrid.service.core.resolve;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.statgrid.core.label.LabelNormalizer;
import com.statgrid.service.core.config.StatgridProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Translates free-text labels into canonical entity ids.
 *
 * <p>Lookup order is in-process cache, then the durable {@code label_mappings} table, then the
 * {@link EntityResolver} registered for the context type. Every outcome reaching the resolver,
 * unresolved ones included, is persisted with insert-or-ignore; when another writer got there
 * first its row is adopted, so all callers converge on the first recorded outcome for a key.
 *
 * <p>The in-process cache is a Caffeine cache and may be shared by concurrent sync jobs.
 */
@Service
@Slf4j
public class LabelResolver {

    static final String NO_MATCH_REASON = "No matching pattern found";

    private final LabelMappingRepository mappings;
    private final Map<ContextType, EntityResolver> resolvers = new EnumMap<>(ContextType.class);
    private final Clock clock;
    private final Cache<CacheKey, Resolution> cache;

    public LabelResolver(
            LabelMappingRepository mappings,
            List<EntityResolver> entityResolvers,
            StatgridProperties properties,
            Clock clock) {
        this.mappings = mappings;
        this.clock = clock;
        for (EntityResolver resolver : entityResolvers) {
            EntityResolver previous = resolvers.put(resolver.contextType(), resolver);
            if (previous != null) {
                throw new IllegalStateException("Duplicate resolver for context type " + resolver.contextType());
            }
        }
        int cacheSize = properties.getResolution().getCacheSize();
        this.cache = Caffeine.newBuilder().maximumSize(cacheSize).recordStats().build();
        log.info("Initialized label resolver for {} with cache size={}", resolvers.keySet(), cacheSize);
    }

    public Optional<Long> resolve(LabelRequest request) {
        String normalized = LabelNormalizer.normalize(request.label());
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        CacheKey key = new CacheKey(request.contextType(), request.contextHintKey(), normalized);

        Resolution cached = cache.getIfPresent(key);
        if (cached != null) {
            return Optional.ofNullable(cached.entityId());
        }

        Optional<LabelMapping> persisted = mappings.find(normalized, key.contextType(), key.contextHint());
        if (persisted.isPresent()) {
            Resolution resolution = Resolution.of(persisted.get());
            cache.put(key, resolution);
            return Optional.ofNullable(resolution.entityId());
        }

        EntityResolver resolver = resolvers.get(request.contextType());
        if (resolver == null) {
            throw new IllegalStateException("No resolver registered for context type " + request.contextType());
        }
        ResolverOutcome outcome = resolver.resolve(request);
        if (!outcome.isResolved()) {
            log.debug(
                    "Unresolved {} label '{}' (hint='{}'): {}",
                    request.contextType(),
                    request.label(),
                    key.contextHint(),
                    outcome.reason());
        }

        Resolution resolution = persist(key, request, outcome);
        cache.put(key, resolution);
        return Optional.ofNullable(resolution.entityId());
    }

    public Optional<Long> resolveTerritory(String label, String alternativeLabel) {
        return resolve(new LabelRequest(ContextType.TERRITORY, label, alternativeLabel, null, null, null));
    }

    public Optional<Long> resolveTimePeriod(String label, String alternativeLabel) {
        return resolve(new LabelRequest(ContextType.TIME_PERIOD, label, alternativeLabel, null, null, null));
    }

    public Optional<Long> resolveUnit(String label) {
        return resolve(LabelRequest.of(ContextType.UNIT, label));
    }

    public Optional<Long> resolveClassification(
            long typeId, String label, String alternativeLabel, ClassificationPlacement placement) {
        return resolve(new LabelRequest(
                ContextType.CLASSIFICATION, label, alternativeLabel, Long.toString(typeId), null, placement));
    }

    /** Drops the in-process cache only; durable mappings stay. */
    public void clearCache() {
        cache.invalidateAll();
    }

    /** Deletes the durable mappings first written for a matrix, then drops the in-process cache. */
    public int clearMappingsForMatrix(long matrixId) {
        int deleted = mappings.deleteByMatrix(matrixId);
        cache.invalidateAll();
        log.info("Cleared {} label mappings for matrix {}", deleted, matrixId);
        return deleted;
    }

    long cachedEntries() {
        return cache.estimatedSize();
    }

    private Resolution persist(CacheKey key, LabelRequest request, ResolverOutcome outcome) {
        Instant now = clock.instant();
        boolean resolved = outcome.isResolved();
        LabelMapping mapping = new LabelMapping(
                key.labelNormalized(),
                key.contextType(),
                key.contextHint(),
                request.label(),
                outcome.entityId(),
                outcome.method(),
                resolved ? outcome.confidence() : null,
                !resolved,
                resolved ? null : reasonOf(outcome),
                request.matrixId(),
                now,
                resolved ? now : null);

        boolean inserted;
        try {
            inserted = mappings.insertIfAbsent(mapping);
        } catch (DuplicateKeyException ex) {
            // Concurrent writer on the same key.
            inserted = false;
        }
        if (inserted) {
            return Resolution.of(mapping);
        }
        return mappings.find(key.labelNormalized(), key.contextType(), key.contextHint())
                .map(Resolution::of)
                .orElseGet(() -> Resolution.of(mapping));
    }

    private static String reasonOf(ResolverOutcome outcome) {
        return outcome.reason() == null ? NO_MATCH_REASON : outcome.reason();
    }

    record CacheKey(ContextType contextType, String contextHint, String labelNormalized) {}

    /** Cached outcome. Caffeine cannot hold nulls, so a negative result is a null id. */
    record Resolution(Long entityId) {
        static Resolution of(LabelMapping mapping) {
            return new Resolution(mapping.unresolvable() ? null : mapping.entityId());
        }
    }
}
