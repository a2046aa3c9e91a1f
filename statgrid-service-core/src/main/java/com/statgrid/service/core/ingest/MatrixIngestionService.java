package com.statgrid.service.core.ingest;

import com.statgrid.service.core.checkpoint.CheckpointService;
import com.statgrid.service.core.checkpoint.ResyncOptions;
import com.statgrid.service.core.classification.ClassificationResolver;
import com.statgrid.service.core.config.StatgridProperties;
import com.statgrid.service.core.resolve.ClassificationPlacement;
import com.statgrid.service.core.resolve.ContextType;
import com.statgrid.service.core.resolve.LabelRequest;
import com.statgrid.service.core.resolve.LabelResolver;
import com.statgrid.service.core.statistic.StatisticRow;
import com.statgrid.service.core.statistic.StatisticUpsertService;
import com.statgrid.service.core.statistic.UpsertResult;
import com.statgrid.service.core.status.SyncStateRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Syncs a matrix chunk by chunk: resolve every label, upsert the rows, then checkpoint the chunk.
 * A chunk is checkpointed only after its rows are written, so a crash loses at most the chunk in
 * flight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatrixIngestionService {

    private final LabelResolver labelResolver;
    private final ClassificationResolver classificationResolver;
    private final CheckpointService checkpoints;
    private final StatisticUpsertService upserts;
    private final SyncStateRepository syncState;
    private final StatgridProperties properties;
    private final Clock clock;

    public MatrixSyncResult sync(MatrixSyncRequest request, ChunkSource source) {
        long matrixId = request.matrixId();
        upserts.requirePartition(matrixId);

        List<String> typeHints = classificationTypeHints(request.dimensions());
        ResyncOptions resync = request.resync() != null
                ? request.resync()
                : ResyncOptions.maxAge(properties.getIngest().getMaxChunkAge());
        log.info("Syncing matrix {}: {} chunks, resync={}", matrixId, request.chunkSignatures().size(), resync);

        List<ChunkOutcome> outcomes = new ArrayList<>();
        boolean cancelled = false;
        try {
            for (String signature : request.chunkSignatures()) {
                if (request.cancelled().getAsBoolean()) {
                    log.info("Sync of matrix {} cancelled after {} chunks", matrixId, outcomes.size());
                    cancelled = true;
                    break;
                }
                String chunkHash = CheckpointService.chunkHash(signature);
                if (!checkpoints.shouldResync(matrixId, signature, resync)) {
                    outcomes.add(ChunkOutcome.fresh(chunkHash));
                    continue;
                }

                List<RawRow> rows;
                try {
                    rows = source.fetch(matrixId, signature);
                } catch (ChunkFetchException ex) {
                    log.warn(
                            "Fetch failed for chunk {} of matrix {}; checkpoint not advanced: {}",
                            shortHash(chunkHash),
                            matrixId,
                            ex.getMessage());
                    outcomes.add(ChunkOutcome.fetchFailed(chunkHash, ex.getMessage()));
                    if (properties.getIngest().isStopOnFetchFailure()) {
                        break;
                    }
                    continue;
                }

                ChunkOutcome outcome = ingestChunk(request, typeHints, signature, chunkHash, rows);
                outcomes.add(outcome);
            }
        } catch (RuntimeException ex) {
            try {
                recordRun(new MatrixSyncResult(matrixId, request.chunkSignatures().size(), outcomes, false));
            } catch (RuntimeException recordFailure) {
                ex.addSuppressed(recordFailure);
            }
            throw ex;
        }

        MatrixSyncResult result = new MatrixSyncResult(matrixId, request.chunkSignatures().size(), outcomes, cancelled);
        recordRun(result);
        log.info(
                "Finished matrix {}: synced={} fresh={} failed={} rowsWritten={} complete={}",
                matrixId,
                result.count(ChunkOutcome.Status.SYNCED),
                result.count(ChunkOutcome.Status.FRESH),
                result.count(ChunkOutcome.Status.FETCH_FAILED),
                result.rowsWritten(),
                result.complete());
        return result;
    }

    private ChunkOutcome ingestChunk(
            MatrixSyncRequest request, List<String> typeHints, String signature, String chunkHash, List<RawRow> rows) {
        long matrixId = request.matrixId();
        List<DimensionBinding> dimensions = request.dimensions();
        UnresolvedLabelPolicy policy = properties.getIngest().getUnresolvedPolicy();

        List<StatisticRow> statistics = new ArrayList<>(rows.size());
        int skipped = 0;
        int unresolved = 0;
        for (RawRow raw : rows) {
            if (raw.labels().size() != dimensions.size()) {
                log.warn(
                        "Skipping row with {} labels in chunk {} of matrix {}; layout has {} dimensions",
                        raw.labels().size(),
                        shortHash(chunkHash),
                        matrixId,
                        dimensions.size());
                skipped++;
                continue;
            }

            Long territoryId = null;
            Long timePeriodId = null;
            Long unitId = null;
            List<Long> classificationIds = new ArrayList<>();
            boolean missing = false;
            for (int i = 0; i < dimensions.size(); i++) {
                ContextType type = dimensions.get(i).contextType();
                String label = raw.labels().get(i);
                Optional<Long> id = resolve(matrixId, type, typeHints.get(i), label);
                if (id.isEmpty()) {
                    unresolved++;
                    missing = true;
                    if (policy == UnresolvedLabelPolicy.FAIL_CHUNK) {
                        throw new UnresolvedDimensionException(matrixId, type, label);
                    }
                    continue;
                }
                switch (type) {
                    case TERRITORY -> territoryId = id.get();
                    case TIME_PERIOD -> timePeriodId = id.get();
                    case UNIT -> unitId = id.get();
                    case CLASSIFICATION -> classificationIds.add(id.get());
                }
            }
            if (missing && policy == UnresolvedLabelPolicy.SKIP_ROW) {
                skipped++;
                continue;
            }

            ValueParser.ParsedValue value = ValueParser.parse(raw.value());
            statistics.add(new StatisticRow(
                    matrixId,
                    territoryId,
                    timePeriodId,
                    unitId,
                    classificationIds,
                    value.value(),
                    value.status(),
                    chunkHash));
        }

        UpsertResult written = upserts.upsert(matrixId, statistics);
        checkpoints.saveCheckpoint(matrixId, signature, written.written());
        log.info(
                "Chunk {} of matrix {}: fetched={} inserted={} updated={} skipped={} collapsed={} unresolvedLabels={}",
                shortHash(chunkHash),
                matrixId,
                rows.size(),
                written.inserted(),
                written.updated(),
                skipped,
                written.collapsed(),
                unresolved);
        return new ChunkOutcome(
                chunkHash,
                ChunkOutcome.Status.SYNCED,
                rows.size(),
                skipped,
                written.collapsed(),
                unresolved,
                written.inserted(),
                written.updated(),
                null);
    }

    private Optional<Long> resolve(long matrixId, ContextType type, String hint, String label) {
        if (label == null) {
            return Optional.empty();
        }
        return labelResolver.resolve(
                new LabelRequest(type, label, null, hint, matrixId, ClassificationPlacement.ROOT));
    }

    /** Context hint per dimension: the classification type id, null for other dimensions. */
    private List<String> classificationTypeHints(List<DimensionBinding> dimensions) {
        List<String> hints = new ArrayList<>(dimensions.size());
        for (DimensionBinding binding : dimensions) {
            if (binding.contextType() != ContextType.CLASSIFICATION) {
                hints.add(null);
            } else if (binding.classificationTypeId() != null) {
                hints.add(Long.toString(binding.classificationTypeId()));
            } else {
                long typeId = classificationResolver
                        .findOrCreateTypeForDimension(binding.dimensionLabel())
                        .id();
                hints.add(Long.toString(typeId));
            }
        }
        return hints;
    }

    private void recordRun(MatrixSyncResult result) {
        syncState.recordRun(
                result.matrixId(),
                result.complete(),
                clock.instant(),
                (int) result.count(ChunkOutcome.Status.SYNCED),
                (int) result.count(ChunkOutcome.Status.FRESH),
                (int) result.count(ChunkOutcome.Status.FETCH_FAILED),
                result.rowsWritten());
    }

    private static String shortHash(String chunkHash) {
        return chunkHash.substring(0, 12);
    }
}
