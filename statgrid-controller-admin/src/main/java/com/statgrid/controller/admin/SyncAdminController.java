package com.statgrid.controller.admin;

import com.statgrid.service.core.checkpoint.CheckpointService;
import com.statgrid.service.core.checkpoint.MatrixCheckpoint;
import com.statgrid.service.core.resolve.LabelResolver;
import com.statgrid.service.core.status.MatrixSyncStatus;
import com.statgrid.service.core.status.SyncStatusService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operational endpoints for matrix sync state. */
@RestController
@RequestMapping("/admin/sync/matrices")
@RequiredArgsConstructor
@Slf4j
public class SyncAdminController {

    private final SyncStatusService statusService;
    private final CheckpointService checkpointService;
    private final LabelResolver labelResolver;

    @GetMapping("/{matrixId}")
    public MatrixSyncStatus status(@PathVariable long matrixId) {
        return statusService.status(requireValid(matrixId));
    }

    @GetMapping("/{matrixId}/checkpoints")
    public List<MatrixCheckpoint> checkpoints(@PathVariable long matrixId) {
        return checkpointService.getMatrixCheckpoints(requireValid(matrixId));
    }

    @PostMapping("/{matrixId}/resync")
    public ResyncResponse forceResync(@PathVariable long matrixId) {
        int cleared = statusService.forceResync(requireValid(matrixId));
        log.info("Force resync requested for matrix {} ({} checkpoints cleared)", matrixId, cleared);
        return new ResyncResponse(matrixId, cleared);
    }

    @DeleteMapping("/{matrixId}/label-mappings")
    public MappingsClearedResponse clearLabelMappings(@PathVariable long matrixId) {
        int deleted = labelResolver.clearMappingsForMatrix(requireValid(matrixId));
        return new MappingsClearedResponse(matrixId, deleted);
    }

    private static long requireValid(long matrixId) {
        if (matrixId <= 0) {
            throw new IllegalArgumentException("matrixId must be positive: " + matrixId);
        }
        return matrixId;
    }

    public record ResyncResponse(long matrixId, int clearedCheckpoints) {}

    public record MappingsClearedResponse(long matrixId, int deletedMappings) {}
}
