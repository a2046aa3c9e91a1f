package com.statgrid.controller.admin;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.statgrid.service.core.checkpoint.CheckpointService;
import com.statgrid.service.core.checkpoint.MatrixCheckpoint;
import com.statgrid.service.core.resolve.LabelResolver;
import com.statgrid.service.core.statistic.MissingPartitionException;
import com.statgrid.service.core.status.MatrixSyncStatus;
import com.statgrid.service.core.status.SyncStatusService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SyncAdminControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final SyncStatusService statusService = mock(SyncStatusService.class);
    private final CheckpointService checkpointService = mock(CheckpointService.class);
    private final LabelResolver labelResolver = mock(LabelResolver.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        SyncAdminController controller = new SyncAdminController(statusService, checkpointService, labelResolver);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new AdminErrorHandler(Clock.fixed(NOW, ZoneOffset.UTC)))
                .build();
    }

    @Test
    void returnsStatus() throws Exception {
        when(statusService.status(1234L)).thenReturn(new MatrixSyncStatus(1234L, NOW, null, 3, 120, NOW, NOW));

        mvc.perform(get("/admin/sync/matrices/1234"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matrixId").value(1234))
                .andExpect(jsonPath("$.chunkCount").value(3))
                .andExpect(jsonPath("$.totalRows").value(120));
    }

    @Test
    void listsCheckpoints() throws Exception {
        when(checkpointService.getMatrixCheckpoints(1234L))
                .thenReturn(List.of(new MatrixCheckpoint(1234L, "a".repeat(64), "1,2:3", NOW, 10)));

        mvc.perform(get("/admin/sync/matrices/1234/checkpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].chunkSignature").value("1,2:3"))
                .andExpect(jsonPath("$[0].rowCount").value(10));
    }

    @Test
    void forceResyncReportsClearedCheckpoints() throws Exception {
        when(statusService.forceResync(1234L)).thenReturn(7);

        mvc.perform(post("/admin/sync/matrices/1234/resync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clearedCheckpoints").value(7));
    }

    @Test
    void clearsLabelMappingsOfMatrix() throws Exception {
        when(labelResolver.clearMappingsForMatrix(1234L)).thenReturn(42);

        mvc.perform(delete("/admin/sync/matrices/1234/label-mappings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedMappings").value(42));
    }

    @Test
    void nonPositiveMatrixIdIsBadRequest() throws Exception {
        mvc.perform(post("/admin/sync/matrices/0/resync"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/admin/sync/matrices/0/resync"));
        verifyNoInteractions(statusService);
    }

    @Test
    void missingPartitionIsConflict() throws Exception {
        when(statusService.status(99L)).thenThrow(new MissingPartitionException(99L));

        mvc.perform(get("/admin/sync/matrices/99"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"))
                .andExpect(jsonPath("$.matrixId").value(99));
    }

    @Test
    void databaseFailureIsServiceUnavailable() throws Exception {
        when(statusService.status(5L)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mvc.perform(get("/admin/sync/matrices/5"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Database unavailable"));
    }
}
