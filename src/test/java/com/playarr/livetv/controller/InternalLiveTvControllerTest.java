package com.playarr.livetv.controller;

import com.playarr.livetv.dto.SyncResult;
import com.playarr.livetv.dto.UserSyncResult;
import com.playarr.livetv.exception.SyncInProgressException;
import com.playarr.livetv.service.impl.LiveTvSyncJob;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for the manual sync trigger and cancel endpoints.
 */
@ExtendWith(MockitoExtension.class)
class InternalLiveTvControllerTest {

    @Mock
    private LiveTvSyncJob syncJob;

    private SimpleMeterRegistry meterRegistry;
    private InternalLiveTvController controller;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        controller = new InternalLiveTvController(syncJob, meterRegistry);
    }

    @Nested
    class TriggerSyncTests {

        @Test
        void triggerSync_WhenSyncCompletes_Returns200WithPerUserResults() throws Exception {
            // Given
            SyncResult result = new SyncResult(List.of(
                    UserSyncResult.success("alice", 12, 340),
                    UserSyncResult.failure("bob", "Failed to fetch M3U content")), 1500L);
            when(syncJob.runNow()).thenReturn(result);
            MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controller).build();

            // When / Then
            mockMvc.perform(post("/internal/livetv/sync"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.users_processed").value(2))
                    .andExpect(jsonPath("$.results[0].username").value("alice"))
                    .andExpect(jsonPath("$.results[0].channels").value(12))
                    .andExpect(jsonPath("$.results[1].success").value(false))
                    .andExpect(jsonPath("$.results[1].error").value("Failed to fetch M3U content"));
            assertThat(meterRegistry.counter("livetv_manual_sync_total", "action", "trigger").count()).isEqualTo(1.0);
        }

        @Test
        void triggerSync_WhenAlreadyRunning_Returns409() throws Exception {
            // Given
            when(syncJob.runNow()).thenThrow(new SyncInProgressException());
            MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controller).build();

            // When / Then
            mockMvc.perform(post("/internal/livetv/sync"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("SYNC_IN_PROGRESS"));
        }
    }

    @Nested
    class CancelSyncTests {

        @Test
        void cancelSync_WhenRunning_Returns202() {
            // Given
            when(syncJob.cancel()).thenReturn(true);

            // When
            ResponseEntity<Map<String, String>> response = controller.cancelSync();

            // Then
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
            assertThat(response.getBody()).containsEntry("status", "cancelling");
            assertThat(meterRegistry.counter("livetv_manual_sync_total", "action", "cancel").count()).isEqualTo(1.0);
        }

        @Test
        void cancelSync_WhenIdle_Returns404() {
            // Given
            when(syncJob.cancel()).thenReturn(false);

            // When
            ResponseEntity<Map<String, String>> response = controller.cancelSync();

            // Then
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(response.getBody()).containsEntry("status", "idle");
        }
    }
}
