package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.exception.InvalidSourceException;
import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.model.AcquisitionJob;
import com.github.stormino.medialib.model.AcquisitionResult;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.model.JobState;
import com.github.stormino.medialib.model.JobStatus;
import com.github.stormino.medialib.service.job.AcquisitionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("AcquisitionController")
class AcquisitionControllerTest {

    private static final String TENANT = "X-Tenant-Id";
    private static final String BODY = "{\"url\": \"https://youtu.be/dQw4w9WgXcQ\", \"title\": \"Song\"}";

    private AcquisitionService acquisitionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        acquisitionService = mock(AcquisitionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AcquisitionController(acquisitionService)).build();
    }

    @Nested
    @DisplayName("POST /api/download")
    class AcquireTests {

        @Test
        @DisplayName("should answer 202 with a job id for new content")
        void shouldAcceptJob() throws Exception {
            AcquisitionJob job = AcquisitionJob.builder().id("job-1").tenantId(1L).build();
            when(acquisitionService.acquire(eq(1L), eq("https://youtu.be/dQw4w9WgXcQ"), eq("Song"), isNull()))
                    .thenReturn(AcquisitionResult.jobCreated(job));

            mockMvc.perform(post("/api/download").header(TENANT, "1")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.jobId").value("job-1"))
                    .andExpect(jsonPath("$.dedup").value(false))
                    .andExpect(jsonPath("$.filename").doesNotExist());
        }

        @Test
        @DisplayName("should answer 200 with the file on a dedup hit")
        void shouldReturnDedupHit() throws Exception {
            Asset asset = Asset.builder().id(5L).storageKey("abc.mp4").displayTitle("Song").build();
            when(acquisitionService.acquire(anyLong(), any(), any(), any()))
                    .thenReturn(AcquisitionResult.dedupHit(asset, "Song"));

            mockMvc.perform(post("/api/download").header(TENANT, "2")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.dedup").value(true))
                    .andExpect(jsonPath("$.filename").value("abc.mp4"))
                    .andExpect(jsonPath("$.jobId").doesNotExist());
        }

        @Test
        @DisplayName("should answer 400 for a rejected URL")
        void shouldRejectBadUrl() throws Exception {
            when(acquisitionService.acquire(anyLong(), eq("not-a-url"), any(), any()))
                    .thenThrow(new InvalidSourceException("URL must be an absolute http(s) URL", "not-a-url"));

            mockMvc.perform(post("/api/download").header(TENANT, "1")
                            .contentType(MediaType.APPLICATION_JSON).content("{\"url\": \"not-a-url\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("should answer 500 when a dedup hit cannot be attached")
        void shouldReportAttachFailure() throws Exception {
            when(acquisitionService.acquire(anyLong(), any(), any(), any()))
                    .thenThrow(new RegistrationException("Failed to attach asset to library: disk full", "abc.mp4", null));

            mockMvc.perform(post("/api/download").header(TENANT, "1")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isInternalServerError());
        }

        @Test
        @DisplayName("should answer 401 without a tenant")
        void shouldRequireTenant() throws Exception {
            mockMvc.perform(post("/api/download")
                            .contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isUnauthorized());
            verifyNoInteractions(acquisitionService);
        }
    }

    @Nested
    @DisplayName("GET /api/download/{jobId}")
    class StatusTests {

        @Test
        @DisplayName("should return the job status")
        void shouldReturnStatus() throws Exception {
            JobStatus status = JobStatus.builder()
                    .jobId("job-1")
                    .state(JobState.RUNNING)
                    .progress(42.0)
                    .title("Song")
                    .build();
            when(acquisitionService.getJobStatus(1L, "job-1")).thenReturn(Optional.of(status));

            mockMvc.perform(get("/api/download/job-1").header(TENANT, "1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("RUNNING"))
                    .andExpect(jsonPath("$.progress").value(42.0))
                    .andExpect(jsonPath("$.title").value("Song"));
        }

        @Test
        @DisplayName("should answer 404 for another tenant's job")
        void shouldHideForeignJob() throws Exception {
            when(acquisitionService.getJobStatus(2L, "job-1")).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/download/job-1").header(TENANT, "2"))
                    .andExpect(status().isNotFound());
        }
    }
}
