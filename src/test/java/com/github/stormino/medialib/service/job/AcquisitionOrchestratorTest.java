package com.github.stormino.medialib.service.job;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.exception.StorageException;
import com.github.stormino.medialib.model.AcquisitionJob;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.model.AttemptOutcome;
import com.github.stormino.medialib.model.FailureKind;
import com.github.stormino.medialib.model.JobState;
import com.github.stormino.medialib.service.credential.CookieJarValidator;
import com.github.stormino.medialib.service.credential.CredentialResolver;
import com.github.stormino.medialib.service.credential.JdbcCredentialStore;
import com.github.stormino.medialib.service.egress.ClientIdentity;
import com.github.stormino.medialib.service.egress.EgressStrategySelector;
import com.github.stormino.medialib.service.registry.GarbageCollector;
import com.github.stormino.medialib.service.registry.JdbcContentRegistry;
import com.github.stormino.medialib.service.registry.LibraryAdmission;
import com.github.stormino.medialib.service.registry.RegistryFixture;
import com.github.stormino.medialib.service.registry.TenantLibrary;
import com.github.stormino.medialib.service.state.JobStateMachine;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import com.github.stormino.medialib.util.AcquisitionConstants;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;

@DisplayName("AcquisitionOrchestrator")
class AcquisitionOrchestratorTest {

    private static final String SOURCE = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
    private static final long TENANT = 1L;

    @TempDir
    Path tempDir;

    private MediaLibraryProperties properties;
    private RegistryFixture fixture;
    private ScriptedRunner runner;
    private JdbcCredentialStore credentialStore;

    @BeforeEach
    void setUp() {
        properties = new MediaLibraryProperties();
        properties.getDownload().setTempPath(tempDir.resolve("tmp").toString());
        properties.getDownload().setArtifactRecheckDelayMs(0);
        properties.getEgress().setRoutes(List.of(route("first"), route("second")));
        fixture = new RegistryFixture(tempDir.resolve("videos"));
        runner = new ScriptedRunner();
        credentialStore = new JdbcCredentialStore(fixture.tenantRepository());
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static MediaLibraryProperties.Route route(String name) {
        MediaLibraryProperties.Route route = new MediaLibraryProperties.Route();
        route.setName(name);
        route.setScheme("http");
        route.setHost(name + ".proxy.local");
        return route;
    }

    private AcquisitionOrchestrator orchestrator() {
        return orchestrator(fixture.libraryAdmission(), fixture.artifactStore());
    }

    private AcquisitionOrchestrator orchestrator(LibraryAdmission admission, ArtifactStore artifactStore) {
        return new AcquisitionOrchestrator(
                properties,
                new EgressStrategySelector(properties),
                runner,
                new CredentialResolver(credentialStore, new CookieJarValidator(), properties),
                fixture.contentRegistry(),
                admission,
                artifactStore,
                new JobStateMachine());
    }

    /**
     * Admission whose registry lets a full collection run on another thread right after the first registration.
     */
    private LibraryAdmission admissionCollectingAfterRegister(List<String> collected) {
        GarbageCollector collector = new GarbageCollector(
                fixture.contentRegistry(), fixture.artifactStore(), fixture.transactionManager());
        AtomicBoolean fired = new AtomicBoolean();
        JdbcContentRegistry registry = new JdbcContentRegistry(fixture.jdbcTemplate(), fixture.transactionManager()) {
            @Override
            public Asset register(String storageKey, String sourceIdentity, String title, Long byteSize) {
                Asset asset = super.register(storageKey, sourceIdentity, title, byteSize);
                if (fired.compareAndSet(false, true)) {
                    collected.addAll(CompletableFuture.supplyAsync(collector::collect).join());
                }
                return asset;
            }
        };
        return new LibraryAdmission(registry, fixture.tenantLibrary(), fixture.transactionManager());
    }

    private static AcquisitionJob newJob() {
        AcquisitionJob job = AcquisitionJob.builder()
                .tenantId(TENANT)
                .sourceIdentity(SOURCE)
                .requestMetadata(Map.of("playlist", "favourites"))
                .build();
        job.setStorageKey(job.getId() + ".mp4");
        return job;
    }

    @Nested
    @DisplayName("ladder")
    class LadderTests {

        @Test
        @DisplayName("should move to the next route after an upstream block")
        void shouldAdvanceAfterUpstreamBlock() {
            runner.thenFail(FailureKind.UPSTREAM_BLOCKED, "ERROR: Sign in to confirm you're not a bot")
                    .thenSucceed("Song");
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState(), job.getErrorMessage());
            assertEquals(2, runner.requests().size());
            assertEquals("first", runner.requests().get(0).getAttempt().getRoute().getName());
            assertEquals("second", runner.requests().get(1).getAttempt().getRoute().getName());
            assertEquals(2, job.getAttemptIndex());
        }

        @Test
        @DisplayName("should retry the same route under another client after a client block")
        void shouldSwapClientAfterClientBlock() {
            runner.thenFail(FailureKind.CLIENT_BLOCKED, "ERROR: HTTP Error 403: Forbidden")
                    .thenSucceed("Song");
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState());
            assertEquals("first", runner.requests().get(1).getAttempt().getRoute().getName());
            assertEquals(ClientIdentity.ANDROID, runner.requests().get(0).getAttempt().getClientIdentity());
            assertEquals(ClientIdentity.WEB, runner.requests().get(1).getAttempt().getClientIdentity());
        }

        @Test
        @DisplayName("should stop at a non-retryable failure")
        void shouldStopAtFatalFailure() {
            runner.thenFail(FailureKind.CONTENT_UNAVAILABLE, "ERROR: Video unavailable");
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.FAILED, job.getState());
            assertEquals("ERROR: Video unavailable", job.getErrorMessage());
            assertEquals(1, runner.requests().size());
            assertTrue(fixture.contentRegistry().findBySource(SOURCE).isEmpty());
        }

        @Test
        @DisplayName("should report the last error once every rung failed")
        void shouldReportExhaustion() {
            runner.thenFail(FailureKind.CONNECTIVITY, "ERROR: Connection refused")
                    .thenFail(FailureKind.TIMEOUT, "Download timeout exceeded (60 min)");
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.FAILED, job.getState());
            assertEquals(AcquisitionConstants.LADDER_EXHAUSTED_PREFIX + "Download timeout exceeded (60 min)",
                    job.getErrorMessage());
            assertNotNull(job.getCompletedAt());
        }
    }

    @Nested
    @DisplayName("retries within a rung")
    class RungRetryTests {

        @Test
        @DisplayName("should fail after the artifact is missing twice")
        void shouldFailOnRepeatedMissingArtifact() {
            runner.thenFail(FailureKind.ARTIFACT_MISSING, AcquisitionConstants.ARTIFACT_MISSING_ERROR)
                    .thenFail(FailureKind.ARTIFACT_MISSING, AcquisitionConstants.ARTIFACT_MISSING_ERROR);
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.FAILED, job.getState());
            assertEquals(AcquisitionConstants.ARTIFACT_MISSING_ERROR, job.getErrorMessage());
            assertEquals(2, runner.requests().size());
            assertEquals("first", runner.requests().get(1).getAttempt().getRoute().getName());
        }

        @Test
        @DisplayName("should accept an artifact that shows up on re-check")
        void shouldAcceptLateArtifact() {
            runner.then(request -> {
                ScriptedRunner.write(request.getOutputFile(), "late");
                return AttemptOutcome.failure(FailureKind.ARTIFACT_MISSING, AcquisitionConstants.ARTIFACT_MISSING_ERROR);
            });
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState());
            assertEquals(1, runner.requests().size());
        }

        @Test
        @DisplayName("should retry an unstartable tool once, then fail")
        void shouldRetryUnavailableToolOnce() {
            runner.thenFail(FailureKind.TOOL_UNAVAILABLE, "Extraction tool not available: no such file")
                    .thenFail(FailureKind.TOOL_UNAVAILABLE, "Extraction tool not available: no such file");
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.FAILED, job.getState());
            assertEquals("Extraction tool not available: no such file", job.getErrorMessage());
            assertEquals(2, runner.requests().size());
        }

        @Test
        @DisplayName("should continue after one unstartable-tool retry succeeds")
        void shouldContinueAfterToolRetry() {
            runner.thenFail(FailureKind.TOOL_UNAVAILABLE, "Extraction tool not available")
                    .thenSucceed(null);
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState());
        }
    }

    @Nested
    @DisplayName("completion")
    class CompletionTests {

        @Test
        @DisplayName("should register the asset and attach it with metadata")
        void shouldRegisterAndAttach() {
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState());
            assertEquals(100.0, job.getProgress(), 0.001);
            assertEquals(job.getStorageKey(), job.getFilename());
            assertNull(job.getWarning());

            Asset asset = fixture.contentRegistry().findBySource(SOURCE).orElseThrow();
            assertEquals(job.getAssetId(), asset.getId());
            assertEquals("Song", asset.getDisplayTitle());
            assertEquals(11L, asset.getByteSize());

            Map<String, Object> metadata = fixture.tenantLibrary().list(TENANT).get(job.getFilename());
            assertEquals("Song", metadata.get("title"));
            assertEquals(SOURCE, metadata.get("url"));
            assertEquals("favourites", metadata.get("playlist"));
        }

        @Test
        @DisplayName("should prefer the requested title")
        void shouldPreferRequestedTitle() {
            runner.thenSucceed("Tool Title");
            AcquisitionJob job = newJob();
            job.setRequestedTitle("My Title");

            orchestrator().execute(job);

            assertEquals("My Title", fixture.tenantLibrary().list(TENANT).get(job.getFilename()).get("title"));
        }

        @Test
        @DisplayName("should keep the container the tool chose")
        void shouldKeepChosenContainer() {
            runner.then(request -> {
                Path mkv = tempDir.resolve("videos").resolve(
                        request.getOutputFile().getFileName().toString().replace(".mp4", ".mkv"));
                return AttemptOutcome.success(ScriptedRunner.write(mkv, "x"), "Song");
            });
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertTrue(job.getFilename().endsWith(".mkv"));
            assertEquals(job.getFilename(), fixture.contentRegistry().findBySource(SOURCE).orElseThrow().getStorageKey());
        }

        @Test
        @DisplayName("should adopt the canonical asset when another job registered the source first")
        void shouldAdoptCanonicalAsset() throws IOException {
            fixture.writeArtifact("canonical.mp4", "winner");
            Asset canonical = fixture.contentRegistry().register("canonical.mp4", SOURCE, "Winner", 6L);
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();
            String ownKey = job.getStorageKey();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState());
            assertEquals("canonical.mp4", job.getFilename());
            assertEquals(canonical.getId(), job.getAssetId());
            assertFalse(fixture.artifactStore().exists(ownKey));
            assertEquals(1, fixture.contentRegistry().referenceCount(canonical.getId()));
        }

        @Test
        @DisplayName("should move the bytes to a registered asset whose bytes went missing")
        void shouldRefillStaleAsset() {
            Asset stale = fixture.contentRegistry().register("stale.mp4", SOURCE, "Old", null);
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();
            String ownKey = job.getStorageKey();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState(), job.getErrorMessage());
            assertEquals(stale.getId(), job.getAssetId());
            assertEquals("stale.mp4", job.getFilename());
            assertTrue(fixture.artifactStore().exists("stale.mp4"));
            assertFalse(fixture.artifactStore().exists(ownKey));
            assertEquals(11L, fixture.contentRegistry().findBySource(SOURCE).orElseThrow().getByteSize());
        }

        @Test
        @DisplayName("should fail and clean up when the bytes cannot be moved to the canonical asset")
        void shouldFailWhenCanonicalStaysEmpty() {
            Asset stale = fixture.contentRegistry().register("canonical.mp4", SOURCE, "Old", null);
            ArtifactStore store = spy(fixture.artifactStore());
            doThrow(new StorageException("disk full", "canonical.mp4", "put"))
                    .when(store).push(eq("canonical.mp4"), any());
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();
            String ownKey = job.getStorageKey();

            orchestrator(fixture.libraryAdmission(), store).execute(job);

            assertEquals(JobState.FAILED, job.getState());
            assertTrue(job.getErrorMessage().startsWith("Storage failure"), job.getErrorMessage());
            assertFalse(fixture.artifactStore().exists(ownKey));
            assertFalse(fixture.artifactStore().exists("canonical.mp4"));
            assertEquals(0, fixture.contentRegistry().referenceCount(stale.getId()));
        }

        @Test
        @DisplayName("should complete with a warning when the upload fails")
        void shouldWarnOnUploadFailure() {
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();
            ArtifactStore store = spy(fixture.artifactStore());
            doThrow(new StorageException("bucket unreachable", job.getStorageKey(), "put"))
                    .when(store).push(eq(job.getStorageKey()), any());

            orchestrator(fixture.libraryAdmission(), store).execute(job);

            assertEquals(JobState.COMPLETE, job.getState(), job.getErrorMessage());
            assertNotNull(job.getWarning());
            assertTrue(job.getWarning().startsWith("Remote storage upload failed"), job.getWarning());
            assertTrue(fixture.artifactStore().exists(job.getStorageKey()));
            assertEquals(1, fixture.contentRegistry().referenceCount(job.getAssetId()));
        }

        @Test
        @DisplayName("should fail but keep the asset registered when the attach fails")
        void shouldFailOnAttachFailure() {
            TenantLibrary failing = mock(TenantLibrary.class);
            doThrow(new RegistrationException("Failed to attach asset to library: disk full", "x", null))
                    .when(failing).attach(anyLong(), anyLong(), any());
            LibraryAdmission admission = new LibraryAdmission(
                    fixture.contentRegistry(), failing, fixture.transactionManager());
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();

            orchestrator(admission, fixture.artifactStore()).execute(job);

            assertEquals(JobState.FAILED, job.getState());
            assertTrue(job.getErrorMessage().startsWith("Failed to save to library"), job.getErrorMessage());
            Asset asset = fixture.contentRegistry().findBySource(SOURCE).orElseThrow();
            assertTrue(fixture.artifactStore().exists(asset.getStorageKey()));
        }

        @Test
        @DisplayName("should not run a job that is no longer queued")
        void shouldSkipTerminalJob() {
            AcquisitionJob job = newJob();
            job.setState(JobState.FAILED);

            orchestrator().execute(job);

            assertTrue(runner.requests().isEmpty());
        }
    }

    @Nested
    @DisplayName("collection during completion")
    class CollectionRaceTests {

        @Test
        @DisplayName("should keep a new asset that a collection sees before the attach")
        void shouldKeepNewAsset() {
            List<String> collected = new ArrayList<>();
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();

            orchestrator(admissionCollectingAfterRegister(collected), fixture.artifactStore()).execute(job);

            assertEquals(JobState.COMPLETE, job.getState(), job.getErrorMessage());
            assertTrue(collected.isEmpty());
            assertTrue(fixture.contentRegistry().findBySource(SOURCE).isPresent());
            assertTrue(fixture.artifactStore().exists(job.getStorageKey()));
            assertEquals(1, fixture.contentRegistry().referenceCount(job.getAssetId()));
        }

        @Test
        @DisplayName("should register under its own key when the stale asset is collected mid-completion")
        void shouldReRegisterCollectedStaleAsset() {
            Asset stale = fixture.contentRegistry().register("stale.mp4", SOURCE, "Old", null);
            List<String> collected = new ArrayList<>();
            runner.thenSucceed("Song");
            AcquisitionJob job = newJob();
            String ownKey = job.getStorageKey();

            orchestrator(admissionCollectingAfterRegister(collected), fixture.artifactStore()).execute(job);

            assertEquals(JobState.COMPLETE, job.getState(), job.getErrorMessage());
            assertEquals(List.of("stale.mp4"), collected);
            assertNotEquals(stale.getId(), job.getAssetId());
            assertEquals(ownKey, job.getFilename());
            assertTrue(fixture.artifactStore().exists(ownKey));
            assertEquals(1, fixture.contentRegistry().referenceCount(job.getAssetId()));
        }
    }

    @Nested
    @DisplayName("credentials")
    class CredentialTests {

        @Test
        @DisplayName("should hand the credential file to credential rungs only and remove it afterwards")
        void shouldUseCredentialFile() throws IOException {
            credentialStore.set(TENANT, "# Netscape HTTP Cookie File\n.youtube.com\tTRUE\t/\tTRUE\t0\tSID\tx\n");
            runner.thenFail(FailureKind.UPSTREAM_BLOCKED, "ERROR: Sign in to confirm your age")
                    .thenSucceed("Song");
            AcquisitionJob job = newJob();

            orchestrator().execute(job);

            assertEquals(JobState.COMPLETE, job.getState());
            assertTrue(runner.requests().get(0).getAttempt().isUseCredential());
            assertTrue(runner.credentialFilePresent().get(0));
            assertFalse(runner.requests().get(1).getAttempt().isUseCredential());
            assertNull(runner.requests().get(1).getCredentialFile());

            Path credentialFile = runner.requests().get(0).getCredentialFile();
            assertFalse(Files.exists(credentialFile));
        }
    }
}
