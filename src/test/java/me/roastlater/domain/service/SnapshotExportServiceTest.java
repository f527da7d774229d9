package me.roastlater.domain.service;

import me.roastlater.domain.exception.InsufficientStorageException;
import me.roastlater.domain.exception.OperationCancelledException;
import me.roastlater.domain.exception.StoreAccessException;
import me.roastlater.domain.model.CancellationToken;
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.ErrorKind;
import me.roastlater.domain.model.ExportOptions;
import me.roastlater.domain.model.ExportResult;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.OperationPhase;
import me.roastlater.domain.model.OperationProgress;
import me.roastlater.domain.model.PreferenceKeys;
import me.roastlater.domain.model.RecoveryStrategy;
import me.roastlater.domain.model.Snapshot;
import me.roastlater.domain.model.UsageStatistics;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.port.outbound.StoragePort;
import me.roastlater.testsupport.InMemoryLocalStore;
import me.roastlater.testsupport.TransferFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SnapshotExportServiceTest {

    private static final long PLENTY_OF_SPACE = 1024L * 1024 * 1024;

    private InMemoryLocalStore localStore;
    private StoragePort storagePort;
    private RoastLaterProperties properties;
    private SnapshotCodec codec;
    private ErrorRecoveryClassifier classifier;
    private SnapshotExportService service;

    @BeforeEach
    void setUp() {
        localStore = new InMemoryLocalStore();
        storagePort = mock(StoragePort.class);
        properties = TransferFixtures.properties();
        codec = new SnapshotCodec(TransferFixtures.objectMapper(), new SnapshotMigrationService(),
                TransferFixtures.fixedClock());
        classifier = new ErrorRecoveryClassifier(properties);
        service = new SnapshotExportService(localStore, storagePort, codec, new ContentAnonymizer(properties),
                new RecordInspector(properties), classifier, properties, TransferFixtures.fixedClock());

        when(storagePort.usableSpace(anyString())).thenReturn(CompletableFuture.completedFuture(PLENTY_OF_SPACE));
        when(storagePort.putObjectAtomic(anyString(), anyString(), any(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.restrictToOwner(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(true));
        when(storagePort.deleteObject(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
    }

    private List<OperationProgress<ExportResult>> collect(ExportOptions options, CancellationToken token) {
        List<OperationProgress<ExportResult>> events = new ArrayList<>();
        StepVerifier.create(service.export(options, token).doOnNext(events::add))
                .thenConsumeWhile(event -> true)
                .verifyComplete();
        return events;
    }

    private byte[] writtenPayload() {
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(storagePort).putObjectAtomic(eq("exports"), anyString(), captor.capture(), eq(false));
        return captor.getValue();
    }

    @Test
    void shouldExportRecordsAndFavorites() {
        localStore.withRecords(TransferFixtures.records("r", 42))
                .withFavorites("r1", "r2", "r3", "r4", "r5");

        List<OperationProgress<ExportResult>> events = collect(ExportOptions.defaults(), CancellationToken.create());

        OperationProgress<ExportResult> last = events.get(events.size() - 1);
        assertEquals(OperationPhase.COMPLETED, last.phase());
        assertEquals(1.0, last.progress());
        ExportResult result = last.result();
        Snapshot snapshot = result.snapshot();
        assertEquals(42, snapshot.getContentRecords().size());
        assertEquals(Set.of("r1", "r2", "r3", "r4", "r5"), snapshot.getFavoriteIds());
        assertTrue(snapshot.getContentRecords().get(0).isFavorite());
        assertFalse(snapshot.getContentRecords().get(5).isFavorite());
        assertEquals("1.2.0", snapshot.getAppVersion());
        assertEquals(TransferFixtures.NOW, snapshot.getExportTimestamp());
        assertEquals(SnapshotCodec.CURRENT_SCHEMA_VERSION, snapshot.getSchemaVersion());
        assertNotNull(snapshot.getDeviceInfo());
        assertEquals(42, snapshot.getUsageStatistics().getTotalRecords());
        assertEquals(5, snapshot.getUsageStatistics().getTotalFavorites());
        assertEquals("roastlater-export-20260301-120000-000.json", result.fileName());

        byte[] payload = writtenPayload();
        assertEquals(payload.length, result.sizeBytes());
        assertEquals(snapshot, codec.deserialize(payload));
    }

    @Test
    void shouldReportMonotonicProgressThroughAllPhases() {
        localStore.withRecords(TransferFixtures.records("r", 12)).withFavorites("r1");

        List<OperationProgress<ExportResult>> events = collect(ExportOptions.minimal(), CancellationToken.create());

        double previous = 0.0;
        for (OperationProgress<ExportResult> event : events) {
            assertTrue(event.progress() >= previous, "progress went backwards at " + event.phase());
            previous = event.progress();
        }
        List<OperationPhase> phases = events.stream().map(OperationProgress::phase).distinct().toList();
        assertEquals(List.of(OperationPhase.PREPARING, OperationPhase.COLLECTING_DATA,
                OperationPhase.PROCESSING_RECORDS, OperationPhase.PROCESSING_FAVORITES,
                OperationPhase.PROCESSING_PREFERENCES, OperationPhase.GENERATING_METADATA,
                OperationPhase.SERIALIZING, OperationPhase.WRITING, OperationPhase.COMPLETED), phases);
        assertEquals(1, events.stream().filter(OperationProgress::isTerminal).count());
    }

    @Test
    void shouldExportEmptyStore() {
        List<OperationProgress<ExportResult>> events = collect(ExportOptions.defaults(), CancellationToken.create());

        ExportResult result = events.get(events.size() - 1).result();
        assertTrue(result.snapshot().getContentRecords().isEmpty());
        assertTrue(result.snapshot().getFavoriteIds().isEmpty());
        assertEquals(0, result.snapshot().getUsageStatistics().getTotalRecords());
    }

    @Test
    void shouldStripCredentialsUnlessRequested() {
        localStore.withRecords(List.of(TransferFixtures.record("r1")))
                .withPreference(PreferenceKeys.API_KEY, "sk-secret")
                .withPreference(PreferenceKeys.API_MODEL, "roast-large")
                .withPreference(PreferenceKeys.LANGUAGE, "vi");

        List<OperationProgress<ExportResult>> withoutCredentials = collect(ExportOptions.defaults(),
                CancellationToken.create());
        List<OperationProgress<ExportResult>> withCredentials = collect(new ExportOptions(true, false, false, false),
                CancellationToken.create());

        Snapshot stripped = withoutCredentials.get(withoutCredentials.size() - 1).result().snapshot();
        assertFalse(stripped.getPreferences().containsKey(PreferenceKeys.API_KEY));
        assertFalse(stripped.getPreferences().containsKey(PreferenceKeys.API_MODEL));
        assertEquals("vi", stripped.getPreferences().get(PreferenceKeys.LANGUAGE));

        Snapshot full = withCredentials.get(withCredentials.size() - 1).result().snapshot();
        assertEquals("sk-secret", full.getPreferences().get(PreferenceKeys.API_KEY));
        assertNull(full.getDeviceInfo());
        assertNull(full.getUsageStatistics());
    }

    @Test
    void shouldAnonymizeContentWhenRequested() {
        localStore.withRecords(List.of(TransferFixtures.record("r1", "Ping bob@corp.io again", "general", 2)));

        List<OperationProgress<ExportResult>> events = collect(ExportOptions.secure(), CancellationToken.create());

        ContentRecord exported = events.get(events.size() - 1).result().snapshot().getContentRecords().get(0);
        assertEquals("Ping [EMAIL] again", exported.getContent());
        assertEquals("Ping bob@corp.io again", localStore.readAllRecords().get(0).getContent());
    }

    @Test
    void shouldDropFavoritesOfMissingRecords() {
        localStore.withRecords(List.of(TransferFixtures.record("r1"))).withFavorites("r1", "ghost");

        List<OperationProgress<ExportResult>> events = collect(ExportOptions.minimal(), CancellationToken.create());

        assertEquals(Set.of("r1"), events.get(events.size() - 1).result().snapshot().getFavoriteIds());
    }

    @Test
    void shouldFailWithoutWritingWhenStorageIsLow() {
        localStore.withRecords(TransferFixtures.records("r", 10));
        when(storagePort.usableSpace(anyString())).thenReturn(CompletableFuture.completedFuture(100L));

        List<OperationProgress<ExportResult>> events = new ArrayList<>();
        StepVerifier.create(service.export(ExportOptions.defaults(), CancellationToken.create())
                .doOnNext(events::add))
                .thenConsumeWhile(event -> true)
                .verifyError(InsufficientStorageException.class);

        OperationProgress<ExportResult> last = events.get(events.size() - 1);
        assertEquals(OperationPhase.FAILED, last.phase());
        assertEquals(ErrorKind.INSUFFICIENT_STORAGE, last.failure().classification().kind());
        assertEquals(OperationPhase.WRITING, last.failure().context().phase());
        assertEquals(RecoveryStrategy.FREE_STORAGE_AND_RETRY, last.failure().recommendedOption().strategy());
        verify(storagePort, never()).putObjectAtomic(anyString(), anyString(), any(), anyBoolean());
        assertEquals(1, classifier.recentErrors(10).size());
    }

    @Test
    void shouldRejectPayloadAboveMaximumFileSize() {
        localStore.withRecords(TransferFixtures.records("r", 10));
        properties.getTransfer().setMaxFileSizeBytes(100);

        StepVerifier.create(service.export(ExportOptions.defaults(), CancellationToken.create()))
                .thenConsumeWhile(event -> !event.isTerminal())
                .assertNext(event -> {
                    assertEquals(OperationPhase.FAILED, event.phase());
                    assertEquals(ErrorKind.INSUFFICIENT_STORAGE, event.failure().classification().kind());
                    assertEquals("transfer.error.export_too_large", event.failure().classification().messageKey());
                    assertEquals(100L, event.failure().classification().arguments().get(1));
                    assertEquals(1, event.failure().options().size());
                    assertEquals(RecoveryStrategy.ABORT, event.failure().recommendedOption().strategy());
                })
                .verifyErrorSatisfies(error -> assertTrue(
                        assertInstanceOf(InsufficientStorageException.class, error).isSizeLimit()));

        verify(storagePort, never()).putObjectAtomic(anyString(), anyString(), any(), anyBoolean());
    }

    @Test
    void shouldMapWriteFailureToInsufficientStorage() {
        localStore.withRecords(TransferFixtures.records("r", 2));
        when(storagePort.putObjectAtomic(anyString(), anyString(), any(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));

        StepVerifier.create(service.export(ExportOptions.defaults(), CancellationToken.create()))
                .thenConsumeWhile(event -> !event.isTerminal())
                .assertNext(event -> assertEquals(OperationPhase.FAILED, event.phase()))
                .verifyError(InsufficientStorageException.class);
    }

    @Test
    void shouldRestrictExportFileToOwner() {
        localStore.withRecords(TransferFixtures.records("r", 2));

        List<OperationProgress<ExportResult>> events = collect(ExportOptions.defaults(), CancellationToken.create());

        String fileName = events.get(events.size() - 1).result().fileName();
        verify(storagePort).restrictToOwner("exports", fileName);
        verify(storagePort, never()).deleteObject(anyString(), anyString());
    }

    @Test
    void shouldCompleteWhenFilesystemHasNoPermissions() {
        localStore.withRecords(TransferFixtures.records("r", 2));
        when(storagePort.restrictToOwner(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(false));

        List<OperationProgress<ExportResult>> events = collect(ExportOptions.defaults(), CancellationToken.create());

        assertEquals(OperationPhase.COMPLETED, events.get(events.size() - 1).phase());
        verify(storagePort, never()).deleteObject(anyString(), anyString());
    }

    @Test
    void shouldRemoveExportThatCannotBeRestricted() {
        localStore.withRecords(TransferFixtures.records("r", 2));
        when(storagePort.restrictToOwner(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("denied"))));

        StepVerifier.create(service.export(ExportOptions.defaults(), CancellationToken.create()))
                .thenConsumeWhile(event -> !event.isTerminal())
                .assertNext(event -> {
                    assertEquals(OperationPhase.FAILED, event.phase());
                    assertEquals(ErrorKind.STORE_ACCESS, event.failure().classification().kind());
                })
                .verifyError(StoreAccessException.class);

        verify(storagePort).deleteObject(eq("exports"), eq("roastlater-export-20260301-120000-000.json"));
    }

    @Test
    void shouldStopWhenCancelledBeforeStart() {
        localStore.withRecords(TransferFixtures.records("r", 3));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        StepVerifier.create(service.export(ExportOptions.defaults(), token))
                .assertNext(event -> {
                    assertEquals(OperationPhase.FAILED, event.phase());
                    assertEquals(ErrorKind.OPERATION_CANCELLED, event.failure().classification().kind());
                })
                .verifyError(OperationCancelledException.class);

        verifyNoInteractions(storagePort);
    }

    @Test
    void shouldStopWhenCancelledMidway() {
        localStore.withRecords(TransferFixtures.records("r", 20));
        CancellationToken token = CancellationToken.create();

        StepVerifier.create(service.export(ExportOptions.defaults(), token)
                .doOnNext(event -> {
                    if (event.phase() == OperationPhase.PROCESSING_RECORDS && event.itemsProcessed() >= 10) {
                        token.cancel();
                    }
                }))
                .thenConsumeWhile(event -> !event.isTerminal())
                .assertNext(event -> {
                    assertEquals(OperationPhase.FAILED, event.phase());
                    assertEquals(OperationPhase.PROCESSING_RECORDS, event.failure().context().phase());
                    assertEquals(10, event.itemsProcessed());
                })
                .verifyError(OperationCancelledException.class);

        verify(storagePort, never()).putObjectAtomic(anyString(), anyString(), any(), anyBoolean());
    }

    @Test
    void shouldEstimateSizeFromRecordCount() {
        assertEquals(3072, service.estimateExportSize());

        localStore.withRecords(TransferFixtures.records("r", 4));

        assertEquals(4 * 500 + 3072, service.estimateExportSize());
    }

    @Test
    void shouldValidateLocalData() {
        localStore.withRecords(List.of(
                TransferFixtures.record("r1"),
                TransferFixtures.record("r2", " ", "general", 3),
                TransferFixtures.record("r3", "ok", "horoscopes", 7)))
                .withFavorites("r1", "missing");

        List<ImportWarning> warnings = service.validateLocalData();

        assertEquals(List.of(ImportWarningType.EMPTY_CONTENT, ImportWarningType.INTENSITY_OUT_OF_RANGE,
                ImportWarningType.UNSUPPORTED_CATEGORY, ImportWarningType.ORPHAN_FAVORITE),
                warnings.stream().map(ImportWarning::type).toList());
        assertEquals("missing", warnings.get(3).itemId());
    }

    @Test
    void shouldComputeUsageStatistics() {
        List<ContentRecord> records = List.of(
                TransferFixtures.record("a", "x", "meetings", 2),
                TransferFixtures.record("b", "y", "deadlines", 4),
                TransferFixtures.record("c", "z", "meetings", 3).toBuilder()
                        .createdAt(TransferFixtures.NOW.minusSeconds(7200)).build());

        UsageStatistics statistics = SnapshotExportService.statistics(records, Set.of("a"));

        assertEquals(3, statistics.getTotalRecords());
        assertEquals(1, statistics.getTotalFavorites());
        assertEquals(3.0, statistics.getAverageIntensity());
        assertEquals("meetings", statistics.getMostPopularCategory());
        assertEquals(2, statistics.getCategoryBreakdown().get("meetings"));
        assertEquals(TransferFixtures.NOW.minusSeconds(7200), statistics.getEarliestRecord());
        assertEquals(TransferFixtures.NOW.minusSeconds(3600), statistics.getLatestRecord());
    }
}
