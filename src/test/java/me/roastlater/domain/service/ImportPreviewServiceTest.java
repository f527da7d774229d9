package me.roastlater.domain.service;

import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.DeviceInfo;
import me.roastlater.domain.model.ImportPreview;
import me.roastlater.domain.model.ImportSummary;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.ParsedSnapshot;
import me.roastlater.domain.model.PreferenceChange;
import me.roastlater.domain.model.PreferenceKeys;
import me.roastlater.domain.model.Snapshot;
import me.roastlater.testsupport.InMemoryLocalStore;
import me.roastlater.testsupport.TransferFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImportPreviewServiceTest {

    private InMemoryLocalStore localStore;
    private ImportPreviewService service;

    @BeforeEach
    void setUp() {
        localStore = new InMemoryLocalStore();
        service = new ImportPreviewService(localStore, new RecordInspector(TransferFixtures.properties()),
                TransferFixtures.properties(), TransferFixtures.fixedClock());
    }

    private static ParsedSnapshot parsed(Snapshot snapshot) {
        return new ParsedSnapshot(snapshot, SnapshotCodec.CURRENT_SCHEMA_VERSION, true, List.of());
    }

    private static List<ImportWarning> warningsOf(ImportPreview preview, ImportWarningType type) {
        return preview.warnings().stream().filter(warning -> warning.type() == type).toList();
    }

    @Test
    void shouldSummarizeNewAndDuplicateRecords() {
        localStore.withRecords(TransferFixtures.records("r", 10)).withFavorites("r1");
        List<ContentRecord> incoming = new ArrayList<>(TransferFixtures.records("r", 10).subList(7, 10));
        incoming.addAll(List.of(
                TransferFixtures.record("n1", "Fresh roast one", "deadlines", 2),
                TransferFixtures.record("n2", "Fresh roast two", "kpis", 3),
                TransferFixtures.record("n3", "Fresh roast three", "kpis", 4),
                TransferFixtures.record("n4", "Fresh roast four", "kpis", 5)));

        ImportPreview preview = service.buildPreview(parsed(TransferFixtures.snapshot(incoming, "r1", "n1")));

        ImportSummary summary = preview.summary();
        assertEquals(7, summary.totalRecords());
        assertEquals(4, summary.newRecords());
        assertEquals(3, summary.duplicateRecords());
        assertEquals(0, summary.likelyDuplicateRecords());
        assertEquals(0, summary.invalidRecords());
        assertEquals(2, summary.totalFavorites());
        assertEquals(1, summary.newFavorites());
        assertEquals(Map.of("deadlines", 1, "kpis", 3), summary.categoryBreakdown());

        List<ImportWarning> duplicates = warningsOf(preview, ImportWarningType.DUPLICATE_RECORD);
        assertEquals(1, duplicates.size());
        assertEquals("3", duplicates.get(0).detail());
        assertNotNull(preview.previewId());
        assertEquals(TransferFixtures.NOW, preview.createdAt());
        assertTrue(preview.compatible());
    }

    @Test
    void shouldNotTouchTheStore() {
        localStore.withRecords(TransferFixtures.records("r", 2)).withPreference(PreferenceKeys.LANGUAGE, "en");
        Snapshot snapshot = TransferFixtures.snapshot(TransferFixtures.records("x", 3),
                new LinkedHashSet<>(List.of("x1")), Map.of(PreferenceKeys.LANGUAGE, "vi"));

        service.buildPreview(parsed(snapshot));

        assertEquals(2, localStore.readAllRecords().size());
        assertTrue(localStore.readFavoriteIds().isEmpty());
        assertEquals("en", localStore.readPreferences().get(PreferenceKeys.LANGUAGE));
        assertTrue(localStore.getUpsertBatchSizes().isEmpty());
    }

    @Test
    void shouldDetectLikelyDuplicateWithinSnapshot() {
        Snapshot snapshot = TransferFixtures.snapshot(List.of(
                TransferFixtures.record("a", "Another sprint, another fire", "deadlines", 3),
                TransferFixtures.record("b", "  another SPRINT,   another fire ", "deadlines", 4),
                TransferFixtures.record("c", "Another sprint, another fire", "meetings", 4)));

        ImportPreview preview = service.buildPreview(parsed(snapshot));

        assertEquals(1, preview.summary().likelyDuplicateRecords());
        List<ImportWarning> likely = warningsOf(preview, ImportWarningType.LIKELY_DUPLICATE);
        assertEquals("b", likely.get(0).itemId());
        assertEquals("a", likely.get(0).detail());
    }

    @Test
    void shouldDetectLikelyDuplicateOfRecentLocalRecord() {
        ContentRecord local = TransferFixtures.record("local-1", "Standup ran 45 minutes", "meetings", 3);
        ContentRecord old = TransferFixtures.record("local-2", "Budget review again", "meetings", 3).toBuilder()
                .createdAt(TransferFixtures.NOW.minusSeconds(86_400)).build();
        localStore.withRecords(List.of(local, old));

        Snapshot snapshot = TransferFixtures.snapshot(List.of(
                TransferFixtures.record("remote-1", "standup ran 45 minutes", "meetings", 2).toBuilder()
                        .createdAt(local.getCreatedAt().plusSeconds(120)).build(),
                TransferFixtures.record("remote-2", "Budget review again", "meetings", 2)));

        ImportPreview preview = service.buildPreview(parsed(snapshot));

        List<ImportWarning> likely = warningsOf(preview, ImportWarningType.LIKELY_DUPLICATE);
        assertEquals(1, likely.size());
        assertEquals("remote-1", likely.get(0).itemId());
        assertEquals("local-1", likely.get(0).detail());
        assertEquals(2, preview.summary().newRecords());
    }

    @Test
    void shouldCountInvalidRecordsWithoutFailing() {
        Snapshot snapshot = TransferFixtures.snapshot(List.of(
                TransferFixtures.record("ok"),
                TransferFixtures.record("empty", "", "general", 3),
                TransferFixtures.record("hot", "too spicy", "general", 11)));

        ImportPreview preview = service.buildPreview(parsed(snapshot));

        assertEquals(2, preview.summary().invalidRecords());
        assertTrue(preview.hasWarnings(ImportWarningType.EMPTY_CONTENT));
        assertEquals("11", warningsOf(preview, ImportWarningType.INTENSITY_OUT_OF_RANGE).get(0).detail());
    }

    @Test
    void shouldFlagOrphanFavoritesAndCredentials() {
        localStore.withRecords(List.of(TransferFixtures.record("local")));
        Map<String, Object> preferences = new LinkedHashMap<>();
        preferences.put(PreferenceKeys.API_KEY, "sk-123");
        preferences.put(PreferenceKeys.API_BASE_URL, "https://roast.example");
        Snapshot snapshot = TransferFixtures.snapshot(List.of(TransferFixtures.record("r1")),
                new LinkedHashSet<>(List.of("r1", "local", "ghost")), preferences);

        ImportPreview preview = service.buildPreview(parsed(snapshot));

        List<ImportWarning> orphans = warningsOf(preview, ImportWarningType.ORPHAN_FAVORITE);
        assertEquals(1, orphans.size());
        assertEquals("ghost", orphans.get(0).itemId());
        assertEquals("2", warningsOf(preview, ImportWarningType.CREDENTIALS_INCLUDED).get(0).detail());
    }

    @Test
    void shouldKeepParserWarningsFirstAndDescribeSource() {
        Snapshot snapshot = TransferFixtures.snapshot(List.of(TransferFixtures.record("r1"))).toBuilder()
                .deviceInfo(DeviceInfo.builder().platform("Android").osVersion("14").appBuild("0.9").build())
                .build();
        ParsedSnapshot parsed = new ParsedSnapshot(snapshot, 1, false, List.of(
                ImportWarning.of(ImportWarningType.SCHEMA_VERSION_MISMATCH, "1->2")));

        ImportPreview preview = service.buildPreview(parsed);

        assertFalse(preview.compatible());
        assertEquals(ImportWarningType.SCHEMA_VERSION_MISMATCH, preview.warnings().get(0).type());
        assertEquals(1, preview.source().schemaVersion());
        assertEquals("1.2.0", preview.source().appVersion());
        assertEquals("Android", preview.source().deviceInfo().getPlatform());
    }

    @Test
    void shouldListChangedPreferencesAndMaskCredentials() {
        Map<String, Object> local = new LinkedHashMap<>();
        local.put(PreferenceKeys.LANGUAGE, "en");
        local.put(PreferenceKeys.DEFAULT_INTENSITY, 3);
        local.put(PreferenceKeys.API_KEY, "sk-old");
        Map<String, Object> incoming = new LinkedHashMap<>();
        incoming.put(PreferenceKeys.LANGUAGE, "vi");
        incoming.put(PreferenceKeys.DEFAULT_INTENSITY, 3);
        incoming.put(PreferenceKeys.API_KEY, "sk-new");
        incoming.put(PreferenceKeys.PREFERRED_CATEGORIES, List.of("kpis", "meetings"));

        List<PreferenceChange> changes = ImportPreviewService.preferenceChanges(local, incoming);

        assertEquals(3, changes.size());
        assertEquals("language: en → vi", changes.get(0).description());
        assertEquals(new PreferenceChange(PreferenceKeys.API_KEY, "***", "***"), changes.get(1));
        assertEquals("categories.preferred: ∅ → [kpis, meetings]", changes.get(2).description());
    }
}
