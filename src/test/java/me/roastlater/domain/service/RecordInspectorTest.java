package me.roastlater.domain.service;

import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.testsupport.TransferFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordInspectorTest {

    private final RecordInspector inspector = new RecordInspector(TransferFixtures.properties());

    @Test
    void shouldAcceptWellFormedRecord() {
        ContentRecord contentRecord = TransferFixtures.record("r1");

        assertTrue(inspector.isApplicable(contentRecord));
        assertTrue(inspector.inspect(contentRecord, TransferFixtures.NOW).isEmpty());
    }

    @Test
    void shouldRejectBlankContentAndBadIntensity() {
        ContentRecord blank = TransferFixtures.record("r1", "   ", "general", 3);
        ContentRecord tooHot = TransferFixtures.record("r2", "ok", "general", 6);
        ContentRecord tooMild = TransferFixtures.record("r3", "ok", "general", 0);

        assertFalse(inspector.isApplicable(blank));
        assertFalse(inspector.isApplicable(tooHot));
        assertFalse(inspector.isApplicable(tooMild));
        assertTrue(inspector.isApplicable(TransferFixtures.record("r4", "ok", "general", 5)));
        assertTrue(inspector.isApplicable(TransferFixtures.record("r5", "ok", "general", 1)));
    }

    @Test
    void shouldReportEveryAnomaly() {
        ContentRecord contentRecord = TransferFixtures.record("r1", "", "astrology", 9).toBuilder()
                .createdAt(TransferFixtures.NOW.plus(Duration.ofDays(2)))
                .build();

        List<ImportWarning> warnings = inspector.inspect(contentRecord, TransferFixtures.NOW);

        assertEquals(List.of(
                ImportWarningType.EMPTY_CONTENT,
                ImportWarningType.INTENSITY_OUT_OF_RANGE,
                ImportWarningType.UNSUPPORTED_CATEGORY,
                ImportWarningType.FUTURE_TIMESTAMP),
                warnings.stream().map(ImportWarning::type).toList());
        assertEquals("9", warnings.get(1).detail());
        assertEquals("astrology", warnings.get(2).detail());
        assertTrue(warnings.stream().allMatch(warning -> "r1".equals(warning.itemId())));
    }

    @Test
    void shouldTolerateSlightlyFutureTimestamps() {
        ContentRecord contentRecord = TransferFixtures.record("r1").toBuilder()
                .createdAt(TransferFixtures.NOW.plus(Duration.ofHours(23)))
                .build();

        assertTrue(inspector.inspect(contentRecord, TransferFixtures.NOW).isEmpty());
    }

    @Test
    void shouldNormalizeSimilarityKey() {
        ContentRecord first = TransferFixtures.record("a", "  Yet   another MEETING ", "meetings", 2);
        ContentRecord second = TransferFixtures.record("b", "yet another meeting", "meetings", 4);
        ContentRecord otherCategory = TransferFixtures.record("c", "yet another meeting", "general", 4);

        assertEquals(inspector.similarityKey(first), inspector.similarityKey(second));
        assertNotEquals(inspector.similarityKey(first), inspector.similarityKey(otherCategory));
    }
}
