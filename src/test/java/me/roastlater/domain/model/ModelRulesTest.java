package me.roastlater.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ModelRulesTest {

    @Test
    void shouldDescribePreferenceChanges() {
        assertEquals("language: en → vi", new PreferenceChange("language", "en", "vi").description());
        assertEquals("theme: ∅ → dark", new PreferenceChange("theme", null, "dark").description());
        assertEquals("kpis: [a, b] → [c]",
                new PreferenceChange("kpis", List.of("a", "b"), List.of("c")).description());
    }

    @Test
    void shouldPickRecommendedRecoveryOption() {
        ErrorReport report = new ErrorReport(ErrorClassification.of(ErrorKind.INSUFFICIENT_STORAGE), null, List.of(
                RecoveryOption.of(RecoveryStrategy.RETRY, false),
                RecoveryOption.of(RecoveryStrategy.FREE_STORAGE_AND_RETRY, true)));

        assertEquals(RecoveryStrategy.FREE_STORAGE_AND_RETRY, report.recommendedOption().strategy());
    }

    @Test
    void shouldFailWithoutRecommendedOption() {
        ErrorReport report = new ErrorReport(ErrorClassification.of(ErrorKind.UNKNOWN), null,
                List.of(RecoveryOption.of(RecoveryStrategy.ABORT, false)));

        assertThrows(IllegalStateException.class, report::recommendedOption);
    }

    @Test
    void shouldRequireAcknowledgementOnlyForHighSeverity() {
        ComplianceIssue low = new ComplianceIssue(ComplianceIssueType.DEVICE_INFO_INCLUDED, Severity.LOW, "d", "r");
        ComplianceIssue high = new ComplianceIssue(ComplianceIssueType.SENSITIVE_DATA_INCLUDED, Severity.HIGH,
                "d", "r");
        PrivacyNotice notice = new PrivacyNotice(List.of(), List.of(), List.of());

        assertFalse(new ComplianceReport(notice, List.of(low)).requiresAcknowledgement());
        assertTrue(new ComplianceReport(notice, List.of(low, high)).requiresAcknowledgement());
    }

    @Test
    void shouldClampProgressAndDeriveMessageKeys() {
        OperationProgress<ImportResult> progress = OperationProgress.of(OperationType.IMPORT,
                OperationPhase.SAVING, 1.7, 3, 3);

        assertEquals(1.0, progress.progress());
        assertEquals("transfer.import.phase.saving", progress.messageKey());
        assertFalse(progress.isTerminal());
        assertTrue(OperationProgress.completed(OperationType.EXPORT, null, 0).isTerminal());
        assertEquals("transfer.error.version_mismatch.suggestion", ErrorKind.VERSION_MISMATCH.suggestionKey());
    }

    @Test
    void shouldCopyCollectionsDefensively() {
        List<ImportWarning> warnings = new ArrayList<>();
        ImportResult result = new ImportResult(ImportStrategy.MERGE, 1, 0, 0, 0, 0, warnings, Instant.EPOCH);
        warnings.add(ImportWarning.of(ImportWarningType.DUPLICATE_RECORD, "1"));

        assertTrue(result.warnings().isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> result.warnings().add(ImportWarning.of(ImportWarningType.DUPLICATE_RECORD, "2")));
    }

    @Test
    void shouldBuildMessageKeysIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("transfer.error.version_mismatch", ErrorKind.VERSION_MISMATCH.messageKey());
            assertEquals("transfer.error.insufficient_storage.suggestion",
                    ErrorKind.INSUFFICIENT_STORAGE.suggestionKey());
            assertEquals("transfer.recovery.skip_and_continue.title", RecoveryStrategy.SKIP_AND_CONTINUE.titleKey());
            assertEquals("transfer.import.phase.processing_records",
                    OperationPhase.PROCESSING_RECORDS.messageKey(OperationType.IMPORT));
            assertEquals("transfer.validation.phase.validating",
                    OperationPhase.VALIDATING.messageKey(OperationType.VALIDATION));
            assertEquals("transfer.warning.intensity_out_of_range",
                    ImportWarningType.INTENSITY_OUT_OF_RANGE.messageKey());
            assertEquals("transfer.category.device_info", DataCategory.DEVICE_INFO.messageKey());
        } finally {
            Locale.setDefault(original);
        }
    }
}
