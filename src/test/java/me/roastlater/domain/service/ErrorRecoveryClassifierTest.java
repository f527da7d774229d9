package me.roastlater.domain.service;

import me.roastlater.domain.exception.CorruptedDataException;
import me.roastlater.domain.exception.InsufficientStorageException;
import me.roastlater.domain.exception.OperationCancelledException;
import me.roastlater.domain.exception.PartialImportExceededException;
import me.roastlater.domain.exception.PreviewNotFoundException;
import me.roastlater.domain.exception.SerializationFailedException;
import me.roastlater.domain.exception.StoreAccessException;
import me.roastlater.domain.exception.VersionMismatchException;
import me.roastlater.domain.model.ErrorClassification;
import me.roastlater.domain.model.ErrorKind;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.OperationContext;
import me.roastlater.domain.model.OperationPhase;
import me.roastlater.domain.model.OperationType;
import me.roastlater.domain.model.RecoveryOption;
import me.roastlater.domain.model.RecoveryStrategy;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.testsupport.TransferFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorRecoveryClassifierTest {

    private static final OperationContext IMPORT_CONTEXT = OperationContext.of(
            OperationType.IMPORT, OperationPhase.PROCESSING_RECORDS, 3, 10, TransferFixtures.NOW);

    private ErrorRecoveryClassifier classifier;

    @BeforeEach
    void setUp() {
        RoastLaterProperties properties = TransferFixtures.properties();
        properties.getTransfer().setRecentErrorCapacity(3);
        classifier = new ErrorRecoveryClassifier(properties);
    }

    private static List<RecoveryStrategy> strategies(List<RecoveryOption> options) {
        return options.stream().map(RecoveryOption::strategy).toList();
    }

    @Test
    void shouldClassifyTransferErrorsWithArguments() {
        ErrorClassification classification = classifier.classify(new InsufficientStorageException(2048, 1024));

        assertEquals(ErrorKind.INSUFFICIENT_STORAGE, classification.kind());
        assertEquals("transfer.error.insufficient_storage", classification.messageKey());
        assertEquals("transfer.error.insufficient_storage.suggestion", classification.recoverySuggestionKey());
        assertEquals(List.of(2048L, 1024L), classification.arguments());
    }

    @Test
    void shouldUnwrapCauseChain() {
        Throwable wrapped = new CompletionException(new IllegalStateException("outer",
                new StoreAccessException("disk gone", new IOException("io"))));

        assertEquals(ErrorKind.STORE_ACCESS, classifier.classify(wrapped).kind());
    }

    @Test
    void shouldClassifyForeignErrorsAsUnknown() {
        ErrorClassification classification = classifier.classify(new IllegalStateException("boom"));

        assertEquals(ErrorKind.UNKNOWN, classification.kind());
        assertEquals(List.of("boom"), classification.arguments());
        assertEquals(List.of("NullPointerException"),
                classifier.classify(new NullPointerException()).arguments());
    }

    @Test
    void shouldRecommendFreeingStorage() {
        List<RecoveryOption> options = classifier.recoveryOptions(new InsufficientStorageException(10, 1), null);

        assertEquals(List.of(RecoveryStrategy.FREE_STORAGE_AND_RETRY, RecoveryStrategy.RETRY,
                RecoveryStrategy.ABORT), strategies(options));
        assertTrue(options.get(0).recommended());
    }

    @Test
    void shouldOnlyOfferAbortWhenExportExceedsSizeLimit() {
        InsufficientStorageException error = InsufficientStorageException.sizeLimitExceeded(4096, 1024);

        ErrorClassification classification = classifier.classify(new CompletionException(error));
        List<RecoveryOption> options = classifier.recoveryOptions(error, null);

        assertEquals(ErrorKind.INSUFFICIENT_STORAGE, classification.kind());
        assertEquals("transfer.error.export_too_large", classification.messageKey());
        assertEquals("transfer.error.export_too_large.suggestion", classification.recoverySuggestionKey());
        assertEquals(List.of(4096L, 1024L), classification.arguments());
        assertEquals(List.of(RecoveryStrategy.ABORT), strategies(options));
        assertTrue(options.get(0).recommended());
    }

    @Test
    void shouldRecommendRetryForTransientFailures() {
        List<Throwable> errors = List.of(
                new SerializationFailedException("x", new IOException()),
                new OperationCancelledException(OperationType.EXPORT, OperationPhase.WRITING),
                new StoreAccessException("x", new IOException()));

        for (Throwable error : errors) {
            List<RecoveryOption> options = classifier.recoveryOptions(error, null);
            assertEquals(List.of(RecoveryStrategy.RETRY, RecoveryStrategy.ABORT), strategies(options));
            assertTrue(options.get(0).recommended());
        }
    }

    @Test
    void shouldOfferSkipForCorruptedDataOnlyWhenPartialImportAllowed() {
        CorruptedDataException error = new CorruptedDataException("contentRecords[2].content", "empty");

        List<RecoveryOption> strict = classifier.recoveryOptions(error, IMPORT_CONTEXT);
        List<RecoveryOption> lenient = classifier.recoveryOptions(error, IMPORT_CONTEXT.withAllowPartialImport(true));
        List<RecoveryOption> noContext = classifier.recoveryOptions(error, null);

        assertEquals(List.of(RecoveryStrategy.ABORT), strategies(strict));
        assertEquals(List.of(RecoveryStrategy.SKIP_AND_CONTINUE, RecoveryStrategy.ABORT), strategies(lenient));
        assertEquals(RecoveryStrategy.SKIP_AND_CONTINUE, lenient.get(0).strategy());
        assertTrue(lenient.get(0).recommended());
        assertEquals(List.of(RecoveryStrategy.ABORT), strategies(noContext));
    }

    @Test
    void shouldOnlyAllowAbortOnVersionMismatch() {
        List<RecoveryOption> options = classifier.recoveryOptions(new VersionMismatchException(3, 2), null);

        assertEquals(List.of(RecoveryStrategy.ABORT), strategies(options));
    }

    @Test
    void shouldRecommendSkipWhenErrorBudgetExceeded() {
        PartialImportExceededException error = new PartialImportExceededException(4, List.of("a"), List.of("b"));

        List<RecoveryOption> options = classifier.recoveryOptions(error, IMPORT_CONTEXT);

        assertEquals(List.of(RecoveryStrategy.SKIP_AND_CONTINUE, RecoveryStrategy.ABORT), strategies(options));
    }

    @Test
    void shouldRecommendAbortForUnknownFailures() {
        List<RecoveryOption> options = classifier.recoveryOptions(new IllegalStateException("?"), null);

        assertEquals(List.of(RecoveryStrategy.ABORT, RecoveryStrategy.RETRY), strategies(options));
        assertTrue(options.get(0).recommended());
    }

    @Test
    void shouldAlwaysRecommendExactlyOneOption() {
        List<Throwable> errors = List.of(
                new InsufficientStorageException(1, 0),
                new CorruptedDataException("$", "x"),
                new VersionMismatchException(5, 2),
                new PreviewNotFoundException("p"),
                new RuntimeException());

        for (Throwable error : errors) {
            List<RecoveryOption> options = classifier.recoveryOptions(error, IMPORT_CONTEXT);
            assertEquals(1, options.stream().filter(RecoveryOption::recommended).count());
        }
    }

    @Test
    void shouldKeepBoundedNewestFirstHistory() {
        for (int i = 1; i <= 5; i++) {
            classifier.report(new PreviewNotFoundException("p" + i), null);
        }

        List<ErrorReport> recent = classifier.recentErrors(10);

        assertEquals(3, recent.size());
        assertEquals(List.of("p5"), recent.get(0).classification().arguments());
        assertEquals(List.of("p3"), recent.get(2).classification().arguments());
        assertEquals(1, classifier.recentErrors(1).size());
    }

    @Test
    void shouldClearRecordedErrors() {
        classifier.report(new PreviewNotFoundException("p1"), null);
        classifier.report(new PreviewNotFoundException("p2"), null);

        assertEquals(2, classifier.clearRecentErrors());
        assertTrue(classifier.recentErrors(10).isEmpty());
        assertEquals(0, classifier.clearRecentErrors());

        classifier.report(new PreviewNotFoundException("p3"), null);
        assertEquals(1, classifier.recentErrors(10).size());
    }

    @Test
    void shouldCarryContextInReport() {
        ErrorReport report = classifier.report(new StoreAccessException("x", new IOException()), IMPORT_CONTEXT);

        assertSame(IMPORT_CONTEXT, report.context());
        assertEquals(RecoveryStrategy.RETRY, report.recommendedOption().strategy());
    }
}
