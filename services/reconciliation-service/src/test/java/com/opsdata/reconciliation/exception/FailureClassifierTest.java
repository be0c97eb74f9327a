package com.opsdata.reconciliation.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.opsdata.reconciliation.domain.FailureCode;
import java.io.IOException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

class FailureClassifierTest {

    @Test
    @DisplayName("failures map to their codes")
    void classifiesFailures() {
        assertThat(FailureClassifier.classify(new RowValidationException("bad row"))).isEqualTo(FailureCode.ROW_VALIDATION);
        assertThat(FailureClassifier.classify(new IntegrityConstraintException("second shipment")))
            .isEqualTo(FailureCode.INTEGRITY_CONSTRAINT);
        assertThat(FailureClassifier.classify(new DataIntegrityViolationException("duplicate key")))
            .isEqualTo(FailureCode.INTEGRITY_CONSTRAINT);
        assertThat(FailureClassifier.classify(new QueryTimeoutException("timed out"))).isEqualTo(FailureCode.STORAGE_ERROR);
        assertThat(FailureClassifier.classify(new CannotCreateTransactionException("no connection")))
            .isEqualTo(FailureCode.STORAGE_ERROR);
        assertThat(FailureClassifier.classify(new SourceReadException("unreadable", new IOException("eof"))))
            .isEqualTo(FailureCode.SOURCE_READ);
        assertThat(FailureClassifier.classify(new IllegalStateException("boom"))).isEqualTo(FailureCode.PROCESSING_ERROR);
    }

    @Test
    void describesDataAccessFailuresByRootCause() {
        DataIntegrityViolationException ex =
            new DataIntegrityViolationException("could not execute statement", new SQLException("unique violation on lot_id"));

        assertThat(FailureClassifier.describe(ex)).isEqualTo("unique violation on lot_id");
    }

    @Test
    void truncatesLongAndBlankMessages() {
        assertThat(FailureClassifier.truncate("x".repeat(1000))).hasSize(400);
        assertThat(FailureClassifier.truncate("  ")).isEqualTo("unknown");
        assertThat(FailureClassifier.truncate(null)).isEqualTo("unknown");
    }
}
