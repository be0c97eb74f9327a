package com.opsdata.reconciliation.exception;

import com.opsdata.reconciliation.domain.FailureCode;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.TransactionException;

public final class FailureClassifier {

    private static final int MAX_MESSAGE_LENGTH = 400;

    private FailureClassifier() {
    }

    public static FailureCode classify(Throwable error) {
        if (error instanceof RowValidationException) {
            return FailureCode.ROW_VALIDATION;
        }
        if (error instanceof IntegrityConstraintException || error instanceof DataIntegrityViolationException) {
            return FailureCode.INTEGRITY_CONSTRAINT;
        }
        if (error instanceof StorageException
            || error instanceof DataAccessException
            || error instanceof TransactionException) {
            return FailureCode.STORAGE_ERROR;
        }
        if (error instanceof SourceReadException) {
            return FailureCode.SOURCE_READ;
        }
        return FailureCode.PROCESSING_ERROR;
    }

    public static String describe(Throwable error) {
        String message = error.getMessage();
        if (error instanceof DataAccessException dataAccess && dataAccess.getMostSpecificCause() != error) {
            message = dataAccess.getMostSpecificCause().getMessage();
        }
        return truncate(message);
    }

    public static String truncate(String text) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= MAX_MESSAGE_LENGTH ? text : text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
