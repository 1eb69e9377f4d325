package com.loanmatch.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Batch ids as issued by ingestion: 1-50 chars of letters, digits, '_' and '-'.
 */
@Component
public class BatchIdValidator {

    private static final Pattern BATCH_ID = Pattern.compile("^[A-Za-z0-9_-]{1,50}$");

    public boolean isValid(String batchId) {
        if (batchId == null || batchId.isBlank()) return false;
        return BATCH_ID.matcher(batchId.trim()).matches();
    }
}
