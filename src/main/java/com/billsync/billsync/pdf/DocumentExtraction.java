package com.billsync.billsync.pdf;

import java.time.LocalDateTime;

/**
 * Pass/fail record for one bill document. {@code psid} is set only on {@link ExtractionStatus#SUCCESS}.
 */
public record DocumentExtraction(
        String fileName,
        String fullPath,
        String psid,
        ExtractionStatus status,
        String detail,
        LocalDateTime processedAt
) {

    public boolean isSuccess() {
        return status == ExtractionStatus.SUCCESS;
    }
}
