package com.billsync.billsync.pdf;

import com.billsync.billsync.classify.IssuanceEvidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one extraction pass over a document directory.
 */
public record PdfExtractionReport(
        List<DocumentExtraction> documents,
        Map<String, String> documentsByPsid,
        int successCount,
        int failureCount
) {

    public PdfExtractionReport {
        documents = documents == null ? List.of() : List.copyOf(documents);
        documentsByPsid = documentsByPsid == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(documentsByPsid));
    }

    /**
     * Builds the report from per-document results; when the same PSID appears in several documents the
     * first one (by path order) is kept for traceability.
     */
    public static PdfExtractionReport of(List<DocumentExtraction> documents) {
        Map<String, String> byPsid = new LinkedHashMap<>();
        int success = 0;
        for (DocumentExtraction document : documents) {
            if (document.isSuccess()) {
                success++;
                byPsid.putIfAbsent(document.psid(), document.fileName());
            }
        }
        return new PdfExtractionReport(documents, byPsid, success, documents.size() - success);
    }

    public static PdfExtractionReport empty() {
        return new PdfExtractionReport(List.of(), Map.of(), 0, 0);
    }

    public int totalDocuments() {
        return documents.size();
    }

    public double successRate() {
        return documents.isEmpty() ? 0.0d : (successCount * 100.0d) / documents.size();
    }

    public IssuanceEvidence toEvidence() {
        return new IssuanceEvidence(documentsByPsid);
    }
}
