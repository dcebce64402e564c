package com.billsync.billsync.pdf;

import com.billsync.billsync.sync.SyncConstants;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the tabular extraction results and the plain-text summary for one extraction pass.
 */
@Component
public class ExtractionReportWriter {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern(SyncConstants.FILE_TIMESTAMP_PATTERN);
    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern(SyncConstants.LOG_TIMESTAMP_PATTERN);
    private static final String[] RESULT_HEADERS = {
            "filename", "full_path", "extracted_psid", "status", "detail", "processed_at"
    };

    public record ExtractionFiles(Path results, Path summary) {
    }

    public ExtractionFiles write(PdfExtractionReport report, Path outputDir, LocalDateTime generatedAt) {
        String stamp = FILE_TIMESTAMP.format(generatedAt);
        Path results = outputDir.resolve(SyncConstants.EXTRACTION_RESULTS_PREFIX + stamp + ".csv");
        Path summary = outputDir.resolve(SyncConstants.EXTRACTION_SUMMARY_PREFIX + stamp + ".txt");
        try {
            Files.createDirectories(outputDir);
            writeResults(report, results);
            writeSummary(report, summary, generatedAt);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write PSID extraction report to " + outputDir, ex);
        }
        return new ExtractionFiles(results, summary);
    }

    private void writeResults(PdfExtractionReport report, Path target) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(RESULT_HEADERS).build();
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (DocumentExtraction document : report.documents()) {
                printer.printRecord(
                        document.fileName(),
                        document.fullPath(),
                        document.psid(),
                        document.status().name(),
                        document.detail(),
                        LOG_TIMESTAMP.format(document.processedAt())
                );
            }
        }
    }

    private void writeSummary(PdfExtractionReport report, Path target, LocalDateTime generatedAt) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write("PDF PSID Extraction Summary\n");
            writer.write("===========================\n");
            writer.write("Total PDFs processed: " + report.totalDocuments() + "\n");
            writer.write("PSIDs extracted: " + report.successCount() + "\n");
            writer.write("Failed documents: " + report.failureCount() + "\n");
            writer.write(String.format(Locale.ROOT, "Success rate: %.1f%%%n", report.successRate()));
            writer.write("Processed at: " + LOG_TIMESTAMP.format(generatedAt) + "\n\n");

            writer.write("Extracted PSIDs:\n");
            for (Map.Entry<String, String> entry : report.documentsByPsid().entrySet()) {
                writer.write("  " + entry.getKey() + " <- " + entry.getValue() + "\n");
            }

            if (report.failureCount() > 0) {
                writer.write("\nFailed documents:\n");
                for (DocumentExtraction document : report.documents()) {
                    if (!document.isSuccess()) {
                        writer.write("  " + document.fileName() + " [" + document.status() + "] "
                                + (document.detail() == null ? "" : document.detail()) + "\n");
                    }
                }
            }
        }
    }
}
