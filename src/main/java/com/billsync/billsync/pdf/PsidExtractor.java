package com.billsync.billsync.pdf;

import com.billsync.billsync.sync.SyncConstants;
import com.billsync.billsync.sync.SyncProperties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads bill PDFs and pulls out the portal system identifier printed on each one. A document yields at
 * most one PSID; unreadable, PSID-less or ambiguous documents are recorded as failures and never stop
 * the rest of the directory from being processed.
 */
@Component
public class PsidExtractor {

    private static final Logger log = LoggerFactory.getLogger(PsidExtractor.class);
    private static final Pattern PSID_PATTERN = Pattern.compile("PSID[:\\s]*(\\d{10,20})(?!\\d)", Pattern.CASE_INSENSITIVE);
    private static final String PDF_EXTENSION = ".pdf";

    private final SyncProperties syncProperties;
    private final Clock clock;

    public PsidExtractor(SyncProperties syncProperties, Clock clock) {
        this.syncProperties = syncProperties;
        this.clock = clock;
    }

    /**
     * Lazily parses every PDF under {@code directory} in path order. Each call walks the directory
     * again, so the stream can be re-run from scratch. Callers must close the stream.
     */
    public Stream<DocumentExtraction> stream(Path directory) {
        return listDocuments(directory).stream().map(this::extract);
    }

    /**
     * Parses all documents on a bounded worker pool and aggregates the results in path order.
     */
    public PdfExtractionReport extractAll(Path directory) {
        List<Path> documents = listDocuments(directory);
        if (documents.isEmpty()) {
            log.warn("No PDF documents found in {}", directory);
            return PdfExtractionReport.empty();
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, syncProperties.getPdfWorkers()));
        try {
            List<Future<DocumentExtraction>> futures = new ArrayList<>(documents.size());
            for (Path document : documents) {
                futures.add(pool.submit(() -> extract(document)));
            }

            List<DocumentExtraction> results = new ArrayList<>(documents.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), documents.get(i)));
            }

            PdfExtractionReport report = PdfExtractionReport.of(results);
            log.info("PSID extraction complete. dir={}, documents={}, extracted={}, failed={}",
                    directory, report.totalDocuments(), report.successCount(), report.failureCount());
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Extracts the PSID from one document.
     */
    public DocumentExtraction extract(Path document) {
        String fileName = document.getFileName().toString();
        String fullPath = document.toAbsolutePath().toString();
        LocalDateTime processedAt = LocalDateTime.now(clock);

        String text;
        try {
            text = readText(document);
        } catch (IOException | RuntimeException ex) {
            log.warn("Unable to read PDF {}: {}", fileName, ex.getMessage());
            return new DocumentExtraction(fileName, fullPath, null, ExtractionStatus.UNREADABLE,
                    describe(ex), processedAt);
        }

        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = PSID_PATTERN.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }

        if (found.isEmpty()) {
            return new DocumentExtraction(fileName, fullPath, null, ExtractionStatus.NOT_FOUND,
                    "No PSID token in first " + syncProperties.getPdfMaxPages() + " page(s)", processedAt);
        }
        if (found.size() > 1) {
            return new DocumentExtraction(fileName, fullPath, null, ExtractionStatus.AMBIGUOUS,
                    "Multiple PSIDs: " + String.join(", ", found), processedAt);
        }
        String psid = found.iterator().next();
        log.debug("{} -> {}", fileName, psid);
        return new DocumentExtraction(fileName, fullPath, psid, ExtractionStatus.SUCCESS, null, processedAt);
    }

    private String readText(Path document) throws IOException {
        try (PDDocument pdf = PDDocument.load(document.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(Math.max(1, syncProperties.getPdfMaxPages()));
            String text = stripper.getText(pdf);
            return text == null ? "" : text;
        }
    }

    private List<Path> listDocuments(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new IllegalArgumentException(SyncConstants.MSG_PDF_DIR_NOT_FOUND.formatted(directory));
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list PDF documents in " + directory, ex);
        }
    }

    private DocumentExtraction await(Future<DocumentExtraction> future, Path document) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("PSID extraction interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("PSID extraction task failed for {}", document, cause);
            return new DocumentExtraction(document.getFileName().toString(), document.toAbsolutePath().toString(),
                    null, ExtractionStatus.UNREADABLE, describe(cause), LocalDateTime.now(clock));
        }
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
