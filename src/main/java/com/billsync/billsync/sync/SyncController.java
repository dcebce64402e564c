package com.billsync.billsync.sync;

import com.billsync.billsync.pdf.PdfExtractionReport;
import com.billsync.billsync.stats.RunStatistics;
import com.billsync.billsync.stats.SyncStatisticsResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Manual triggers for the reconciliation runs and the statistics view.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private static final String UPLOAD_SOURCE_NAME = "upload.csv";

    private final SyncService syncService;

    public SyncController(SyncService syncService) {
        this.syncService = syncService;
    }

    @PostMapping(value = "/survey-units", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RunStatistics> syncSurveyUnits(@RequestParam("file") MultipartFile file) {
        byte[] content = readUpload(file);
        return ResponseEntity.ok(run(() -> syncService.syncSurveyUnits(sourceName(file), content)));
    }

    /**
     * Loads a bill ledger. {@code billMonth} applies to rows without a month column; {@code pdfDir} points
     * at the issued bill PDFs used to tag issued bills.
     */
    @PostMapping(value = "/bills", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RunStatistics> syncBills(@RequestParam("file") MultipartFile file,
                                                   @RequestParam(required = false) String billMonth,
                                                   @RequestParam(required = false) String pdfDir) {
        byte[] content = readUpload(file);
        Path documents = pdfDir == null || pdfDir.isBlank() ? null : Path.of(pdfDir);
        return ResponseEntity.ok(run(() -> syncService.syncBills(sourceName(file), content, billMonth, documents)));
    }

    @PostMapping("/pdf-extraction")
    public ResponseEntity<PdfExtractionReport> extractPsids(@RequestParam String dir) {
        return ResponseEntity.ok(run(() -> syncService.extractPsids(Path.of(dir))));
    }

    @PostMapping("/inbox")
    public ResponseEntity<InboxRunResult> syncInbox() {
        return ResponseEntity.ok(run(syncService::syncInbox));
    }

    @PostMapping("/abort")
    public ResponseEntity<Map<String, Boolean>> abort() {
        return ResponseEntity.ok(Map.of("runInProgress", syncService.requestAbort()));
    }

    @GetMapping("/stats")
    public ResponseEntity<SyncStatisticsResponse> statistics() {
        return ResponseEntity.ok(syncService.statistics());
    }

    private static <T> T run(Supplier<T> action) {
        try {
            return action.get();
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (SyncRunAbortedException ex) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex);
        }
    }

    private static byte[] readUpload(MultipartFile file) {
        if (file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded file is empty");
        }
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unable to read uploaded file", ex);
        }
    }

    private static String sourceName(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? UPLOAD_SOURCE_NAME : name;
    }
}
