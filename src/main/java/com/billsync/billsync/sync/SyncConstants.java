package com.billsync.billsync.sync;

/**
 * Shared constants for the reconciliation and upload flow.
 */
public final class SyncConstants {

    private SyncConstants() {
    }

    public static final String DEFAULT_INPUT_DIR = "inputs";
    public static final String DEFAULT_SURVEY_FILE_PATTERN = "master_db_ready/MASTER_ASSETS_*.csv";
    public static final String DEFAULT_BILL_FILE_PATTERN = "master_db_ready/MASTER_FINANCIALS_*.csv";
    public static final String DEFAULT_PDF_DIR = "inputs/raw_pdfs";
    public static final String DEFAULT_OUTPUT_DIR = "outputs/processed_pdfs";
    public static final String DEFAULT_LOG_DIR = "outputs/logs";
    public static final String DEFAULT_CRON = "-";

    public static final int DEFAULT_BATCH_SIZE = 500;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 2000L;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0d;
    public static final long DEFAULT_MAX_BACKOFF_MILLIS = 30000L;
    public static final int DEFAULT_UPLOAD_WORKERS = 4;
    public static final int DEFAULT_PDF_WORKERS = 4;
    public static final int DEFAULT_PDF_MAX_PAGES = 3;
    public static final int DEFAULT_RECENT_RUNS = 20;

    public static final String TABLE_SURVEY_UNITS = "survey_units";
    public static final String TABLE_BILLS = "bills";
    public static final String TABLE_SYNC_RUN = "sync_run";

    public static final String SYNCED_LOG_FILE = "synced_log.txt";
    public static final String PENDING_SYNC_LOG_FILE = "pending_sync_log.txt";
    public static final String ERROR_LOG_FILE = "error_log.txt";
    public static final String EXTRACTION_RESULTS_PREFIX = "psid_extraction_results_";
    public static final String EXTRACTION_SUMMARY_PREFIX = "psid_extraction_summary_";

    public static final String LOG_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";
    public static final String FILE_TIMESTAMP_PATTERN = "yyyyMMdd_HHmmss";
    public static final String BILL_MONTH_PATTERN = "MMM-yyyy";

    public static final int MAX_IDENTIFIER_LENGTH = 64;
    public static final int MONEY_PRECISION = 14;
    public static final int MONEY_SCALE = 2;

    public static final String MSG_LOG_OPEN_FAILED = "Unable to open audit logs in %s";
    public static final String MSG_DATABASE_UNAVAILABLE = "Database connection unavailable";
    public static final String MSG_SURVEY_KEYS_UNAVAILABLE = "Unable to load survey keys from " + TABLE_SURVEY_UNITS;
    public static final String MSG_INPUT_READ_FAILED = "Unable to read input file: %s";
    public static final String MSG_INPUT_NO_HEADER = "Input file has no header row: %s";
    public static final String MSG_INPUT_MISSING_KEY_COLUMN = "Input file %s has no %s column";
    public static final String MSG_PDF_DIR_NOT_FOUND = "PDF directory not found: %s";
    public static final String MSG_RUN_ABORTED = "Run aborted on request";
}
