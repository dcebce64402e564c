package com.billsync.billsync.sync;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized reconciliation configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "billsync")
public class SyncProperties {

    private String inputDir = SyncConstants.DEFAULT_INPUT_DIR;
    private String surveyFilePattern = SyncConstants.DEFAULT_SURVEY_FILE_PATTERN;
    private String billFilePattern = SyncConstants.DEFAULT_BILL_FILE_PATTERN;
    private String pdfDir = SyncConstants.DEFAULT_PDF_DIR;
    private String outputDir = SyncConstants.DEFAULT_OUTPUT_DIR;
    private String logDir = SyncConstants.DEFAULT_LOG_DIR;
    private String cron = SyncConstants.DEFAULT_CRON;
    private int batchSize = SyncConstants.DEFAULT_BATCH_SIZE;
    private int maxAttempts = SyncConstants.DEFAULT_MAX_ATTEMPTS;
    private long initialBackoffMillis = SyncConstants.DEFAULT_INITIAL_BACKOFF_MILLIS;
    private double backoffMultiplier = SyncConstants.DEFAULT_BACKOFF_MULTIPLIER;
    private long maxBackoffMillis = SyncConstants.DEFAULT_MAX_BACKOFF_MILLIS;
    private int uploadWorkers = SyncConstants.DEFAULT_UPLOAD_WORKERS;
    private int pdfWorkers = SyncConstants.DEFAULT_PDF_WORKERS;
    private int pdfMaxPages = SyncConstants.DEFAULT_PDF_MAX_PAGES;

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    public String getSurveyFilePattern() {
        return surveyFilePattern;
    }

    public void setSurveyFilePattern(String surveyFilePattern) {
        this.surveyFilePattern = surveyFilePattern;
    }

    public String getBillFilePattern() {
        return billFilePattern;
    }

    public void setBillFilePattern(String billFilePattern) {
        this.billFilePattern = billFilePattern;
    }

    public String getPdfDir() {
        return pdfDir;
    }

    public void setPdfDir(String pdfDir) {
        this.pdfDir = pdfDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getLogDir() {
        return logDir;
    }

    public void setLogDir(String logDir) {
        this.logDir = logDir;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMillis() {
        return initialBackoffMillis;
    }

    public void setInitialBackoffMillis(long initialBackoffMillis) {
        this.initialBackoffMillis = initialBackoffMillis;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public void setMaxBackoffMillis(long maxBackoffMillis) {
        this.maxBackoffMillis = maxBackoffMillis;
    }

    public int getUploadWorkers() {
        return uploadWorkers;
    }

    public void setUploadWorkers(int uploadWorkers) {
        this.uploadWorkers = uploadWorkers;
    }

    public int getPdfWorkers() {
        return pdfWorkers;
    }

    public void setPdfWorkers(int pdfWorkers) {
        this.pdfWorkers = pdfWorkers;
    }

    public int getPdfMaxPages() {
        return pdfMaxPages;
    }

    public void setPdfMaxPages(int pdfMaxPages) {
        this.pdfMaxPages = pdfMaxPages;
    }
}
