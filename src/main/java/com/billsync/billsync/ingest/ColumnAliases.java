package com.billsync.billsync.ingest;

import java.util.Locale;
import java.util.Map;

/**
 * Maps export headers, both database-ready names and the original survey/biller export headers,
 * to canonical column names.
 */
public final class ColumnAliases {

    public static final String SURVEY_ID = "survey_id";
    public static final String SURVEYOR_NAME = "surveyor_name";
    public static final String SURVEY_TIMESTAMP = "survey_timestamp";
    public static final String CITY_DISTRICT = "city_district";
    public static final String UC_NAME = "uc_name";
    public static final String BUSINESS_TYPE = "unit_specific_type";
    public static final String SURVEY_CATEGORY = "survey_category";
    public static final String CONSUMER_NAME = "survey_consumer_name";
    public static final String MOBILE = "survey_mobile";
    public static final String ADDRESS = "survey_address";
    public static final String BILLING_CONSUMER_NAME = "billing_consumer_name";
    public static final String BILLING_MOBILE = "billing_mobile";
    public static final String BILLING_ADDRESS = "billing_address";
    public static final String GPS_LAT = "gps_lat";
    public static final String GPS_LONG = "gps_long";
    public static final String GPS_COORDINATES = "gps_coordinates";
    public static final String ACTIVE = "is_active";

    public static final String PSID = "psid";
    public static final String BILL_MONTH = "bill_month";
    public static final String SURVEY_ID_FK = "survey_id_fk";
    public static final String MONTHLY_FEE = "monthly_fee";
    public static final String ARREARS = "arrears";
    public static final String AMOUNT_DUE = "amount_due";
    public static final String PAID_AMOUNT = "paid_amount";
    public static final String FINE = "fine";
    public static final String PAYMENT_STATUS = "payment_status";
    public static final String PAYMENT_DATE = "payment_date";

    public static final Map<String, String> SURVEY = Map.ofEntries(
            Map.entry("survey_id", SURVEY_ID),
            Map.entry("surveyor_name", SURVEYOR_NAME),
            Map.entry("survey_timestamp", SURVEY_TIMESTAMP),
            Map.entry("city_district", CITY_DISTRICT),
            Map.entry("tehsil", CITY_DISTRICT),
            Map.entry("city", CITY_DISTRICT),
            Map.entry("uc_name", UC_NAME),
            Map.entry("union_council", UC_NAME),
            Map.entry("unit_specific_type", BUSINESS_TYPE),
            Map.entry("type", BUSINESS_TYPE),
            Map.entry("business_type", BUSINESS_TYPE),
            Map.entry("survey_category", SURVEY_CATEGORY),
            Map.entry("level", SURVEY_CATEGORY),
            Map.entry("survey_consumer_name", CONSUMER_NAME),
            Map.entry("name", CONSUMER_NAME),
            Map.entry("survey_mobile", MOBILE),
            Map.entry("mobile_num", MOBILE),
            Map.entry("survey_address", ADDRESS),
            Map.entry("address", ADDRESS),
            Map.entry("billing_consumer_name", BILLING_CONSUMER_NAME),
            Map.entry("billing_mobile", BILLING_MOBILE),
            Map.entry("billing_address", BILLING_ADDRESS),
            Map.entry("gps_lat", GPS_LAT),
            Map.entry("gps_long", GPS_LONG),
            Map.entry("gps_coordinates", GPS_COORDINATES),
            Map.entry("is_active", ACTIVE),
            Map.entry("is_active_portal", ACTIVE),
            Map.entry("status", ACTIVE)
    );

    public static final Map<String, String> BILL = Map.ofEntries(
            Map.entry("psid", PSID),
            Map.entry("biller_psid", PSID),
            Map.entry("bill_month", BILL_MONTH),
            Map.entry("month", BILL_MONTH),
            Map.entry("survey_id_fk", SURVEY_ID_FK),
            Map.entry("survey_id", SURVEY_ID_FK),
            Map.entry("monthly_fee", MONTHLY_FEE),
            Map.entry("arrears", ARREARS),
            Map.entry("balance", ARREARS),
            Map.entry("amount_due", AMOUNT_DUE),
            Map.entry("total_payable", AMOUNT_DUE),
            Map.entry("amount", AMOUNT_DUE),
            Map.entry("paid_amount", PAID_AMOUNT),
            Map.entry("fine", FINE),
            Map.entry("payment_status", PAYMENT_STATUS),
            Map.entry("payment_date", PAYMENT_DATE),
            Map.entry("paid_date", PAYMENT_DATE),
            // biller list contact columns, written onto the owning survey unit
            Map.entry("name", BILLING_CONSUMER_NAME),
            Map.entry("billing_consumer_name", BILLING_CONSUMER_NAME),
            Map.entry("mobile", BILLING_MOBILE),
            Map.entry("billing_mobile", BILLING_MOBILE),
            Map.entry("address", BILLING_ADDRESS),
            Map.entry("billing_address", BILLING_ADDRESS),
            Map.entry("status", ACTIVE),
            Map.entry("is_active_portal", ACTIVE),
            Map.entry("is_active", ACTIVE)
    );

    private ColumnAliases() {
    }

    /**
     * Normalizes a raw header ({@code "Survey ID"}, {@code "Biller PSID"}) to its lookup form.
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String cleaned = header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        return cleaned.replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }
}
