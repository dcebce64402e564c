package com.billsync.billsync.classify;

/**
 * Lifecycle tier of a unit: surveyed only, placed on the biller list, or with an issued bill document.
 */
public enum IssuanceTier {
    SURVEY_ONLY,
    LISTED,
    ISSUED
}
