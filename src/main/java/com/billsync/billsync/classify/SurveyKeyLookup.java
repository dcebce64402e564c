package com.billsync.billsync.classify;

import java.util.Set;

/**
 * Read-only existence check over survey unit keys.
 */
@FunctionalInterface
public interface SurveyKeyLookup {

    boolean exists(String surveyId);

    static SurveyKeyLookup of(Set<String> surveyIds) {
        Set<String> snapshot = Set.copyOf(surveyIds);
        return snapshot::contains;
    }
}
