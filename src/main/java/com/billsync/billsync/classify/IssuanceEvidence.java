package com.billsync.billsync.classify;

import java.util.Map;
import java.util.Optional;

/**
 * PSIDs found in bill documents during the current run, mapped to the document they came from.
 */
public final class IssuanceEvidence {

    private static final IssuanceEvidence NONE = new IssuanceEvidence(Map.of());

    private final Map<String, String> documentsByPsid;

    public IssuanceEvidence(Map<String, String> documentsByPsid) {
        this.documentsByPsid = Map.copyOf(documentsByPsid);
    }

    public static IssuanceEvidence none() {
        return NONE;
    }

    public boolean isIssued(String psid) {
        return psid != null && documentsByPsid.containsKey(psid);
    }

    public Optional<String> documentFor(String psid) {
        return Optional.ofNullable(documentsByPsid.get(psid));
    }

    public int size() {
        return documentsByPsid.size();
    }
}
