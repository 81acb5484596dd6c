package com.supperclub.reservation.service;

import java.util.List;

/**
 * Outcome of one reconciliation pass. A check that threw is listed in
 * {@code failedChecks} and reports zero.
 */
public record ReconciliationReport(int danglingHoldsCompleted,
                                   int eventsSynced,
                                   int issuesRealerted,
                                   List<String> failedChecks) {

    public boolean clean() {
        return failedChecks.isEmpty();
    }
}
