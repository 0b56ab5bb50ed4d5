package com.rankbox.engine.audit;

import java.util.Set;

/**
 * What one consistency audit did.
 *
 * @param skipped    the audit did not run because another one was in progress
 * @param committed  corrections were made and the working ratings should replace the live ones
 * @param changedIds items whose rating differs from before the audit
 */
public record AuditReport(
        boolean skipped,
        boolean committed,
        int corrections,
        int directViolationsFixed,
        int transitivityViolationsFixed,
        int normalizationFixes,
        int cyclesFound,
        Set<String> changedIds
) {
    public static AuditReport skippedRun() {
        return new AuditReport(true, false, 0, 0, 0, 0, 0, Set.of());
    }
}
