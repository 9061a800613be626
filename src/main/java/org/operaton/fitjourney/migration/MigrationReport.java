package org.operaton.fitjourney.migration;

import java.util.List;

/**
 * Outcome of one migration run, by step name.
 */
public record MigrationReport(List<String> applied, List<String> skipped, List<String> failed) {

    public MigrationReport {
        applied = List.copyOf(applied);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
