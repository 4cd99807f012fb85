package org.normharvest;

import java.time.Duration;

public record Progress(String source, int year, long accepted, long rejected, long saved, long errorsSaved,
                       long failedWrites, Duration elapsed) {
    public Progress minus(Progress before) {
        return new Progress(source, year, accepted - before.accepted, rejected - before.rejected,
                saved - before.saved, errorsSaved - before.errorsSaved, failedWrites - before.failedWrites,
                elapsed.minus(before.elapsed));
    }
}
