package io.github.drompincen.payverify.protocol.api;

import java.util.List;
import java.util.Objects;

public record VerificationVerdict(
        List<FieldVerdict> fieldVerdicts,
        OverallStatus overallStatus,
        double scorePercent,
        String summary
) {
    public VerificationVerdict {
        fieldVerdicts = fieldVerdicts == null ? List.of() : List.copyOf(fieldVerdicts);
        Objects.requireNonNull(overallStatus, "overallStatus");
        if (scorePercent < 0 || scorePercent > 100) {
            throw new IllegalArgumentException("scorePercent out of range: " + scorePercent);
        }
    }

    /** Verdict for a run that failed before any field could be compared. */
    public static VerificationVerdict error(String message) {
        return new VerificationVerdict(List.of(), OverallStatus.ERROR, 0, message);
    }

    public long matchedCount() {
        return fieldVerdicts.stream().filter(FieldVerdict::matched).count();
    }
}
