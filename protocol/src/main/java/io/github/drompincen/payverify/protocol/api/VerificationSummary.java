package io.github.drompincen.payverify.protocol.api;

public record VerificationSummary(
        String applicationId,
        OverallStatus overallStatus,
        int totalFields,
        int matchedFields,
        int mismatchedFields,
        VerificationDto verification
) {}
