package io.github.drompincen.payverify.protocol.api;

public record VerificationStats(
        int totalApplications,
        int verified,
        int mismatch,
        int error,
        int noDocuments,
        double verificationRate
) {}
