package io.github.drompincen.payverify.runtime.verification;

public record ComparisonResult(boolean matched, String reason) {

    public static ComparisonResult match(String reason) {
        return new ComparisonResult(true, reason);
    }

    public static ComparisonResult mismatch(String reason) {
        return new ComparisonResult(false, reason);
    }
}
