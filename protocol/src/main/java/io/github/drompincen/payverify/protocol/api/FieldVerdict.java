package io.github.drompincen.payverify.protocol.api;

import java.util.Objects;

/**
 * Match decision for one compared field. {@code extractedValue} is the value read
 * off the document, or null when the document did not yield one.
 */
public record FieldVerdict(
        FieldName field,
        boolean matched,
        String reason,
        Object extractedValue
) {
    public FieldVerdict {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(reason, "reason");
    }

    public static FieldVerdict matched(FieldName field, String reason, Object extractedValue) {
        return new FieldVerdict(field, true, reason, extractedValue);
    }

    public static FieldVerdict mismatched(FieldName field, String reason, Object extractedValue) {
        return new FieldVerdict(field, false, reason, extractedValue);
    }
}
