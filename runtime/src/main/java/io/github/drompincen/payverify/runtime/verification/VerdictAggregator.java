package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.protocol.api.FieldName;
import io.github.drompincen.payverify.protocol.api.FieldVerdict;
import io.github.drompincen.payverify.protocol.api.OverallStatus;
import io.github.drompincen.payverify.protocol.api.VerificationVerdict;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines the four field verdicts into an overall verdict. Any unmatched field,
 * including one that could not be compared for lack of data, makes the whole
 * verification a mismatch.
 */
@Component
public class VerdictAggregator {

    public static final int TOTAL_FIELDS = FieldName.values().length;

    public VerificationVerdict aggregate(List<FieldVerdict> fieldVerdicts) {
        Set<FieldName> seen = EnumSet.noneOf(FieldName.class);
        for (FieldVerdict verdict : fieldVerdicts) {
            if (!seen.add(verdict.field())) {
                throw new IllegalArgumentException("Duplicate verdict for field " + verdict.field());
            }
        }
        if (seen.size() != TOTAL_FIELDS) {
            throw new IllegalArgumentException("Expected verdicts for all " + TOTAL_FIELDS
                    + " fields but got " + seen);
        }

        List<String> mismatches = fieldVerdicts.stream()
                .filter(v -> !v.matched())
                .map(v -> v.field().label())
                .collect(Collectors.toList());
        int matched = TOTAL_FIELDS - mismatches.size();
        double score = matched * 100.0 / TOTAL_FIELDS;

        if (mismatches.isEmpty()) {
            String summary = String.format("Verification passed - all fields match (%d/%d fields verified)",
                    matched, TOTAL_FIELDS);
            return new VerificationVerdict(fieldVerdicts, OverallStatus.VERIFIED, score, summary);
        }
        String summary = String.format("Verification failed - %d field(s) mismatch: %s (%d/%d fields verified)",
                mismatches.size(), String.join(", ", mismatches), matched, TOTAL_FIELDS);
        return new VerificationVerdict(fieldVerdicts, OverallStatus.MISMATCH, score, summary);
    }
}
