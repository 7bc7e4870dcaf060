package io.github.drompincen.payverify.runtime.verification;

import org.springframework.stereotype.Component;

/** Exact comparison of the last four SSN characters. */
@Component
public class SsnMatcher {

    static final String EXTRACTED_SSN_MISSING = "Could not extract SSN from pay stub";
    static final String APPLICATION_SSN_MISSING = "Could not verify SSN - missing data";

    public ComparisonResult compare(String declaredSsn, String extractedLast4) {
        if (extractedLast4 == null || extractedLast4.isEmpty()) {
            return ComparisonResult.mismatch(EXTRACTED_SSN_MISSING);
        }
        if (declaredSsn == null || declaredSsn.isEmpty()) {
            return ComparisonResult.mismatch(APPLICATION_SSN_MISSING);
        }

        String declaredLast4 = lastFour(declaredSsn);
        if (declaredLast4.equals(extractedLast4)) {
            return ComparisonResult.match("SSN last 4 digits match");
        }
        return ComparisonResult.mismatch("SSN mismatch: application last 4 digits are " + declaredLast4
                + " but pay stub shows " + extractedLast4 + " - exact match required");
    }

    static String lastFour(String ssn) {
        return ssn.length() >= 4 ? ssn.substring(ssn.length() - 4) : ssn;
    }
}
