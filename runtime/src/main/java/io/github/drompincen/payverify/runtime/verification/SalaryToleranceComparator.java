package io.github.drompincen.payverify.runtime.verification;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Compares a declared annual salary with the extracted one against a tolerance
 * that narrows as the declared salary grows: 15% below 30,000, 12% below
 * 100,000, 10% otherwise. The boundary is inclusive.
 */
@Component
public class SalaryToleranceComparator {

    static final String APPLICATION_SALARY_MISSING = "Could not verify salary - application salary not provided";
    static final String EXTRACTED_SALARY_MISSING = "Could not extract salary from pay stub";

    public ComparisonResult compare(Long declared, Double extracted) {
        if (extracted == null) {
            return ComparisonResult.mismatch(EXTRACTED_SALARY_MISSING);
        }
        if (declared == null || declared <= 0) {
            return ComparisonResult.mismatch(APPLICATION_SALARY_MISSING);
        }

        double diff = Math.abs(declared - extracted);
        double diffPercent = diff / declared * 100;
        int tolerance = tolerancePercent(declared);

        if (diffPercent <= tolerance) {
            return ComparisonResult.match(String.format(Locale.US,
                    "Salary matches within %d%% tolerance (difference: %s, %.1f%%)",
                    tolerance, money(diff), diffPercent));
        }
        return ComparisonResult.mismatch(String.format(Locale.US,
                "Salary mismatch: application shows %s but pay stub indicates %s "
                        + "(difference: %s, %.1f%%) - exceeds %d%% tolerance",
                money(declared), money(extracted), money(diff), diffPercent, tolerance));
    }

    public static int tolerancePercent(double declared) {
        if (declared < 30000) {
            return 15;
        }
        if (declared < 100000) {
            return 12;
        }
        return 10;
    }

    private static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }
}
