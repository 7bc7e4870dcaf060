package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.protocol.api.ApplicationRecord;
import io.github.drompincen.payverify.protocol.api.ExtractedRecord;
import io.github.drompincen.payverify.protocol.api.FieldName;
import io.github.drompincen.payverify.protocol.api.FieldVerdict;
import io.github.drompincen.payverify.protocol.api.VerificationVerdict;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * The comparison stage: a pure function of the application record and the
 * normalized extracted record. Holds no mutable state and is safe to call
 * concurrently.
 */
@Component
public class VerificationEngine {

    private final SimilarityScorer similarityScorer;
    private final SalaryToleranceComparator salaryComparator;
    private final SsnMatcher ssnMatcher;
    private final VerdictAggregator aggregator;

    public VerificationEngine(SimilarityScorer similarityScorer,
                              SalaryToleranceComparator salaryComparator,
                              SsnMatcher ssnMatcher,
                              VerdictAggregator aggregator) {
        this.similarityScorer = similarityScorer;
        this.salaryComparator = salaryComparator;
        this.ssnMatcher = ssnMatcher;
        this.aggregator = aggregator;
    }

    public VerificationVerdict evaluate(ApplicationRecord application, ExtractedRecord extracted) {
        return aggregator.aggregate(List.of(
                verifyName(application, extracted),
                verifySalary(application, extracted),
                verifyEmployer(application, extracted),
                verifySsn(application, extracted)));
    }

    FieldVerdict verifyName(ApplicationRecord application, ExtractedRecord extracted) {
        String declared = application.fullName();
        String found = extracted.employeeName().orElse(null);
        if (isBlank(declared) || found == null) {
            return FieldVerdict.mismatched(FieldName.NAME, "Could not verify name - missing data", found);
        }
        double score = similarityScorer.similarity(declared, found);
        if (similarityScorer.isMatch(score)) {
            return FieldVerdict.matched(FieldName.NAME,
                    "Name matches (similarity: " + percent(score) + ")", found);
        }
        return FieldVerdict.mismatched(FieldName.NAME,
                "Name mismatch: application has '" + declared + "' but pay stub shows '" + found
                        + "' (similarity: " + percent(score) + ") - requires 80%+ similarity", found);
    }

    FieldVerdict verifySalary(ApplicationRecord application, ExtractedRecord extracted) {
        Double found = extracted.annualSalary().orElse(null);
        ComparisonResult result = salaryComparator.compare(application.annualSalary(), found);
        return new FieldVerdict(FieldName.SALARY, result.matched(), result.reason(), found);
    }

    FieldVerdict verifyEmployer(ApplicationRecord application, ExtractedRecord extracted) {
        String found = extracted.companyName().orElse(null);
        if (found == null) {
            return FieldVerdict.mismatched(FieldName.EMPLOYER, "Could not extract employer name from pay stub", null);
        }
        String declared = application.employerName();
        if (isBlank(declared)) {
            return FieldVerdict.mismatched(FieldName.EMPLOYER, "Could not verify employer - missing data", found);
        }
        double score = similarityScorer.employerSimilarity(declared, found);
        if (similarityScorer.isMatch(score)) {
            return FieldVerdict.matched(FieldName.EMPLOYER,
                    "Employer matches (similarity: " + percent(score) + ")", found);
        }
        return FieldVerdict.mismatched(FieldName.EMPLOYER,
                "Employer mismatch: application has '" + declared + "' but pay stub shows '" + found
                        + "' (similarity: " + percent(score) + ") - requires 80%+ similarity", found);
    }

    FieldVerdict verifySsn(ApplicationRecord application, ExtractedRecord extracted) {
        String found = extracted.ssn().orElse(null);
        String declared = application.ssn() == null ? null : application.ssn().trim();
        ComparisonResult result = ssnMatcher.compare(declared, found);
        return new FieldVerdict(FieldName.SSN, result.matched(), result.reason(), found);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String percent(double score) {
        return String.format(Locale.US, "%.1f%%", score * 100);
    }
}
