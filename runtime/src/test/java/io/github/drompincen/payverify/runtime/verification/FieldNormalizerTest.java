package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.protocol.api.ExtractedRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldNormalizerTest {

    private final FieldNormalizer normalizer = new FieldNormalizer();

    @Test
    void emptyOrNullInputGivesUnknownRecord() {
        assertThat(normalizer.normalize(null)).isEqualTo(ExtractedRecord.unknown());
        assertThat(normalizer.normalize(Map.of())).isEqualTo(ExtractedRecord.unknown());
    }

    @Test
    void nullSentinelsBecomeUnknown() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("employee_name", "N/A");
        raw.put("company_name", "  unknown ");
        raw.put("ssn", "null");
        raw.put("gross_pay", "TBD");

        ExtractedRecord record = normalizer.normalize(raw);

        assertThat(record.employeeName()).isEmpty();
        assertThat(record.companyName()).isEmpty();
        assertThat(record.ssn()).isEmpty();
        assertThat(record.grossPay()).isEmpty();
    }

    @Test
    void casesNamesAndCompanies() {
        ExtractedRecord record = normalizer.normalize(Map.of(
                "employee_name", "  maria   GARCIA ",
                "company_name", "global tech solutions inc."));

        assertThat(record.employeeName()).contains("Maria Garcia");
        assertThat(record.companyName()).contains("Global Tech Solutions Inc.");
    }

    @Test
    void stripsCurrencyAndGroupingFromAmounts() {
        ExtractedRecord record = normalizer.normalize(Map.of(
                "annual_salary", "$84,000.50",
                "net_pay", "£1,234",
                "hours_worked", 80));

        assertThat(record.annualSalary()).contains(84000.50);
        assertThat(record.netPay()).contains(1234.0);
        assertThat(record.hoursWorked()).contains(80.0);
    }

    @Test
    void malformedAmountIsUnknown() {
        ExtractedRecord record = normalizer.normalize(Map.of("annual_salary", "about 50k"));

        assertThat(record.annualSalary()).isEmpty();
    }

    @Test
    void overflowingAmountIsUnknown() {
        assertThat(FieldNormalizer.number("1e400")).isNull();
        assertThat(FieldNormalizer.number("-1e400")).isNull();
        assertThat(normalizer.normalize(Map.of("annual_salary", "1e400")).annualSalary()).isEmpty();
        assertThat(FieldNormalizer.number("6.05e4")).isEqualTo(60500.0);
    }

    @Test
    void keepsLastFourOfSsn() {
        assertThat(FieldNormalizer.ssn("123-45-6789")).isEqualTo("6789");
        assertThat(FieldNormalizer.ssn("XXX XX 4321")).isEqualTo("4321");
        assertThat(FieldNormalizer.ssn("89")).isEqualTo("89");
        assertThat(FieldNormalizer.ssn("--")).isNull();
        assertThat(FieldNormalizer.ssn(7777)).isEqualTo("7777");
    }

    @Test
    void parsesSeveralPayDateLayouts() {
        assertThat(FieldNormalizer.payDate("2024-03-31")).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(FieldNormalizer.payDate("03/31/2024")).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(FieldNormalizer.payDate("31/03/2024")).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(FieldNormalizer.payDate("2024/03/31")).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(FieldNormalizer.payDate("March 31st")).isNull();
    }

    @Test
    void splitsDeductionText() {
        assertThat(FieldNormalizer.deductions("Federal Tax, State Tax; Medicare"))
                .containsExactly("Federal Tax", "State Tax", "Medicare");
        assertThat(FieldNormalizer.deductions(List.of("401k", " ", "Dental")))
                .containsExactly("401k", "Dental");
        assertThat(FieldNormalizer.deductions(",;")).isNull();
    }

    @Test
    void derivesAnnualSalaryFromPayPeriod() {
        assertThat(normalizer.normalize(Map.of("gross_pay", "2000", "pay_period", "Bi-Weekly"))
                .annualSalary()).contains(52000.0);
        assertThat(normalizer.normalize(Map.of("gross_pay", "2000", "pay_period", "semi-monthly"))
                .annualSalary()).contains(48000.0);
        assertThat(normalizer.normalize(Map.of("gross_pay", "1000", "pay_period", "Weekly"))
                .annualSalary()).contains(52000.0);
        assertThat(normalizer.normalize(Map.of("gross_pay", "5000", "pay_period", "Monthly"))
                .annualSalary()).contains(60000.0);
    }

    @Test
    void assumesMonthlyGrossWhenPeriodIsUnknown() {
        ExtractedRecord record = normalizer.normalize(Map.of("gross_pay", "5000", "pay_period", "quarterly"));

        assertThat(record.annualSalary()).contains(60000.0);
    }

    @Test
    void usesNetPayOnlyWithoutGross() {
        assertThat(normalizer.normalize(Map.of("net_pay", "4000")).annualSalary()).contains(48000.0);
        assertThat(normalizer.normalize(Map.of("net_pay", "4000", "gross_pay", "500"))
                .annualSalary()).isEmpty();
    }

    @Test
    void fallsBackToYearToDateGross() {
        ExtractedRecord record = normalizer.normalize(Map.of("year_to_date_gross", "15000"));

        assertThat(record.annualSalary()).contains(60000.0);
    }

    @Test
    void statedAnnualSalaryWins() {
        ExtractedRecord record = normalizer.normalize(Map.of(
                "annual_salary", "60500", "gross_pay", "5000", "pay_period", "monthly"));

        assertThat(record.annualSalary()).contains(60500.0);
    }

    @Test
    void derivesHourlyRate() {
        ExtractedRecord record = normalizer.normalize(Map.of("gross_pay", "2000", "hours_worked", "80"));

        assertThat(record.hourlyRate()).contains(25.0);
        assertThat(normalizer.normalize(Map.of("gross_pay", "2000", "hours_worked", "0"))
                .hourlyRate()).isEmpty();
    }

    @Test
    void ignoresExtraKeysAndNestedValues() {
        ExtractedRecord record = normalizer.normalize(Map.of(
                "employee_name", Map.of("first", "Maria"),
                "favourite_colour", "blue"));

        assertThat(record).isEqualTo(ExtractedRecord.unknown());
    }
}
