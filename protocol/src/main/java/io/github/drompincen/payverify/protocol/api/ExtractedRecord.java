package io.github.drompincen.payverify.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fields read off a pay document after normalization. Every field is either a
 * typed value or unknown; unknown fields are reported as {@link Optional#empty()}.
 */
public final class ExtractedRecord {

    private static final ExtractedRecord UNKNOWN = builder().build();

    private final String employeeName;
    private final String companyName;
    private final Double annualSalary;
    private final String ssn;
    private final String payPeriod;
    private final Double grossPay;
    private final Double netPay;
    private final Double hourlyRate;
    private final Double hoursWorked;
    private final Double yearToDateGross;
    private final Double yearToDateNet;
    private final LocalDate payDate;
    private final List<String> deductions;

    private ExtractedRecord(Builder b) {
        this.employeeName = b.employeeName;
        this.companyName = b.companyName;
        this.annualSalary = b.annualSalary;
        this.ssn = b.ssn;
        this.payPeriod = b.payPeriod;
        this.grossPay = b.grossPay;
        this.netPay = b.netPay;
        this.hourlyRate = b.hourlyRate;
        this.hoursWorked = b.hoursWorked;
        this.yearToDateGross = b.yearToDateGross;
        this.yearToDateNet = b.yearToDateNet;
        this.payDate = b.payDate;
        this.deductions = b.deductions == null || b.deductions.isEmpty() ? null : List.copyOf(b.deductions);
    }

    /** A record in which every field is unknown. */
    public static ExtractedRecord unknown() {
        return UNKNOWN;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .employeeName(employeeName)
                .companyName(companyName)
                .annualSalary(annualSalary)
                .ssn(ssn)
                .payPeriod(payPeriod)
                .grossPay(grossPay)
                .netPay(netPay)
                .hourlyRate(hourlyRate)
                .hoursWorked(hoursWorked)
                .yearToDateGross(yearToDateGross)
                .yearToDateNet(yearToDateNet)
                .payDate(payDate)
                .deductions(deductions);
    }

    public Optional<String> employeeName() { return Optional.ofNullable(employeeName); }
    public Optional<String> companyName() { return Optional.ofNullable(companyName); }
    public Optional<Double> annualSalary() { return Optional.ofNullable(annualSalary); }
    public Optional<String> ssn() { return Optional.ofNullable(ssn); }
    public Optional<String> payPeriod() { return Optional.ofNullable(payPeriod); }
    public Optional<Double> grossPay() { return Optional.ofNullable(grossPay); }
    public Optional<Double> netPay() { return Optional.ofNullable(netPay); }
    public Optional<Double> hourlyRate() { return Optional.ofNullable(hourlyRate); }
    public Optional<Double> hoursWorked() { return Optional.ofNullable(hoursWorked); }
    public Optional<Double> yearToDateGross() { return Optional.ofNullable(yearToDateGross); }
    public Optional<Double> yearToDateNet() { return Optional.ofNullable(yearToDateNet); }
    public Optional<LocalDate> payDate() { return Optional.ofNullable(payDate); }
    public Optional<List<String>> deductions() { return Optional.ofNullable(deductions); }

    /**
     * Known fields keyed by their wire names, in declaration order. Dates are
     * rendered as ISO-8601 strings.
     */
    @JsonValue
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        put(map, "employee_name", employeeName);
        put(map, "company_name", companyName);
        put(map, "annual_salary", annualSalary);
        put(map, "ssn", ssn);
        put(map, "pay_period", payPeriod);
        put(map, "gross_pay", grossPay);
        put(map, "net_pay", netPay);
        put(map, "hourly_rate", hourlyRate);
        put(map, "hours_worked", hoursWorked);
        put(map, "year_to_date_gross", yearToDateGross);
        put(map, "year_to_date_net", yearToDateNet);
        put(map, "pay_date", payDate == null ? null : payDate.toString());
        put(map, "deductions", deductions);
        return map;
    }

    private static void put(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedRecord other)) return false;
        return asMap().equals(other.asMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(asMap());
    }

    @Override
    public String toString() {
        Map<String, Object> masked = asMap();
        masked.computeIfPresent("ssn", (k, v) -> "***" + v);
        return "ExtractedRecord" + masked;
    }

    public static final class Builder {
        private String employeeName;
        private String companyName;
        private Double annualSalary;
        private String ssn;
        private String payPeriod;
        private Double grossPay;
        private Double netPay;
        private Double hourlyRate;
        private Double hoursWorked;
        private Double yearToDateGross;
        private Double yearToDateNet;
        private LocalDate payDate;
        private List<String> deductions;

        private Builder() {}

        public Builder employeeName(String v) { this.employeeName = v; return this; }
        public Builder companyName(String v) { this.companyName = v; return this; }
        public Builder annualSalary(Double v) { this.annualSalary = v; return this; }
        public Builder ssn(String v) { this.ssn = v; return this; }
        public Builder payPeriod(String v) { this.payPeriod = v; return this; }
        public Builder grossPay(Double v) { this.grossPay = v; return this; }
        public Builder netPay(Double v) { this.netPay = v; return this; }
        public Builder hourlyRate(Double v) { this.hourlyRate = v; return this; }
        public Builder hoursWorked(Double v) { this.hoursWorked = v; return this; }
        public Builder yearToDateGross(Double v) { this.yearToDateGross = v; return this; }
        public Builder yearToDateNet(Double v) { this.yearToDateNet = v; return this; }
        public Builder payDate(LocalDate v) { this.payDate = v; return this; }
        public Builder deductions(List<String> v) { this.deductions = v; return this; }

        public ExtractedRecord build() {
            return new ExtractedRecord(this);
        }
    }
}
