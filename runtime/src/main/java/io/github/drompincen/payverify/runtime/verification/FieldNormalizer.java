package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.protocol.api.ExtractedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans and type-coerces the raw field mapping returned by the OCR model and
 * derives annual salary and hourly rate when the document did not state them.
 * Malformed values become unknown; normalization never fails.
 */
@Component
public class FieldNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    static final Set<String> NULL_SENTINELS = Set.of(
            "", "null", "none", "n/a", "na", "not available", "unknown", "tbd");

    private static final Pattern CURRENCY_AND_GROUPING = Pattern.compile("[$€£¥₹,]");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern SSN_SEPARATORS = Pattern.compile("[-_ ]");
    private static final Pattern DEDUCTION_SEPARATORS = Pattern.compile("[,;]");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-M-d"),
            strict("M/d/uuuu"),
            strict("d/M/uuuu"),
            strict("uuuu/M/d"),
            strict("M-d-uuuu"),
            strict("d-M-uuuu"));

    // Prefixed periods first so that "bi-weekly" is not read as "weekly".
    private static final Map<String, Integer> PERIOD_MULTIPLIERS = new LinkedHashMap<>();
    static {
        PERIOD_MULTIPLIERS.put("biweekly", 26);
        PERIOD_MULTIPLIERS.put("semimonthly", 24);
        PERIOD_MULTIPLIERS.put("weekly", 52);
        PERIOD_MULTIPLIERS.put("monthly", 12);
        PERIOD_MULTIPLIERS.put("daily", 260);
        PERIOD_MULTIPLIERS.put("week", 52);
        PERIOD_MULTIPLIERS.put("month", 12);
        PERIOD_MULTIPLIERS.put("day", 260);
    }

    static final double MONTHLY_PAY_MIN = 1000;
    static final double MONTHLY_PAY_MAX = 500000;
    static final int YEAR_TO_DATE_MULTIPLIER = 4;

    public ExtractedRecord normalize(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return ExtractedRecord.unknown();
        }

        String name = text(raw.get("employee_name"));
        String company = text(raw.get("company_name"));

        ExtractedRecord.Builder builder = ExtractedRecord.builder()
                .employeeName(name == null ? null : capitalizeWords(name))
                .companyName(company == null ? null : titleCase(company))
                .ssn(ssn(raw.get("ssn")))
                .payPeriod(text(raw.get("pay_period")))
                .payDate(payDate(raw.get("pay_date")))
                .deductions(deductions(raw.get("deductions")))
                .annualSalary(number(raw.get("annual_salary")))
                .grossPay(number(raw.get("gross_pay")))
                .netPay(number(raw.get("net_pay")))
                .hourlyRate(number(raw.get("hourly_rate")))
                .hoursWorked(number(raw.get("hours_worked")))
                .yearToDateGross(number(raw.get("year_to_date_gross")))
                .yearToDateNet(number(raw.get("year_to_date_net")));

        ExtractedRecord parsed = builder.build();
        if (parsed.annualSalary().isEmpty()) {
            Double derived = deriveAnnualSalary(parsed);
            if (derived != null) {
                builder.annualSalary(derived);
            }
        }
        if (parsed.hourlyRate().isEmpty()) {
            builder.hourlyRate(deriveHourlyRate(parsed));
        }
        return builder.build();
    }

    /**
     * Strategies in priority order: gross pay times the stated period multiplier,
     * gross pay assumed monthly, net pay assumed monthly (only without gross pay),
     * then year-to-date gross times four.
     */
    Double deriveAnnualSalary(ExtractedRecord record) {
        Double gross = record.grossPay().orElse(null);
        Double net = record.netPay().orElse(null);

        if (gross != null) {
            Integer multiplier = record.payPeriod().map(FieldNormalizer::periodMultiplier).orElse(null);
            if (multiplier != null) {
                log.debug("Deriving annual salary from gross pay with period multiplier {}", multiplier);
                return gross * multiplier;
            }
            if (isPlausibleMonthly(gross)) {
                log.debug("Deriving annual salary from gross pay assumed monthly");
                return gross * 12;
            }
        } else if (net != null && isPlausibleMonthly(net)) {
            log.debug("Deriving annual salary from net pay assumed monthly");
            return net * 12;
        }

        return record.yearToDateGross()
                .map(ytd -> ytd * YEAR_TO_DATE_MULTIPLIER)
                .orElse(null);
    }

    Double deriveHourlyRate(ExtractedRecord record) {
        Double gross = record.grossPay().orElse(null);
        Double hours = record.hoursWorked().orElse(null);
        if (gross == null || hours == null || hours <= 0) {
            return null;
        }
        return gross / hours;
    }

    static Integer periodMultiplier(String period) {
        String compact = SSN_SEPARATORS.matcher(period.toLowerCase(Locale.ROOT)).replaceAll("");
        for (Map.Entry<String, Integer> entry : PERIOD_MULTIPLIERS.entrySet()) {
            if (compact.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static boolean isPlausibleMonthly(double amount) {
        return amount >= MONTHLY_PAY_MIN && amount <= MONTHLY_PAY_MAX;
    }

    static String text(Object value) {
        if (value == null || value instanceof Map || value instanceof Collection) {
            return null;
        }
        String trimmed = scalarToString(value).trim();
        if (NULL_SENTINELS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return trimmed;
    }

    static Double number(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (!(value instanceof String s)) {
            return null;
        }
        String cleaned = CURRENCY_AND_GROUPING.matcher(s).replaceAll("").trim();
        if (!DECIMAL.matcher(cleaned).matches()) {
            return null;
        }
        try {
            double d = Double.parseDouble(cleaned);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String ssn(Object value) {
        String text = text(value);
        if (text == null) {
            return null;
        }
        String compact = SSN_SEPARATORS.matcher(text).replaceAll("");
        if (compact.isEmpty()) {
            return null;
        }
        return compact.length() >= 4 ? compact.substring(compact.length() - 4) : compact;
    }

    static LocalDate payDate(Object value) {
        String text = text(value);
        if (text == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException e) {
                log.trace("Pay date '{}' does not match {}", text, format);
            }
        }
        return null;
    }

    static List<String> deductions(Object value) {
        List<String> tokens = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String token = text(item);
                if (token != null) {
                    tokens.add(token);
                }
            }
        } else {
            String text = text(value);
            if (text == null) {
                return null;
            }
            for (String part : DEDUCTION_SEPARATORS.split(text)) {
                String token = part.trim();
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
        }
        return tokens.isEmpty() ? null : tokens;
    }

    /** Upper-cases the first letter of each whitespace-separated word and lower-cases the rest. */
    static String capitalizeWords(String text) {
        String[] words = text.trim().split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /** Upper-cases every letter that follows a non-letter, lower-cases the others. */
    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }

    private static String scalarToString(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
        }
        return String.valueOf(value);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
