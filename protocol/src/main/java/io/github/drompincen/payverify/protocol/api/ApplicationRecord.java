package io.github.drompincen.payverify.protocol.api;

/**
 * Identity and income data declared by the applicant.
 * {@code annualSalary} is null when the applicant left it blank.
 */
public record ApplicationRecord(
        String fullName,
        Long annualSalary,
        String employerName,
        String ssn
) {}
