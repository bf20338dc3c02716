package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;

import java.util.List;
import java.util.regex.Pattern;

public final class JobApplicationRules {
    public static final String INVALID_URL = "Must be a valid URL";
    public static final String PROTOCOL_NOT_ALLOWED = "Only HTTP and HTTPS protocols are allowed";
    public static final String INVALID_DATE = "Invalid date";
    public static final String INVALID_EMAIL = "Must be a valid email";
    public static final String INVALID_PHONE = "Invalid phone number format";
    public static final String RESPONSE_BEFORE_APPLIED = "Response date cannot be before application date";

    private static final Pattern PHONE = Pattern.compile("[0-9 ()+\\-]*");

    private JobApplicationRules() {
    }

    /**
     * Rules in evaluation order. Within a field the first failing rule wins, so order required checks
     * before format checks.
     */
    public static List<FieldRule> rules() {
        return List.of(
            new RequiredTextRule(ApplicationField.ROLE_TITLE, "Role is required"),
            new RequiredTextRule(ApplicationField.COMPANY_NAME, "Company name is required"),
            new RequiredTextRule(ApplicationField.ROLE_TYPE, "Role type is required"),
            new RequiredTextRule(ApplicationField.LOCATION, "Location is required"),
            new RequiredTextRule(ApplicationField.DATE_APPLIED, "Date applied is required"),
            new HttpUrlRule(ApplicationField.ADVERT_LINK, INVALID_URL, PROTOCOL_NOT_ALLOWED),
            new IsoDateRule(ApplicationField.RESPONSE_DATE, INVALID_DATE),
            new RequiredTextRule(ApplicationField.STATUS, "Status is required"),
            new EmailRule(ApplicationField.CONTACT_EMAIL, INVALID_EMAIL),
            new PatternRule(ApplicationField.CONTACT_PHONE, PHONE, INVALID_PHONE),
            new DateNotBeforeRule(
                ApplicationField.RESPONSE_DATE,
                ApplicationField.DATE_APPLIED,
                RESPONSE_BEFORE_APPLIED
            )
        );
    }
}
