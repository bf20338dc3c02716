package com.delta.jobapplication.form.model;

import java.util.Locale;
import java.util.Optional;

public enum ApplicationField {
    ROLE_TITLE("roleTitle", "Role", ValueType.TEXT, true),
    COMPANY_NAME("companyName", "Company", ValueType.TEXT, true),
    ROLE_TYPE("roleType", "Role Type", ValueType.TEXT, true),
    LOCATION("location", "Location", ValueType.TEXT, true),
    SALARY("salary", "Salary", ValueType.TEXT, false),
    DATE_APPLIED("dateApplied", "Date Applied", ValueType.TEXT, true),
    ADVERT_LINK("advertLink", "Advert Link", ValueType.TEXT, true),
    CV_USED("cvUsed", "CV Used", ValueType.TEXT, false),
    RESPONSE_DATE("responseDate", "Response Date", ValueType.TEXT, false),
    STATUS("status", "Status", ValueType.TEXT, true),
    CONTACT_NAME("contactName", "Contact Name", ValueType.TEXT, false),
    CONTACT_EMAIL("contactEmail", "Contact Email", ValueType.TEXT, false),
    CONTACT_PHONE("contactPhone", "Contact Phone", ValueType.TEXT, false),
    IS_LINKED_IN_CONNECTION("isLinkedInConnection", "LinkedIn Connection", ValueType.BOOLEAN, false);

    public enum ValueType {
        TEXT,
        BOOLEAN
    }

    private final String jsonName;
    private final String label;
    private final ValueType valueType;
    private final boolean required;

    ApplicationField(String jsonName, String label, ValueType valueType, boolean required) {
        this.jsonName = jsonName;
        this.label = label;
        this.valueType = valueType;
        this.required = required;
    }

    public String jsonName() {
        return jsonName;
    }

    public String label() {
        return label;
    }

    public ValueType valueType() {
        return valueType;
    }

    public boolean isRequired() {
        return required;
    }

    public Object read(JobApplicationRecord record) {
        if (record == null) {
            return valueType == ValueType.BOOLEAN ? Boolean.FALSE : null;
        }
        return switch (this) {
            case ROLE_TITLE -> record.roleTitle();
            case COMPANY_NAME -> record.companyName();
            case ROLE_TYPE -> record.roleType();
            case LOCATION -> record.location();
            case SALARY -> record.salary();
            case DATE_APPLIED -> record.dateApplied();
            case ADVERT_LINK -> record.advertLink();
            case CV_USED -> record.cvUsed();
            case RESPONSE_DATE -> record.responseDate();
            case STATUS -> record.status();
            case CONTACT_NAME -> record.contactName();
            case CONTACT_EMAIL -> record.contactEmail();
            case CONTACT_PHONE -> record.contactPhone();
            case IS_LINKED_IN_CONNECTION -> record.isLinkedInConnection();
        };
    }

    public String readText(JobApplicationRecord record) {
        Object value = read(record);
        return value instanceof String text ? text : null;
    }

    /**
     * Converts a raw edit value to this field's type. Text fields accept {@code null} or a string;
     * the boolean field accepts a boolean, {@code "true"}/{@code "false"}, or {@code null} for false.
     */
    public Object coerce(Object raw) {
        if (valueType == ValueType.BOOLEAN) {
            if (raw == null) {
                return Boolean.FALSE;
            }
            if (raw instanceof Boolean flag) {
                return flag;
            }
            if (raw instanceof String text) {
                String normalized = text.trim().toLowerCase(Locale.ROOT);
                if ("true".equals(normalized) || "false".equals(normalized)) {
                    return Boolean.valueOf(normalized);
                }
            }
            throw new IllegalArgumentException("Field " + jsonName + " expects a boolean value");
        }
        if (raw == null || raw instanceof String) {
            return raw;
        }
        throw new IllegalArgumentException("Field " + jsonName + " expects a text value");
    }

    public static Optional<ApplicationField> fromJsonName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        for (ApplicationField field : values()) {
            if (field.jsonName.equals(trimmed)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public static ApplicationField requireByJsonName(String name) {
        return fromJsonName(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown application field: " + name));
    }
}
