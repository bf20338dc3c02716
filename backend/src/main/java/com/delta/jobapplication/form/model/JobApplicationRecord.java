package com.delta.jobapplication.form.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A job application as edited in a form session. Text fields may be {@code null} or empty while the
 * record is incomplete; drafts persist it in that state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobApplicationRecord(
    String roleTitle,
    String companyName,
    String roleType,
    String location,
    String salary,
    String dateApplied,
    String advertLink,
    String cvUsed,
    String responseDate,
    String status,
    String contactName,
    String contactEmail,
    String contactPhone,
    @JsonProperty("isLinkedInConnection") boolean isLinkedInConnection
) {
    public static JobApplicationRecord defaults() {
        return new JobApplicationRecord(
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            false
        );
    }

    /**
     * Returns a copy with {@code field} replaced. The value must already be of the field's type, see
     * {@link ApplicationField#coerce(Object)}.
     */
    public JobApplicationRecord with(ApplicationField field, Object value) {
        Object coerced = field.coerce(value);
        String text = coerced instanceof String s ? s : null;
        return new JobApplicationRecord(
            field == ApplicationField.ROLE_TITLE ? text : roleTitle,
            field == ApplicationField.COMPANY_NAME ? text : companyName,
            field == ApplicationField.ROLE_TYPE ? text : roleType,
            field == ApplicationField.LOCATION ? text : location,
            field == ApplicationField.SALARY ? text : salary,
            field == ApplicationField.DATE_APPLIED ? text : dateApplied,
            field == ApplicationField.ADVERT_LINK ? text : advertLink,
            field == ApplicationField.CV_USED ? text : cvUsed,
            field == ApplicationField.RESPONSE_DATE ? text : responseDate,
            field == ApplicationField.STATUS ? text : status,
            field == ApplicationField.CONTACT_NAME ? text : contactName,
            field == ApplicationField.CONTACT_EMAIL ? text : contactEmail,
            field == ApplicationField.CONTACT_PHONE ? text : contactPhone,
            field == ApplicationField.IS_LINKED_IN_CONNECTION ? (Boolean) coerced : isLinkedInConnection
        );
    }
}
