package com.delta.jobapplication.form.sanitize;

import com.delta.jobapplication.form.model.JobApplicationRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MarkupSanitizerTest {
    private final MarkupSanitizer sanitizer = new MarkupSanitizer();

    @Test
    void removesScriptElementsWithTheirBody() {
        assertThat(sanitizer.sanitize("<script>x</script>Bob")).isEqualTo("Bob");
        assertThat(sanitizer.sanitize("<script>alert(\"xss\")</script>Hello")).isEqualTo("Hello");
    }

    @Test
    void keepsTextOfNestedElements() {
        assertThat(sanitizer.sanitize("<div><p>Hello <strong>World</strong></p></div>")).isEqualTo("Hello World");
    }

    @Test
    void dropsDangerousAttributes() {
        assertThat(sanitizer.sanitize("<img src=\"x\" onerror=\"alert(1)\">Image")).isEqualTo("Image");
        assertThat(sanitizer.sanitize("<a href=\"javascript:alert(1)\">Click</a>")).isEqualTo("Click");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "<iframe><img src=x onerror=alert(1)></iframe>Job",
        "<textarea><b onclick=\"x()\">hi</b></textarea>Job",
        "<title><a href=javascript:alert(1)>t</a></title>Job",
        "<noembed><img src=x onerror=alert(1)></noembed>Job",
        "<noframes><img src=x onerror=alert(1)></noframes>Job",
        "<xmp><svg onload=alert(1)></xmp>Job"
    })
    void dropsMarkupHeldAsTextInsideRawTextElements(String input) {
        assertThat(sanitizer.sanitize(input)).isEqualTo("Job");
    }

    @Test
    void preservesPlainTextAndSpecialCharacters() {
        assertThat(sanitizer.sanitize("Hello World 123")).isEqualTo("Hello World 123");
        assertThat(sanitizer.sanitize("Hello & goodbye! @#$%^&*()")).isEqualTo("Hello & goodbye! @#$%^&*()");
        assertThat(sanitizer.sanitize("Tech &amp; Co")).isEqualTo("Tech &amp; Co");
        assertThat(sanitizer.sanitize("")).isEmpty();
    }

    @Test
    void removesStrayDelimiters() {
        assertThat(sanitizer.sanitize("salary < 50k > 40k")).isEqualTo("salary  50k  40k");
    }

    @Test
    void handlesLongInputAroundMarkup() {
        String input = "A".repeat(10000) + "<script>alert(\"xss\")</script>" + "B".repeat(10000);

        assertThat(sanitizer.sanitize(input)).isEqualTo("A".repeat(10000) + "B".repeat(10000));
    }

    @Test
    void keepsUnicodeAndEmoji() {
        assertThat(sanitizer.sanitize("🚀 Hello 世界 <b>bold</b> 🎉")).isEqualTo("🚀 Hello 世界 bold 🎉");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "<script>x</script>Bob",
        "a < b > c",
        "&lt;b&gt;escaped&lt;/b&gt;",
        "<p>one</p><!-- note --><p>two</p>",
        "<<b>>nested<</b>>",
        "plain text"
    })
    void isIdempotentAndLeavesNoDelimiters(String input) {
        String once = sanitizer.sanitize(input);

        assertThat(sanitizer.sanitize(once)).isEqualTo(once);
        assertThat(once).doesNotContain("<", ">");
    }

    @Test
    void nonTextValuesPassThrough() {
        assertThat(sanitizer.sanitizeValue(Boolean.TRUE)).isEqualTo(Boolean.TRUE);
        assertThat(sanitizer.sanitizeValue(42)).isEqualTo(42);
        assertThat(sanitizer.sanitizeValue(null)).isNull();
        assertThat(sanitizer.sanitizeValue("<i>x</i>")).isEqualTo("x");
    }

    @Test
    void sanitizesEveryTextFieldOfRecord() {
        JobApplicationRecord dirty = new JobApplicationRecord(
            "<script>x</script>Bob", "<b>Acme</b>", "FT", "NYC", null, "2024-01-01", "https://x.com/job",
            "<i>cv.pdf</i>", "", "Applied", "<img src=x onerror=alert(1)>Jane", "jane@example.com", "0123", true
        );

        JobApplicationRecord clean = sanitizer.sanitizeRecord(dirty);

        assertThat(clean.roleTitle()).isEqualTo("Bob");
        assertThat(clean.companyName()).isEqualTo("Acme");
        assertThat(clean.cvUsed()).isEqualTo("cv.pdf");
        assertThat(clean.contactName()).isEqualTo("Jane");
        assertThat(clean.salary()).isNull();
        assertThat(clean.responseDate()).isEmpty();
        assertThat(clean.advertLink()).isEqualTo("https://x.com/job");
        assertThat(clean.isLinkedInConnection()).isTrue();
    }
}
