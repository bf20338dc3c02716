package com.delta.jobapplication.form.sanitize;

import com.delta.jobapplication.form.model.JobApplicationRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Strips markup from free text before it leaves the form. Tags, attributes and comments are dropped,
 * along with the bodies of script and style elements and of raw-text elements such as iframe or
 * textarea. The remaining character data is kept verbatim, including {@code &} and entity-like
 * sequences. Stray {@code <} and {@code >} are removed so the output never
 * carries a tag delimiter, which also makes {@link #sanitize(String)} idempotent.
 */
@Component
public class MarkupSanitizer {
    // jsoup keeps the raw markup inside these elements as text nodes
    private static final Set<String> DROPPED_CONTENT = Set.of(
        "iframe", "noembed", "noframes", "noscript", "plaintext", "textarea", "title", "xmp"
    );

    public String sanitize(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        // Escape ampersands so jsoup hands entity text back unchanged instead of decoding it.
        Document fragment = Jsoup.parseBodyFragment(input.replace("&", "&amp;"));
        StringBuilder text = new StringBuilder(input.length());
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode && !insideDroppedElement(textNode)) {
                text.append(textNode.getWholeText());
            }
        }, fragment.body());
        return stripDelimiters(text);
    }

    /**
     * Text is sanitized; every other value is returned unchanged.
     */
    public Object sanitizeValue(Object value) {
        if (value instanceof String text) {
            return sanitize(text);
        }
        return value;
    }

    /**
     * Sanitizes the record's top-level text fields. The boolean field passes through.
     */
    public JobApplicationRecord sanitizeRecord(JobApplicationRecord record) {
        if (record == null) {
            return null;
        }
        return new JobApplicationRecord(
            sanitize(record.roleTitle()),
            sanitize(record.companyName()),
            sanitize(record.roleType()),
            sanitize(record.location()),
            sanitize(record.salary()),
            sanitize(record.dateApplied()),
            sanitize(record.advertLink()),
            sanitize(record.cvUsed()),
            sanitize(record.responseDate()),
            sanitize(record.status()),
            sanitize(record.contactName()),
            sanitize(record.contactEmail()),
            sanitize(record.contactPhone()),
            record.isLinkedInConnection()
        );
    }

    private boolean insideDroppedElement(Node node) {
        Node parent = node.parent();
        while (parent instanceof Element element) {
            if (DROPPED_CONTENT.contains(element.normalName())) {
                return true;
            }
            parent = element.parent();
        }
        return false;
    }

    private String stripDelimiters(CharSequence text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '<' && c != '>') {
                out.append(c);
            }
        }
        return out.toString();
    }
}
