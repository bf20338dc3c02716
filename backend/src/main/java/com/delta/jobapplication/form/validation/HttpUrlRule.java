package com.delta.jobapplication.form.validation;

import com.delta.jobapplication.form.model.ApplicationField;
import com.delta.jobapplication.form.model.JobApplicationRecord;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Requires an absolute URL whose scheme is http or https. The scheme is read before full parsing so
 * that {@code javascript:}, {@code data:} and {@code file:} values are reported as protocol violations
 * even when the rest of the value is not a well-formed URI.
 */
public record HttpUrlRule(ApplicationField field, String invalidMessage, String protocolMessage)
    implements FieldRule {

    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*):");
    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    @Override
    public Optional<String> check(JobApplicationRecord candidate) {
        String value = field.readText(candidate);
        if (value == null || value.isBlank()) {
            return Optional.of(invalidMessage);
        }
        String trimmed = value.trim();
        Matcher matcher = SCHEME.matcher(trimmed);
        if (!matcher.find()) {
            return Optional.of(invalidMessage);
        }
        String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            return Optional.of(protocolMessage);
        }
        URI uri = safeUri(encodeSpacesAfterAuthority(trimmed, matcher.end()));
        // registry-based authorities (underscores, IDN labels) leave getHost() null
        if (uri == null || uri.getRawAuthority() == null || uri.getRawAuthority().isBlank()) {
            return Optional.of(invalidMessage);
        }
        return Optional.empty();
    }

    /**
     * Browsers percent-encode spaces in the path, query and fragment. A space inside the authority is
     * left alone so that parsing still fails on it.
     */
    static String encodeSpacesAfterAuthority(String url, int schemeEnd) {
        int authorityStart = url.startsWith("//", schemeEnd) ? schemeEnd + 2 : schemeEnd;
        int tailStart = url.length();
        for (int i = authorityStart; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                tailStart = i;
                break;
            }
        }
        if (tailStart == url.length()) {
            return url;
        }
        return url.substring(0, tailStart) + url.substring(tailStart).replace(" ", "%20");
    }

    static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
