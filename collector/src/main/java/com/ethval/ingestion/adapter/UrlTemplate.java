package com.ethval.ingestion.adapter;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {name}} placeholder substitution. Values are inserted as given; callers encode them.
 */
public final class UrlTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z_]+)}");
    private static final Pattern SECRET_PARAM = Pattern.compile("((?:api_?key)=)[^&]*", Pattern.CASE_INSENSITIVE);

    private UrlTemplate() {
    }

    /**
     * @throws IllegalArgumentException when a placeholder has no value
     */
    public static String expand(String template, Map<String, String> variables) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = variables.get(m.group(1));
            if (value == null) {
                throw new IllegalArgumentException("No value for {" + m.group(1) + "} in " + template);
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** URL with API keys masked, for logs and error messages. */
    public static String redact(String url) {
        return url == null ? null : SECRET_PARAM.matcher(url).replaceAll("$1***");
    }
}
