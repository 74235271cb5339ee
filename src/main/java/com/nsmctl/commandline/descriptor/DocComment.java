package com.nsmctl.commandline.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured documentation attached to a target type or operation.
 *
 * Format (Javadoc tag style):
 * <pre>
 * Summary text, possibly over several lines.
 * &#64;param install_directory The path to the installation directory
 *     continuation lines are folded into the previous parameter
 * &#64;return ignored
 * </pre>
 */
public final class DocComment {

    private static final Logger log = LoggerFactory.getLogger(DocComment.class);

    private static final Pattern PARAM_TAG = Pattern.compile("^@param\\s+(\\S+)\\s*(.*)$");
    private static final Pattern ANY_TAG = Pattern.compile("^@\\w+.*$");

    private static final DocComment EMPTY = new DocComment("", Map.of());

    private final String summary;
    private final Map<String, String> parameterDescriptions;

    private DocComment(String summary, Map<String, String> parameterDescriptions) {
        this.summary = summary;
        this.parameterDescriptions = Collections.unmodifiableMap(parameterDescriptions);
    }

    public static DocComment empty() {
        return EMPTY;
    }

    public static DocComment parse(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY;
        }
        return parse(text.lines().toList());
    }

    public static DocComment parse(List<String> lines) {
        StringBuilder summary = new StringBuilder();
        Map<String, StringBuilder> params = new LinkedHashMap<>();
        StringBuilder current = summary;

        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            Matcher param = PARAM_TAG.matcher(trimmed);
            if (param.matches()) {
                current = new StringBuilder(param.group(2).trim());
                params.put(param.group(1), current);
                continue;
            }
            if (ANY_TAG.matcher(trimmed).matches()) {
                // Tags other than @param end the previous block and are not kept
                log.debug("Ignoring documentation tag: {}", trimmed);
                current = new StringBuilder();
                continue;
            }
            appendWord(current, trimmed);
        }

        Map<String, String> descriptions = new LinkedHashMap<>();
        params.forEach((name, text) -> descriptions.put(name, text.toString()));
        return new DocComment(summary.toString(), descriptions);
    }

    private static void appendWord(StringBuilder target, String text) {
        if (target.length() > 0) {
            target.append(' ');
        }
        target.append(text);
    }

    public String getSummary() {
        return summary;
    }

    public Optional<String> describe(String parameterName) {
        return Optional.ofNullable(parameterDescriptions.get(parameterName));
    }

    public Map<String, String> getParameterDescriptions() {
        return parameterDescriptions;
    }
}
