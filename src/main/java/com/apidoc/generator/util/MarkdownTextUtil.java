package com.apidoc.generator.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.text.StringEscapeUtils;

/**
 * Small text helpers for producing Markdown from metadata strings.
 */
public class MarkdownTextUtil {

    private static final Pattern ENTITY_PATTERN = Pattern.compile("&(#[0-9]+|#[xX][0-9a-fA-F]+|[a-zA-Z]+);");

    private static final Map<String, String> NAMED_ENTITIES = Map.of(
            "lt", "<",
            "gt", ">",
            "amp", "&",
            "quot", "\"",
            "apos", "'",
            "nbsp", " ");

    private MarkdownTextUtil() {
        // Utility class
    }

    /**
     * Makes a string safe to place inside a Markdown table cell. Null becomes
     * the empty string.
     */
    public static String formatForTable(String input) {
        if (input == null) {
            return "";
        }
        return input.replace('\n', ' ');
    }

    /**
     * Decodes HTML 4 character references. Unknown named entities and numeric
     * references outside the Unicode range are left untouched.
     */
    public static String decodeHtmlEntities(String input) {
        if (input == null || input.indexOf('&') < 0) {
            return input;
        }
        Matcher matcher = ENTITY_PATTERN.matcher(input);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String entity = matcher.group(1);
            String decoded;
            if (entity.startsWith("#x") || entity.startsWith("#X")) {
                decoded = decodeCodePoint(entity.substring(2), 16, matcher.group());
            } else if (entity.startsWith("#")) {
                decoded = decodeCodePoint(entity.substring(1), 10, matcher.group());
            } else if (NAMED_ENTITIES.containsKey(entity)) {
                decoded = NAMED_ENTITIES.get(entity);
            } else {
                decoded = StringEscapeUtils.unescapeHtml4(matcher.group());
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(decoded));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String decodeCodePoint(String digits, int radix, String original) {
        int codePoint;
        try {
            codePoint = Integer.parseInt(digits, radix);
        } catch (NumberFormatException e) {
            return original;
        }
        if (!Character.isValidCodePoint(codePoint)) {
            return original;
        }
        return new String(Character.toChars(codePoint));
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
