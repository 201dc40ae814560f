package com.apidoc.generator.link;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.apidoc.generator.util.MarkdownTextUtil;

/**
 * Rewrites free text from the metadata into Markdown.
 *
 * HTML entities are decoded and each {@code <xref href="..."></xref>} element
 * becomes a link. The escaped shortcode delimiters "{{|" and "|}}" are turned
 * back into "{{&lt;" and "&gt;}}".
 */
public class CrossReferenceFormatter {

    private static final Pattern XREF_PATTERN =
            Pattern.compile("<xref .*?href=\"(.*?)\".*?></xref>", Pattern.MULTILINE);

    private final ReferenceLinker linker;

    public CrossReferenceFormatter(ReferenceLinker linker) {
        this.linker = linker;
    }

    public String format(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }

        String text = input.replace("{{|", "{{<").replace("|}}", ">}}");
        text = MarkdownTextUtil.decodeHtmlEntities(text);

        Matcher matcher = XREF_PATTERN.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String uid = matcher.group(1).replace("%2c", ",");
            matcher.appendReplacement(result, Matcher.quoteReplacement(linker.link(uid)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Formats the text and flattens it onto one line for a table cell.
     */
    public String formatForTable(String input) {
        return MarkdownTextUtil.formatForTable(format(input));
    }
}
