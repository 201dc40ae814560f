package com.apidoc.generator.link;

import com.apidoc.generator.util.MarkdownTextUtil;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The outcome of resolving one identifier.
 */
@Value
@Builder
public class ResolvedReference {

    @NonNull
    ReferenceKind kind;

    /**
     * Text shown to the reader, including a trailing {@code []} for arrays.
     */
    @NonNull
    String displayText;

    /**
     * Output path of an internal item, or the URL of an external page;
     * {@code null} when unlinked.
     */
    String target;

    /**
     * Hyperlink written into the document; {@code null} when unlinked.
     */
    String href;

    public boolean isLinked() {
        return href != null;
    }

    /**
     * Code-styled Markdown, hyperlinked when a target exists.
     */
    public String toMarkdown() {
        String text = MarkdownTextUtil.formatForTable(displayText);
        if (!isLinked()) {
            return "`" + text + "`";
        }
        return "[`" + text + "`](" + href + ")";
    }
}
