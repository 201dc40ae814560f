package com.apidoc.generator.overwrite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.apidoc.generator.exception.OverwriteFormatException;
import com.apidoc.generator.exception.OverwriteValidationException;

/**
 * Unit tests for OverwriteParser.
 */
class OverwriteParserTest {

    private final OverwriteParser parser = new OverwriteParser();

    @Test
    void testParseHeaderAndBody() {
        List<String> lines = List.of(
                "---",
                "uid: Ns.Widget",
                "summary: *content",
                "remarks: Handle with care.",
                "---",
                "A widget that draws itself.",
                "",
                "Second paragraph.");

        OverwriteDocument doc = parser.parse("widget.md", lines);

        assertThat(doc.getUid()).isEqualTo("Ns.Widget");
        assertThat(doc.getSource()).isEqualTo("widget.md");
        assertThat(doc.getPartial().getSummary()).isEqualTo("A widget that draws itself.\n\nSecond paragraph.");
        assertThat(doc.getPartial().getRemarks()).isEqualTo("Handle with care.");
    }

    @Test
    void testPlaceholderInSeveralFields() {
        List<String> lines = List.of("---", "uid: Ns.Widget", "summary: *content", "remarks: *content", "---", "Body");

        OverwriteDocument doc = parser.parse("widget.md", lines);

        assertThat(doc.getPartial().getSummary()).isEqualTo("Body");
        assertThat(doc.getPartial().getRemarks()).isEqualTo("Body");
    }

    @Test
    void testEmptyBody() {
        OverwriteDocument doc = parser.parse("widget.md", List.of("---", "uid: Ns.Widget", "name: Gizmo", "---"));

        assertThat(doc.getPartial().getName()).isEqualTo("Gizmo");
        assertThat(doc.getPartial().getSummary()).isNull();
    }

    @Test
    void testMissingOpeningDelimiter() {
        assertThatThrownBy(() -> parser.parse("bad.md", List.of("uid: Ns.Widget", "---")))
                .isInstanceOf(OverwriteFormatException.class)
                .hasMessageContaining("bad.md")
                .hasMessageContaining("start with '---'");
    }

    @Test
    void testEmptyFile() {
        assertThatThrownBy(() -> parser.parse("empty.md", List.of()))
                .isInstanceOf(OverwriteFormatException.class);
    }

    @Test
    void testUnterminatedHeader() {
        assertThatThrownBy(() -> parser.parse("open.md", List.of("---", "uid: Ns.Widget", "summary: text")))
                .isInstanceOf(OverwriteFormatException.class)
                .hasMessageContaining("Unexpected end of file");
    }

    @Test
    void testMissingUid() {
        assertThatThrownBy(() -> parser.parse("nouid.md", List.of("---", "summary: text", "---")))
                .isInstanceOf(OverwriteValidationException.class)
                .hasMessageContaining("nouid.md");
    }

    @Test
    void testBlankUid() {
        assertThatThrownBy(() -> parser.parse("blank.md", List.of("---", "uid: '  '", "---")))
                .isInstanceOf(OverwriteValidationException.class);
    }
}
