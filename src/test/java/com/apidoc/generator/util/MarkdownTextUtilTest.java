package com.apidoc.generator.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for MarkdownTextUtil.
 */
class MarkdownTextUtilTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "a &lt; b|a < b",
            "&quot;quoted&quot;|\"quoted\"",
            "&#65;&#x42;|AB",
            "fish &amp; chips|fish & chips",
            "&unknown; stays|&unknown; stays",
            "no entities|no entities",
            "a &#99999999999; b|a &#99999999999; b",
            "&#x110000; kept|&#x110000; kept",
            "&copy; 2024 &mdash; more&hellip;|\u00A9 2024 \u2014 more\u2026",
            "no&nbsp;break|no break",
            "&eacute;t&eacute;|\u00E9t\u00E9"
    })
    void testDecodeHtmlEntities(String input, String expected) {
        assertThat(MarkdownTextUtil.decodeHtmlEntities(input)).isEqualTo(expected);
    }

    @Test
    void testFormatForTable() {
        assertThat(MarkdownTextUtil.formatForTable(null)).isEmpty();
        assertThat(MarkdownTextUtil.formatForTable("one\ntwo")).isEqualTo("one two");
    }

    @Test
    void testIsBlank() {
        assertThat(MarkdownTextUtil.isBlank(null)).isTrue();
        assertThat(MarkdownTextUtil.isBlank(" \t")).isTrue();
        assertThat(MarkdownTextUtil.isBlank("x")).isFalse();
    }
}
