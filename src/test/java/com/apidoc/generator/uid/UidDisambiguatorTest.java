package com.apidoc.generator.uid;

import static com.apidoc.generator.ItemFixtures.member;
import static com.apidoc.generator.ItemFixtures.namespace;
import static com.apidoc.generator.ItemFixtures.storeOf;
import static com.apidoc.generator.ItemFixtures.type;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemType;
import com.apidoc.generator.store.ItemStore;

/**
 * Unit tests for UidDisambiguator.
 */
class UidDisambiguatorTest {

    private final UidDisambiguator disambiguator = new UidDisambiguator();

    @Test
    void testCaseCollidingUidsGetOrdinalSuffixes() {
        Item upper = type("Foo", null, ItemType.CLASS);
        Item lower = type("foo", null, ItemType.CLASS);

        CaseSuffixIndex suffixes = disambiguator.disambiguate(storeOf(lower, upper));

        assertThat(suffixes.suffixFor("Foo")).isEqualTo("0");
        assertThat(suffixes.suffixFor("foo")).isEqualTo("1");
        assertThat(suffixes.collidingItemCount()).isEqualTo(2);
    }

    @Test
    void testSuffixesAreContiguousForLargerGroups() {
        ItemStore store = storeOf(
                type("ns.Widget", null, ItemType.CLASS),
                type("NS.WIDGET", null, ItemType.CLASS),
                type("Ns.Widget", null, ItemType.CLASS),
                type("Ns.Other", null, ItemType.CLASS));

        CaseSuffixIndex suffixes = disambiguator.disambiguate(store);

        // ordinal order: uppercase letters sort before lowercase
        assertThat(suffixes.suffixFor("NS.WIDGET")).isEqualTo("0");
        assertThat(suffixes.suffixFor("Ns.Widget")).isEqualTo("1");
        assertThat(suffixes.suffixFor("ns.Widget")).isEqualTo("2");
        assertThat(suffixes.suffixFor("Ns.Other")).isEmpty();
    }

    @Test
    void testUniqueUidHasEmptySuffix() {
        CaseSuffixIndex suffixes = disambiguator.disambiguate(storeOf(namespace("Ns")));

        assertThat(suffixes.suffixFor("Ns")).isEmpty();
        assertThat(suffixes.suffixFor("Unknown")).isEmpty();
        assertThat(suffixes.collidingItemCount()).isZero();
    }

    @Test
    void testSingletonOverloadGroupUsesOverloadWithoutMarker() {
        Item widget = type("Ns.Widget", "Ns", ItemType.CLASS);
        Item draw = member("Ns.Widget.Draw(System.Int32)", widget, ItemType.METHOD, "Ns.Widget.Draw*");

        disambiguator.disambiguate(storeOf(widget, draw));

        assertThat(draw.getShortUid()).isEqualTo("Ns.Widget.Draw");
    }

    @Test
    void testSharedOverloadKeepsFullUids() {
        Item widget = type("Ns.Widget", "Ns", ItemType.CLASS);
        Item first = member("Ns.Widget.Draw(System.Int32)", widget, ItemType.METHOD, "Ns.Widget.Draw*");
        Item second = member("Ns.Widget.Draw(System.String)", widget, ItemType.METHOD, "Ns.Widget.Draw*");

        disambiguator.disambiguate(storeOf(widget, first, second));

        assertThat(first.getShortUid()).isEqualTo("Ns.Widget.Draw(System.Int32)");
        assertThat(second.getShortUid()).isEqualTo("Ns.Widget.Draw(System.String)");
    }

    @Test
    void testItemWithoutOverloadUsesUid() {
        Item widget = type("Ns.Widget", "Ns", ItemType.CLASS);

        disambiguator.disambiguate(storeOf(widget));

        assertThat(widget.getShortUid()).isEqualTo("Ns.Widget");
    }

    @ParameterizedTest
    @CsvSource({
            "Ns.Widget.Draw*, Ns.Widget.Draw",
            "Ns.Widget.Draw**, Ns.Widget.Draw",
            "Ns.Widget.Draw, Ns.Widget.Draw",
            "'*', ''"
    })
    void testStripTrailingMarkers(String overload, String expected) {
        assertThat(UidDisambiguator.stripTrailingMarkers(overload)).isEqualTo(expected);
    }
}
