package com.apidoc.generator.store;

import static com.apidoc.generator.ItemFixtures.namespace;
import static com.apidoc.generator.ItemFixtures.type;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemType;
import com.apidoc.generator.model.Reference;

/**
 * Unit tests for ItemStore.
 */
class ItemStoreTest {

    @Test
    void testItemsSortedOrdinally() {
        ItemStore store = new ItemStore();
        store.putItem(type("b.Thing", null, ItemType.CLASS));
        store.putItem(namespace("B"));
        store.putItem(namespace("A"));

        assertThat(store.getItemsSortedByUid()).extracting(Item::getUid).containsExactly("A", "B", "b.Thing");
        assertThat(store.getNamespaces()).extracting(Item::getUid).containsExactly("A", "B");
    }

    @Test
    void testLaterItemReplacesEarlier() {
        ItemStore store = new ItemStore();
        Item first = namespace("Ns");
        Item second = namespace("Ns");
        second.setSummary("second");

        store.putItem(first);
        store.putItem(second);

        assertThat(store.itemCount()).isEqualTo(1);
        assertThat(store.findItem("Ns")).containsSame(second);
    }

    @Test
    void testItemWithoutUidIsRejected() {
        assertThatThrownBy(() -> new ItemStore().putItem(new Item()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testLookupsTolerateNull() {
        ItemStore store = new ItemStore();

        assertThat(store.findItem(null)).isEmpty();
        assertThat(store.findReference(null)).isEmpty();
        assertThat(store.containsItem(null)).isFalse();
    }

    @Test
    void testFrozenStoreRejectsChanges() {
        ItemStore store = new ItemStore();
        store.putReference(new Reference("System.String", "String"));
        store.freeze();

        assertThat(store.isFrozen()).isTrue();
        assertThat(store.findReference("System.String")).isPresent();
        assertThatThrownBy(() -> store.putItem(namespace("Ns")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
        assertThatThrownBy(() -> store.putReference(new Reference("X", "X")))
                .isInstanceOf(IllegalStateException.class);
    }
}
