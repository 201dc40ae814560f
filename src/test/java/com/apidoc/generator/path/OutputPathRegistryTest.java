package com.apidoc.generator.path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.apidoc.generator.exception.PathCollisionException;

/**
 * Unit tests for OutputPathRegistry.
 */
class OutputPathRegistryTest {

    @Test
    void testRegisterDistinctPaths() {
        OutputPathRegistry registry = new OutputPathRegistry();

        registry.register("Ns/_index");
        registry.register("Ns/Widget/_index");

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.isRegistered("ns/widget/_INDEX")).isTrue();
    }

    @Test
    void testCollisionIgnoringCase() {
        OutputPathRegistry registry = new OutputPathRegistry();
        registry.register("Ns/Foo/_index");

        assertThatThrownBy(() -> registry.register("Ns/foo/_index"))
                .isInstanceOf(PathCollisionException.class)
                .hasMessageContaining("Ns/foo/_index");
    }
}
