package com.apidoc.generator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.apidoc.generator.exception.StructuralException;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemType;

/**
 * Unit tests for MetadataLoader.
 */
class MetadataLoaderTest {

    private final MetadataLoader loader = new MetadataLoader();

    @TempDir
    Path tempDir;

    @Test
    void testLoadsTocEntriesAndChildren() throws IOException {
        Files.writeString(tempDir.resolve("toc.yml"), """
                - uid: Ns
                  name: Ns
                  items:
                  - uid: Ns.Box`1
                    name: Box<T>
                """);
        Files.writeString(tempDir.resolve("Ns.yml"), """
                items:
                - uid: Ns
                  id: Ns
                  type: Namespace
                  name: Ns
                  fullName: Ns
                  children:
                  - Ns.Box`1
                references:
                - uid: Ns.Box`1
                  name: Box<T>
                """);
        Files.writeString(tempDir.resolve("Ns.Box-1.yml"), """
                items:
                - uid: Ns.Box`1
                  id: Box`1
                  parent: Ns
                  type: Class
                  name: Box<T>
                  fullName: Ns.Box<T>
                  namespace: Ns
                  summary: A box.
                  syntax:
                    content: public class Box<T>
                    typeParameters:
                    - id: T
                      description: Content type.
                  seealso:
                  - linkId: System.Object
                  source:
                    path: src/Box.cs
                    startLine: 9
                    remote:
                      path: src/Box.cs
                      branch: main
                      repo: git@github.com:example/boxes.git
                  someUnknownField: ignored
                references:
                - uid: System.Object
                  name: Object
                """);

        ItemStore store = loader.load(tempDir);

        assertThat(store.itemCount()).isEqualTo(2);
        assertThat(store.referenceCount()).isEqualTo(2);

        Item box = store.findItem("Ns.Box`1").orElseThrow();
        assertThat(box.getType()).isEqualTo(ItemType.CLASS);
        assertThat(box.getSyntax().getTypeParameters()).hasSize(1);
        assertThat(box.getSeeAlso()).hasSize(1);
        assertThat(box.getSeeAlso().get(0).getLinkId()).isEqualTo("System.Object");
        assertThat(box.getSource().getRepoUrl())
                .isEqualTo("https://github.com/example/boxes/blob/main/src/Box.cs#L10");
        assertThat(store.findItem("Ns").orElseThrow().getType()).isEqualTo(ItemType.NAMESPACE);
    }

    @Test
    void testMissingTocIsStructuralError() {
        assertThatThrownBy(() -> loader.load(tempDir))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("toc.yml");
    }

    @Test
    void testMissingItemFileIsStructuralError() throws IOException {
        Files.writeString(tempDir.resolve("toc.yml"), "- uid: Ns\n  name: Ns\n");

        assertThatThrownBy(() -> loader.load(tempDir))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Ns.yml");
    }

    @Test
    void testMalformedItemFileIsStructuralError() throws IOException {
        Files.writeString(tempDir.resolve("toc.yml"), "- uid: Ns\n  name: Ns\n");
        Files.writeString(tempDir.resolve("Ns.yml"), "items: [unclosed\n");

        assertThatThrownBy(() -> loader.load(tempDir))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void testItemWithoutUidIsStructuralError() throws IOException {
        Files.writeString(tempDir.resolve("toc.yml"), "- uid: Ns\n  name: Ns\n");
        Files.writeString(tempDir.resolve("Ns.yml"), """
                items:
                - name: Stray
                  type: Class
                """);

        assertThatThrownBy(() -> loader.load(tempDir))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Ns.yml")
                .hasMessageContaining("Stray");
    }

    @Test
    void testItemWithoutTypeIsStructuralError() throws IOException {
        Files.writeString(tempDir.resolve("toc.yml"), "- uid: Ns\n  name: Ns\n");
        Files.writeString(tempDir.resolve("Ns.yml"), """
                items:
                - uid: Ns.Widget
                  name: Widget
                """);

        assertThatThrownBy(() -> loader.load(tempDir))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Ns.Widget has no type")
                .hasMessageContaining("Ns.yml");
    }

    @Test
    void testReferenceWithoutUidIsStructuralError() throws IOException {
        Files.writeString(tempDir.resolve("toc.yml"), "- uid: Ns\n  name: Ns\n");
        Files.writeString(tempDir.resolve("Ns.yml"), """
                items:
                - uid: Ns
                  type: Namespace
                  name: Ns
                references:
                - name: Object
                """);

        assertThatThrownBy(() -> loader.load(tempDir))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Reference without a UID");
    }
}
