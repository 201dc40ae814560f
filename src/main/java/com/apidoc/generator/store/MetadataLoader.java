package com.apidoc.generator.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.exception.StructuralException;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemCollection;
import com.apidoc.generator.model.Reference;
import com.apidoc.generator.model.TocEntry;
import com.apidoc.generator.util.YamlMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Populates an {@link ItemStore} from a metadata directory.
 *
 * The directory holds a {@code toc.yml} listing each namespace and its
 * types, and one {@code <uid>.yml} file per listed UID (backticks in the UID
 * are written as dashes in the file name).
 */
public class MetadataLoader {
    private static final Logger log = LoggerFactory.getLogger(MetadataLoader.class);

    public static final String TOC_FILE_NAME = "toc.yml";

    private final ObjectMapper mapper = YamlMappers.getYamlMapper();

    public ItemStore load(Path inputDir) throws IOException {
        ItemStore store = new ItemStore();

        List<TocEntry> tableOfContents = readTableOfContents(inputDir.resolve(TOC_FILE_NAME));

        for (TocEntry entry : tableOfContents) {
            for (String uid : documentableUids(entry)) {
                ItemCollection collection = readItemFile(inputDir, uid);
                for (Item item : collection.getItems()) {
                    store.putItem(item);
                }
                for (Reference reference : collection.getReferences()) {
                    store.putReference(reference);
                }
            }
        }

        log.info("Loaded {} items and {} references from {}", store.itemCount(), store.referenceCount(), inputDir);
        return store;
    }

    List<TocEntry> readTableOfContents(Path tocPath) throws IOException {
        if (!Files.isRegularFile(tocPath)) {
            throw new StructuralException("Table of contents not found: " + tocPath);
        }
        try {
            List<TocEntry> entries = mapper.readValue(tocPath.toFile(), new TypeReference<List<TocEntry>>() {});
            return entries == null ? List.of() : entries;
        } catch (JsonProcessingException e) {
            throw new StructuralException("Malformed table of contents " + tocPath + ": " + e.getOriginalMessage(), e);
        }
    }

    private List<String> documentableUids(TocEntry entry) {
        List<String> uids = new ArrayList<>();
        if (entry.getItems() != null) {
            for (TocEntry.Child child : entry.getItems()) {
                uids.add(child.getUid());
            }
        }
        uids.add(entry.getUid());
        return uids;
    }

    private ItemCollection readItemFile(Path inputDir, String uid) throws IOException {
        if (uid == null) {
            throw new StructuralException("Table of contents entry without a UID in " + inputDir);
        }
        Path itemPath = inputDir.resolve(uid.replace("`", "-") + ".yml");
        if (!Files.isRegularFile(itemPath)) {
            throw new StructuralException("Metadata file for " + uid + " not found: " + itemPath);
        }
        log.debug("Reading {}", itemPath);
        try {
            ItemCollection collection = mapper.readValue(itemPath.toFile(), ItemCollection.class);
            if (collection == null) {
                return new ItemCollection();
            }
            if (collection.getItems() == null) {
                collection.setItems(List.of());
            }
            if (collection.getReferences() == null) {
                collection.setReferences(List.of());
            }
            checkRequiredFields(collection, itemPath);
            return collection;
        } catch (JsonProcessingException e) {
            throw new StructuralException("Malformed metadata file " + itemPath + ": " + e.getOriginalMessage(), e);
        }
    }

    private void checkRequiredFields(ItemCollection collection, Path itemPath) {
        for (Item item : collection.getItems()) {
            if (item.getUid() == null) {
                throw new StructuralException("Item without a UID in " + itemPath + ": " + item.getName());
            }
            if (item.getType() == null) {
                throw new StructuralException("Item " + item.getUid() + " has no type in " + itemPath);
            }
        }
        for (Reference reference : collection.getReferences()) {
            if (reference.getUid() == null) {
                throw new StructuralException("Reference without a UID in " + itemPath + ": " + reference.getName());
            }
        }
    }
}
