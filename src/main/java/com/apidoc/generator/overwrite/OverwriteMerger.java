package com.apidoc.generator.overwrite;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.core.context.ToolDiagnostics;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.store.ItemStore;
import com.apidoc.generator.util.MarkdownTextUtil;

/**
 * Applies overwrite documents to the items in a store, field by field
 * according to {@link OverwriteField}.
 *
 * Only non-blank values are copied, so an overwrite document can add or
 * replace content but never erase it.
 */
public class OverwriteMerger {
    private static final Logger log = LoggerFactory.getLogger(OverwriteMerger.class);

    /**
     * Merges one overwrite document into the store.
     *
     * @return {@code true} if the target item existed and was merged,
     *         {@code false} if it was skipped with a warning
     */
    public boolean merge(ItemStore store, OverwriteDocument document, ToolDiagnostics diagnostics) {
        store.checkNotFrozen();

        Optional<Item> target = store.findItem(document.getUid());
        if (target.isEmpty()) {
            String warning = "Overwrite file " + document.getSource() + " overwrites item " + document.getUid()
                    + ", but no such item exists in the documentation";
            log.warn(warning);
            diagnostics.addWarning(warning);
            return false;
        }

        Item item = target.get();
        for (OverwriteField field : OverwriteField.values()) {
            if (field.getRule() != MergeRule.REPLACE) {
                continue;
            }
            String value = field.get(document.getPartial());
            if (!MarkdownTextUtil.isBlank(value)) {
                field.set(item, value);
                log.debug("{} {} => {}", item.getUid(), field.getPropertyName(), value);
            }
        }
        return true;
    }
}
