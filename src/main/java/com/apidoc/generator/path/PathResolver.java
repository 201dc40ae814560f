package com.apidoc.generator.path;

import com.apidoc.generator.core.context.ResolutionContext;
import com.apidoc.generator.exception.StructuralException;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemType;
import com.apidoc.generator.store.ItemStore;
import com.apidoc.generator.uid.CaseSuffixIndex;

/**
 * Maps items to their location in the output tree.
 *
 * <ul>
 * <li>Namespaces: {@code <uid><suffix>/_index}</li>
 * <li>Members: {@code <parent uid without namespace>/<short uid><suffix>},
 * next to their declaring type</li>
 * <li>Types: {@code <uid without namespace><suffix>/_index}</li>
 * </ul>
 *
 * {@code #} becomes {@code _} and generic-arity backticks become {@code -}.
 * Paths carry no file extension.
 */
public class PathResolver {

    public static final String INDEX_NAME = "_index";

    private final ItemStore store;
    private final CaseSuffixIndex caseSuffixes;

    public PathResolver(ResolutionContext context) {
        this.store = context.getStore();
        this.caseSuffixes = context.getCaseSuffixes();
    }

    /**
     * Path of the item relative to its namespace directory (or to the output
     * root, for namespaces).
     */
    public String resolve(Item item) {
        String caseSuffix = caseSuffixes.suffixFor(item);
        String path;

        if (item.getType() == ItemType.NAMESPACE) {
            path = item.getUid() + caseSuffix + "/" + INDEX_NAME;
        } else if (item.getType() != null && item.getType().isMember()) {
            Item parent = store.findItem(item.getParent())
                    .orElseThrow(() -> new StructuralException("Parent " + item.getParent() + " of "
                            + item.getType().getDisplayName() + " " + item.getUid() + " is not a documented item"));
            if (parent.getType() == ItemType.NAMESPACE) {
                throw new StructuralException("Parent of " + item.getType().getDisplayName() + " " + item.getUid()
                        + " is namespace " + parent.getUid() + "; members must be declared inside a type");
            }
            path = stripNamespacePrefix(parent) + "/" + shortUidOf(item) + caseSuffix;
        } else {
            path = stripNamespacePrefix(item) + caseSuffix + "/" + INDEX_NAME;
        }

        return normalize(path);
    }

    /**
     * Path of the item relative to the output root: the resolved path, inside
     * the item's namespace directory unless the item is a namespace itself.
     */
    public String outputPath(Item item) {
        String path = resolve(item);
        if (item.getType() == ItemType.NAMESPACE || item.getNamespace() == null || item.getNamespace().isEmpty()) {
            return path;
        }
        return item.getNamespace() + "/" + path;
    }

    /**
     * Removes one leading {@code "<namespace>."} from the item's UID.
     */
    static String stripNamespacePrefix(Item item) {
        String uid = item.getUid();
        if (item.getNamespace() == null) {
            return uid;
        }
        String prefix = item.getNamespace() + ".";
        return uid.startsWith(prefix) ? uid.substring(prefix.length()) : uid;
    }

    private static String shortUidOf(Item item) {
        return item.getShortUid() != null ? item.getShortUid() : item.getUid();
    }

    static String normalize(String path) {
        return path.replace('#', '_').replace('`', '-');
    }
}
