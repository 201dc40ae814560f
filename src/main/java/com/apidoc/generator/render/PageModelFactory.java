package com.apidoc.generator.render;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.apidoc.generator.core.context.ResolutionContext;
import com.apidoc.generator.link.AuthorityTable;
import com.apidoc.generator.link.CrossReferenceFormatter;
import com.apidoc.generator.link.ReferenceLinker;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemType;
import com.apidoc.generator.model.LinkInfo;
import com.apidoc.generator.model.Source;
import com.apidoc.generator.model.Syntax;
import com.apidoc.generator.model.ThrownException;
import com.apidoc.generator.path.PathResolver;
import com.apidoc.generator.render.model.IndexPage;
import com.apidoc.generator.render.model.ItemPage;
import com.apidoc.generator.render.model.MemberGroup;
import com.apidoc.generator.render.model.NamespacePage;
import com.apidoc.generator.render.model.TableRow;
import com.apidoc.generator.store.ItemStore;

import static com.apidoc.generator.util.MarkdownTextUtil.formatForTable;
import static com.apidoc.generator.util.MarkdownTextUtil.isBlank;

/**
 * Builds the template models for documents. Every identifier is resolved
 * here, so the templates only lay out text.
 */
public class PageModelFactory {

    private final ResolutionContext context;
    private final ItemStore store;
    private final AuthorityTable authorities;
    private final PathResolver pathResolver;
    private final ReferenceLinker linker;
    private final CrossReferenceFormatter formatter;

    public PageModelFactory(ResolutionContext context) {
        this.context = context;
        this.store = context.getStore();
        this.authorities = context.getAuthorities();
        this.linker = new ReferenceLinker(context);
        this.pathResolver = linker.getPathResolver();
        this.formatter = new CrossReferenceFormatter(linker);
    }

    public NamespacePage namespacePage(Item namespace, int weight) {
        Set<String> inherited = new LinkedHashSet<>(nullToEmpty(namespace.getInheritedMembers()));
        List<String> ownChildren = nullToEmpty(namespace.getChildren()).stream()
                .filter(uid -> !inherited.contains(uid))
                .collect(Collectors.toList());

        return NamespacePage.builder()
                .title(namespace.getName() + " Namespace")
                .weight(weight)
                .summary(formatter.format(namespace.getSummary()))
                .memberGroups(memberGroups(ownChildren))
                .build();
    }

    public ItemPage itemPage(Item item, int weight) {
        ItemPage.ItemPageBuilder page = ItemPage.builder()
                .title(orElse(item.getDisplayName(), item.getName()) + " "
                        + item.getType().getDisplayName())
                .weight(weight)
                .metadataLine(metadataLine(item))
                .summary(formatter.format(item.getSummary()))
                .remarks(formatter.format(item.getRemarks()))
                .memberGroups(memberGroups(nullToEmpty(item.getChildren())))
                .sourceLine(sourceLine(item.getSource()));

        item.getObsoleteMessage().ifPresent(message -> page.obsoleteNotice(
                "This " + item.getType().getDisplayName().toLowerCase(Locale.ROOT)
                        + " is **obsolete** and may be removed from a future version."
                        + (message.isEmpty() ? "" : " " + message)));

        for (String example : nullToEmpty(item.getExample())) {
            page.example(formatter.format(example));
        }

        Syntax syntax = item.getSyntax();
        if (syntax != null) {
            page.syntaxContent(syntax.getContent());
            page.syntaxRemarks(formatter.format(syntax.getRemarks()));

            for (Syntax.TypeParameter typeParameter : nullToEmpty(syntax.getTypeParameters())) {
                page.typeParameter(new TableRow(typeParameter.getId(),
                        formatter.formatForTable(typeParameter.getDescription())));
            }
            for (Syntax.Parameter parameter : nullToEmpty(syntax.getParameters())) {
                page.parameter(new TableRow(linker.link(parameter.getType()) + " " + parameter.getId(),
                        formatter.formatForTable(parameter.getDescription())));
            }
            Syntax.ReturnValue returnValue = syntax.getReturnValue();
            if (returnValue != null && item.getType().hasReturnSection()) {
                String description = isBlank(returnValue.getDescription())
                        ? ""
                        : ": " + formatter.format(returnValue.getDescription());
                page.returnType(linker.link(returnValue.getType()) + description);
            }
        }

        for (ThrownException exception : nullToEmpty(item.getExceptions())) {
            page.exception(new TableRow(linker.link(exception.getType()),
                    formatter.formatForTable(exception.getDescription())));
        }

        for (String uid : seeAlsoUids(item)) {
            String summary = store.findItem(uid).map(Item::getSummary).orElse(null);
            page.seeAlsoEntry(linker.link(uid) + (isBlank(summary) ? "" : ": " + formatter.format(summary)));
        }

        return page.build();
    }

    public IndexPage indexPage() {
        IndexPage.IndexPageBuilder page = IndexPage.builder();

        for (Item namespace : store.getNamespaces()) {
            page.namespace(new TableRow(linker.link(namespace.getUid()),
                    formatter.formatForTable(namespace.getSummary())));
        }

        store.getItemsSortedByUid().stream()
                .filter(i -> i.getType() != ItemType.NAMESPACE)
                .filter(i -> !i.isDoNotDocument())
                .filter(PageModelFactory::needsWork)
                .forEach(i -> page.itemNeedingWork("[`"
                        + formatForTable(orElse(i.getNameWithType(), i.getName()))
                        + "`](" + hrefOf(i) + ")"));

        return page.build();
    }

    /**
     * An item needs work when its summary is missing, a parameter is
     * undescribed, or it is a method whose return value is undescribed.
     */
    static boolean needsWork(Item item) {
        if (isBlank(item.getSummary())) {
            return true;
        }
        Syntax syntax = item.getSyntax();
        if (syntax == null) {
            return false;
        }
        boolean undescribedParameter = nullToEmpty(syntax.getParameters()).stream()
                .anyMatch(p -> isBlank(p.getDescription()));
        boolean undescribedReturn = item.getType() == ItemType.METHOD
                && syntax.getReturnValue() != null
                && isBlank(syntax.getReturnValue().getDescription());
        return undescribedParameter || undescribedReturn;
    }

    private String metadataLine(Item item) {
        List<String> metadata = new ArrayList<>();

        store.findItem(item.getParent())
                .filter(parent -> parent.getType() != ItemType.NAMESPACE)
                .ifPresent(parent -> metadata.add("Parent: " + linker.link(parent.getUid())));

        if (item.getNamespace() != null) {
            metadata.add("Namespace: " + linker.link(item.getNamespace()));
        }

        List<String> assemblies = nullToEmpty(item.getAssemblies());
        if (!assemblies.isEmpty()) {
            metadata.add("Assembly: " + assemblies.stream().map(a -> a + ".dll").collect(Collectors.joining(", ")));
        }

        return String.join(", ", metadata);
    }

    private List<MemberGroup> memberGroups(List<String> childUids) {
        Map<ItemType, List<TableRow>> rowsByType = new LinkedHashMap<>();

        for (String childUid : childUids) {
            store.findItem(childUid)
                    .filter(child -> !child.isDoNotDocument())
                    .ifPresent(child -> rowsByType
                            .computeIfAbsent(child.getType(), t -> new ArrayList<>())
                            .add(memberRow(child)));
        }

        return rowsByType.entrySet().stream()
                .map(e -> new MemberGroup(e.getKey().getPluralName(), e.getValue()))
                .collect(Collectors.toList());
    }

    private TableRow memberRow(Item child) {
        String name = "[" + formatForTable(child.getName()) + "](" + hrefOf(child) + ")";

        StringBuilder description = new StringBuilder();
        if (child.isObsolete()) {
            description.append("*Obsolete*");
            if (!isBlank(child.getSummary())) {
                description.append(": ");
            }
        }
        description.append(formatter.formatForTable(child.getSummary()));

        return new TableRow(name, description.toString());
    }

    /**
     * Manually authored see-also entries, plus the documented parameter and
     * return types of fields and properties. The item itself is left out.
     */
    private Set<String> seeAlsoUids(Item item) {
        Set<String> uids = new LinkedHashSet<>();
        for (LinkInfo link : nullToEmpty(item.getSeeAlso())) {
            if (link.getLinkId() != null) {
                uids.add(link.getLinkId());
            }
        }

        Syntax syntax = item.getSyntax();
        if (syntax != null && (item.getType() == ItemType.PROPERTY || item.getType() == ItemType.FIELD)) {
            List<String> types = new ArrayList<>();
            nullToEmpty(syntax.getParameters()).forEach(p -> types.add(p.getType()));
            if (syntax.getReturnValue() != null) {
                types.add(syntax.getReturnValue().getType());
            }
            types.stream()
                    .filter(Objects::nonNull)
                    .filter(uid -> store.findItem(uid).filter(i -> i.getType() != ItemType.NAMESPACE).isPresent())
                    .filter(uid -> !authorities.isExternal(uid))
                    .forEach(uids::add);
        }

        uids.remove(item.getUid());
        return uids;
    }

    private String sourceLine(Source source) {
        if (source == null || source.getPath() == null) {
            return null;
        }
        String repoUrl = source.getRepoUrl();
        String location = repoUrl != null ? "[" + source.getPath() + "](" + repoUrl + ")" : "`" + source.getPath() + "`";
        return "Defined in " + location + ", line " + (source.getStartLine() + 1) + ".";
    }

    private String hrefOf(Item item) {
        return context.internalHref(pathResolver.outputPath(item));
    }

    private static String orElse(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
