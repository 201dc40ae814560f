package com.apidoc.generator.docgen;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.core.context.ResolutionContext;
import com.apidoc.generator.core.context.ToolDiagnostics;
import com.apidoc.generator.exception.ApiDocException;
import com.apidoc.generator.link.AuthorityTable;
import com.apidoc.generator.link.AuthorityTableLoader;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemType;
import com.apidoc.generator.output.DocumentWriter;
import com.apidoc.generator.output.GeneratedFile;
import com.apidoc.generator.output.GeneratedFileType;
import com.apidoc.generator.overwrite.OverwriteDiscoveryService;
import com.apidoc.generator.overwrite.OverwriteDocument;
import com.apidoc.generator.overwrite.OverwriteMerger;
import com.apidoc.generator.overwrite.OverwriteParser;
import com.apidoc.generator.path.OutputPathRegistry;
import com.apidoc.generator.path.PathResolver;
import com.apidoc.generator.render.MarkdownRenderer;
import com.apidoc.generator.render.PageModelFactory;
import com.apidoc.generator.store.ItemStore;
import com.apidoc.generator.store.MetadataLoader;
import com.apidoc.generator.uid.CaseSuffixIndex;
import com.apidoc.generator.uid.UidDisambiguator;
import com.apidoc.generator.util.FileWriteUtil;

/**
 * Runs the whole conversion: load metadata, derive identifiers, apply
 * overwrites, then render and write every document.
 *
 * Each stage needs the previous one to have seen the complete store, so the
 * stages run strictly in order and any fatal error ends the run.
 */
public class DocumentationGenerator {
    private static final Logger log = LoggerFactory.getLogger(DocumentationGenerator.class);

    private final GeneratorConfig config;
    private final MetadataLoader metadataLoader;
    private final UidDisambiguator disambiguator;
    private final OverwriteDiscoveryService overwriteDiscovery;
    private final OverwriteParser overwriteParser;
    private final OverwriteMerger overwriteMerger;
    private final AuthorityTableLoader authorityLoader;
    private final MarkdownRenderer renderer;

    public DocumentationGenerator(GeneratorConfig config) {
        this.config = config;
        this.metadataLoader = new MetadataLoader();
        this.disambiguator = new UidDisambiguator();
        this.overwriteDiscovery = new OverwriteDiscoveryService();
        this.overwriteParser = new OverwriteParser();
        this.overwriteMerger = new OverwriteMerger();
        this.authorityLoader = new AuthorityTableLoader();
        this.renderer = new MarkdownRenderer();
    }

    /**
     * Generate the complete documentation tree.
     */
    public GeneratorResult generate() {
        try {
            log.info("Starting documentation generation...");
            ToolDiagnostics diagnostics = new ToolDiagnostics();

            log.info("Step 1: Loading metadata...");
            ItemStore store = metadataLoader.load(config.getInputDir());

            log.info("Step 2: Disambiguating UIDs...");
            CaseSuffixIndex caseSuffixes = disambiguator.disambiguate(store);
            if (caseSuffixes.collidingItemCount() > 0) {
                diagnostics.addInfo(caseSuffixes.collidingItemCount()
                        + " items share a UID with another item except for case; their paths carry a numeric suffix");
            }

            log.info("Step 3: Applying overwrite files...");
            int[] overwriteCounts = applyOverwrites(store, diagnostics);

            store.freeze();

            log.info("Step 4: Loading external authorities...");
            AuthorityTable authorities = config.getAuthoritiesFile() != null
                    ? authorityLoader.load(config.getAuthoritiesFile())
                    : authorityLoader.loadDefault();

            ResolutionContext context = ResolutionContext.builder()
                    .store(store)
                    .caseSuffixes(caseSuffixes)
                    .authorities(authorities)
                    .linkPrefix(config.getLinkPrefix())
                    .build();

            log.info("Step 5: Preparing output directory...");
            prepareOutputDirectory();

            log.info("Step 6: Writing documents...");
            DocumentWriter writer = new DocumentWriter(config.getOutputDir(), new OutputPathRegistry());
            writeDocuments(store, context, writer);

            log.info("Documentation generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputDir())
                    .itemsLoaded(store.itemCount())
                    .referencesLoaded(store.referenceCount())
                    .caseCollisions(caseSuffixes.collidingItemCount())
                    .overwritesApplied(overwriteCounts[0])
                    .overwritesSkipped(overwriteCounts[1])
                    .documentsWritten(writer.getFilesWritten())
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .infos(List.copyOf(diagnostics.getInfos()))
                    .build();

        } catch (ApiDocException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Generation failed with I/O error", e);
            return GeneratorResult.failure("I/O error: " + e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("Generation failed with I/O error", e);
            return GeneratorResult.failure("I/O error: " + e.getCause().getMessage());
        }
    }

    /**
     * @return applied and skipped overwrite counts
     */
    private int[] applyOverwrites(ItemStore store, ToolDiagnostics diagnostics) throws IOException {
        Path overwriteDir = config.getOverwriteDir();
        if (overwriteDir == null || !Files.isDirectory(overwriteDir)) {
            log.info("No overwrite directory, skipping");
            return new int[] {0, 0};
        }

        int applied = 0;
        int skipped = 0;
        for (Path file : overwriteDiscovery.discoverOverwriteFiles(overwriteDir)) {
            OverwriteDocument document = overwriteParser.parse(file);
            if (overwriteMerger.merge(store, document, diagnostics)) {
                applied++;
            } else {
                skipped++;
            }
        }
        log.info("Applied {} overwrite files ({} skipped)", applied, skipped);
        return new int[] {applied, skipped};
    }

    private void prepareOutputDirectory() throws IOException {
        Path outputDir = config.getOutputDir();
        if (config.isForce() && !FileWriteUtil.isEmptyDirectory(outputDir)) {
            log.warn("Force mode enabled, clearing: {}", outputDir);
            FileWriteUtil.deleteDirectoryContents(outputDir);
        }
        Files.createDirectories(outputDir);
    }

    private void writeDocuments(ItemStore store, ResolutionContext context, DocumentWriter writer)
            throws IOException {
        PageModelFactory pages = new PageModelFactory(context);
        PathResolver pathResolver = new PathResolver(context);

        int documentIndexNumber = 0;
        for (Item item : store.getItemsSortedByUid()) {
            if (item.isDoNotDocument()) {
                continue;
            }
            documentIndexNumber++;

            GeneratedFile file;
            if (item.getType() == ItemType.NAMESPACE) {
                file = GeneratedFile.builder()
                        .path(pathResolver.outputPath(item))
                        .contents(renderer.renderNamespace(pages.namespacePage(item, documentIndexNumber)))
                        .type(GeneratedFileType.NAMESPACE)
                        .build();
            } else {
                file = GeneratedFile.builder()
                        .path(pathResolver.outputPath(item))
                        .contents(renderer.renderItem(pages.itemPage(item, documentIndexNumber)))
                        .type(GeneratedFileType.ITEM)
                        .build();
            }
            writer.write(file);
        }

        writer.write(GeneratedFile.builder()
                .path(PathResolver.INDEX_NAME)
                .contents(renderer.renderIndex(pages.indexPage()))
                .type(GeneratedFileType.INDEX)
                .build());
    }
}
