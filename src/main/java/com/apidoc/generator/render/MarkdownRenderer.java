package com.apidoc.generator.render;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import com.apidoc.generator.exception.RenderException;
import com.apidoc.generator.render.model.IndexPage;
import com.apidoc.generator.render.model.ItemPage;
import com.apidoc.generator.render.model.NamespacePage;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders page models into Markdown with the FreeMarker templates under
 * {@code /templates}.
 */
public class MarkdownRenderer {

    static final String ITEM_TEMPLATE = "item.md.ftl";
    static final String NAMESPACE_TEMPLATE = "namespace.md.ftl";
    static final String INDEX_TEMPLATE = "index.md.ftl";

    private final Configuration freemarkerConfig;

    public MarkdownRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String renderItem(ItemPage page) throws IOException {
        return process(ITEM_TEMPLATE, page);
    }

    public String renderNamespace(NamespacePage page) throws IOException {
        return process(NAMESPACE_TEMPLATE, page);
    }

    public String renderIndex(IndexPage page) throws IOException {
        return process(INDEX_TEMPLATE, page);
    }

    private String process(String templateName, Object page) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        try {
            template.process(Map.of("page", page), out);
        } catch (TemplateException e) {
            throw new RenderException("Failed to render " + templateName + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}
