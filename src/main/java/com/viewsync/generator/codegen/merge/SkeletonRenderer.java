package com.viewsync.generator.codegen.merge;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the full source of a view that does not exist yet.
 */
public class SkeletonRenderer {

    static final String TEMPLATE_NAME = "view-class.ftl";

    private final Configuration freemarkerConfig;

    public SkeletonRenderer() {
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

    /**
     * @param namespace       package name, empty for the default package
     * @param baseType        superclass, empty for none
     * @param propertiesRegion rendered accessor region, empty to leave it out
     */
    public String render(String className, String namespace, String baseType,
                         String fieldsRegion, String propertiesRegion, String initRegion) {
        Map<String, Object> model = new HashMap<>();
        model.put("className", className);
        model.put("namespace", namespace);
        model.put("baseType", baseType);
        model.put("fieldsRegion", stripTrailingNewline(fieldsRegion));
        model.put("propertiesRegion", stripTrailingNewline(propertiesRegion));
        model.put("initRegion", stripTrailingNewline(initRegion));
        model.put("userCodeStart", Region.USER_CODE_START);
        model.put("userCodeEnd", Region.USER_CODE_END);

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render " + TEMPLATE_NAME + " for " + className, e);
        }
    }

    private static String stripTrailingNewline(String region) {
        return region.endsWith("\n") ? region.substring(0, region.length() - 1) : region;
    }
}
