package com.cfamily.astexport.schema;

import com.cfamily.astexport.exception.SchemaException;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the document schema: one {@code #define <kind>_tuple} line per kind and one
 * variant type per family listing its concrete kinds.
 * <p>
 * Families are validated first; an inconsistent kind tree is reported as a
 * {@link SchemaException} listing every problem.
 */
public class SchemaGenerator {

    private static final Logger log = LoggerFactory.getLogger(SchemaGenerator.class);
    private static final String TEMPLATE = "schema.atd.ftl";

    private final Configuration freemarkerConfig;

    public SchemaGenerator() {
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

    public String render() throws IOException {
        StringWriter out = new StringWriter();
        render(out);
        return out.toString();
    }

    public void render(Writer out) throws IOException {
        List<FamilyLayout> families = new ArrayList<>();
        for (NodeFamily family : NodeFamily.values()) {
            families.add(layout(family));
        }

        Map<String, Object> data = new HashMap<>();
        data.put("families", families);

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        try {
            template.process(data, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE + ": " + e.getMessage(), e);
        }
        out.flush();
    }

    FamilyLayout layout(NodeFamily family) {
        List<String> errors = KindHierarchy.validate(family);
        if (!errors.isEmpty()) {
            throw new SchemaException("Kind tree of family " + family + " is inconsistent: "
                    + String.join("; ", errors));
        }
        List<KindLayout> kinds = new ArrayList<>();
        List<KindLayout> concrete = new ArrayList<>();
        for (NodeKind kind : family.kinds()) {
            KindLayout layout = KindLayout.of(kind);
            kinds.add(layout);
            if (!kind.isAbstractKind()) {
                concrete.add(layout);
            }
        }
        log.debug("Family {}: {} kinds, {} concrete", family.getSchemaName(), kinds.size(), concrete.size());
        return new FamilyLayout(family.getSchemaName(), kinds, concrete);
    }
}
