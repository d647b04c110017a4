package com.cscript.compiler.prelude;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.model.Configuration;

import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the C support declarations prepended to every compiled unit.
 * The output depends only on the configuration and the unit name, which the
 * closing {@code #line} marker hands to the C compiler for its diagnostics.
 */
public class PreludeComposer {
    private static final Logger log = LoggerFactory.getLogger(PreludeComposer.class);

    static final String TEMPLATE_NAME = "prelude.c.ftl";

    private final freemarker.template.Configuration freemarkerConfig;

    public PreludeComposer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private freemarker.template.Configuration createFreemarkerConfig() {
        freemarker.template.Configuration cfg =
                new freemarker.template.Configuration(freemarker.template.Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String compose(Configuration configuration, String unitName) {
        Map<String, Object> model = new HashMap<>();
        model.put("hardline", configuration.isHardline());
        model.put("guardian", configuration.isGuardian());
        model.put("muttrack", configuration.isMuttrack());
        model.put("abi", escapeCString(configuration.getAbi()));
        model.put("unitName", escapeCString(unitName));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter writer = new StringWriter();
            template.process(model, writer);
            log.debug("Composed prelude of {} characters", writer.getBuffer().length());
            return writer.toString();
        } catch (IOException | TemplateException e) {
            // The template ships inside the jar; failing to render it is a packaging defect.
            throw new IllegalStateException("Cannot render " + TEMPLATE_NAME, e);
        }
    }

    /**
     * Prelude followed by the unit text, ready for the C compiler.
     */
    public String composeUnit(Configuration configuration, String unitName, String loweredText) {
        return compose(configuration, unitName) + loweredText;
    }

    static String escapeCString(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
