package org.fmrest.dataapi.freemarker;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateModel;
import freemarker.template.TemplateModelException;
import lombok.Getter;
import org.fmrest.dataapi.freemarker.exception.ConvertException;
import org.fmrest.dataapi.freemarker.exception.FreeMarkerException;
import org.fmrest.dataapi.freemarker.exception.FreeMarkerFormatException;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Application-wide singleton for Freemarker template configuration and execution.
 * <p>
 * - Renders the Data API endpoint templates ({@code ${database?url}} style placeholders).
 * - Percent-encodes with UTF-8 for the {@code ?url} built-in.
 * - Caches compiled templates, since the same few paths are rendered on every call.
 * </p>
 */
public class FreeMarkerEngine {

    /** Singleton instance of engine for global access. */
    @Getter
    private static final FreeMarkerEngine instance = new FreeMarkerEngine();

    /** Freemarker configuration: thread-safe once set up, global per application. */
    private static final Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);

    static {
        cfg.setURLEscapingCharset(StandardCharsets.UTF_8.name());
        cfg.setNumberFormat("computer");
        cfg.setBooleanFormat("c");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
    }

    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    private FreeMarkerEngine() {
    }

    /**
     * Renders a template string with provided variable bindings.
     *
     * @param template  The template text as a string.
     * @param variables Bindings (variable name -> TemplateModel).
     * @return The rendered template result as a trimmed string.
     * @throws FreeMarkerFormatException If the template renders with error.
     */
    public String process(String template, Map<String, TemplateModel> variables)
            throws FreeMarkerFormatException {
        StringWriter stringWriter = new StringWriter();
        try {
            getTemplate(template).process(variables, stringWriter);
        } catch (IOException | TemplateException ex) {
            throw new FreeMarkerFormatException("Cannot render " + template + ": " + ex.getMessage(), ex);
        }
        return stringWriter.toString().trim();
    }

    /**
     * Renders a template with plain Java values, wrapping each of them first.
     *
     * @param template  The template text.
     * @param values    Bindings (variable name -> value).
     * @return The rendered result.
     */
    public String processValues(String template, Map<String, ?> values) {
        Map<String, TemplateModel> variables = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            variables.put(entry.getKey(), convert(entry.getValue()));
        }
        return process(template, variables);
    }

    /**
     * Compiles (or returns the cached) template for the provided string.
     *
     * @param templateText Plain template source code.
     * @return The compiled Freemarker Template object.
     * @throws FreeMarkerException If the template cannot be parsed.
     */
    public Template getTemplate(String templateText) {
        return templates.computeIfAbsent(templateText, text -> {
            try {
                return new Template("path", text, cfg);
            } catch (IOException e) {
                throw new FreeMarkerException(e.getMessage(), e);
            }
        });
    }

    /**
     * Converts a Java object to a Freemarker TemplateModel, for use as a variable in templates.
     *
     * @param value Arbitrary Java object (primitives, strings, collections).
     * @return Corresponding TemplateModel for Freemarker binding.
     * @throws ConvertException If wrapping fails or the value type is not supported.
     */
    public static TemplateModel convert(Object value) throws ConvertException {
        try {
            return cfg.getObjectWrapper().wrap(value);
        } catch (TemplateModelException e) {
            throw ConvertException.buildConvertException(value, e);
        }
    }
}
