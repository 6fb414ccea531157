// file: loader/src/main/java/io/hiermerge/loader/JinjaTemplateRenderer.java
package io.hiermerge.loader;

import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.JinjavaConfig;
import com.hubspot.jinjava.interpret.InterpretException;
import com.hubspot.jinjava.interpret.RenderResult;
import com.hubspot.jinjava.interpret.TemplateError;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Renders fragment files as Jinja templates: expressions, filters,
 * {@code {% if %}} and {@code {% for %}} blocks.
 * <p>
 * Notes:
 *  - Unknown variables fail the render instead of printing nothing.
 *  - Any FATAL error reported by the engine becomes a TemplateException;
 *    lesser errors are logged at WARNING and the output is kept.
 *  - One engine instance is shared; Jinjava renders are independent.
 */
public final class JinjaTemplateRenderer implements TemplateRenderer {
    private static final Logger log = Logger.getLogger(JinjaTemplateRenderer.class.getName());

    private final Jinjava jinjava;

    public JinjaTemplateRenderer() {
        this.jinjava = new Jinjava(JinjavaConfig.newBuilder()
                .withFailOnUnknownTokens(true)
                .build());
    }

    @Override
    public String render(String template, Map<String, Object> variables) {
        RenderResult result;
        try {
            result = jinjava.renderForResult(template, variables);
        } catch (InterpretException e) {
            throw new TemplateException("Template rendering failed: " + e.getMessage(), e);
        }

        List<TemplateError> fatal = result.getErrors().stream()
                .filter(err -> err.getSeverity() == TemplateError.ErrorType.FATAL)
                .toList();
        if (!fatal.isEmpty()) {
            throw new TemplateException("Template rendering failed: " + fatal.stream()
                    .map(err -> "line %d: %s".formatted(err.getLineno(), err.getMessage()))
                    .collect(Collectors.joining("; ")));
        }
        result.getErrors().forEach(err -> log.warning(() -> "Template warning at line %d: %s"
                .formatted(err.getLineno(), err.getMessage())));
        return result.getOutput();
    }
}
