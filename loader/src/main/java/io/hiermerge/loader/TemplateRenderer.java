// file: loader/src/main/java/io/hiermerge/loader/TemplateRenderer.java
package io.hiermerge.loader;

import java.util.Map;

/**
 * Renders fragment file text before it is parsed as YAML.
 */
public interface TemplateRenderer {

    /**
     * @param template  raw file contents
     * @param variables values available to placeholders
     * @return rendered text
     * @throws TemplateException when the template cannot be rendered
     */
    String render(String template, Map<String, Object> variables);

    /** Renderer that returns its input unchanged. */
    static TemplateRenderer verbatim() {
        return (template, variables) -> template;
    }
}
