// file: loader/src/main/java/io/hiermerge/loader/PlaceholderTemplateRenderer.java
package io.hiermerge.loader;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{ name }}} and {@code {{ a.b.c }}} placeholders.
 * <p>
 * Rules:
 *  - Dotted names walk nested maps in the variables.
 *  - An undefined name, or anything other than a plain name between the
 *    braces, is a TemplateException.
 *  - A "{{" with no closing "}}" is a TemplateException.
 *  - Values are inserted with toString(); no escaping is applied.
 */
public final class PlaceholderTemplateRenderer implements TemplateRenderer {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}", Pattern.DOTALL);
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-]*(\\.[A-Za-z0-9_\\-]+)*");

    @Override
    public String render(String template, Map<String, Object> variables) {
        Matcher m = PLACEHOLDER.matcher(template);
        var sb = new StringBuilder(template.length());
        int tail = 0;
        while (m.find()) {
            String name = m.group(1).strip();
            if (!NAME.matcher(name).matches()) {
                throw new TemplateException("Unsupported template expression '{{%s}}'".formatted(m.group(1)));
            }
            Object value = lookup(variables, name);
            if (value == null) {
                throw new TemplateException("Unresolved template variable '%s'".formatted(name));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value.toString()));
            tail = m.end();
        }
        int open = template.indexOf("{{", tail);
        if (open >= 0) {
            throw new TemplateException("Unterminated placeholder at offset " + open);
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static Object lookup(Map<String, Object> variables, String path) {
        Object current = variables;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) return null;
            current = map.get(part);
        }
        return current;
    }
}
