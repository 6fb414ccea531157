// file: cli/src/main/java/io/hiermerge/cli/TreeWriter.java
package io.hiermerge.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.UncheckedIOException;

/**
 * Serializes combined trees for stdout.
 * <p>
 * YAML omits the document start marker, quotes only where needed and indents
 * sequences under their parent key. JSON is pretty-printed.
 */
final class TreeWriter {

    private final ObjectMapper mapper;

    private TreeWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    static TreeWriter forFormat(CombineConfig.Format format) {
        return switch (format) {
            case YAML -> new TreeWriter(new ObjectMapper(YAMLFactory.builder()
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                    .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                    .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                    .build()));
            case JSON -> new TreeWriter(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
        };
    }

    String write(Object tree) {
        try {
            String text = mapper.writeValueAsString(tree);
            return text.endsWith("\n") ? text : text + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
