// file: cli/src/main/java/io/hiermerge/cli/Main.java
package io.hiermerge.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.hiermerge.core.CombineResult;
import io.hiermerge.core.Combiner;
import io.hiermerge.core.HierMergeException;
import io.hiermerge.core.MergeEvent;
import io.hiermerge.core.PathPatternResolver;
import io.hiermerge.core.ProvenanceStripper;
import io.hiermerge.loader.DirectoryFragmentSource;
import io.hiermerge.loader.FragmentLoadException;
import io.hiermerge.loader.FragmentQuery;
import io.hiermerge.loader.JinjaTemplateRenderer;
import io.hiermerge.loader.MergeKeyRuleLoader;
import io.hiermerge.loader.PlaceholderTemplateRenderer;
import io.hiermerge.loader.TemplateRenderer;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the hiermerge command.
 *
 * Responsibilities:
 *  - Apply the bundled logging configuration.
 *  - Parse configuration from CLI.
 *  - Load the merge-key table and template variables.
 *  - Load fragments for the entity, combine them, print the result.
 *
 * Exit codes: 0 success, 1 usage or combine error, 2 anything unexpected.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int OK = 0;
    static final int FAILED = 1;
    static final int UNEXPECTED = 2;

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns its exit code. Never calls System.exit. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CombineConfig cfg;
        try {
            cfg = CombineConfig.fromArgs(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.print(CombineConfig.USAGE);
            return FAILED;
        }
        if (cfg.help()) {
            out.print(CombineConfig.USAGE);
            return OK;
        }

        try {
            CombineResult result = combine(cfg);
            if (cfg.diagnostics()) {
                for (MergeEvent event : result.diagnostics()) err.println(event.describe());
            }
            out.print(TreeWriter.forFormat(cfg.format()).write(select(cfg.output(), result)));
            return OK;
        } catch (HierMergeException e) {
            err.println(e.getMessage());
            return FAILED;
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Unexpected failure", e);
            err.println("Unexpected error: " + e);
            return UNEXPECTED;
        }
    }

    static CombineResult combine(CombineConfig cfg) {
        PathPatternResolver rules = cfg.rulesFile() == null
                ? MergeKeyRuleLoader.defaults()
                : MergeKeyRuleLoader.fromFile(cfg.rulesFile());

        var query = new FragmentQuery(cfg.root(), cfg.entity(), cfg.filespecs(), cfg.tags(),
                cfg.weight(), readVariables(cfg.varsFile()));
        var fragments = new DirectoryFragmentSource(renderer(cfg.templating())).load(query);
        return new Combiner(rules).combine(fragments);
    }

    private static TemplateRenderer renderer(CombineConfig.Templating templating) {
        return switch (templating) {
            case JINJA -> new JinjaTemplateRenderer();
            case PLACEHOLDER -> new PlaceholderTemplateRenderer();
            case OFF -> TemplateRenderer.verbatim();
        };
    }

    private static Map<String, Object> readVariables(Path file) {
        if (file == null) return Map.of();
        try {
            Map<String, Object> vars = YAML.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
            return vars == null ? Map.of() : vars;
        } catch (IOException e) {
            throw new FragmentLoadException(file.toString(), "cannot read variables", e);
        }
    }

    private static Object select(CombineConfig.Output output, CombineResult result) {
        return switch (output) {
            case PLAIN -> result.plainTree();
            case ANNOTATED -> ProvenanceStripper.audit(result.annotatedTree());
            case BOTH -> {
                var both = new LinkedHashMap<String, Object>();
                both.put("plain", result.plainTree());
                both.put("annotated", ProvenanceStripper.audit(result.annotatedTree()));
                yield both;
            }
        };
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Failed to read logging.properties: " + e.getMessage());
        }
    }
}
