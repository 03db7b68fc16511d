package com.docpublish.cli;

import com.docpublish.core.error.ConfigException;
import com.docpublish.core.error.HaltException;
import com.docpublish.core.error.TransformFailedException;
import com.docpublish.core.publish.Publisher;
import com.docpublish.core.reader.DocumentSource;
import com.docpublish.core.reader.ReadResult;
import com.docpublish.core.reader.Reader;
import com.docpublish.core.renderer.GeneratedOutput;
import com.docpublish.core.renderer.OutputRenderer;
import com.docpublish.core.renderer.RenderContext;
import com.docpublish.core.renderer.impl.ConsoleRenderer;
import com.docpublish.core.renderer.impl.FileSystemRenderer;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.settings.SettingsResolution;
import com.docpublish.core.settings.StandardOptions;
import com.docpublish.core.writer.Writer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to publish a document.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Resolve settings from the configuration files and {@code --set} overrides</li>
 *   <li>Read the source with the plain-text parser and apply the stock transforms</li>
 *   <li>Render the document with the selected writer</li>
 *   <li>Write the result to the output directory, or print it</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print a document as HTML
 * docpublish publish guide.txt
 *
 * # Write plain text into ./out, stripping comments
 * docpublish publish guide.txt -w text -o out --set strip-comments=true
 *
 * # Print only the body part of the HTML
 * docpublish publish guide.txt --part body
 * }</pre>
 *
 * <p><b>Exit codes:</b> 0 on success, 1 on configuration or I/O errors, 2 when a transform
 * condition reached halt-level.
 */
@Command(
    name = "publish",
    description = "Read, transform and write a document",
    mixinStandardHelpOptions = true
)
public class PublishCommand implements Callable<Integer> {

    /** Exit code when a run halts. */
    public static final int EXIT_HALTED = 2;

    private static final Logger log = LoggerFactory.getLogger(PublishCommand.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source document")
    private Path source;

    @Option(
        names = {"-w", "--writer"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: html)",
        completionCandidates = WriterCandidates.class,
        defaultValue = Components.DEFAULT_WRITER
    )
    private String writerId;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: print to standard output)"
    )
    private Path outputDir;

    @Option(
        names = {"-p", "--part"},
        description = "Write only the named writer part"
    )
    private String partName;

    @Option(
        names = {"-s", "--set"},
        description = "Override an option, e.g. --set report-level=info"
    )
    private Map<String, String> overrides = new LinkedHashMap<>();

    @Option(
        names = {"--dump-settings"},
        description = "Print the resolved settings as YAML and exit"
    )
    private boolean dumpSettings;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Optional<Writer> selected = Components.writer(writerId);
        if (selected.isEmpty()) {
            err.println("✗ Unknown writer: " + writerId + ". Use one of " + Components.writerIds());
            return 1;
        }
        Writer writer = selected.get();
        if (partName != null && !writer.partNames().contains(partName)) {
            err.println("✗ Writer " + writerId + " has no part '" + partName + "'. Parts: " + writer.partNames());
            return 1;
        }
        if (!Files.isRegularFile(source)) {
            err.println("✗ Source not found: " + source);
            return 1;
        }

        Settings settings = null;
        try {
            DocumentSource documentSource = DocumentSource.fromPath(source);
            Reader reader = Components.reader();
            Publisher publisher = new Publisher();

            SettingsResolution resolution = publisher.resolveSettings(documentSource, reader, writer, overrides);
            settings = resolution.settings();
            resolution.warnings().forEach(warning -> err.println("⚠ " + warning));
            if (dumpSettings) {
                out.print(toYaml(settings));
                out.flush();
                return 0;
            }

            ReadResult read = publisher.readDocument(documentSource, reader, settings);
            writer.attach(read.document());
            GeneratedOutput output = partName == null ? writer.output() : writer.partOutput(partName);
            renderer(out).render(output, new RenderContext(
                outputDir == null ? Path.of(".") : outputDir,
                Publisher.outputEncoding(settings)));

            if (outputDir != null) {
                out.println("✓ Published " + source + " as " + writer.getDisplayName() + " to " + outputDir);
            }
            log.info("Published {} ({} transform(s), {} condition(s))", source,
                read.transforms().executedTransforms().size(), read.transforms().conditions().size());
            return 0;
        } catch (HaltException e) {
            log.error("Publishing halted", e);
            err.println("✗ " + e.getMessage());
            return EXIT_HALTED;
        } catch (ConfigException e) {
            err.println("✗ Configuration error: " + e.getMessage());
            return 1;
        } catch (TransformFailedException | UncheckedIOException | IllegalStateException e) {
            log.error("Publishing failed", e);
            err.println("✗ Publishing failed: " + e.getMessage());
            if (log.isDebugEnabled() || (settings != null && settings.getBoolean(StandardOptions.TRACEBACK, false))) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    private OutputRenderer renderer(PrintWriter out) {
        return outputDir == null ? new ConsoleRenderer(out) : new FileSystemRenderer();
    }

    /**
     * Renders settings as YAML; paths are written as strings.
     *
     * @param settings settings to render
     * @return YAML document
     */
    static String toYaml(Settings settings) {
        Map<String, Object> values = new LinkedHashMap<>();
        settings.asMap().forEach((name, value) -> values.put(name, value instanceof Path ? value.toString() : value));
        try {
            return YAML_MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render settings as YAML", e);
        }
    }

    public static final class WriterCandidates implements Iterable<String> {
        @Override
        public Iterator<String> iterator() {
            return Components.writerIds().iterator();
        }
    }
}
