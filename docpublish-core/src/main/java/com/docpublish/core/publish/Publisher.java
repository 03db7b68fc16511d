package com.docpublish.core.publish;

import com.docpublish.core.error.ConfigException;
import com.docpublish.core.reader.DocumentSource;
import com.docpublish.core.reader.ReadResult;
import com.docpublish.core.reader.Reader;
import com.docpublish.core.renderer.GeneratedOutput;
import com.docpublish.core.renderer.OutputRenderer;
import com.docpublish.core.renderer.RenderContext;
import com.docpublish.core.settings.InvalidValuePolicy;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.settings.SettingsRegistry;
import com.docpublish.core.settings.SettingsResolution;
import com.docpublish.core.settings.SettingsResolver;
import com.docpublish.core.settings.StandardConfigFiles;
import com.docpublish.core.settings.StandardOptions;
import com.docpublish.core.transform.TransformScheduler;
import com.docpublish.core.tree.Document;
import com.docpublish.core.writer.Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wires reader, transforms and writer into a publishing run.
 *
 * <p>A full run resolves settings for the components involved, reads and transforms the source,
 * then renders the writer's output:
 * <pre>{@code
 * Publisher publisher = new Publisher();
 * PublishResult result = publisher.publish(
 *     DocumentSource.fromPath(Path.of("guide.txt")),
 *     new StandaloneReader(new PlainTextParser()),
 *     new HtmlWriter(),
 *     new FileSystemRenderer(),
 *     RenderContext.of(Path.of("build/docs")),
 *     Map.of());
 * }</pre>
 *
 * <p>A {@link com.docpublish.core.error.HaltException} from the transforms propagates before
 * anything is written.
 */
public class Publisher {

    private static final Logger log = LoggerFactory.getLogger(Publisher.class);

    private final List<Path> standardConfigFiles;
    private final InvalidValuePolicy invalidValuePolicy;
    private final TransformScheduler scheduler;

    /**
     * Creates a publisher reading the standard configuration files.
     */
    public Publisher() {
        this(StandardConfigFiles.defaults(), InvalidValuePolicy.KEEP_CURRENT, new TransformScheduler());
    }

    /**
     * Creates a publisher.
     *
     * @param standardConfigFiles configuration files read before the document-specific one
     * @param invalidValuePolicy handling of invalid configuration values
     * @param scheduler scheduler running the transforms
     */
    public Publisher(List<Path> standardConfigFiles, InvalidValuePolicy invalidValuePolicy, TransformScheduler scheduler) {
        this.standardConfigFiles = List.copyOf(Objects.requireNonNull(standardConfigFiles, "standardConfigFiles must not be null"));
        this.invalidValuePolicy = Objects.requireNonNull(invalidValuePolicy, "invalidValuePolicy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Builds the option catalogue of a reader/writer combination.
     *
     * @param reader reader, with its parser and transforms
     * @param writer writer
     * @return registry with the standard options and the components' options
     */
    public SettingsRegistry registry(Reader reader, Writer writer) {
        SettingsRegistry registry = SettingsRegistry.withStandardOptions();
        registry.registerAll(reader);
        registry.registerAll(writer);
        return registry;
    }

    /**
     * Resolves the settings of a run.
     *
     * @param source document source; a file source adds its document-specific configuration
     * @param reader reader of the run
     * @param writer writer of the run
     * @param overrides raw option values applied last
     * @return resolved settings with the files read
     * @throws ConfigException if a value is invalid and the policy aborts
     */
    public SettingsResolution resolveSettings(DocumentSource source, Reader reader, Writer writer,
                                              Map<String, String> overrides) {
        SettingsResolver resolver = new SettingsResolver(registry(reader, writer), standardConfigFiles, invalidValuePolicy);
        return resolver.resolveWithReport(source.path().orElse(null), overrides);
    }

    /**
     * Creates an empty document for a source, for callers that build trees themselves.
     *
     * @param source source naming the document
     * @param settings settings carried by the document
     * @return empty document
     */
    public Document newDocument(DocumentSource source, Settings settings) {
        return Document.create(source.name(), settings);
    }

    /**
     * Reads and transforms a source.
     *
     * @param source source to read
     * @param reader reader to use
     * @param settings resolved settings
     * @return transformed document
     */
    public ReadResult readDocument(DocumentSource source, Reader reader, Settings settings) {
        log.info("Reading {} with reader {} ({})", source.name(), reader.getId(), reader.parser().getId());
        return reader.read(source, settings, scheduler);
    }

    /**
     * Renders a document and writes the assembled output to a file.
     *
     * @param writer writer to render with
     * @param document document to render
     * @param destination output file
     */
    public void writeDocument(Writer writer, Document document, Path destination) {
        writer.attach(document);
        writeFile(destination, writer.content(), document.settings());
    }

    /**
     * Renders a document and writes the assembled output to a character stream; the stream is
     * flushed, not closed.
     *
     * @param writer writer to render with
     * @param document document to render
     * @param destination output stream
     */
    public void writeDocument(Writer writer, Document document, java.io.Writer destination) {
        writer.attach(document);
        writeStream(destination, writer.content());
    }

    /**
     * Renders a document and writes one part to a file.
     *
     * @param writer writer to render with
     * @param document document to render
     * @param partName part to write
     * @param destination output file
     */
    public void writePart(Writer writer, Document document, String partName, Path destination) {
        writer.attach(document);
        writeFile(destination, writer.part(partName).content(), document.settings());
    }

    public void writePart(Writer writer, Document document, String partName, java.io.Writer destination) {
        writer.attach(document);
        writeStream(destination, writer.part(partName).content());
    }

    /**
     * Runs a complete publication.
     *
     * @param source document source
     * @param reader reader
     * @param writer writer
     * @param renderer renderer emitting the writer's output
     * @param context output directory, the encoding is taken from {@code output-encoding}
     * @param overrides raw option values applied last
     * @return settings, document and output of the run
     */
    public PublishResult publish(DocumentSource source, Reader reader, Writer writer,
                                 OutputRenderer renderer, RenderContext context, Map<String, String> overrides) {
        SettingsResolution resolution = resolveSettings(source, reader, writer, overrides);
        Settings settings = resolution.settings();
        ReadResult read = readDocument(source, reader, settings);

        writer.attach(read.document());
        GeneratedOutput output = writer.output();
        renderer.render(output, new RenderContext(context.outputDirectory(), outputEncoding(settings)));
        log.info("Published {} as {} ({} condition(s))", source.name(), writer.getId(),
            read.transforms().conditions().size());
        return new PublishResult(resolution, read, output);
    }

    /**
     * Returns the charset named by {@code output-encoding}.
     *
     * @param settings run settings
     * @return output charset
     * @throws ConfigException if the charset is unknown
     */
    public static Charset outputEncoding(Settings settings) {
        String name = settings.getString(StandardOptions.OUTPUT_ENCODING);
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unsupported output encoding: " + name, null, 0,
                StandardOptions.OUTPUT_ENCODING, name, e);
        }
    }

    private void writeFile(Path destination, String content, Settings settings) {
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(destination, content, outputEncoding(settings));
            log.info("Wrote {} ({} chars)", destination, content.length());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + destination, e);
        }
    }

    private void writeStream(java.io.Writer destination, String content) {
        try {
            destination.write(content);
            destination.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output", e);
        }
    }
}
