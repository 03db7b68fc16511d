package com.docpublish.core.reader;

import com.docpublish.core.settings.OptionDefinition;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.settings.SettingsSpec;
import com.docpublish.core.transform.TransformScheduler;
import com.docpublish.core.transform.TransformSpec;
import com.docpublish.core.tree.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link DocumentSource} into a transformed {@link Document}.
 *
 * <p>{@link #read} always runs in three steps:
 * <ol>
 *   <li>create an empty document carrying the run's settings</li>
 *   <li>let the {@link Parser} populate it</li>
 *   <li>run the reader's transforms followed by the parser's through the scheduler</li>
 * </ol>
 * Subclasses choose the transforms; they cannot skip the scheduler run.
 */
public abstract class Reader implements SettingsSpec {

    private static final Logger log = LoggerFactory.getLogger(Reader.class);

    private final Parser parser;

    protected Reader(Parser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Returns unique identifier for this reader (e.g., "standalone").
     *
     * @return reader identifier
     */
    public abstract String getId();

    /**
     * Returns the transforms this reader applies to every document it reads.
     *
     * @return transform specs
     */
    public abstract List<TransformSpec> getTransforms();

    public Parser parser() {
        return parser;
    }

    /**
     * Options of the reader and its parser.
     *
     * @return option definitions
     */
    @Override
    public List<OptionDefinition> getSettingsSpec() {
        return parser.getSettingsSpec();
    }

    /**
     * Reads and transforms a source.
     *
     * @param source source to read
     * @param settings resolved settings of the run
     * @param scheduler scheduler running the transforms
     * @return document with transform summary
     */
    public final ReadResult read(DocumentSource source, Settings settings, TransformScheduler scheduler) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(scheduler, "scheduler must not be null");

        Document document = Document.create(source.name(), settings);
        parser.parse(source.readLines(), document);
        log.debug("Parsed {} with {} into {} node(s)", source.name(), parser.getId(), document.size());

        List<TransformSpec> transforms = new ArrayList<>(getTransforms());
        transforms.addAll(parser.getTransforms());
        return new ReadResult(document, scheduler.run(document, transforms, settings));
    }
}
