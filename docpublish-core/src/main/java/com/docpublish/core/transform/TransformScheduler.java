package com.docpublish.core.transform;

import com.docpublish.core.error.Condition;
import com.docpublish.core.error.HaltException;
import com.docpublish.core.error.Reporter;
import com.docpublish.core.error.TransformCondition;
import com.docpublish.core.error.TransformFailedException;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Runs transforms over a document in a deterministic order and turns their conditions into
 * system messages.
 *
 * <h2>Ordering</h2>
 * <p>Instances run by {@code (priority, order)} ascending. Order numbers are unique per
 * {@link TransformOrderCounter}, so the order is total: equal priorities run in the order they
 * were scheduled. Callables all carry order 0 and run in the order they were listed or
 * scheduled. Transforms added through {@link TransformContext#schedule(TransformSpec)} join
 * the pending transforms and are ordered with them.
 *
 * <h2>Conditions</h2>
 * <p>A {@link TransformCondition} becomes a {@link NodeKind#SYSTEM_MESSAGE} appended to the
 * diagnostics section, a section titled {@value #DIAGNOSTICS_TITLE} created as the last root
 * child on first use and found again by its title. When the condition names a node, the message
 * back-references it. Conditions at or above report-level are printed by the {@link Reporter};
 * conditions at or above halt-level end the run with a {@link HaltException}. Below halt-level
 * the run continues with the next transform.
 *
 * <p>When the run ends, normally or not, a diagnostics section holding nothing but its title is
 * removed again.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TransformScheduler scheduler = new TransformScheduler();
 * TransformRunResult result = scheduler.run(document, List.of(
 *     TransformSpec.of(SectionIdTransform::new),
 *     TransformSpec.of(DocTitleTransform::new)
 * ), settings);
 * }</pre>
 */
public class TransformScheduler {

    /** Title of the section collecting system messages. */
    public static final String DIAGNOSTICS_TITLE = "System Messages";

    /** Class attribute value marking the diagnostics section. */
    public static final String DIAGNOSTICS_CLASS = "system-messages";

    private static final Logger log = LoggerFactory.getLogger(TransformScheduler.class);

    private final TransformOrderCounter counter;
    private final ReporterFactory reporterFactory;

    /**
     * Creates a scheduler using the process-wide order counter, reporting to the configured
     * warning stream.
     */
    public TransformScheduler() {
        this(TransformOrderCounter.global(), ReporterFactory.STANDARD);
    }

    /**
     * Creates a scheduler.
     *
     * @param counter source of order numbers
     * @param reporterFactory creates the reporter of each run
     */
    public TransformScheduler(TransformOrderCounter counter, ReporterFactory reporterFactory) {
        this.counter = Objects.requireNonNull(counter, "counter must not be null");
        this.reporterFactory = Objects.requireNonNull(reporterFactory, "reporterFactory must not be null");
    }

    public TransformOrderCounter counter() {
        return counter;
    }

    /**
     * Runs transforms with the document's own settings.
     *
     * @param document document to rewrite in place
     * @param specs transforms to run
     * @return run summary
     */
    public TransformRunResult run(Document document, List<TransformSpec> specs) {
        return run(document, specs, document.settings());
    }

    /**
     * Runs transforms over a document.
     *
     * @param document document to rewrite in place
     * @param specs transforms to run
     * @param settings run settings (report-level, halt-level, ...)
     * @return run summary, including the conditions absorbed into the document
     * @throws HaltException if a condition reaches halt-level
     * @throws TransformFailedException if a transform fails with an unexpected exception
     */
    public TransformRunResult run(Document document, List<TransformSpec> specs, Settings settings) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(specs, "specs must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        if (document.isEmpty()) {
            log.debug("Document {} is empty, skipping {} transform(s)", document.sourceName(), specs.size());
            return TransformRunResult.skippedRun();
        }

        PendingQueue pending = new PendingQueue();
        for (TransformSpec spec : specs) {
            pending.add(spec.instantiate(document, counter));
        }

        List<String> executed = new ArrayList<>();
        List<Condition> conditions = new ArrayList<>();
        int haltLevel = settings.haltLevel();
        log.debug("Running {} transform(s) on {}", pending.size(), document.sourceName());

        try (Reporter reporter = openReporter(settings)) {
            while (!pending.isEmpty()) {
                TransformInstance instance = pending.poll();
                TransformContext context = new TransformContext(document, instance.target(), settings,
                    spec -> pending.add(spec.instantiate(document, counter)));

                log.debug("Applying transform {} (priority {}, order {})",
                    instance.id(), instance.priority(), instance.order());
                executed.add(instance.id());
                try {
                    instance.transform().apply(context);
                } catch (TransformCondition e) {
                    Condition condition = e.condition();
                    conditions.add(condition);
                    recordDiagnostic(document, instance, condition);
                    reporter.report(condition);
                    if (condition.severity() >= haltLevel) {
                        log.error("Transform {} raised {} at or above halt-level {}: {}",
                            instance.id(), condition.label(), haltLevel, condition.message());
                        throw new HaltException(instance.id(), condition, haltLevel);
                    }
                    log.debug("Recovered from {} in transform {}", condition.label(), instance.id());
                } catch (HaltException | TransformFailedException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Transform {} failed: {}", instance.id(), e.getMessage(), e);
                    throw new TransformFailedException(instance.id(), e);
                }
            }
        } finally {
            removeEmptyDiagnosticsSection(document);
        }

        log.debug("Applied {} transform(s) to {}, {} condition(s) recorded",
            executed.size(), document.sourceName(), conditions.size());
        return new TransformRunResult(false, executed, conditions);
    }

    /**
     * Finds the diagnostics section among the root's children by title.
     *
     * @param document document to search
     * @return the section, or empty if there is none
     */
    public static Optional<NodeId> findDiagnosticsSection(Document document) {
        List<NodeId> matches = new ArrayList<>();
        for (NodeId child : document.children(document.root())) {
            if (isDiagnosticsSection(document, child)) {
                matches.add(child);
            }
        }
        if (matches.size() > 1) {
            log.warn("Document {} has {} sections titled '{}'; using the last one",
                document.sourceName(), matches.size(), DIAGNOSTICS_TITLE);
        }
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(matches.size() - 1));
    }

    private static boolean isDiagnosticsSection(Document document, NodeId node) {
        if (document.kind(node) != NodeKind.SECTION || document.childCount(node) == 0) {
            return false;
        }
        NodeId title = document.child(node, 0);
        return document.kind(title) == NodeKind.TITLE
            && DIAGNOSTICS_TITLE.equals(document.textContent(title));
    }

    private NodeId diagnosticsSection(Document document) {
        return findDiagnosticsSection(document).orElseGet(() -> {
            NodeId section = document.createNode(NodeKind.SECTION);
            document.setAttribute(section, "class", DIAGNOSTICS_CLASS);
            NodeId title = document.createNode(NodeKind.TITLE);
            document.appendChild(title, document.createText(DIAGNOSTICS_TITLE));
            document.appendChild(section, title);
            document.appendChild(document.root(), section);
            log.debug("Created diagnostics section in {}", document.sourceName());
            return section;
        });
    }

    private void recordDiagnostic(Document document, TransformInstance instance, Condition condition) {
        NodeId message = document.createNode(NodeKind.SYSTEM_MESSAGE);
        document.setAttribute(message, "level", Integer.toString(condition.severity()));
        document.setAttribute(message, "type", condition.label());
        document.setAttribute(message, "source", document.sourceName());
        document.setAttribute(message, "transform", instance.id());
        condition.lineNumber().ifPresent(line -> document.setAttribute(message, "line", Integer.toString(line)));

        NodeId paragraph = document.createNode(NodeKind.PARAGRAPH);
        document.appendChild(paragraph, document.createText(condition.message()));
        document.appendChild(message, paragraph);

        condition.originatingNode()
            .filter(document::isAttached)
            .ifPresent(node -> {
                String id = document.ensureIdentifier(node);
                document.addBackReference(message, node);
                document.setAttribute(message, "backrefs", id);
            });

        document.appendChild(diagnosticsSection(document), message);
    }

    private void removeEmptyDiagnosticsSection(Document document) {
        findDiagnosticsSection(document)
            .filter(section -> document.childCount(section) < 2)
            .ifPresent(section -> {
                log.debug("Removing empty diagnostics section from {}", document.sourceName());
                document.remove(section);
            });
    }

    /**
     * Pending transforms of one run. Callables share order 0, so entries also carry the position
     * at which they were added and equal {@code (priority, order)} keys leave in that position.
     */
    private static final class PendingQueue {

        private record Entry(TransformInstance instance, long position) {
        }

        private static final Comparator<Entry> ENTRY_ORDER =
            Comparator.comparing(Entry::instance, TransformInstance.EXECUTION_ORDER)
                .thenComparingLong(Entry::position);

        private final PriorityQueue<Entry> entries = new PriorityQueue<>(ENTRY_ORDER);
        private long nextPosition;

        void add(TransformInstance instance) {
            entries.add(new Entry(instance, nextPosition++));
        }

        TransformInstance poll() {
            return entries.poll().instance();
        }

        boolean isEmpty() {
            return entries.isEmpty();
        }

        int size() {
            return entries.size();
        }
    }

    private Reporter openReporter(Settings settings) {
        try {
            return reporterFactory.create(settings);
        } catch (IOException e) {
            log.warn("Cannot open warning stream ({}); reporting to standard error", e.getMessage());
            return Reporter.standardError(settings.reportLevel());
        }
    }
}
