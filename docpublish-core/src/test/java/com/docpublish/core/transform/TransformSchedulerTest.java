package com.docpublish.core.transform;

import com.docpublish.core.TestDocuments;
import com.docpublish.core.error.Condition;
import com.docpublish.core.error.HaltException;
import com.docpublish.core.error.Severity;
import com.docpublish.core.error.TransformCondition;
import com.docpublish.core.error.TransformFailedException;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.settings.StandardOptions;
import com.docpublish.core.tree.BackReference;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TransformScheduler}.
 */
class TransformSchedulerTest {

    private ByteArrayOutputStream warnings;
    private TransformScheduler scheduler;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        warnings = new ByteArrayOutputStream();
        scheduler = new TransformScheduler(new TransformOrderCounter(),
            ReporterFactory.to(new PrintStream(warnings, true, StandardCharsets.UTF_8)));
        calls = new ArrayList<>();
    }

    @Test
    void run_distinctPriorities_runInAscendingPriority() {
        // Given
        Document document = TestDocuments.withParagraphs("text");
        List<TransformSpec> specs = List.of(
            spec("late", 700, context -> { }),
            spec("early", 100, context -> { }),
            spec("middle", 400, context -> { }));

        // When
        TransformRunResult result = scheduler.run(document, specs);

        // Then
        assertThat(calls).containsExactly("early", "middle", "late");
        assertThat(result.executedTransforms()).containsExactly("early", "middle", "late");
        assertThat(result.skipped()).isFalse();
    }

    @Test
    void run_equalPriorities_runInSchedulingOrder() {
        Document document = TestDocuments.withParagraphs("text");

        scheduler.run(document, List.of(
            spec("first", 500, context -> { }),
            spec("second", 500, context -> { }),
            spec("third", 500, context -> { })));

        assertThat(calls).containsExactly("first", "second", "third");
    }

    @Test
    void run_callable_runsAtCallablePriority() {
        Document document = TestDocuments.withParagraphs("text");
        List<String> order = new ArrayList<>();

        scheduler.run(document, List.of(
            TransformSpec.callable("hook", context -> order.add("hook")),
            spec("after", 960, context -> order.add("after")),
            spec("before", 900, context -> order.add("before"))));

        assertThat(order).containsExactly("before", "hook", "after");
    }

    @Test
    void run_severalCallables_runInListOrder() {
        // Given
        Document document = TestDocuments.withParagraphs("text");
        List<String> order = new ArrayList<>();
        List<TransformSpec> specs = new ArrayList<>();
        for (String id : List.of("a", "b", "c", "d", "e", "f")) {
            specs.add(TransformSpec.callable(id, context -> order.add(id)));
        }

        // When
        TransformRunResult result = scheduler.run(document, specs);

        // Then
        assertThat(order).containsExactly("a", "b", "c", "d", "e", "f");
        assertThat(result.executedTransforms()).containsExactly("a", "b", "c", "d", "e", "f");
    }

    @Test
    void run_callablesScheduledAtRuntime_runAfterListedCallablesInScheduleOrder() {
        Document document = TestDocuments.withParagraphs("text");
        List<String> order = new ArrayList<>();

        scheduler.run(document, List.of(
            TransformSpec.callable("first", context -> {
                order.add("first");
                context.schedule(TransformSpec.callable("late-1", c -> order.add("late-1")));
                context.schedule(TransformSpec.callable("late-2", c -> order.add("late-2")));
                context.schedule(TransformSpec.callable("late-3", c -> order.add("late-3")));
            }),
            TransformSpec.callable("second", context -> order.add("second")),
            TransformSpec.callable("third", context -> order.add("third"))));

        assertThat(order).containsExactly("first", "second", "third", "late-1", "late-2", "late-3");
    }

    @Test
    void run_emptyDocument_isSkipped() {
        Document document = TestDocuments.empty();

        TransformRunResult result = scheduler.run(document, List.of(spec("never", 100, context -> { })));

        assertThat(result.skipped()).isTrue();
        assertThat(calls).isEmpty();
    }

    @Test
    void run_scheduledAtRuntime_joinsPendingTransforms() {
        // Given
        Document document = TestDocuments.withParagraphs("text");
        TransformSpec scheduled = spec("scheduled", 300, context -> { });

        // When
        scheduler.run(document, List.of(
            spec("scheduler", 100, context -> context.schedule(scheduled)),
            spec("pending", 500, context -> { })));

        // Then
        assertThat(calls).containsExactly("scheduler", "scheduled", "pending");
    }

    @Test
    void run_conditionBelowHaltLevel_recordsSystemMessageAndContinues() {
        // Given
        Document document = TestDocuments.withParagraphs("text");
        NodeId paragraph = document.child(document.root(), 0);

        // When
        TransformRunResult result = scheduler.run(document, List.of(
            spec("complainer", 100, context -> {
                throw context.condition(Severity.WARNING, "Suspicious paragraph", paragraph);
            }),
            spec("next", 200, context -> { })));

        // Then
        assertThat(calls).containsExactly("complainer", "next");
        assertThat(result.conditions()).singleElement()
            .satisfies(condition -> assertThat(condition.message()).isEqualTo("Suspicious paragraph"));

        NodeId section = TransformScheduler.findDiagnosticsSection(document).orElseThrow();
        assertThat(document.attribute(section, "class")).contains(TransformScheduler.DIAGNOSTICS_CLASS);
        assertThat(document.childCount(section)).isEqualTo(2);

        NodeId message = document.child(section, 1);
        assertThat(document.kind(message)).isEqualTo(NodeKind.SYSTEM_MESSAGE);
        assertThat(document.attribute(message, "type")).contains("WARNING");
        assertThat(document.attribute(message, "transform")).contains("complainer");
        assertThat(document.textContent(message)).isEqualTo("Suspicious paragraph");
    }

    @Test
    void run_conditionAboutNode_backReferencesNode() {
        Document document = TestDocuments.withParagraphs("text");
        NodeId paragraph = document.child(document.root(), 0);

        scheduler.run(document, List.of(spec("complainer", 100, context -> {
            throw context.condition(Severity.ERROR, "Bad", paragraph);
        })));

        NodeId message = document.child(TransformScheduler.findDiagnosticsSection(document).orElseThrow(), 1);
        List<BackReference> references = document.backReferences(message);
        assertThat(references).singleElement()
            .satisfies(reference -> assertThat(document.resolve(reference)).contains(paragraph));
        assertThat(document.attribute(message, "backrefs")).isEqualTo(document.attribute(paragraph, "id"));
    }

    @Test
    void run_existingDiagnosticsSection_isReused() {
        Document document = TestDocuments.withParagraphs("text");
        Consumer<TransformContext> complain = context -> {
            throw context.condition(Severity.INFO, "note");
        };

        scheduler.run(document, List.of(spec("one", 100, complain)));
        scheduler.run(document, List.of(spec("two", 100, complain)));

        NodeId section = TransformScheduler.findDiagnosticsSection(document).orElseThrow();
        assertThat(document.childCount(section)).isEqualTo(3);
        assertThat(document.children(document.root())).hasSize(2);
    }

    @Test
    void run_diagnosticsSectionLeftEmpty_isRemoved() {
        Document document = TestDocuments.withParagraphs("text");

        scheduler.run(document, List.of(
            spec("complainer", 100, context -> {
                throw context.condition(Severity.WARNING, "note");
            }),
            spec("cleaner", 200, context -> {
                Document doc = context.document();
                NodeId section = TransformScheduler.findDiagnosticsSection(doc).orElseThrow();
                doc.remove(doc.child(section, 1));
            })));

        assertThat(TransformScheduler.findDiagnosticsSection(document)).isEmpty();
        assertThat(document.children(document.root())).hasSize(1);
    }

    @Test
    void run_reportLevel_printsOnlyConditionsAtOrAboveIt() {
        // Given
        Settings settings = TestDocuments.defaultSettings().with(StandardOptions.REPORT_LEVEL, 4);
        Document document = TestDocuments.withParagraphs(settings, "text");

        // When
        scheduler.run(document, List.of(
            spec("quiet", 100, context -> {
                throw new TransformCondition(
                    new Condition(3, "quiet note", null, null));
            }),
            spec("loud", 200, context -> {
                throw new TransformCondition(
                    new Condition(5, "loud note", 7, null));
            })));

        // Then
        assertThat(warnings.toString(StandardCharsets.UTF_8).lines())
            .containsExactly("WARNING [line 7] loud note");
        NodeId section = TransformScheduler.findDiagnosticsSection(document).orElseThrow();
        assertThat(document.childCount(section)).isEqualTo(3);
    }

    @Test
    void run_conditionAtHaltLevel_throwsHaltExceptionAndStops() {
        // Given
        Settings settings = TestDocuments.defaultSettings().with(StandardOptions.HALT_LEVEL, 8);
        Document document = TestDocuments.withParagraphs(settings, "text");

        // When / Then
        assertThatThrownBy(() -> scheduler.run(document, List.of(
            spec("fatal", 100, context -> {
                throw context.condition(Severity.SEVERE, "Cannot continue");
            }),
            spec("never", 200, context -> { }))))
            .isInstanceOfSatisfying(HaltException.class, e -> {
                assertThat(e.transformId()).isEqualTo("fatal");
                assertThat(e.condition().severity()).isEqualTo(8);
            });
        assertThat(calls).containsExactly("fatal");
        assertThat(warnings.toString(StandardCharsets.UTF_8)).contains("SEVERE Cannot continue");
        assertThat(TransformScheduler.findDiagnosticsSection(document)).isPresent();
    }

    @Test
    void run_unexpectedException_wrappedInTransformFailedException() {
        Document document = TestDocuments.withParagraphs("text");

        assertThatThrownBy(() -> scheduler.run(document, List.of(
            spec("broken", 100, context -> {
                throw new IllegalStateException("boom");
            }))))
            .isInstanceOf(TransformFailedException.class)
            .hasMessageContaining("broken")
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void transformInstance_priorityOutOfRange_throwsException() {
        Document document = TestDocuments.withParagraphs("text");
        TransformSpec spec = spec("invalid", 1000, context -> { });

        assertThatThrownBy(() -> scheduler.run(document, List.of(spec)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("priority 1000");
    }

    private TransformSpec spec(String id, int priority, Consumer<TransformContext> body) {
        return TransformSpec.of(() -> new RecordingTransform(id, priority, body));
    }

    private final class RecordingTransform implements Transform {
        private final String id;
        private final int priority;
        private final Consumer<TransformContext> body;

        private RecordingTransform(String id, int priority, Consumer<TransformContext> body) {
            this.id = id;
            this.priority = priority;
            this.body = body;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public int getPriority() {
            return priority;
        }

        @Override
        public void apply(TransformContext context) {
            calls.add(id);
            body.accept(context);
        }
    }
}
