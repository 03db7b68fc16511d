package com.docpublish.core.transform;

import com.docpublish.core.tree.Document;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * What to run: an existing transform instance, a transform type to instantiate, or a plain
 * callable.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<TransformSpec> specs = List.of(
 *     TransformSpec.of(DocTitleTransform::new),
 *     TransformSpec.callable("count-words", context -> countWords(context.document()))
 * );
 * }</pre>
 */
@FunctionalInterface
public interface TransformSpec {

    /** Priority given to callables; runs after the stock transforms. */
    int CALLABLE_PRIORITY = 950;

    /** Order given to callables; callables keep their list order among themselves. */
    long CALLABLE_ORDER = 0L;

    /**
     * Produces the instance to run.
     *
     * @param document document being transformed
     * @param counter source of order numbers
     * @return transform instance
     */
    TransformInstance instantiate(Document document, TransformOrderCounter counter);

    /**
     * Reuses an already constructed instance as-is.
     *
     * @param instance instance to run
     * @return spec
     */
    static TransformSpec instance(TransformInstance instance) {
        Objects.requireNonNull(instance, "instance must not be null");
        return (document, counter) -> instance;
    }

    /**
     * Instantiates a transform type against the document root with a fresh order number.
     *
     * @param factory constructor reference of the transform
     * @return spec
     */
    static TransformSpec of(Supplier<? extends Transform> factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        return (document, counter) -> new TransformInstance(factory.get(), document.root(), counter.next());
    }

    /**
     * Wraps a plain callable with priority {@value #CALLABLE_PRIORITY} and order 0.
     *
     * @param id identifier used in logs and diagnostics
     * @param body code to run
     * @return spec
     */
    static TransformSpec callable(String id, Consumer<TransformContext> body) {
        CallableTransform transform = new CallableTransform(id, body);
        return (document, counter) -> new TransformInstance(transform, document.root(), CALLABLE_ORDER);
    }

    /**
     * Wraps a plain callable under the id {@code callable}.
     *
     * @param body code to run
     * @return spec
     */
    static TransformSpec callable(Consumer<TransformContext> body) {
        return callable("callable", body);
    }
}
