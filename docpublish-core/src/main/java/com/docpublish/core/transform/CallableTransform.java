package com.docpublish.core.transform;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Adapts a plain callable to {@link Transform}.
 */
final class CallableTransform implements Transform {

    private final String id;
    private final Consumer<TransformContext> body;

    CallableTransform(String id, Consumer<TransformContext> body) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public int getPriority() {
        return TransformSpec.CALLABLE_PRIORITY;
    }

    @Override
    public void apply(TransformContext context) {
        body.accept(context);
    }
}
