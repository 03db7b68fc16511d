package com.docpublish.core.reader.impl;

import com.docpublish.core.reader.Parser;
import com.docpublish.core.reader.Reader;
import com.docpublish.core.settings.OptionDefinition;
import com.docpublish.core.transform.Transform;
import com.docpublish.core.transform.TransformSpec;
import com.docpublish.core.transform.impl.DocTitleTransform;
import com.docpublish.core.transform.impl.FilterMessagesTransform;
import com.docpublish.core.transform.impl.SectionIdTransform;
import com.docpublish.core.transform.impl.StripCommentsTransform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reader for self-contained documents.
 *
 * <p>By default it applies the stock transforms:
 * <table>
 *   <caption>Stock transforms</caption>
 *   <tr><th>Transform</th><th>Priority</th></tr>
 *   <tr><td>{@link SectionIdTransform}</td><td>260</td></tr>
 *   <tr><td>{@link DocTitleTransform}</td><td>320</td></tr>
 *   <tr><td>{@link StripCommentsTransform}</td><td>740</td></tr>
 *   <tr><td>{@link FilterMessagesTransform}</td><td>870</td></tr>
 * </table>
 */
public class StandaloneReader extends Reader {

    private static final List<Supplier<? extends Transform>> STOCK_TRANSFORMS = List.of(
        SectionIdTransform::new,
        DocTitleTransform::new,
        StripCommentsTransform::new,
        FilterMessagesTransform::new
    );

    private final List<Supplier<? extends Transform>> transforms;

    /**
     * Creates a reader applying the stock transforms.
     *
     * @param parser parser building the tree
     */
    public StandaloneReader(Parser parser) {
        this(parser, STOCK_TRANSFORMS);
    }

    /**
     * Creates a reader applying the given transforms.
     *
     * @param parser parser building the tree
     * @param transforms transform constructors, instantiated per read
     */
    public StandaloneReader(Parser parser, List<Supplier<? extends Transform>> transforms) {
        super(parser);
        this.transforms = List.copyOf(Objects.requireNonNull(transforms, "transforms must not be null"));
    }

    /**
     * Returns fresh instances of the stock transforms, in priority order.
     *
     * @return stock transforms
     */
    public static List<Transform> stockTransforms() {
        return STOCK_TRANSFORMS.stream()
            .<Transform>map(Supplier::get)
            .toList();
    }

    @Override
    public String getId() {
        return "standalone";
    }

    @Override
    public List<TransformSpec> getTransforms() {
        return transforms.stream()
            .map(TransformSpec::of)
            .toList();
    }

    @Override
    public List<OptionDefinition> getSettingsSpec() {
        List<OptionDefinition> definitions = new ArrayList<>(super.getSettingsSpec());
        transforms.forEach(factory -> definitions.addAll(factory.get().getSettingsSpec()));
        return definitions;
    }
}
