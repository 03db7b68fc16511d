package com.docpublish.cli;

import com.docpublish.core.reader.Reader;
import com.docpublish.core.reader.impl.PlainTextParser;
import com.docpublish.core.reader.impl.StandaloneReader;
import com.docpublish.core.transform.Transform;
import com.docpublish.core.writer.Writer;
import com.docpublish.core.writer.impl.HtmlWriter;
import com.docpublish.core.writer.impl.PlainTextWriter;
import com.docpublish.core.writer.impl.PseudoXmlWriter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fixed table of the components the command line can use.
 */
final class Components {

    static final String DEFAULT_WRITER = "html";

    private static final Map<String, Supplier<Writer>> WRITERS = new LinkedHashMap<>();

    static {
        WRITERS.put("html", HtmlWriter::new);
        WRITERS.put("text", PlainTextWriter::new);
        WRITERS.put("pseudoxml", PseudoXmlWriter::new);
    }

    private Components() {
        // Utility class
    }

    static Optional<Writer> writer(String id) {
        return Optional.ofNullable(WRITERS.get(id)).map(Supplier::get);
    }

    static List<Writer> writers() {
        return WRITERS.values().stream().map(Supplier::get).toList();
    }

    static List<String> writerIds() {
        return List.copyOf(WRITERS.keySet());
    }

    static Reader reader() {
        return new StandaloneReader(new PlainTextParser());
    }

    static List<Transform> transforms() {
        return StandaloneReader.stockTransforms();
    }
}
