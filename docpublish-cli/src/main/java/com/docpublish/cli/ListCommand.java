package com.docpublish.cli;

import com.docpublish.core.publish.Publisher;
import com.docpublish.core.settings.OptionDefinition;
import com.docpublish.core.settings.SettingsRegistry;
import com.docpublish.core.transform.Transform;
import com.docpublish.core.writer.Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to list available writers, transforms, or configuration options.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all writers
 * docpublish list writers
 *
 * # List the stock transforms in execution order
 * docpublish list transforms
 *
 * # List the options recognised when writing HTML
 * docpublish list options --writer html
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available writers, transforms, or options",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: writers, transforms, or options"
    )
    private String type;

    @Option(
        names = {"-w", "--writer"},
        description = "Writer whose options are listed (default: html)",
        defaultValue = Components.DEFAULT_WRITER
    )
    private String writerId;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "writers", "writer" -> listWriters(out);
            case "transforms", "transform" -> listTransforms(out);
            case "options", "option" -> listOptions(out);
            default -> {
                log.error("Unknown type: {}. Use: writers, transforms, or options", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: writers, transforms, or options");
                yield 1;
            }
        };
    }

    private int listWriters(PrintWriter out) {
        out.println("Available Writers:");
        out.println();
        for (Writer writer : Components.writers()) {
            out.printf("  • %s (ID: %s)%n", writer.getDisplayName(), writer.getId());
            out.printf("    File Extension: .%s%n", writer.getFileExtension());
            out.printf("    Parts: %s%n", writer.partNames());
            out.println();
        }
        return 0;
    }

    private int listTransforms(PrintWriter out) {
        out.println("Stock Transforms:");
        out.println();
        for (Transform transform : Components.transforms()) {
            out.printf("  • %s (priority %d)%n", transform.getId(), transform.getPriority());
            for (OptionDefinition option : transform.getSettingsSpec()) {
                out.printf("    Setting: %s (default: %s)%n", option.name(), option.defaultValue());
            }
            out.println();
        }
        return 0;
    }

    private int listOptions(PrintWriter out) {
        Optional<Writer> writer = Components.writer(writerId);
        if (writer.isEmpty()) {
            spec.commandLine().getErr().println("✗ Unknown writer: " + writerId + ". Use one of " + Components.writerIds());
            return 1;
        }
        SettingsRegistry registry = new Publisher().registry(Components.reader(), writer.get());
        out.println("Options (" + registry.size() + "):");
        out.println();
        for (OptionDefinition option : registry.definitions()) {
            out.printf("  %s: %s (default: %s)%n", option.name(), option.type().describe(), option.defaultValue());
            if (!option.description().isEmpty()) {
                out.printf("    %s%n", option.description());
            }
        }
        return 0;
    }
}
