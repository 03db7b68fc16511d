package com.docpublish.cli;

import com.docpublish.core.error.ConfigException;
import com.docpublish.core.error.StructuralWarning;
import com.docpublish.core.publish.Publisher;
import com.docpublish.core.settings.InvalidValuePolicy;
import com.docpublish.core.settings.SettingsRegistry;
import com.docpublish.core.settings.SettingsResolution;
import com.docpublish.core.settings.SettingsResolver;
import com.docpublish.core.settings.StandardConfigFiles;
import com.docpublish.core.writer.Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to check configuration files.
 *
 * <p>Every value is parsed against the options of the selected writer and the stock reader;
 * the first invalid value fails the check. Malformed lines are reported as warnings and fail
 * the check only with {@code --strict}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Check the standard configuration files
 * docpublish validate
 *
 * # Check specific files
 * docpublish validate site.conf guide.txt.conf
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate configuration files",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(description = "Configuration files to check (default: the standard files)", arity = "0..*")
    private List<Path> files = new ArrayList<>();

    @Option(
        names = {"-w", "--writer"},
        description = "Writer whose options are accepted (default: html)",
        defaultValue = Components.DEFAULT_WRITER
    )
    private String writerId;

    @Option(names = {"--strict"}, description = "Treat malformed lines as errors")
    private boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Writer writer = Components.writer(writerId).orElse(null);
        if (writer == null) {
            err.println("✗ Unknown writer: " + writerId + ". Use one of " + Components.writerIds());
            return 1;
        }

        List<Path> toCheck = files.isEmpty() ? StandardConfigFiles.defaults() : files;
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                err.println("✗ Configuration file not found: " + file);
                return 1;
            }
        }

        SettingsRegistry registry = new Publisher().registry(Components.reader(), writer);
        SettingsResolver resolver = new SettingsResolver(registry, toCheck, InvalidValuePolicy.ABORT);
        log.info("Validating {} configuration file(s)", toCheck.size());

        SettingsResolution resolution;
        try {
            resolution = resolver.resolveWithReport(null, Map.of());
        } catch (ConfigException e) {
            err.println("✗ " + e.getMessage());
            return 1;
        }

        for (StructuralWarning warning : resolution.warnings()) {
            err.println("⚠ " + warning);
        }
        for (Path processed : resolution.processedFiles()) {
            out.println("✓ " + processed);
        }
        if (resolution.processedFiles().isEmpty()) {
            out.println("No configuration files found");
        }
        if (strict && !resolution.warnings().isEmpty()) {
            err.println("✗ " + resolution.warnings().size() + " warning(s) in strict mode");
            return 1;
        }
        return 0;
    }
}
