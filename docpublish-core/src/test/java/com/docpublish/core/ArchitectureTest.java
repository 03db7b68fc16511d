package com.docpublish.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the core module.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The tree, error and settings packages stay free of processing stages</li>
 *   <li>Base packages don't depend on implementations</li>
 *   <li>Value types are implemented as immutable records</li>
 *   <li>Writers, transforms and parsers implement their SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.docpublish.core");
    }

    /**
     * The document model and its configuration are shared by every stage and must not know any
     * of them.
     */
    @Test
    void foundation_shouldNotDependOnProcessingStages() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.tree..", "..core.error..", "..core.settings..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.transform..", "..core.reader..", "..core.writer..", "..core.renderer..", "..core.publish..");

        rule.check(classes);
    }

    /**
     * Verifies the transform machinery doesn't depend on reading, writing or publishing.
     */
    @Test
    void transforms_shouldNotDependOnReadersOrWriters() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.transform..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.reader..", "..core.writer..", "..core.renderer..", "..core.publish..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldOnlyKnowGeneratedOutput() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.renderer..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.tree..", "..core.transform..", "..core.reader..", "..core.writer..", "..core.publish..");

        rule.check(classes);
    }

    /**
     * Verifies base packages don't depend on implementation classes.
     * This keeps implementations replaceable and prevents circular dependencies.
     */
    @Test
    void basePackages_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.transform", "..core.reader", "..core.writer", "..core.renderer")
            .should().dependOnClassesThat().resideInAPackage("..impl..");

        rule.check(classes);
    }

    /**
     * Only the publish package wires stages together; nothing below it may depend on it.
     */
    @Test
    void publish_shouldNotBeUsedByStages() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..core.publish..")
            .should().dependOnClassesThat().resideInAPackage("..core.publish..");

        rule.check(classes);
    }

    @Test
    void writers_shouldExtendWriter() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.writer.impl..")
            .and().haveSimpleNameEndingWith("Writer")
            .should().beAssignableTo("com.docpublish.core.writer.Writer");

        rule.check(classes);
    }

    @Test
    void transforms_shouldImplementTransform() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.transform.impl..")
            .and().haveSimpleNameEndingWith("Transform")
            .should().implement("com.docpublish.core.transform.Transform");

        rule.check(classes);
    }

    /**
     * Verifies renderer value types are records, as in the rest of the output pipeline.
     */
    @Test
    void generatedOutputTypes_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.renderer")
            .and().haveSimpleNameStartingWith("Generated")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void exceptions_shouldExtendPublishException() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.error..")
            .and().haveSimpleNameEndingWith("Exception")
            .and().doNotHaveSimpleName("PublishException")
            .should().beAssignableTo("com.docpublish.core.error.PublishException");

        rule.check(classes);
    }
}
