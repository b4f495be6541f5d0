package com.graphdoc.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests keeping the layers of the documentation engine apart.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Graph models are immutable records</li>
 *   <li>The model knows nothing about rendering, reading or writing documents</li>
 *   <li>Format backends live in the export implementation package</li>
 *   <li>Utilities stay free of domain dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.graphdoc.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..content..", "..export..", "..generator..", "..source..", "..locator..", "..markup..");

        rule.check(classes);
    }

    @Test
    void exporters_shouldResideInImplPackage() {
        ArchRule rule = classes()
            .that().implement("com.graphdoc.core.export.DocExporter")
            .should().resideInAPackage("..export.impl..");

        rule.check(classes);
    }

    /**
     * The content tree renders through the exporter interface only.
     */
    @Test
    void content_shouldNotDependOnExporterImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..content..")
            .should().dependOnClassesThat().resideInAPackage("..export.impl..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..model..", "..content..", "..generator..", "..source..");

        rule.check(classes);
    }

    @Test
    void source_shouldNotDependOnRendering() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..source..")
            .should().dependOnClassesThat().resideInAnyPackage("..content..", "..export..", "..generator..");

        rule.check(classes);
    }
}
