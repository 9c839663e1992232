package com.genomecurator.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Curation failures share one exception hierarchy</li>
 *   <li>Decision logic stays independent of file formats and configuration</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.genomecurator.core");
    }

    /**
     * Verifies all domain models in the model package are records, apart from enums.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies every exception in the exception package derives from CurationException.
     */
    @Test
    void exceptions_shouldExtendCurationException() {
        ArchRule rule = classes()
            .that().resideInAPackage("..exception..")
            .should().beAssignableTo("com.genomecurator.core.exception.CurationException");

        rule.check(classes);
    }

    /**
     * Verifies scoring, QC, ANI and type-strain logic never reach into report I/O or config.
     */
    @Test
    void decisionLogic_shouldNotDependOnReportsOrConfig() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..quality..", "..ani..", "..typestrain..")
            .should().dependOnClassesThat().resideInAnyPackage("..report..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies the model layer only depends on itself and the exception types.
     */
    @Test
    void models_shouldNotDependOnServices() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..quality..", "..ani..", "..typestrain..", "..report..", "..config..", "..representative..");

        rule.check(classes);
    }

    /**
     * Verifies utilities stay free of domain services.
     */
    @Test
    void utilClasses_shouldNotDependOnServices() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..quality..", "..report..", "..config..");

        rule.check(classes);
    }
}
