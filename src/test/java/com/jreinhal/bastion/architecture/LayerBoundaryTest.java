package com.jreinhal.bastion.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Layer boundaries: request handling depends on services, never the reverse, and the
 * budget and cache layers stay independent of retrieval and generation.
 */
class LayerBoundaryTest {

    private static final JavaClasses CLASSES = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.jreinhal.bastion");

    @Test
    @DisplayName("service package must not depend on controller package")
    void serviceShouldNotDependOnController() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..service..")
                .should().dependOnClassesThat()
                .resideInAPackage("..controller..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("retrieval package must not depend on service or controller packages")
    void retrievalShouldNotDependOnUpperLayers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..retrieval..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..service..", "..controller..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("budget and cache packages must not depend on retrieval or generation")
    void storesShouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..budget..", "..cache..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..retrieval..", "..service..", "..controller..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("filters must not depend on controllers or services")
    void filtersShouldNotDependOnHandlers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..filter..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..controller..", "..service..");
        rule.check(CLASSES);
    }
}
