package com.txwatch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: common and domain are leaves, connection and health know nothing of tracking or the API.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.txwatch");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.txwatch.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.txwatch.domain..", "com.txwatch.connection..", "com.txwatch.health..",
                        "com.txwatch.tracking..", "com.txwatch.config..", "com.txwatch.api..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.txwatch.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.txwatch.connection..", "com.txwatch.health..", "com.txwatch.tracking..",
                        "com.txwatch.config..", "com.txwatch.api..");
        rule.check(classes);
    }

    @Test
    void connection_must_not_depend_on_tracking_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.txwatch.connection..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.txwatch.tracking..", "com.txwatch.api..", "com.txwatch.domain..");
        rule.check(classes);
    }

    @Test
    void health_must_not_depend_on_connection_tracking_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.txwatch.health..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.txwatch.connection..", "com.txwatch.tracking..", "com.txwatch.api..");
        rule.check(classes);
    }

    @Test
    void tracking_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.txwatch.tracking..")
                .should().dependOnClassesThat().resideInAPackage("com.txwatch.api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_touch_mongo_directly() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().resideInAnyPackage("org.springframework.data.mongodb..", "com.mongodb..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.txwatch.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
