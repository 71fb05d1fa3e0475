package com.labelrun;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: common <- domain <- ingestion <- api, config stands alone.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.labelrun");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..", "..api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.labelrun.common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..", "..api..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void governor_must_not_depend_on_classifier_or_pipeline() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.governor..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.classifier..", "..ingestion.pipeline..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.labelrun.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }

    @Test
    void ingestion_pipeline_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.pipeline..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.job..");
        rule.check(classes);
    }
}
