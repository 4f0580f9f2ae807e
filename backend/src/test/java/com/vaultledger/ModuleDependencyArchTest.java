package com.vaultledger;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries. The ledger is the only writer of positions and must not know its callers.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.vaultledger");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..chain..", "..ledger..", "..partner..",
                        "..reconcile..", "..monitor..", "..api..", "..config..", "..auth..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.vaultledger.common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..chain..", "..ledger..",
                        "..partner..", "..reconcile..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void ledger_must_not_depend_on_its_callers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ledger..")
                .should().dependOnClassesThat().resideInAnyPackage("..partner..", "..reconcile..", "..monitor..",
                        "..api..", "..notify..");
        rule.check(classes);
    }

    @Test
    void partner_must_not_depend_on_reconcile_monitor_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..partner..")
                .should().dependOnClassesThat().resideInAnyPackage("..reconcile..", "..monitor..", "..api..");
        rule.check(classes);
    }

    @Test
    void only_ledger_and_schedule_touch_position_repository() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackages("..ledger..", "..schedule..", "..domain..")
                .should().dependOnClassesThat().haveSimpleName("PositionRepository");
        rule.check(classes);
    }

    @Test
    void health_is_pure() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..health..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
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
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.vaultledger.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
