package com.multigallery.core;

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
 *   <li>Syntax tree types are immutable records</li>
 *   <li>Dialect implementations implement the dialect SPI</li>
 *   <li>The parser and resolver stay independent of rendering and output</li>
 *   <li>The core library stays free of CLI and logging backend dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.multigallery.core");
    }

    @Test
    void astTypes_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..ast..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void dialects_shouldImplementMarkupDialect() {
        ArchRule rule = classes()
            .that().resideInAPackage("..dialect.impl..")
            .and().haveSimpleNameEndingWith("Dialect")
            .should().beAssignableTo("com.multigallery.core.dialect.MarkupDialect");

        rule.check(classes);
    }

    /**
     * A parsed document must be renderable for any site, so parsing cannot depend on how
     * rendering or writing works.
     */
    @Test
    void parser_shouldNotDependOnRenderingOrOutput() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..renderer..", "..dialect..", "..generator..", "..output..");

        rule.check(classes);
    }

    @Test
    void resolver_shouldOnlyDependOnSyntaxTree() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..resolve..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..renderer..", "..dialect..", "..generator..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..ast..", "..parser..", "..renderer..", "..site..", "..generator..", "..story..");

        rule.check(classes);
    }

    @Test
    void core_shouldNotDependOnCliOrLoggingBackend() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.multigallery.core..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("picocli..", "ch.qos.logback..");

        rule.check(classes);
    }
}
