package com.sysdiagram.core;

import com.sysdiagram.core.generator.DiagramGenerator;
import com.sysdiagram.core.renderer.OutputRenderer;
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
 *   <li>Model types are immutable records or enums</li>
 *   <li>The parser knows nothing about diagram notations</li>
 *   <li>Generators and renderers live in their impl packages</li>
 *   <li>Generators only depend on the generator API, model, labels and util</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.sysdiagram.core");
    }

    @Test
    void models_shouldBeRecordsOrEnums() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void model_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.parser..", "..core.generator..", "..core.renderer..", "..core.io..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void parser_shouldNotDependOnGeneratorsOrRenderers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.parser..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.generator..", "..core.renderer..", "..core.io..");

        rule.check(classes);
    }

    @Test
    void generatorImplementations_shouldResideInImplPackage() {
        ArchRule rule = classes()
            .that().implement(DiagramGenerator.class)
            .and().areNotInterfaces()
            .should().resideInAPackage("..generator.impl..")
            .andShould().bePublic()
            .andShould().haveSimpleNameEndingWith("Generator");

        rule.check(classes);
    }

    @Test
    void generatorImplementations_shouldOnlyDependOnAllowedLayers() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .should().onlyDependOnClassesThat()
                .resideInAnyPackage(
                    "..generator.impl..",
                    "..generator.label..",
                    "com.sysdiagram.core.generator",
                    "com.sysdiagram.core.model..",
                    "com.sysdiagram.core.util..",
                    "java..",
                    "org.slf4j.."
                )
            .because("generators turn a model tree into text and nothing else");

        rule.check(classes);
    }

    @Test
    void rendererImplementations_shouldResideInImplPackage() {
        ArchRule rule = classes()
            .that().implement(OutputRenderer.class)
            .and().areNotInterfaces()
            .should().resideInAPackage("..renderer.impl..")
            .andShould().haveSimpleNameEndingWith("Renderer");

        rule.check(classes);
    }
}
