package com.actexport.core;

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
 *   <li>Renderers implement the renderer SPI</li>
 *   <li>Tree, grid, markup and violation logic never reach up into rendering or output</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.actexport.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
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

    @Test
    void renderers_shouldImplementActRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..render.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().beAssignableTo("com.actexport.core.render.ActRenderer");

        rule.check(classes);
    }

    @Test
    void outputWriters_shouldImplementOutputWriter() {
        ArchRule rule = classes()
            .that().resideInAPackage("..output.impl..")
            .and().haveSimpleNameEndingWith("Writer")
            .should().beAssignableTo("com.actexport.core.output.OutputWriter");

        rule.check(classes);
    }

    /**
     * Verifies the document logic stays independent of every output target.
     */
    @Test
    void documentLogic_shouldNotDependOnRenderingOrOutput() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..model..", "..tree..", "..grid..", "..markup..", "..violation..", "..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "com.actexport.core.render..",
                "com.actexport.core.output..",
                "com.actexport.core.config..",
                "com.actexport.core.io..");

        rule.check(classes);
    }

    @Test
    void renderBase_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.actexport.core.render")
            .should().dependOnClassesThat().resideInAPackage("..render.impl..");

        rule.check(classes);
    }

    /**
     * Verifies only the renderers touch Apache POI.
     */
    @Test
    void poi_shouldOnlyBeUsedByRenderers() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..render.impl..")
            .should().dependOnClassesThat().resideInAnyPackage("org.apache.poi..", "org.openxmlformats..");

        rule.check(classes);
    }
}
