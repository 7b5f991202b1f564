package org.automatacourse.regex;

import org.automatacourse.regex.dfa.ConstructionMode;
import org.automatacourse.regex.dfa.RefinementMode;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompilerOptionsTest {

    @Test
    void defaults() {
        CompilerOptions options = CompilerOptions.defaults();

        assertEquals(ConstructionMode.TERMINAL_ACCEPTING, options.getConstruction());
        assertEquals(RefinementMode.FIRST_GROUP, options.getRefinement());
        assertFalse(options.isSimplifyNotations());
    }

    @Test
    void readsPropertiesWithDashedValues() {
        Properties properties = new Properties();
        properties.setProperty(CompilerOptions.CONSTRUCTION_PROPERTY, "full-closure");
        properties.setProperty(CompilerOptions.REFINEMENT_PROPERTY, " All-Groups ");
        properties.setProperty(CompilerOptions.SIMPLIFY_NOTATIONS_PROPERTY, "TRUE");

        CompilerOptions options = CompilerOptions.fromProperties(properties);

        assertEquals(ConstructionMode.FULL_CLOSURE, options.getConstruction());
        assertEquals(RefinementMode.ALL_GROUPS, options.getRefinement());
        assertTrue(options.isSimplifyNotations());
    }

    @Test
    void missingPropertiesKeepDefaults() {
        Properties properties = new Properties();
        properties.setProperty(CompilerOptions.REFINEMENT_PROPERTY, "all_groups");

        CompilerOptions options = CompilerOptions.fromProperties(properties);

        assertEquals(ConstructionMode.TERMINAL_ACCEPTING, options.getConstruction());
        assertEquals(RefinementMode.ALL_GROUPS, options.getRefinement());
    }

    @Test
    void rejectsUnknownValues() {
        Properties construction = new Properties();
        construction.setProperty(CompilerOptions.CONSTRUCTION_PROPERTY, "lazy");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilerOptions.fromProperties(construction));
        assertEquals("Unknown value 'lazy' for regex.construction", e.getMessage());

        Properties simplify = new Properties();
        simplify.setProperty(CompilerOptions.SIMPLIFY_NOTATIONS_PROPERTY, "yes");
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.fromProperties(simplify));
    }

    @Test
    void toBuilderCopiesEverySetting() {
        CompilerOptions strict = CompilerOptions.strict();
        CompilerOptions copy = strict.toBuilder().simplifyNotations(true).build();

        assertEquals(ConstructionMode.FULL_CLOSURE, copy.getConstruction());
        assertEquals(RefinementMode.ALL_GROUPS, copy.getRefinement());
        assertTrue(copy.isSimplifyNotations());
    }

    @Test
    void fullClosureRequiresAllGroupsRefinement() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilerOptions.builder().construction(ConstructionMode.FULL_CLOSURE).build());
        assertEquals("FULL_CLOSURE construction requires ALL_GROUPS refinement, got FIRST_GROUP", e.getMessage());

        Properties properties = new Properties();
        properties.setProperty(CompilerOptions.CONSTRUCTION_PROPERTY, "full-closure");
        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.fromProperties(properties));

        assertThrows(IllegalArgumentException.class,
                () -> CompilerOptions.strict().toBuilder().refinement(RefinementMode.FIRST_GROUP).build());
    }
}
