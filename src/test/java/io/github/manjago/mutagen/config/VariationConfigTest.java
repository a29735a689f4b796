package io.github.manjago.mutagen.config;

import io.github.manjago.mutagen.operators.TypeComparison;
import io.github.manjago.mutagen.random.NodeSelectionMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VariationConfig.
 */
class VariationConfigTest {
    
    @Test
    @DisplayName("Defaults come from reference.conf")
    void testDefaults() {
        VariationConfig config = VariationConfig.defaults();
        assertEquals(100, config.maxPoints());
        assertEquals(20, config.mutationMaxPoints());
        assertEquals(10_000, config.tagLimit());
        assertEquals(List.of(new TypeComparison("integer", "integer_eq"),
                new TypeComparison("boolean", "boolean_eq")), config.tagBranchComparisons());
        assertEquals(0.01, config.ultraAlternationRate());
        assertEquals(10.0, config.ultraAlignmentDeviation());
        assertFalse(config.maintainAncestors());
        assertEquals(NodeSelectionMethod.UNBIASED, config.nodeSelectionMethod());
        assertEquals(List.of(-10, 10), config.integerErcRange());
        assertEquals(0, config.randomSeed());
    }
    
    @Test
    @DisplayName("Builder defaults match reference.conf")
    void testBuilderMatchesDefaults() {
        assertEquals(VariationConfig.defaults(), VariationConfig.builder().build());
    }
    
    @Test
    @DisplayName("File values override defaults")
    void testFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("run.conf");
        Files.writeString(file, """
            mutagen {
              max-points = 250
              lineage.maintain-ancestors = true
              node-selection.method = size-tournament
              vocabulary.float-erc = []
              random.seed = 42
            }
            """);
        VariationConfig config = VariationConfig.fromFile(file);
        
        assertEquals(250, config.maxPoints());
        assertTrue(config.maintainAncestors());
        assertEquals(NodeSelectionMethod.SIZE_TOURNAMENT, config.nodeSelectionMethod());
        assertTrue(config.floatErcRange().isEmpty());
        assertEquals(42, config.effectiveSeed());
        // untouched values fall back
        assertEquals(20, config.mutationMaxPoints());
    }
    
    @Test
    @DisplayName("toBuilder overrides single values")
    void testToBuilder() {
        VariationConfig base = VariationConfig.defaults();
        VariationConfig changed = base.toBuilder().maxPoints(7).build();
        assertEquals(7, changed.maxPoints());
        assertEquals(base.instructions(), changed.instructions());
        assertEquals(base, base.toBuilder().build());
    }
    
    @Test
    @DisplayName("Vocabulary holds the instructions plus one generator per constant range")
    void testVocabulary() {
        VariationConfig config = VariationConfig.defaults();
        assertEquals(config.instructions().size() + 2, config.vocabulary().size());
        
        VariationConfig noConstants = config.toBuilder()
                .integerErcRange(List.of())
                .floatErcRange(List.of())
                .build();
        assertEquals(config.instructions().size(), noConstants.vocabulary().size());
        assertEquals(config.gsxoverInstructions().size(), config.gsxoverVocabulary().size());
    }
    
    @Test
    @DisplayName("Invalid values are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> VariationConfig.builder().maxPoints(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> VariationConfig.builder().integerErcRange(List.of(1)).build());
    }
    
    @Test
    @DisplayName("Time-based seed when none is configured")
    void testEffectiveSeed() {
        assertNotEquals(0, VariationConfig.builder().randomSeed(0).build().effectiveSeed());
        assertEquals(5, VariationConfig.builder().randomSeed(5).build().effectiveSeed());
    }
}
