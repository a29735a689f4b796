package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramReader;
import io.github.manjago.mutagen.core.ScriptedSource;
import io.github.manjago.mutagen.core.SeededRng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DeletionMutation.
 */
class DeletionMutationTest {
    
    private static Program read(String text) throws Exception {
        return new ProgramReader().read(text);
    }
    
    private static DeletionMutation deletion(ScriptedSource source) {
        return new DeletionMutation(source, 100, new CommitPolicy(false));
    }
    
    @ParameterizedTest
    @CsvSource({
        "0.0, 1", "0.3199, 1",
        "0.32, 2", "0.7399, 2",
        "0.74, 3", "0.9499, 3",
        "0.95, 4", "0.9999, 4"
    })
    @DisplayName("Deletion count table")
    void testDeletionCount(double draw, int expected) {
        assertEquals(expected, DeletionMutation.deletionCount(draw));
    }
    
    @Test
    @DisplayName("Delete a whole sublist")
    void testDeleteSublist() throws Exception {
        // one deletion, node 2 = (b c), no collapse
        ScriptedSource source = new ScriptedSource().doubles(0.1, 0.5).ints(2);
        Individual child = deletion(source).mutate(Individual.of(read("(a (b c) d)")));
        assertEquals(read("(a d)"), child.program());
        assertTrue(source.isExhausted());
    }
    
    @Test
    @DisplayName("Collapse a sublist's brackets")
    void testCollapse() throws Exception {
        ScriptedSource source = new ScriptedSource().doubles(0.1, 0.1).ints(2);
        Individual child = deletion(source).mutate(Individual.of(read("(a (b c) d)")));
        assertEquals(read("(a b c d)"), child.program());
    }
    
    @Test
    @DisplayName("An atom is deleted without a collapse draw")
    void testDeleteAtom() throws Exception {
        ScriptedSource source = new ScriptedSource().doubles(0.1).ints(1);
        Individual child = deletion(source).mutate(Individual.of(read("(a (b c) d)")));
        assertEquals(read("((b c) d)"), child.program());
        assertTrue(source.isExhausted());
    }
    
    @Test
    @DisplayName("Each step works on the result of the previous one")
    void testSequential() throws Exception {
        // two deletions: node 1 (a), then node 1 of ((b c) d) = (b c) collapsed
        ScriptedSource source = new ScriptedSource().doubles(0.5, 0.0).ints(1, 1);
        Individual child = deletion(source).mutate(Individual.of(read("(a (b c) d)")));
        assertEquals(read("(b c d)"), child.program());
    }
    
    @Test
    @DisplayName("A deletion landing on the root changes nothing")
    void testDeleteRoot() throws Exception {
        ScriptedSource source = new ScriptedSource().doubles(0.1, 0.9).ints(0);
        Individual child = deletion(source).mutate(Individual.of(read("(a (b c) d)")));
        assertEquals(read("(a (b c) d)"), child.program());
        assertTrue(source.isExhausted());
    }
    
    @Test
    @DisplayName("Random deletions never grow a program")
    void testNeverGrows() throws Exception {
        DeletionMutation mutation = new DeletionMutation(new SeededRng(11), 100, new CommitPolicy(false));
        Program start = read("(a (b (c d) e) (f g) (h (i (j))))");
        for (int i = 0; i < 200; i++) {
            Individual child = mutation.mutate(Individual.of(start));
            assertTrue(child.points() <= start.points());
        }
    }
}
