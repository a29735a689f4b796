package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.core.ProgramReader;
import io.github.manjago.mutagen.core.ScriptedSource;
import io.github.manjago.mutagen.core.SeededRng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GaussianMutation.
 */
class GaussianMutationTest {
    
    private static Program read(String text) throws Exception {
        return new ProgramReader().read(text);
    }
    
    @Test
    @DisplayName("Floats move by sd times the normal sample")
    void testPerturb() throws Exception {
        // perturb draw, then Box-Muller u1, u2 giving a sample of 1.0
        ScriptedSource source = new ScriptedSource().doubles(0.0, Math.exp(-0.5), 0.0);
        GaussianMutation mutation = new GaussianMutation(source, 1.0, 0.1, 100, new CommitPolicy(false));
        
        Individual child = mutation.mutate(Individual.of(read("(1.0 a 2 true)")));
        ProgramList list = (ProgramList) child.program();
        
        assertEquals(1.1, ((Atom) list.get(0)).doubleValue(), 1e-9);
        assertEquals(Atom.instruction("a"), list.get(1));
        assertEquals(Atom.integer(2), list.get(2));
        assertEquals(Atom.bool(true), list.get(3));
        assertTrue(source.isExhausted());
    }
    
    @Test
    @DisplayName("Probability 0 changes nothing")
    void testNoPerturb() throws Exception {
        GaussianMutation mutation = new GaussianMutation(new SeededRng(3), 0.0, 1.0, 100, new CommitPolicy(false));
        Program p = read("(1.5 (2.5 x) -0.25)");
        assertEquals(p, mutation.mutate(Individual.of(p)).program());
    }
    
    @Test
    @DisplayName("Shape is preserved")
    void testShape() throws Exception {
        GaussianMutation mutation = new GaussianMutation(new SeededRng(4), 0.5, 1.0, 100, new CommitPolicy(false));
        Program p = read("(1.5 (2.5 x (0.1)) -0.25 7)");
        for (int i = 0; i < 50; i++) {
            Program child = mutation.mutate(Individual.of(p)).program();
            assertEquals(p.points(), child.points());
            assertEquals(Atom.integer(7), ((ProgramList) child).get(3));
        }
    }
    
    @Test
    @DisplayName("Parent already over the size cap is returned as is")
    void testParentOverCap() throws Exception {
        GaussianMutation mutation = new GaussianMutation(new SeededRng(5), 1.0, 1.0, 3, new CommitPolicy(false));
        Individual parent = Individual.of(read("(1.5 2.5 3.5)"));
        assertSame(parent, mutation.mutate(parent));
    }
    
    @Test
    @DisplayName("Perturbation overflowing to infinity keeps the old value")
    void testOverflow() {
        ScriptedSource source = new ScriptedSource().doubles(0.0, Math.exp(-0.5), 0.0);
        GaussianMutation mutation = new GaussianMutation(source, 1.0, Double.MAX_VALUE, 100,
                new CommitPolicy(false));
        Program p = ProgramList.of(Atom.floating(Double.MAX_VALUE));
        assertEquals(p, mutation.mutate(Individual.of(p)).program());
        assertTrue(source.isExhausted());
    }
}
