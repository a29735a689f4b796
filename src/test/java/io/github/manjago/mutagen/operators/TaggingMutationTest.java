package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.core.ProgramReader;
import io.github.manjago.mutagen.core.ScriptedSource;
import io.github.manjago.mutagen.tag.InMemoryTagStore;
import io.github.manjago.mutagen.tag.Tags;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaggingMutation.
 */
class TaggingMutationTest {
    
    private static Program read(String text) throws Exception {
        return new ProgramReader().read(text);
    }
    
    @Test
    @DisplayName("Subtree is tagged up front and referenced in place")
    void testTagging() throws Exception {
        TaggingMutation mutation = new TaggingMutation(
                p -> 3, new ScriptedSource().ints(7), 10, 100, new CommitPolicy(false));
        
        Individual child = mutation.mutate(Individual.of(read("(a b (c d))")));
        assertEquals(read("((tag_exec_7 (c d)) (a b tagged_7))"), child.program());
    }
    
    @Test
    @DisplayName("Tagging the root")
    void testTagRoot() throws Exception {
        TaggingMutation mutation = new TaggingMutation(
                p -> 0, new ScriptedSource().ints(0), 10, 100, new CommitPolicy(false));
        
        Individual child = mutation.mutate(Individual.of(read("(a b)")));
        assertEquals(read("((tag_exec_0 (a b)) tagged_0)"), child.program());
    }
    
    @Test
    @DisplayName("The tagged code resolves through a tag store")
    void testResolves() throws Exception {
        TaggingMutation mutation = new TaggingMutation(
                p -> 2, new ScriptedSource().ints(4), 10, 100, new CommitPolicy(false));
        ProgramList result = (ProgramList) mutation.mutate(Individual.of(read("(a (b c))"))).program();
        
        ProgramList tagging = (ProgramList) result.get(0);
        int written = Tags.writtenTag(tagging.get(0)).orElseThrow();
        InMemoryTagStore store = new InMemoryTagStore();
        store.write(written, tagging.get(1));
        
        Program reference = ((ProgramList) result.get(1)).get(1);
        int referenced = Tags.referencedTag(reference).orElseThrow();
        assertEquals(Optional.of(read("(b c)")), store.read(referenced));
    }
    
    @Test
    @DisplayName("Child grows by three points plus the tagged subtree")
    void testGrowth() throws Exception {
        TaggingMutation mutation = new TaggingMutation(
                p -> 1, new ScriptedSource().ints(1), 10, 100, new CommitPolicy(false));
        Program p = read("(a b c)");
        assertEquals(p.points() + 3 + 1, mutation.mutate(Individual.of(p)).points());
    }
    
    @Test
    @DisplayName("Non-positive tag limit is rejected")
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new TaggingMutation(
                p -> 0, new ScriptedSource(), 0, 100, new CommitPolicy(false)));
    }
}
