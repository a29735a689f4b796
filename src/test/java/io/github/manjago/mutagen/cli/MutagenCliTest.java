package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.core.ProgramReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command line.
 */
class MutagenCliTest {
    
    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;
    
    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = MutagenCli.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }
    
    @Test
    @DisplayName("Quiet vary prints one readable program per child")
    void testVaryQuiet() throws Exception {
        int exit = cli.execute("vary", "deletion", "(a b (c d) e)", "--seed", "42", "-n", "3", "-q");
        assertEquals(0, exit);
        
        String[] lines = out.toString().strip().split("\\R");
        assertEquals(3, lines.length);
        ProgramReader reader = new ProgramReader();
        for (String line : lines) {
            assertTrue(reader.read(line).points() <= 6);
        }
    }
    
    @Test
    @DisplayName("Same seed prints the same children")
    void testVaryReproducible() {
        cli.execute("vary", "ultra", "(1 2 (3 4))", "(a (b c) d)", "-s", "7", "-n", "5", "-q");
        String firstRun = out.toString();
        
        setUp();
        cli.execute("vary", "ultra", "(1 2 (3 4))", "(a (b c) d)", "-s", "7", "-n", "5", "-q");
        assertEquals(firstRun, out.toString());
    }
    
    @Test
    @DisplayName("Verbose vary reports operator statistics")
    void testVaryVerbose() {
        int exit = cli.execute("vary", "crossover", "(a b)", "(c d)", "--seed", "1", "--max-points", "3");
        assertEquals(0, exit);
        String text = out.toString();
        assertTrue(text.contains("Operator: crossover"));
        assertTrue(text.contains("committed="));
    }
    
    @Test
    @DisplayName("Configuration file is applied")
    void testVaryConfigFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("tiny.conf");
        Files.writeString(file, "mutagen { max-points = 2, random.seed = 3 }");
        
        int exit = cli.execute("vary", "tag-branch-insertion", "(a)", "-f", file.toString(), "-q");
        assertEquals(0, exit);
        // every candidate is over the cap, so the parent is printed back
        assertEquals("(a)", out.toString().strip());
    }
    
    @Test
    @DisplayName("Bad input exits with status 1")
    void testErrors() {
        assertEquals(1, cli.execute("vary", "shuffle", "(a b)"));
        assertEquals(1, cli.execute("vary", "ultra", "(a b)"));
        assertEquals(1, cli.execute("vary", "mutation", "(a b"));
        assertTrue(err.toString().contains("Parse error"));
    }
    
    @Test
    @DisplayName("Info shows operators and defaults")
    void testInfo() {
        assertEquals(0, cli.execute("info"));
        String text = out.toString();
        assertTrue(text.contains("MUTAGEN"));
        assertTrue(text.contains("boolean-gsxover"));
        assertTrue(text.contains("max-points"));
    }
}
