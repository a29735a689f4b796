package io.github.manjago.mutagen.core;

import io.github.manjago.mutagen.core.ProgramReader.ProgramParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProgramReader and ProgramWriter.
 */
class ProgramReaderTest {
    
    private ProgramReader reader;
    
    @BeforeEach
    void setUp() {
        reader = new ProgramReader();
    }
    
    @Test
    @DisplayName("Literal types")
    void testAtoms() throws Exception {
        assertEquals(Atom.integer(42), reader.read("42"));
        assertEquals(Atom.integer(-7), reader.read("-7"));
        assertEquals(Atom.floating(2.5), reader.read("2.5"));
        assertEquals(Atom.floating(1.0E-4), reader.read("1.0E-4"));
        assertEquals(Atom.floating(300.0), reader.read("3e2"));
        assertEquals(Atom.bool(true), reader.read("true"));
        assertEquals(Atom.bool(false), reader.read("false"));
        assertEquals(Atom.instruction("integer_add"), reader.read("integer_add"));
        assertEquals(Atom.instruction("-"), reader.read("-"));
    }
    
    @Test
    @DisplayName("Nested lists")
    void testNested() throws Exception {
        Program p = reader.read("(integer_add 1 (exec_if (2.5 float_mult) true))");
        assertEquals(ProgramList.of(
                Atom.instruction("integer_add"),
                Atom.integer(1),
                ProgramList.of(
                        Atom.instruction("exec_if"),
                        ProgramList.of(Atom.floating(2.5), Atom.instruction("float_mult")),
                        Atom.bool(true))),
                p);
        assertEquals(9, p.points());
    }
    
    @Test
    @DisplayName("Empty list")
    void testEmptyList() throws Exception {
        assertEquals(ProgramList.EMPTY, reader.read("()"));
        assertEquals(ProgramList.of(ProgramList.EMPTY), reader.read("( ( ) )"));
    }
    
    @Test
    @DisplayName("Whitespace is free-form")
    void testWhitespace() throws Exception {
        assertEquals(reader.read("(a (b c))"), reader.read("  (a\n\t(b   c)\n)  "));
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "(a b", ")", "(a))", "a b", "(a) (b)"})
    @DisplayName("Malformed text is rejected")
    void testMalformed(String text) {
        assertThrows(ProgramParseException.class, () -> reader.read(text));
    }
    
    @Test
    @DisplayName("Float literals overflowing to infinity are rejected")
    void testFloatOverflow() {
        ProgramParseException e = assertThrows(ProgramParseException.class, () -> reader.read("(a 1e999)"));
        assertEquals(3, e.getPosition());
        assertThrows(ProgramParseException.class, () -> reader.read("99999999999999999999"));
    }
    
    @Test
    @DisplayName("Error reports the position of the unclosed bracket")
    void testErrorPosition() {
        ProgramParseException e = assertThrows(ProgramParseException.class, () -> reader.read("(a (b c)"));
        assertEquals(0, e.getPosition());
        
        e = assertThrows(ProgramParseException.class, () -> reader.read("(a) )"));
        assertEquals(4, e.getPosition());
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "(integer_add 1 (exec_if (2.5 float_mult) true))",
        "(() (a ()) -3 false)",
        "x",
        "((((deep))))"
    })
    @DisplayName("Written text reads back to the same program")
    void testWriteRead(String text) throws Exception {
        Program p = reader.read(text);
        assertEquals(text, ProgramWriter.write(p));
        assertEquals(p, reader.read(ProgramWriter.write(p)));
    }
    
    @Test
    @DisplayName("Token streams print markers as brackets")
    void testWriteTokens() {
        List<Token> tokens = List.of(Marker.OPEN, Atom.integer(1), Marker.CLOSE, Marker.EMPTY_GROUP);
        assertEquals("( 1 ) ()", ProgramWriter.write(tokens));
    }
}
