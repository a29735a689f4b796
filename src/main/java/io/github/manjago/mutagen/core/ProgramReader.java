package io.github.manjago.mutagen.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reader for the parenthesized program syntax.
 * 
 * <h2>Syntax:</h2>
 * <pre>
 * program  := atom | '(' program* ')'
 * atom     := integer | float | boolean | instruction
 * integer  := -?[0-9]+                      e.g. 42, -7
 * float    := -?[0-9]+.[0-9]*([eE]-?[0-9]+)?  e.g. 2.5, 1.0E-4, 3e2
 * boolean  := true | false
 * </pre>
 * Anything else between whitespace and parentheses is an instruction name.
 * 
 * <h2>Example:</h2>
 * <pre>
 * (integer_add 1 (exec_if (2.5 float_mult) true))
 * </pre>
 */
public class ProgramReader {
    
    private static final Logger log = LoggerFactory.getLogger(ProgramReader.class);
    
    /**
     * Read exactly one program from text.
     * 
     * @param source program text
     * @return the parsed program
     * @throws ProgramParseException on empty input, unbalanced brackets or trailing forms
     */
    public Program read(String source) throws ProgramParseException {
        List<Lexeme> lexemes = tokenize(source);
        if (lexemes.isEmpty()) {
            throw new ProgramParseException("Empty program text");
        }
        
        // Stack of open lists; the bottom one collects top-level forms
        Deque<List<Program>> open = new ArrayDeque<>();
        Deque<Integer> openedAt = new ArrayDeque<>();
        open.push(new ArrayList<>());
        
        for (Lexeme lexeme : lexemes) {
            switch (lexeme.text) {
                case "(" -> {
                    open.push(new ArrayList<>());
                    openedAt.push(lexeme.position);
                }
                case ")" -> {
                    if (open.size() == 1) {
                        throw new ProgramParseException("Unmatched ')'", lexeme.position);
                    }
                    ProgramList list = new ProgramList(open.pop());
                    openedAt.pop();
                    open.peek().add(list);
                }
                default -> open.peek().add(parseAtom(lexeme.text, lexeme.position));
            }
        }
        
        if (open.size() > 1) {
            throw new ProgramParseException("Unclosed '('", openedAt.peek());
        }
        
        List<Program> forms = open.pop();
        if (forms.size() > 1) {
            throw new ProgramParseException("Expected one program, found " + forms.size() + " forms");
        }
        
        Program program = forms.get(0);
        log.debug("Read program of {} points from {} lexemes", program.points(), lexemes.size());
        return program;
    }
    
    /**
     * Parse one atom literal.
     */
    public Atom parseAtom(String text, int position) throws ProgramParseException {
        if (text.equals("true") || text.equals("false")) {
            return Atom.bool(Boolean.parseBoolean(text));
        }
        try {
            if (Atom.INTEGER_PATTERN.matcher(text).matches()) {
                return Atom.integer(Long.parseLong(text));
            }
            if (Atom.FLOAT_PATTERN.matcher(text).matches()) {
                return Atom.floating(Double.parseDouble(text));
            }
        } catch (IllegalArgumentException e) {
            // Out of range: too many digits for a long, or a float overflowing to infinity
            throw new ProgramParseException("Invalid number: " + text, position, e);
        }
        return Atom.instruction(text);
    }
    
    /**
     * Split text into parentheses and whitespace-delimited words.
     */
    private List<Lexeme> tokenize(String source) {
        List<Lexeme> lexemes = new ArrayList<>();
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')') {
                lexemes.add(new Lexeme(String.valueOf(c), i));
                i++;
            } else {
                int start = i;
                while (i < n && !Character.isWhitespace(source.charAt(i))
                        && source.charAt(i) != '(' && source.charAt(i) != ')') {
                    i++;
                }
                lexemes.add(new Lexeme(source.substring(start, i), start));
            }
        }
        return lexemes;
    }
    
    // ========== Helper classes ==========
    
    /**
     * Word or bracket with its character position.
     */
    private record Lexeme(String text, int position) {}
    
    /**
     * Exception while reading program text.
     */
    public static class ProgramParseException extends Exception {
        private final int position;
        
        public ProgramParseException(String message) {
            super(message);
            this.position = -1;
        }
        
        public ProgramParseException(String message, int position) {
            super("Position " + position + ": " + message);
            this.position = position;
        }
        
        public ProgramParseException(String message, int position, Throwable cause) {
            super("Position " + position + ": " + message, cause);
            this.position = position;
        }
        
        public int getPosition() {
            return position;
        }
    }
}
