package io.github.manjago.mutagen.core;

/**
 * Structural markers used when a program is laid out as a linear token stream.
 * They never appear inside a {@link Program}.
 */
public enum Marker implements Token {
    
    /** Start of a nested list. */
    OPEN("("),
    
    /** End of a nested list. */
    CLOSE(")"),
    
    /** A complete empty list, produced by linear mutation. */
    EMPTY_GROUP("()");
    
    private final String text;
    
    Marker(String text) {
        this.text = text;
    }
    
    public String getText() {
        return text;
    }
    
    /**
     * Marker with the opposite role (OPEN and CLOSE swap, EMPTY_GROUP stays).
     */
    public Marker mirror() {
        return switch (this) {
            case OPEN -> CLOSE;
            case CLOSE -> OPEN;
            case EMPTY_GROUP -> EMPTY_GROUP;
        };
    }
}
