package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Program;

/**
 * Produces random, syntactically valid programs.
 */
public interface CodeGenerator {
    
    /**
     * Generate a random program.
     * 
     * @param maxPoints upper bound on the program size (at least 1)
     * @param vocabulary atoms to draw from
     * @return a program with 1..maxPoints points
     */
    Program generate(int maxPoints, Vocabulary vocabulary);
}
