package io.github.manjago.mutagen.operators;

/**
 * The variation operators the engine provides.
 */
public enum GeneticOperator {
    MUTATION("mutation", 1),
    DELETION("deletion", 1),
    ADD_PARENTHESES("add-parentheses", 1),
    TAGGING("tagging", 1),
    TAG_BRANCH_INSERTION("tag-branch-insertion", 1),
    GAUSSIAN("gaussian", 1),
    CROSSOVER("crossover", 2),
    BOOLEAN_GSXOVER("boolean-gsxover", 2),
    ULTRA("ultra", 2);
    
    private final String label;
    private final int parents;
    
    GeneticOperator(String label, int parents) {
        this.label = label;
        this.parents = parents;
    }
    
    /**
     * Name used on the command line and in logs.
     */
    public String getLabel() {
        return label;
    }
    
    /**
     * Number of parents the operator consumes (1 or 2).
     */
    public int getParents() {
        return parents;
    }
    
    public boolean isRecombination() {
        return parents == 2;
    }
    
    /**
     * Look up an operator by label (case-insensitive).
     * 
     * @throws IllegalArgumentException for unknown labels
     */
    public static GeneticOperator fromLabel(String label) {
        for (GeneticOperator op : values()) {
            if (op.label.equalsIgnoreCase(label)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + label);
    }
    
    @Override
    public String toString() {
        return label;
    }
}
