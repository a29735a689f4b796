package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.UniformSource;

/**
 * Node selection strategies, as named in configuration.
 */
public enum NodeSelectionMethod {
    UNBIASED("unbiased"),
    LEAF_PROBABILITY("leaf-probability"),
    SIZE_TOURNAMENT("size-tournament");
    
    private final String configName;
    
    NodeSelectionMethod(String configName) {
        this.configName = configName;
    }
    
    public String getConfigName() {
        return configName;
    }
    
    /**
     * Look up a method by its configuration name (case-insensitive).
     * 
     * @throws IllegalArgumentException for unknown names
     */
    public static NodeSelectionMethod fromConfigName(String name) {
        for (NodeSelectionMethod method : values()) {
            if (method.configName.equalsIgnoreCase(name)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown node selection method: " + name);
    }
    
    /**
     * Build the selector for this method.
     * 
     * @param leafProbability used by LEAF_PROBABILITY only
     * @param tournamentSize used by SIZE_TOURNAMENT only
     */
    public NodeSelector create(UniformSource rng, double leafProbability, int tournamentSize) {
        return switch (this) {
            case UNBIASED -> new UnbiasedNodeSelector(rng);
            case LEAF_PROBABILITY -> new LeafProbabilityNodeSelector(rng, leafProbability);
            case SIZE_TOURNAMENT -> new SizeTournamentNodeSelector(rng, tournamentSize);
        };
    }
}
