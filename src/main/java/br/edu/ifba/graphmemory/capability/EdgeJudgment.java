package br.edu.ifba.graphmemory.capability;

/**
 * How a new fact relates to an existing open fact.
 */
public enum EdgeJudgment {
    /** Both state the same thing; the new episode is additional evidence. */
    CORROBORATES,
    /** They cannot both hold; the older one must be closed. */
    CONTRADICTS,
    /** They can both hold at the same time. */
    INDEPENDENT
}
