package br.edu.ifba.graphmemory.core;

/**
 * Source type of an episode body.
 */
public enum EpisodeType {
    /** A conversational turn, usually "speaker: text". */
    MESSAGE,
    /** Free text. */
    TEXT,
    /** A JSON document; must parse at ingestion. */
    JSON
}
