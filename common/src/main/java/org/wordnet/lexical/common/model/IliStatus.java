package org.wordnet.lexical.common.model;

public enum IliStatus {
    ACTIVE,
    /** Referenced by a synset but not loaded from an ILI file. */
    PRESUPPOSED,
    PROPOSED,
    DEPRECATED
}
