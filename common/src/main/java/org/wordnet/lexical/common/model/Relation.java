package org.wordnet.lexical.common.model;

import org.wordnet.lexical.common.RelationType;

import lombok.Value;

/**
 * A typed, directed edge. The source is the sense or synset declaring it.
 */
@Value
public class Relation {
    RelationType type;
    String target;
}
