package org.wordnet.lexical.common.model;

import lombok.Value;

@Value
public class Tag {
    String category;
    String value;
}
