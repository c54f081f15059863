package org.wordnet.lexical.store;

/**
 * Field names and document kinds of the index. Every document has a
 * {@link #KIND} and an {@link #ID}; every document owned by a lexicon,
 * including the lexicon document itself, has a {@link #LEXICON} so that
 * removing a lexicon is a single delete by term.
 */
public final class StoreFields {
    public static final String KIND = "kind";
    public static final String ID = "id";
    public static final String LEXICON = "lexicon";
    /** JSON of the entity, the only stored representation. */
    public static final String JSON = "json";

    public static final String LEMMA = "lemma";
    /** Lemma and every other written form, verbatim. */
    public static final String FORM = "form";
    /** Lemma and every other written form, lower cased. */
    public static final String FORM_NORM = "form_norm";
    public static final String POS = "pos";

    public static final String WORD = "word";
    public static final String SYNSET = "synset";

    public static final String ILI = "ili";
    public static final String HAS_ILI = "has_ili";
    public static final String HAS_DEFINITION = "has_definition";
    /** Number of member senses, as doc values. */
    public static final String SIZE = "size";

    public static final String SOURCE = "source";
    public static final String TARGET = "target";
    public static final String REL_TYPE = "rel_type";
    public static final String REL_SCOPE = "rel_scope";

    public static final String STATUS = "status";
    /** Installation order of lexicons, stored and as doc values. */
    public static final String SEQUENCE = "seq";

    public static final String KIND_LEXICON = "lexicon";
    public static final String KIND_WORD = "word";
    public static final String KIND_SENSE = "sense";
    public static final String KIND_SYNSET = "synset";
    public static final String KIND_RELATION = "relation";
    public static final String KIND_ILI = "ili";

    public static final String SCOPE_SENSE = "sense";
    public static final String SCOPE_SYNSET = "synset";

    public static final String TRUE = "T";
    public static final String FALSE = "F";

    private StoreFields() {
        // Utility class
    }

    public static String flag(boolean value) {
        return value ? TRUE : FALSE;
    }
}
