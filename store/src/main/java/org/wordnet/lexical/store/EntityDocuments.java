package org.wordnet.lexical.store;

import static org.wordnet.lexical.store.StoreFields.FORM;
import static org.wordnet.lexical.store.StoreFields.FORM_NORM;
import static org.wordnet.lexical.store.StoreFields.HAS_DEFINITION;
import static org.wordnet.lexical.store.StoreFields.HAS_ILI;
import static org.wordnet.lexical.store.StoreFields.ID;
import static org.wordnet.lexical.store.StoreFields.ILI;
import static org.wordnet.lexical.store.StoreFields.JSON;
import static org.wordnet.lexical.store.StoreFields.KIND;
import static org.wordnet.lexical.store.StoreFields.LEMMA;
import static org.wordnet.lexical.store.StoreFields.LEXICON;
import static org.wordnet.lexical.store.StoreFields.POS;
import static org.wordnet.lexical.store.StoreFields.REL_SCOPE;
import static org.wordnet.lexical.store.StoreFields.REL_TYPE;
import static org.wordnet.lexical.store.StoreFields.SEQUENCE;
import static org.wordnet.lexical.store.StoreFields.SIZE;
import static org.wordnet.lexical.store.StoreFields.SOURCE;
import static org.wordnet.lexical.store.StoreFields.STATUS;
import static org.wordnet.lexical.store.StoreFields.SYNSET;
import static org.wordnet.lexical.store.StoreFields.TARGET;
import static org.wordnet.lexical.store.StoreFields.WORD;
import static org.wordnet.lexical.store.StoreFields.flag;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field.Store;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.wordnet.lexical.common.model.Form;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Relation;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;

/**
 * Builds the index documents of each entity.
 */
final class EntityDocuments {
    private EntityDocuments() {
        // Utility class
    }

    static Document lexicon(Lexicon lexicon, long sequence) {
        Document doc = base(StoreFields.KIND_LEXICON, lexicon.getId(), lexicon.getId(), lexicon);
        doc.add(new StoredField(SEQUENCE, sequence));
        doc.add(new NumericDocValuesField(SEQUENCE, sequence));
        return doc;
    }

    static Document word(Word word) {
        Document doc = base(StoreFields.KIND_WORD, word.getId(), word.getLexicon(), word);
        doc.add(new StringField(LEMMA, word.getLemma(), Store.NO));
        doc.add(new StringField(POS, word.getPartOfSpeech().tag(), Store.NO));
        Set<String> forms = new LinkedHashSet<>();
        forms.add(word.getLemma());
        for (Form form : word.getForms()) {
            forms.add(form.getWrittenForm());
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String form : forms) {
            doc.add(new StringField(FORM, form, Store.NO));
            normalized.add(normalize(form));
        }
        for (String form : normalized) {
            doc.add(new StringField(FORM_NORM, form, Store.NO));
        }
        return doc;
    }

    static Document sense(Sense sense) {
        Document doc = base(StoreFields.KIND_SENSE, sense.getId(), sense.getLexicon(), sense);
        doc.add(new StringField(WORD, sense.getWord(), Store.NO));
        doc.add(new StringField(SYNSET, sense.getSynset(), Store.NO));
        return doc;
    }

    static Document synset(Synset synset) {
        Document doc = base(StoreFields.KIND_SYNSET, synset.getId(), synset.getLexicon(), synset);
        doc.add(new StringField(POS, synset.getPartOfSpeech().tag(), Store.NO));
        if (synset.hasIli()) {
            doc.add(new StringField(ILI, synset.getIli(), Store.YES));
        }
        doc.add(new StringField(HAS_ILI, flag(synset.hasIli()), Store.NO));
        doc.add(new StringField(HAS_DEFINITION, flag(!synset.getDefinitions().isEmpty()), Store.NO));
        doc.add(new NumericDocValuesField(SIZE, synset.getMembers().size()));
        return doc;
    }

    /**
     * One directed edge, as declared. Inverses are derived when reading.
     */
    static Document relation(String lexicon, String scope, String source, Relation relation) {
        Document doc = new Document();
        doc.add(new StringField(KIND, StoreFields.KIND_RELATION, Store.NO));
        doc.add(new StringField(LEXICON, lexicon, Store.YES));
        doc.add(new StringField(SOURCE, source, Store.YES));
        doc.add(new StringField(TARGET, relation.getTarget(), Store.YES));
        doc.add(new StringField(REL_TYPE, relation.getType().lmfName(), Store.YES));
        doc.add(new StringField(REL_SCOPE, scope, Store.NO));
        return doc;
    }

    /**
     * ILI entries belong to no lexicon and survive lexicon removal.
     */
    static Document ili(IliEntry entry) {
        Document doc = new Document();
        doc.add(new StringField(KIND, StoreFields.KIND_ILI, Store.NO));
        doc.add(new StringField(ID, entry.getId(), Store.YES));
        doc.add(new StringField(STATUS, entry.getStatus().name(), Store.NO));
        doc.add(new StoredField(JSON, EntityCodec.encode(entry)));
        return doc;
    }

    static String normalize(String form) {
        return form.toLowerCase(Locale.ROOT);
    }

    private static Document base(String kind, String id, String lexicon, Object entity) {
        Document doc = new Document();
        doc.add(new StringField(KIND, kind, Store.NO));
        doc.add(new StringField(ID, id, Store.YES));
        doc.add(new StringField(LEXICON, lexicon, Store.YES));
        doc.add(new StoredField(JSON, EntityCodec.encode(entity)));
        return doc;
    }
}
