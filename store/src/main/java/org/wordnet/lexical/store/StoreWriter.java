package org.wordnet.lexical.store;

import static org.wordnet.lexical.store.StoreFields.ID;
import static org.wordnet.lexical.store.StoreFields.KIND;
import static org.wordnet.lexical.store.StoreFields.LEXICON;

import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.IliStatus;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Relation;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;
import org.wordnet.lexical.lmf.LmfDocument;

/**
 * Write side of a transaction. Only valid inside the
 * {@link StoreTransaction} it was handed to.
 *
 * <p>Reads made through it see the last commit plus what this transaction
 * has added or removed so far, at the granularity of whole lexicons and ILI
 * entries.
 */
@NotThreadSafe
public class StoreWriter {
    private static final Logger log = LoggerFactory.getLogger(StoreWriter.class);

    private final IndexWriter writer;
    private final StoreReader committed;
    /** Lexicons added by this transaction, null values mark removals. */
    private final Map<String, Lexicon> pending = new HashMap<>();
    private final Set<String> pendingIlis = new HashSet<>();
    private long nextSequence = -1;

    StoreWriter(IndexWriter writer, StoreReader committed) {
        this.writer = writer;
        this.committed = committed;
    }

    public Optional<Lexicon> lexicon(String id) throws IOException {
        if (pending.containsKey(id)) {
            return Optional.ofNullable(pending.get(id));
        }
        return committed.lexicon(id);
    }

    /**
     * Delete a lexicon and everything it owns. ILI entries are kept.
     */
    public void deleteLexicon(String id) throws IOException {
        writer.deleteDocuments(new Term(LEXICON, id));
        pending.put(id, null);
        log.debug("Deleted lexicon {}", id);
    }

    /**
     * Write one lexicon of a parsed document: its entries, senses, synsets and
     * their declared relations. ILI ids its synsets refer to that aren't known
     * yet are recorded as presupposed entries.
     */
    public void addLexicon(LmfDocument document, Lexicon lexicon) throws IOException {
        String id = lexicon.getId();
        if (nextSequence < 0) {
            nextSequence = committed.nextSequence();
        }
        writer.addDocument(EntityDocuments.lexicon(lexicon, nextSequence++));
        int words = 0;
        for (Word word : document.getWords()) {
            if (id.equals(word.getLexicon())) {
                writer.addDocument(EntityDocuments.word(word));
                words++;
            }
        }
        for (Sense sense : document.getSenses()) {
            if (id.equals(sense.getLexicon())) {
                writer.addDocument(EntityDocuments.sense(sense));
                for (Relation relation : sense.getRelations()) {
                    writer.addDocument(EntityDocuments.relation(id, StoreFields.SCOPE_SENSE, sense.getId(), relation));
                }
            }
        }
        int synsets = 0;
        for (Synset synset : document.getSynsets()) {
            if (!id.equals(synset.getLexicon())) {
                continue;
            }
            writer.addDocument(EntityDocuments.synset(synset));
            for (Relation relation : synset.getRelations()) {
                writer.addDocument(EntityDocuments.relation(id, StoreFields.SCOPE_SYNSET, synset.getId(), relation));
            }
            if (synset.hasIli()) {
                presuppose(synset.getIli());
            }
            synsets++;
        }
        pending.put(id, lexicon);
        log.debug("Wrote lexicon {} with {} words and {} synsets", lexicon.specifier(), words, synsets);
    }

    /**
     * Insert or replace an ILI entry.
     */
    public void putIli(IliEntry entry) throws IOException {
        writer.deleteDocuments(StoreReader.all(
                StoreReader.term(KIND, StoreFields.KIND_ILI), StoreReader.term(ID, entry.getId())));
        writer.addDocument(EntityDocuments.ili(entry));
        pendingIlis.add(entry.getId());
    }

    private void presuppose(String ili) throws IOException {
        if (pendingIlis.contains(ili) || committed.ili(ili).isPresent()) {
            return;
        }
        writer.addDocument(EntityDocuments.ili(new IliEntry(ili, null, IliStatus.PRESUPPOSED)));
        pendingIlis.add(ili);
    }
}
