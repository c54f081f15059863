package org.wordnet.lexical.store;

import static java.util.Collections.emptyList;
import static java.util.stream.Collectors.toList;
import static org.wordnet.lexical.store.StoreFields.FORM;
import static org.wordnet.lexical.store.StoreFields.FORM_NORM;
import static org.wordnet.lexical.store.StoreFields.ID;
import static org.wordnet.lexical.store.StoreFields.ILI;
import static org.wordnet.lexical.store.StoreFields.KIND;
import static org.wordnet.lexical.store.StoreFields.LEXICON;
import static org.wordnet.lexical.store.StoreFields.POS;
import static org.wordnet.lexical.store.StoreFields.REL_SCOPE;
import static org.wordnet.lexical.store.StoreFields.REL_TYPE;
import static org.wordnet.lexical.store.StoreFields.SEQUENCE;
import static org.wordnet.lexical.store.StoreFields.SOURCE;
import static org.wordnet.lexical.store.StoreFields.STATUS;
import static org.wordnet.lexical.store.StoreFields.TARGET;
import static org.wordnet.lexical.store.StoreFields.WORD;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import org.apache.lucene.document.Document;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause.Occur;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ReferenceManager;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermInSetQuery;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.util.BytesRef;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.RelationType;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.IliStatus;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;

import com.google.common.collect.ImmutableSet;

/**
 * Point in time view of the store. Sees the last commit made before it was
 * acquired and nothing after, so a reader never observes a write half done.
 * Must be closed to release the underlying index snapshot.
 *
 * <p>Entity lookups are scoped to one lexicon; ids are only unique within a
 * lexicon.
 */
@NotThreadSafe
public class StoreReader implements Closeable {
    private final ReferenceManager<IndexSearcher> manager;
    private final IndexSearcher searcher;
    private boolean closed;

    StoreReader(ReferenceManager<IndexSearcher> manager) throws IOException {
        this.manager = manager;
        this.searcher = manager.acquire();
    }

    /**
     * Installed lexicons, in installation order.
     */
    public List<Lexicon> lexicons() throws IOException {
        List<Document> docs = new ArrayList<>(search(term(KIND, StoreFields.KIND_LEXICON)));
        docs.sort(Comparator.comparingLong(StoreReader::sequence));
        return decode(docs, Lexicon.class);
    }

    public Optional<Lexicon> lexicon(String id) throws IOException {
        return first(search(all(term(KIND, StoreFields.KIND_LEXICON), term(ID, id))), Lexicon.class);
    }

    long nextSequence() throws IOException {
        long max = 0;
        for (Document doc : search(term(KIND, StoreFields.KIND_LEXICON))) {
            max = Math.max(max, sequence(doc));
        }
        return max + 1;
    }

    /**
     * Words whose lemma or one of whose forms is exactly {@code form}.
     */
    public List<Word> wordsByForm(String form, @Nullable PartOfSpeech pos, String lexicon) throws IOException {
        return words(term(FORM, form), pos, lexicon);
    }

    /**
     * Words with a lemma or form equal to {@code form} ignoring case.
     */
    public List<Word> wordsByNormalizedForm(String form, @Nullable PartOfSpeech pos, String lexicon) throws IOException {
        return words(term(FORM_NORM, EntityDocuments.normalize(form)), pos, lexicon);
    }

    /**
     * Words with a lemma or form matching a case insensitive wildcard pattern:
     * {@code *} matches any sequence, {@code ?} any single character.
     */
    public List<Word> wordsMatching(String pattern, @Nullable PartOfSpeech pos, String lexicon) throws IOException {
        return words(new WildcardQuery(new Term(FORM_NORM, EntityDocuments.normalize(pattern))), pos, lexicon);
    }

    public boolean hasForm(String form, @Nullable PartOfSpeech pos, String lexicon) throws IOException {
        return searcher.count(scoped(StoreFields.KIND_WORD, lexicon, term(FORM, form), pos(pos))) > 0;
    }

    public List<Word> words(String lexicon) throws IOException {
        return byId(search(scoped(StoreFields.KIND_WORD, lexicon)), Word.class, Word::getId);
    }

    public Optional<Word> word(String id, String lexicon) throws IOException {
        return first(search(scoped(StoreFields.KIND_WORD, lexicon, term(ID, id))), Word.class);
    }

    public Optional<Sense> sense(String id, String lexicon) throws IOException {
        return first(search(scoped(StoreFields.KIND_SENSE, lexicon, term(ID, id))), Sense.class);
    }

    public Optional<Synset> synset(String id, String lexicon) throws IOException {
        return first(search(scoped(StoreFields.KIND_SYNSET, lexicon, term(ID, id))), Synset.class);
    }

    /**
     * Senses of a word, by rank.
     */
    public List<Sense> sensesOfWord(String wordId, String lexicon) throws IOException {
        List<Sense> senses = decode(search(scoped(StoreFields.KIND_SENSE, lexicon, term(WORD, wordId))), Sense.class);
        senses.sort(Comparator.comparingInt(Sense::getRank).thenComparing(Sense::getId));
        return senses;
    }

    /**
     * Senses by id, in the order of {@code ids}. Unknown ids are skipped.
     */
    public List<Sense> senses(List<String> ids, String lexicon) throws IOException {
        return inOrder(ids, lexicon, StoreFields.KIND_SENSE, Sense.class, Sense::getId);
    }

    public List<Sense> senses(String lexicon) throws IOException {
        return byId(search(scoped(StoreFields.KIND_SENSE, lexicon)), Sense.class, Sense::getId);
    }

    /**
     * Synsets by id, in the order of {@code ids}. Unknown ids are skipped.
     */
    public List<Synset> synsets(List<String> ids, String lexicon) throws IOException {
        return inOrder(ids, lexicon, StoreFields.KIND_SYNSET, Synset.class, Synset::getId);
    }

    public List<Synset> synsets(String lexicon, @Nullable PartOfSpeech pos) throws IOException {
        return byId(search(scoped(StoreFields.KIND_SYNSET, lexicon, pos(pos))), Synset.class, Synset::getId);
    }

    public List<Synset> synsetsByIli(String ili, String lexicon) throws IOException {
        return byId(search(scoped(StoreFields.KIND_SYNSET, lexicon, term(ILI, ili))), Synset.class, Synset::getId);
    }

    /**
     * Sources of the declared edges pointing at {@code target}, restricted to
     * some relation types when {@code types} isn't empty.
     *
     * @param scope {@link StoreFields#SCOPE_SYNSET} or {@link StoreFields#SCOPE_SENSE}
     */
    public List<String> relationSources(String target, Collection<RelationType> types, String scope,
                                        String lexicon) throws IOException {
        Query typeFilter = types.isEmpty() ? null
                : terms(REL_TYPE, types.stream().map(RelationType::lmfName).collect(toList()));
        Query query = scoped(StoreFields.KIND_RELATION, lexicon,
                term(TARGET, target), typeFilter, term(REL_SCOPE, scope));
        Set<String> sources = new TreeSet<>();
        for (Document doc : search(query)) {
            sources.add(doc.get(SOURCE));
        }
        return new ArrayList<>(sources);
    }

    public Optional<IliEntry> ili(String id) throws IOException {
        return first(search(all(term(KIND, StoreFields.KIND_ILI), term(ID, id))), IliEntry.class);
    }

    public List<IliEntry> ilis(@Nullable IliStatus status) throws IOException {
        Query query = status == null
                ? term(KIND, StoreFields.KIND_ILI)
                : all(term(KIND, StoreFields.KIND_ILI), term(STATUS, status.name()));
        return byId(search(query), IliEntry.class, IliEntry::getId);
    }

    /**
     * Distinct ILI ids referenced by the synsets of some lexicons.
     */
    public Set<String> referencedIlis(Collection<String> lexicons) throws IOException {
        Set<String> ilis = new TreeSet<>();
        Query query = all(term(KIND, StoreFields.KIND_SYNSET), lexicons(lexicons), term(StoreFields.HAS_ILI, StoreFields.TRUE));
        for (ScoreDoc hit : hits(query)) {
            ilis.add(searcher.doc(hit.doc, ImmutableSet.of(ILI)).get(ILI));
        }
        return ilis;
    }

    IndexSearcher searcher() {
        return searcher;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            manager.release(searcher);
        }
    }

    private List<Word> words(Query match, @Nullable PartOfSpeech pos, String lexicon) throws IOException {
        return byId(search(scoped(StoreFields.KIND_WORD, lexicon, match, pos(pos))), Word.class, Word::getId);
    }

    private <T> List<T> inOrder(List<String> ids, String lexicon, String kind, Class<T> type,
                                Function<T, String> id) throws IOException {
        if (ids.isEmpty()) {
            return emptyList();
        }
        Map<String, T> found = new HashMap<>();
        for (T entity : decode(search(scoped(kind, lexicon, terms(ID, ids))), type)) {
            found.put(id.apply(entity), entity);
        }
        List<T> ordered = new ArrayList<>(ids.size());
        for (String i : ids) {
            T entity = found.get(i);
            if (entity != null) {
                ordered.add(entity);
            }
        }
        return ordered;
    }

    private List<Document> search(Query query) throws IOException {
        ScoreDoc[] hits = hits(query);
        List<Document> docs = new ArrayList<>(hits.length);
        for (ScoreDoc hit : hits) {
            docs.add(searcher.doc(hit.doc));
        }
        return docs;
    }

    private ScoreDoc[] hits(Query query) throws IOException {
        int count = searcher.count(query);
        if (count == 0) {
            return new ScoreDoc[0];
        }
        TopDocs top = searcher.search(query, count);
        return top.scoreDocs;
    }

    private static long sequence(Document doc) {
        return doc.getField(SEQUENCE).numericValue().longValue();
    }

    private static <T> Optional<T> first(List<Document> docs, Class<T> type) {
        return docs.isEmpty() ? Optional.empty() : Optional.of(EntityCodec.decode(docs.get(0), type));
    }

    private static <T> List<T> decode(List<Document> docs, Class<T> type) {
        List<T> entities = new ArrayList<>(docs.size());
        for (Document doc : docs) {
            entities.add(EntityCodec.decode(doc, type));
        }
        return entities;
    }

    private static <T> List<T> byId(List<Document> docs, Class<T> type, Function<T, String> id) {
        List<T> entities = decode(docs, type);
        entities.sort(Comparator.comparing(id));
        return entities;
    }

    static Query term(String field, String value) {
        return new TermQuery(new Term(field, value));
    }

    static Query terms(String field, Collection<String> values) {
        return new TermInSetQuery(field, values.stream().map(BytesRef::new).collect(toList()));
    }

    /**
     * Restricts to some lexicons, {@code null} meaning all of them.
     */
    @Nullable
    static Query lexicons(@Nullable Collection<String> lexicons) {
        if (lexicons == null) {
            return null;
        }
        if (lexicons.isEmpty()) {
            return new MatchNoDocsQuery();
        }
        return terms(LEXICON, lexicons);
    }

    @Nullable
    static Query pos(@Nullable PartOfSpeech pos) {
        if (pos == null) {
            return null;
        }
        if (pos == PartOfSpeech.ADJECTIVE) {
            return terms(POS, ImmutableSet.of(PartOfSpeech.ADJECTIVE.tag(), PartOfSpeech.ADJECTIVE_SATELLITE.tag()));
        }
        return term(POS, pos.tag());
    }

    static Query scoped(String kind, String lexicon, Query... clauses) {
        Query[] all = new Query[clauses.length + 2];
        all[0] = term(KIND, kind);
        all[1] = term(LEXICON, lexicon);
        System.arraycopy(clauses, 0, all, 2, clauses.length);
        return all(all);
    }

    /**
     * Conjunction of non-scoring filters, {@code null} clauses are ignored.
     */
    static Query all(Query... clauses) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (Query clause : clauses) {
            if (clause != null) {
                builder.add(clause, Occur.FILTER);
            }
        }
        return builder.build();
    }
}
