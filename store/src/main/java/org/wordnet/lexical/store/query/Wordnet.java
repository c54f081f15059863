package org.wordnet.lexical.store.query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.RelationType;
import org.wordnet.lexical.common.exception.StorageException;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.IliStatus;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Relation;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;
import org.wordnet.lexical.store.LexicalStore;
import org.wordnet.lexical.store.LexiconStatistics;
import org.wordnet.lexical.store.QualityMetrics;
import org.wordnet.lexical.store.StoreAnalytics;
import org.wordnet.lexical.store.StoreFields;
import org.wordnet.lexical.store.StoreReader;
import org.wordnet.lexical.store.StoreStatistics;
import org.wordnet.lexical.store.SynsetSizeAnalysis;

/**
 * Read-only view of the lexicons selected by a {@link LexiconFilter}.
 *
 * <p>Queries run once per selected lexicon, in installation order, and the
 * results are concatenated; within a lexicon they are ordered by id. With the
 * {@code *} filter a lexicon failing to answer is logged and left out of the
 * results; with an explicit filter the failure propagates.
 *
 * <p>Every call works on its own snapshot of the store. Unknown ids give
 * empty results, never errors.
 */
@ThreadSafe
public class Wordnet {
    private static final Logger log = LoggerFactory.getLogger(Wordnet.class);

    private static final Set<RelationType> INVERTIBLE = Arrays.stream(RelationType.values())
            .filter(type -> type.inverse().isPresent())
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(RelationType.class)));

    private final LexicalStore store;
    private final LexiconFilter filter;
    private final boolean lemmatize;
    private final Morphy morphy;

    /**
     * @param lemmatize fall back to {@link Morphy} when a form isn't found
     */
    public Wordnet(LexicalStore store, LexiconFilter filter, boolean lemmatize) {
        this.store = store;
        this.filter = filter;
        this.lemmatize = lemmatize;
        this.morphy = new Morphy(this::isWord);
    }

    public Wordnet(LexicalStore store, LexiconFilter filter) {
        this(store, filter, true);
    }

    public LexiconFilter getFilter() {
        return filter;
    }

    public Morphy morphy() {
        return morphy;
    }

    public Taxonomy taxonomy() {
        return new Taxonomy(this);
    }

    /**
     * The same store seen through another filter.
     */
    public Wordnet withFilter(LexiconFilter other) {
        return new Wordnet(store, other, lemmatize);
    }

    public List<Lexicon> lexicons() {
        return read(this::scope);
    }

    public Optional<Lexicon> lexicon(String id) {
        return lexicons().stream().filter(l -> l.getId().equals(id)).findFirst();
    }

    /**
     * Words having {@code form} as lemma or other form. Tries an exact match,
     * then a case insensitive one, then the base forms found by
     * {@link Morphy}.
     *
     * @param form the form to look up, {@code null} for every word
     * @param pos part of speech filter, {@code null} for any
     */
    public List<Word> words(@Nullable String form, @Nullable PartOfSpeech pos) {
        return read(reader -> findWords(reader, form, pos));
    }

    public List<Word> words(String form) {
        return words(form, null);
    }

    /**
     * Words with a lemma or form matching a case insensitive wildcard
     * pattern ({@code *} and {@code ?}).
     */
    public List<Word> searchWords(String pattern, @Nullable PartOfSpeech pos) {
        return read(reader -> fanOut(reader, (r, lexicon) -> r.wordsMatching(pattern, pos, lexicon)));
    }

    /**
     * Senses of the words found by {@link #words(String, PartOfSpeech)}, by
     * word then by rank.
     */
    public List<Sense> senses(@Nullable String form, @Nullable PartOfSpeech pos) {
        return read(reader -> {
            if (form == null) {
                return fanOut(reader, (r, lexicon) -> filterByPos(r, r.senses(lexicon), pos, lexicon));
            }
            List<Sense> senses = new ArrayList<>();
            for (Word word : findWords(reader, form, pos)) {
                senses.addAll(reader.sensesOfWord(word.getId(), word.getLexicon()));
            }
            return senses;
        });
    }

    /**
     * Synsets of the senses found by {@link #senses(String, PartOfSpeech)},
     * without duplicates.
     */
    public List<Synset> synsets(@Nullable String form, @Nullable PartOfSpeech pos) {
        return read(reader -> {
            if (form == null) {
                return fanOut(reader, (r, lexicon) -> r.synsets(lexicon, pos));
            }
            Map<String, List<String>> idsByLexicon = new LinkedHashMap<>();
            for (Word word : findWords(reader, form, pos)) {
                List<String> ids = idsByLexicon.computeIfAbsent(word.getLexicon(), l -> new ArrayList<>());
                for (Sense sense : reader.sensesOfWord(word.getId(), word.getLexicon())) {
                    if (!ids.contains(sense.getSynset())) {
                        ids.add(sense.getSynset());
                    }
                }
            }
            List<Synset> synsets = new ArrayList<>();
            for (Map.Entry<String, List<String>> ids : idsByLexicon.entrySet()) {
                synsets.addAll(reader.synsets(ids.getValue(), ids.getKey()));
            }
            return synsets;
        });
    }

    /**
     * Synsets of every selected lexicon linked to an ILI entry.
     */
    public List<Synset> synsetsByIli(String ili) {
        return read(reader -> fanOut(reader, (r, lexicon) -> r.synsetsByIli(ili, lexicon)));
    }

    public Optional<Synset> synset(String id) {
        return read(reader -> first(fanOut(reader, (r, lexicon) -> optional(r.synset(id, lexicon)))));
    }

    public Optional<Word> word(String id) {
        return read(reader -> first(fanOut(reader, (r, lexicon) -> optional(r.word(id, lexicon)))));
    }

    public Optional<Sense> sense(String id) {
        return read(reader -> first(fanOut(reader, (r, lexicon) -> optional(r.sense(id, lexicon)))));
    }

    /**
     * Senses of a word, by rank.
     */
    public List<Sense> wordSenses(String wordId) {
        return read(reader -> fanOut(reader, (r, lexicon) -> r.sensesOfWord(wordId, lexicon)));
    }

    /**
     * Member senses of a synset, in declared order.
     */
    public List<Sense> synsetSenses(String synsetId) {
        return read(reader -> fanOut(reader, (r, lexicon) -> {
            Optional<Synset> synset = r.synset(synsetId, lexicon);
            return synset.isPresent() ? r.senses(synset.get().getMembers(), lexicon) : Collections.emptyList();
        }));
    }

    /**
     * Words of the member senses of a synset, in member order.
     */
    public List<Word> synsetWords(String synsetId) {
        return read(reader -> fanOut(reader, (r, lexicon) -> {
            Optional<Synset> synset = r.synset(synsetId, lexicon);
            if (!synset.isPresent()) {
                return Collections.emptyList();
            }
            List<Word> words = new ArrayList<>();
            for (Sense sense : r.senses(synset.get().getMembers(), lexicon)) {
                r.word(sense.getWord(), lexicon).ifPresent(words::add);
            }
            return words;
        }));
    }

    /**
     * First definition of a synset. Empty when the synset is unknown or has
     * no definition.
     */
    public Optional<String> definition(String synsetId) {
        return synset(synsetId).flatMap(Synset::getDefinition);
    }

    /**
     * ILI entry by id. ILI entries aren't owned by lexicons so the filter
     * doesn't apply.
     */
    public Optional<IliEntry> ili(String id) {
        return read(reader -> reader.ili(id));
    }

    /**
     * ILI entries, restricted to those referenced by the selected lexicons
     * unless the filter is {@code *}.
     *
     * @param status only entries with this status, {@code null} for any
     */
    public List<IliEntry> ilis(@Nullable IliStatus status) {
        return read(reader -> {
            if (filter.isAll()) {
                return reader.ilis(status);
            }
            List<IliEntry> entries = new ArrayList<>();
            for (String id : reader.referencedIlis(lexiconIds(reader))) {
                reader.ili(id).filter(e -> status == null || e.getStatus() == status).ifPresent(entries::add);
            }
            return entries;
        });
    }

    /**
     * Synsets reached from {@code synset} by relations of some types, or of
     * any type when none is given. Only edges within the synset's lexicon
     * are followed. Inverse relations are included: the hyponyms of a synset
     * are the ones it declares plus those declaring it as hypernym.
     */
    public List<Synset> related(Synset synset, RelationType... types) {
        Set<RelationType> wanted = types.length == 0 ? EnumSet.allOf(RelationType.class) : EnumSet.copyOf(Arrays.asList(types));
        return read(reader -> {
            String lexicon = synset.getLexicon();
            List<String> ids = relatedIds(reader, synset.getId(), synset.getRelations(), wanted,
                    StoreFields.SCOPE_SYNSET, lexicon);
            return reader.synsets(ids, lexicon);
        });
    }

    /**
     * Like {@link #related(Synset, RelationType...)} for sense relations.
     */
    public List<Sense> relatedSenses(Sense sense, RelationType... types) {
        Set<RelationType> wanted = types.length == 0 ? EnumSet.allOf(RelationType.class) : EnumSet.copyOf(Arrays.asList(types));
        return read(reader -> {
            String lexicon = sense.getLexicon();
            List<String> ids = relatedIds(reader, sense.getId(), sense.getRelations(), wanted,
                    StoreFields.SCOPE_SENSE, lexicon);
            return reader.senses(ids, lexicon);
        });
    }

    /**
     * Synsets sharing the ILI of {@code synset} in other lexicons. This is the
     * only way to cross from one lexicon to another.
     *
     * @param target lexicons to translate into
     */
    public List<Synset> translate(Synset synset, LexiconFilter target) {
        if (!synset.hasIli()) {
            return Collections.emptyList();
        }
        return withFilter(target).synsetsByIli(synset.getIli()).stream()
                .filter(s -> !(s.getLexicon().equals(synset.getLexicon()) && s.getId().equals(synset.getId())))
                .collect(Collectors.toList());
    }

    public StoreStatistics stats() {
        return read(reader -> analytics(reader).statistics());
    }

    public QualityMetrics qualityMetrics() {
        return read(reader -> analytics(reader).qualityMetrics());
    }

    public Map<PartOfSpeech, Long> partOfSpeechDistribution() {
        return read(reader -> analytics(reader).partOfSpeechDistribution());
    }

    public List<LexiconStatistics> lexiconStatistics() {
        return read(reader -> analytics(reader).lexiconStatistics());
    }

    public SynsetSizeAnalysis synsetSizeAnalysis() {
        return read(reader -> analytics(reader).synsetSizeAnalysis());
    }

    /**
     * Whether a form is a word of some selected lexicon. Used to validate
     * {@link Morphy} candidates.
     */
    boolean isWord(String form, PartOfSpeech pos) {
        return read(reader -> !fanOut(reader, (r, lexicon) ->
                r.hasForm(form, pos, lexicon) ? Collections.singletonList(lexicon) : Collections.<String>emptyList())
                .isEmpty());
    }

    private List<Word> findWords(StoreReader reader, @Nullable String form, @Nullable PartOfSpeech pos) throws IOException {
        if (form == null) {
            return fanOut(reader, (r, lexicon) -> filterWords(r.words(lexicon), pos));
        }
        List<Word> words = fanOut(reader, (r, lexicon) -> r.wordsByForm(form, pos, lexicon));
        if (words.isEmpty()) {
            words = fanOut(reader, (r, lexicon) -> r.wordsByNormalizedForm(form, pos, lexicon));
        }
        if (words.isEmpty() && lemmatize) {
            words = lemmatized(reader, form, pos);
        }
        return words;
    }

    private List<Word> lemmatized(StoreReader reader, String form, @Nullable PartOfSpeech pos) throws IOException {
        Set<String> lemmas = new LinkedHashSet<>();
        for (Set<String> forPos : morphy.analyze(form, pos).values()) {
            lemmas.addAll(forPos);
        }
        lemmas.remove(form);
        Map<String, Word> words = new LinkedHashMap<>();
        for (String lemma : lemmas) {
            for (Word word : fanOut(reader, (r, lexicon) -> r.wordsByForm(lemma, pos, lexicon))) {
                words.putIfAbsent(word.getLexicon() + '\u0000' + word.getId(), word);
            }
        }
        return new ArrayList<>(words.values());
    }

    private static List<Word> filterWords(List<Word> words, @Nullable PartOfSpeech pos) {
        if (pos == null) {
            return words;
        }
        return words.stream().filter(w -> w.getPartOfSpeech().matches(pos)).collect(Collectors.toList());
    }

    private static List<Sense> filterByPos(StoreReader reader, List<Sense> senses, @Nullable PartOfSpeech pos,
                                           String lexicon) throws IOException {
        if (pos == null) {
            return senses;
        }
        List<Sense> filtered = new ArrayList<>();
        for (Sense sense : senses) {
            Optional<Word> word = reader.word(sense.getWord(), lexicon);
            if (word.isPresent() && word.get().getPartOfSpeech().matches(pos)) {
                filtered.add(sense);
            }
        }
        return filtered;
    }

    private static List<String> relatedIds(StoreReader reader, String source, List<Relation> declared,
                                           Set<RelationType> wanted, String scope, String lexicon) throws IOException {
        Set<String> ids = new LinkedHashSet<>();
        for (Relation relation : declared) {
            if (wanted.contains(relation.getType())) {
                ids.add(relation.getTarget());
            }
        }
        Set<RelationType> inverses = EnumSet.noneOf(RelationType.class);
        for (RelationType type : wanted) {
            if (INVERTIBLE.contains(type)) {
                inverses.add(type.inverse().get());
            }
        }
        if (!inverses.isEmpty()) {
            ids.addAll(reader.relationSources(source, inverses, scope, lexicon));
        }
        ids.remove(source);
        return new ArrayList<>(ids);
    }

    private StoreAnalytics analytics(StoreReader reader) throws IOException {
        return new StoreAnalytics(reader, filter.isAll() ? null : lexiconIds(reader));
    }

    private List<Lexicon> scope(StoreReader reader) throws IOException {
        return filter.select(reader.lexicons());
    }

    private Collection<String> lexiconIds(StoreReader reader) throws IOException {
        return scope(reader).stream().map(Lexicon::getId).collect(Collectors.toList());
    }

    /**
     * Run a query on every selected lexicon and concatenate the results.
     */
    private <T> List<T> fanOut(StoreReader reader, LexiconQuery<T> query) throws IOException {
        List<T> results = new ArrayList<>();
        for (Lexicon lexicon : scope(reader)) {
            try {
                results.addAll(query.run(reader, lexicon.getId()));
            } catch (IOException | RuntimeException e) {
                if (!filter.isAll()) {
                    throw e;
                }
                log.warn("Leaving lexicon {} out of the results", lexicon.specifier(), e);
            }
        }
        return results;
    }

    private <T> T read(ReaderQuery<T> query) {
        try (StoreReader reader = store.reader()) {
            return query.run(reader);
        } catch (IOException e) {
            throw new StorageException("Unable to read store " + store.getPath(), e);
        }
    }

    private static <T> List<T> optional(Optional<T> value) {
        return value.isPresent() ? Collections.singletonList(value.get()) : Collections.emptyList();
    }

    private static <T> Optional<T> first(List<T> values) {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @FunctionalInterface
    private interface ReaderQuery<T> {
        T run(StoreReader reader) throws IOException;
    }

    @FunctionalInterface
    private interface LexiconQuery<T> {
        List<T> run(StoreReader reader, String lexicon) throws IOException;
    }
}
