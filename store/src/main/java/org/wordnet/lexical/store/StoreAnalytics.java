package org.wordnet.lexical.store;

import static org.wordnet.lexical.store.StoreFields.HAS_DEFINITION;
import static org.wordnet.lexical.store.StoreFields.HAS_ILI;
import static org.wordnet.lexical.store.StoreFields.KIND;
import static org.wordnet.lexical.store.StoreFields.POS;
import static org.wordnet.lexical.store.StoreFields.SIZE;
import static org.wordnet.lexical.store.StoreReader.all;
import static org.wordnet.lexical.store.StoreReader.lexicons;
import static org.wordnet.lexical.store.StoreReader.term;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import javax.annotation.Nullable;

import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.index.DocValues;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.NumericDocValues;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreMode;
import org.apache.lucene.search.SimpleCollector;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.model.Lexicon;

/**
 * Aggregates over a reader snapshot, restricted to some lexicons or covering
 * the whole store.
 */
public class StoreAnalytics {
    private final StoreReader reader;
    private final IndexSearcher searcher;
    @Nullable
    private final Collection<String> lexicons;

    /**
     * @param lexicons ids of the lexicons to cover, {@code null} for all
     */
    public StoreAnalytics(StoreReader reader, @Nullable Collection<String> lexicons) {
        this.reader = reader;
        this.searcher = reader.searcher();
        this.lexicons = lexicons;
    }

    public StoreStatistics statistics() throws IOException {
        long ilis = lexicons == null
                ? searcher.count(term(KIND, StoreFields.KIND_ILI))
                : reader.referencedIlis(lexicons).size();
        return StoreStatistics.builder()
                .totalWords(count(StoreFields.KIND_WORD))
                .totalSynsets(count(StoreFields.KIND_SYNSET))
                .totalSenses(count(StoreFields.KIND_SENSE))
                .totalIlis(ilis)
                .totalLexicons(count(StoreFields.KIND_LEXICON))
                .build();
    }

    public QualityMetrics qualityMetrics() throws IOException {
        long synsets = count(StoreFields.KIND_SYNSET);
        long withIli = count(StoreFields.KIND_SYNSET, term(HAS_ILI, StoreFields.TRUE));
        long withDefinition = count(StoreFields.KIND_SYNSET, term(HAS_DEFINITION, StoreFields.TRUE));
        return QualityMetrics.builder()
                .synsetsWithIli(withIli)
                .synsetsWithoutIli(synsets - withIli)
                .iliCoveragePercentage(synsets == 0 ? 0 : withIli * 100.0 / synsets)
                .emptySynsets(count(StoreFields.KIND_SYNSET, NumericDocValuesField.newSlowExactQuery(SIZE, 0)))
                .synsetsWithDefinitions(withDefinition)
                .synsetsWithoutDefinitions(synsets - withDefinition)
                .build();
    }

    /**
     * Synset counts per part of speech. Parts of speech without synsets are
     * left out.
     */
    public Map<PartOfSpeech, Long> partOfSpeechDistribution() throws IOException {
        Map<PartOfSpeech, Long> distribution = new EnumMap<>(PartOfSpeech.class);
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            long count = count(StoreFields.KIND_SYNSET, term(POS, pos.tag()));
            if (count > 0) {
                distribution.put(pos, count);
            }
        }
        return distribution;
    }

    /**
     * Word and synset counts of each covered lexicon, in installation order.
     */
    public List<LexiconStatistics> lexiconStatistics() throws IOException {
        List<LexiconStatistics> statistics = new ArrayList<>();
        for (Lexicon lexicon : reader.lexicons()) {
            if (lexicons != null && !lexicons.contains(lexicon.getId())) {
                continue;
            }
            Query scope = term(StoreFields.LEXICON, lexicon.getId());
            statistics.add(new LexiconStatistics(
                    lexicon.getId(), lexicon.getLabel(), lexicon.getLanguage(), lexicon.getVersion(),
                    searcher.count(all(term(KIND, StoreFields.KIND_WORD), scope)),
                    searcher.count(all(term(KIND, StoreFields.KIND_SYNSET), scope))));
        }
        return statistics;
    }

    public SynsetSizeAnalysis synsetSizeAnalysis() throws IOException {
        SizeCollector sizes = new SizeCollector();
        searcher.search(all(term(KIND, StoreFields.KIND_SYNSET), lexicons(lexicons)), sizes);
        SortedMap<Integer, Long> distribution = new TreeMap<>();
        long synsets = 0;
        long members = 0;
        for (Map.Entry<Integer, Long> size : sizes.distribution.entrySet()) {
            if (size.getKey() == 0) {
                continue;
            }
            distribution.put(size.getKey(), size.getValue());
            synsets += size.getValue();
            members += (long) size.getKey() * size.getValue();
        }
        if (distribution.isEmpty()) {
            return new SynsetSizeAnalysis(0, 0, 0, distribution);
        }
        return new SynsetSizeAnalysis((double) members / synsets,
                distribution.lastKey(), distribution.firstKey(), distribution);
    }

    private long count(String kind, Query... clauses) throws IOException {
        Query[] all = new Query[clauses.length + 2];
        all[0] = term(KIND, kind);
        all[1] = lexicons(lexicons);
        System.arraycopy(clauses, 0, all, 2, clauses.length);
        return searcher.count(all(all));
    }

    /**
     * Histogram of the member count doc values.
     */
    private static final class SizeCollector extends SimpleCollector {
        private final Map<Integer, Long> distribution = new TreeMap<>();
        private NumericDocValues sizes;

        @Override
        protected void doSetNextReader(LeafReaderContext context) throws IOException {
            sizes = DocValues.getNumeric(context.reader(), SIZE);
        }

        @Override
        public void collect(int doc) throws IOException {
            int size = sizes.advanceExact(doc) ? (int) sizes.longValue() : 0;
            distribution.merge(size, 1L, Long::sum);
        }

        @Override
        public ScoreMode scoreMode() {
            return ScoreMode.COMPLETE_NO_SCORES;
        }
    }
}
