package org.wordnet.lexical.store.query;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.exception.ContainedException;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Synset;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;

/**
 * Corpus based specificity weights of synsets, kept per part of speech with
 * adjective satellites counted as adjectives. The probability of a synset is
 * its weight over the total weight of its part of speech and its information
 * content is the negative log of that probability.
 *
 * <p>Weights are either computed from a tokenized corpus or loaded from a
 * weights file in the format distributed with the WordNet similarity tools.
 */
@Immutable
public final class InformationContent {
    private static final Logger log = LoggerFactory.getLogger(InformationContent.class);
    private static final Splitter FIELDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final Map<PartOfSpeech, Map<String, Double>> weights;
    private final Map<PartOfSpeech, Double> totals;

    private InformationContent(Map<PartOfSpeech, Map<String, Double>> weights, Map<PartOfSpeech, Double> totals) {
        this.weights = weights;
        this.totals = totals;
    }

    /**
     * Maps a synset offset of a weights file to a synset id.
     */
    @FunctionalInterface
    public interface SynsetIdResolver {
        String synsetId(long offset, PartOfSpeech pos);
    }

    /**
     * Weights from a corpus, each occurrence of a word split evenly among
     * its synsets, with a smoothing weight of 1.
     */
    public static InformationContent compute(Wordnet wordnet, Iterable<String> corpus) {
        return compute(wordnet, corpus, true, 1.0);
    }

    /**
     * Weights from a corpus. Every synset starts at {@code smoothing}; each
     * occurrence of a word then adds to the synsets of the word and to all
     * their hypernyms, once per hypernym path.
     *
     * @param distributeWeight divide the count of a word among its synsets
     *      rather than giving the full count to each of them
     */
    public static InformationContent compute(Wordnet wordnet, Iterable<String> corpus,
                                             boolean distributeWeight, double smoothing) {
        Map<PartOfSpeech, Map<String, Double>> weights = initialize(wordnet, smoothing);
        Map<PartOfSpeech, Double> totals = totals(smoothing);
        Multiset<String> counts = LinkedHashMultiset.create(corpus);
        Taxonomy taxonomy = wordnet.taxonomy();
        for (Multiset.Entry<String> count : counts.entrySet()) {
            List<Synset> synsets = wordnet.synsets(count.getElement(), null);
            if (synsets.isEmpty()) {
                continue;
            }
            double weight = distributeWeight ? (double) count.getCount() / synsets.size() : count.getCount();
            for (Synset synset : synsets) {
                PartOfSpeech pos = weightedPos(synset.getPartOfSpeech());
                totals.merge(pos, weight, Double::sum);
                propagate(taxonomy, synset, weight, weights.get(pos), new HashSet<>());
            }
        }
        log.debug("Computed information content from {} distinct tokens", counts.elementSet().size());
        return new InformationContent(weights, totals);
    }

    private static void propagate(Taxonomy taxonomy, Synset synset, double weight,
                                  Map<String, Double> posWeights, Set<String> onPath) {
        if (!onPath.add(synset.getId())) {
            return;
        }
        posWeights.merge(synset.getId(), weight, Double::sum);
        for (Synset hypernym : taxonomy.hypernyms(synset)) {
            propagate(taxonomy, hypernym, weight, posWeights, onPath);
        }
        onPath.remove(synset.getId());
    }

    /**
     * Load a weights file for a wordnet made of a single lexicon whose synset
     * ids are {@code <lexicon>-<8 digit offset>-<pos>}.
     *
     * @throws ContainedException if the wordnet doesn't have exactly one
     *      lexicon or the file is malformed
     */
    public static InformationContent load(Path file, Wordnet wordnet) throws IOException {
        return load(file, wordnet, defaultResolver(wordnet));
    }

    public static InformationContent load(Path file, Wordnet wordnet, SynsetIdResolver resolver) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, UTF_8)) {
            return load(reader, file.toString(), wordnet, resolver);
        }
    }

    /**
     * Read weights, one synset per line after a header line:
     * {@code <offset><pos> <weight>}, followed by {@code ROOT} for the roots
     * of the hierarchy. The total of a part of speech is the sum of its
     * roots.
     */
    public static InformationContent load(Reader in, String sourceName, Wordnet wordnet,
                                          SynsetIdResolver resolver) throws IOException {
        Map<PartOfSpeech, Map<String, Double>> weights = initialize(wordnet, 0.0);
        Map<PartOfSpeech, Double> totals = totals(0.0);
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        // Header, naming the wordnet the weights were computed for.
        reader.readLine();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            List<String> fields = FIELDS.splitToList(line);
            if (fields.isEmpty()) {
                continue;
            }
            if (fields.size() < 2 || fields.get(0).length() < 2) {
                throw malformedLine(lineNumber, sourceName, null);
            }
            String synsetInfo = fields.get(0);
            PartOfSpeech pos = PartOfSpeech.lookup(synsetInfo.substring(synsetInfo.length() - 1));
            if (pos == null) {
                throw malformedLine(lineNumber, sourceName, null);
            }
            long offset;
            double weight;
            try {
                offset = Long.parseLong(synsetInfo.substring(0, synsetInfo.length() - 1));
                weight = Double.parseDouble(fields.get(1));
            } catch (NumberFormatException e) {
                throw malformedLine(lineNumber, sourceName, e);
            }
            PartOfSpeech weighted = weightedPos(pos);
            weights.get(weighted).put(resolver.synsetId(offset, pos), weight);
            if (fields.size() > 2 && "ROOT".equals(fields.get(2))) {
                totals.merge(weighted, weight, Double::sum);
            }
        }
        log.debug("Loaded information content from {}", sourceName);
        return new InformationContent(weights, totals);
    }

    private static SynsetIdResolver defaultResolver(Wordnet wordnet) {
        List<Lexicon> lexicons = wordnet.lexicons();
        if (lexicons.size() != 1) {
            throw new ContainedException("Information content weights need exactly one lexicon, found "
                    + lexicons.size());
        }
        String lexicon = lexicons.get(0).getId();
        return (offset, pos) -> String.format(Locale.ROOT, "%s-%08d-%s", lexicon, offset, pos.tag());
    }

    /**
     * Negative log of {@link #synsetProbability(Synset)}, 0 for synsets
     * without weight.
     */
    public double informationContent(Synset synset) {
        double probability = synsetProbability(synset);
        if (probability <= 0) {
            return 0;
        }
        return -Math.log(probability);
    }

    /**
     * Weight of the synset over the total weight of its part of speech.
     */
    public double synsetProbability(Synset synset) {
        PartOfSpeech pos = weightedPos(synset.getPartOfSpeech());
        double total = totals.get(pos);
        Double weight = weights.get(pos).get(synset.getId());
        if (weight == null) {
            return 0;
        }
        return weight / (total == 0 ? 1 : total);
    }

    private static Map<PartOfSpeech, Map<String, Double>> initialize(Wordnet wordnet, double smoothing) {
        Map<PartOfSpeech, Map<String, Double>> weights = new EnumMap<>(PartOfSpeech.class);
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            if (pos != PartOfSpeech.ADJECTIVE_SATELLITE) {
                weights.put(pos, new HashMap<>());
            }
        }
        for (Synset synset : wordnet.synsets(null, null)) {
            weights.get(weightedPos(synset.getPartOfSpeech())).put(synset.getId(), smoothing);
        }
        return weights;
    }

    private static Map<PartOfSpeech, Double> totals(double initial) {
        Map<PartOfSpeech, Double> totals = new EnumMap<>(PartOfSpeech.class);
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            if (pos != PartOfSpeech.ADJECTIVE_SATELLITE) {
                totals.put(pos, initial);
            }
        }
        return totals;
    }

    private static PartOfSpeech weightedPos(PartOfSpeech pos) {
        return pos == PartOfSpeech.ADJECTIVE_SATELLITE ? PartOfSpeech.ADJECTIVE : pos;
    }

    private static ContainedException malformedLine(int line, String sourceName,
                                                     @Nullable NumberFormatException cause) {
        String message = "Malformed information content weight on line " + line + " of " + sourceName;
        return cause == null ? new ContainedException(message) : new ContainedException(message, cause);
    }
}
