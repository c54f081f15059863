package org.wordnet.lexical.store.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.wordnet.lexical.store.ParsedFixtures.openStore;
import static org.wordnet.lexical.store.ParsedFixtures.parse;
import static org.wordnet.lexical.test.CloseableRule.autoClose;
import static org.wordnet.lexical.test.LmfFixtures.MINI_EN;
import static org.wordnet.lexical.test.LmfFixtures.MINI_ES;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.RuleChain;
import org.junit.rules.TemporaryFolder;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.exception.ContainedException;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.store.LexicalStore;
import org.wordnet.lexical.test.CloseableRule;

public class InformationContentUnitTest {
    private static final InformationContent.SynsetIdResolver MINI_IDS =
            (offset, pos) -> String.format(Locale.ROOT, "mini-en-%05d-%s", offset, pos.tag());

    private final TemporaryFolder temp = new TemporaryFolder();
    private final CloseableRule<LexicalStore> store = autoClose(() -> openStore(temp));

    @Rule
    public RuleChain chain = RuleChain.outerRule(temp).around(store);

    private Wordnet english;
    private Taxonomy taxonomy;
    private InformationContent ic;

    @Before
    public void computeFromCorpus() {
        store.get().add(parse(MINI_EN, temp), false);
        store.get().add(parse(MINI_ES, temp), false);
        english = new Wordnet(store.get(), LexiconFilter.of("mini-en"));
        taxonomy = english.taxonomy();
        ic = InformationContent.compute(english, Arrays.asList("cat", "cat", "dog", "animal", "unknown"));
    }

    @Test
    public void countsReachEveryHypernym() {
        // Noun total: 1 of smoothing plus 4 counted tokens.
        assertThat(ic.synsetProbability(synset("00001-n"))).isCloseTo(1.0, within(1e-9));
        assertThat(ic.synsetProbability(synset("00002-n"))).isCloseTo(1.0, within(1e-9));
        assertThat(ic.synsetProbability(synset("00008-n"))).isCloseTo(0.8, within(1e-9));
        assertThat(ic.synsetProbability(synset("00003-n"))).isCloseTo(0.6, within(1e-9));
        assertThat(ic.synsetProbability(synset("00004-n"))).isCloseTo(0.4, within(1e-9));
        assertThat(ic.synsetProbability(synset("00009-n"))).isCloseTo(0.2, within(1e-9));
    }

    @Test
    public void informationContentIsTheNegativeLogProbability() {
        assertThat(ic.informationContent(synset("00001-n"))).isCloseTo(0.0, within(1e-9));
        assertThat(ic.informationContent(synset("00003-n"))).isCloseTo(-Math.log(0.6), within(1e-9));
        // Adjectives saw no token, smoothing alone leaves them at probability 1.
        assertThat(ic.informationContent(synset("00005-a"))).isCloseTo(0.0, within(1e-9));
    }

    @Test
    public void fullCountsWithoutDistribution() {
        InformationContent undistributed = InformationContent.compute(english, Arrays.asList("cat"), false, 0.0);

        assertThat(undistributed.synsetProbability(synset("00003-n"))).isCloseTo(1.0, within(1e-9));
        assertThat(undistributed.synsetProbability(synset("00004-n"))).isZero();
        assertThat(undistributed.informationContent(synset("00004-n"))).isZero();
    }

    @Test
    public void resnik() {
        assertThat(taxonomy.resSimilarity(synset("00003-n"), synset("00004-n"), ic))
                .isCloseTo(-Math.log(0.8), within(1e-9));
        assertThat(taxonomy.resSimilarity(synset("00003-n"), synset("00009-n"), ic))
                .isCloseTo(0.0, within(1e-9));
    }

    @Test
    public void jiangConrath() {
        assertThat(taxonomy.jcnSimilarity(synset("00003-n"), synset("00004-n"), ic))
                .isCloseTo(1.0195454478, within(1e-9));
        assertThat(taxonomy.jcnSimilarity(synset("00003-n"), synset("00003-n"), ic)).isEqualTo(1.0);
    }

    @Test
    public void lin() {
        assertThat(taxonomy.linSimilarity(synset("00003-n"), synset("00004-n"), ic))
                .isCloseTo(0.3127194926, within(1e-9));
        assertThat(taxonomy.linSimilarity(synset("00003-n"), synset("00003-n"), ic)).isEqualTo(1.0);
    }

    @Test
    public void weightedSimilarityNeedsTheSamePartOfSpeech() {
        assertThatThrownBy(() -> taxonomy.linSimilarity(synset("00003-n"), synset("00007-v"), ic))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void loadsWeightsFile() throws IOException {
        String weights = "wnver::mini\n"
                + "1n 10 ROOT\n"
                + "2n 8\n"
                + "8n 5\n"
                + "3n 2\n"
                + "\n"
                + "7v 3 ROOT\n";

        InformationContent loaded = InformationContent.load(new StringReader(weights), "weights", english, MINI_IDS);

        assertThat(loaded.synsetProbability(synset("00008-n"))).isCloseTo(0.5, within(1e-9));
        assertThat(loaded.synsetProbability(synset("00003-n"))).isCloseTo(0.2, within(1e-9));
        assertThat(loaded.synsetProbability(synset("00004-n"))).isZero();
        assertThat(loaded.synsetProbability(synset("00007-v"))).isCloseTo(1.0, within(1e-9));
    }

    @Test
    public void defaultIdsUseEightDigitOffsets() throws IOException {
        Path file = temp.getRoot().toPath().resolve("ic-mini.dat");
        Files.write(file, Arrays.asList("wnver::mini", "1n 4 ROOT", "5a 2 ROOT"));

        InformationContent loaded = InformationContent.load(file, english);

        Synset padded = Synset.builder().id("mini-en-00000001-n").lexicon("mini-en")
                .partOfSpeech(PartOfSpeech.NOUN).build();
        assertThat(loaded.synsetProbability(padded)).isCloseTo(1.0, within(1e-9));
        assertThat(loaded.synsetProbability(synset("00001-n"))).isZero();
    }

    @Test
    public void defaultIdsNeedASingleLexicon() {
        Wordnet both = english.withFilter(LexiconFilter.ALL);
        Path file = temp.getRoot().toPath().resolve("ic.dat");

        assertThatThrownBy(() -> InformationContent.load(file, both))
                .isInstanceOf(ContainedException.class)
                .hasMessageContaining("exactly one lexicon");
    }

    @Test
    public void malformedWeight() {
        assertThatThrownBy(() -> InformationContent.load(new StringReader("header\n1n lots\n"), "weights",
                english, MINI_IDS))
                .isInstanceOf(ContainedException.class)
                .hasMessage("Malformed information content weight on line 2 of weights");
    }

    private Synset synset(String suffix) {
        return english.synset("mini-en-" + suffix).orElseThrow(() -> new AssertionError("No synset " + suffix));
    }
}
