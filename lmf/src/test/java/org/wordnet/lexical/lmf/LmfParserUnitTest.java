package org.wordnet.lexical.lmf;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.wordnet.lexical.test.LmfFixtures.CAT_FELINE;
import static org.wordnet.lexical.test.LmfFixtures.DANGLING_RELATION;
import static org.wordnet.lexical.test.LmfFixtures.DANGLING_SENSE;
import static org.wordnet.lexical.test.LmfFixtures.DUPLICATE_SYNSET;
import static org.wordnet.lexical.test.LmfFixtures.ENTRY;
import static org.wordnet.lexical.test.LmfFixtures.HEADER;
import static org.wordnet.lexical.test.LmfFixtures.INVALID_POS;
import static org.wordnet.lexical.test.LmfFixtures.MALFORMED;
import static org.wordnet.lexical.test.LmfFixtures.MEMBERS_1_1;
import static org.wordnet.lexical.test.LmfFixtures.MINI_EN;
import static org.wordnet.lexical.test.LmfFixtures.SYNSET_WITHOUT_POS;
import static org.wordnet.lexical.test.LmfFixtures.UNKNOWN_ELEMENT;
import static org.wordnet.lexical.test.LmfFixtures.UNKNOWN_RELATION;
import static org.wordnet.lexical.test.LmfFixtures.lexicon;
import static org.wordnet.lexical.test.LmfFixtures.load;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.RelationType;
import org.wordnet.lexical.common.exception.LmfParseException;
import org.wordnet.lexical.common.model.Definition;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Relation;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Tag;
import org.wordnet.lexical.common.model.Word;

/**
 * Runs the same documents through every concrete strategy.
 */
@RunWith(Parameterized.class)
public class LmfParserUnitTest {
    private final ParserStrategy strategy;
    private final LmfParser parser;

    public LmfParserUnitTest(ParserStrategy strategy) {
        this.strategy = strategy;
        this.parser = LmfParsers.forStrategy(strategy);
    }

    @Parameterized.Parameters(name = "{0}")
    public static Collection<Object[]> strategies() {
        return Arrays.asList(
                new Object[]{ParserStrategy.STREAMING},
                new Object[]{ParserStrategy.ASYNC},
                new Object[]{ParserStrategy.DOM});
    }

    @Test
    public void parsesLexiconMetadataAndEntities() throws IOException {
        LmfDocument document = parse(load(MINI_EN));

        assertThat(document.getLmfVersion()).isEqualTo("1.0");
        assertThat(document.getLexicons()).hasSize(1);
        Lexicon lexicon = document.getLexicons().get(0);
        assertThat(lexicon.getId()).isEqualTo("mini-en");
        assertThat(lexicon.getLabel()).isEqualTo("Mini English Wordnet");
        assertThat(lexicon.getLanguage()).isEqualTo("en");
        assertThat(lexicon.getVersion()).isEqualTo("1.0");
        assertThat(lexicon.getUrl()).isEqualTo("https://example.org/mini-en");
        assertThat(lexicon.getLogo()).isNull();

        assertThat(document.getWords()).hasSize(8);
        assertThat(document.getSenses()).hasSize(8);
        assertThat(document.getSynsets()).hasSize(9);
        assertThat(document.getIliRefs()).containsExactly("i35545", "i35563", "i46593", "i46360", "i1", "i2");
    }

    @Test
    public void keepsFormsTagsAndPronunciations() throws IOException {
        LmfDocument document = parse(load(MINI_EN));

        Word animal = word(document, "mini-en-animal-n");
        assertThat(animal.getLemma()).isEqualTo("animal");
        assertThat(animal.getPartOfSpeech()).isEqualTo(PartOfSpeech.NOUN);
        assertThat(animal.getForms()).hasSize(1);
        assertThat(animal.getForms().get(0).getWrittenForm()).isEqualTo("animals");
        assertThat(animal.getForms().get(0).getTags()).containsExactly(new Tag("number", "plural"));

        Word cat = word(document, "mini-en-cat-n");
        assertThat(cat.getPronunciations()).hasSize(1);
        assertThat(cat.getPronunciations().get(0).getValue()).isEqualTo("kæt");
        assertThat(cat.getPronunciations().get(0).getVariety()).isEqualTo("GB");
        assertThat(cat.getPronunciations().get(0).isPhonemic()).isTrue();
    }

    @Test
    public void keepsSenseAndSynsetContent() throws IOException {
        LmfDocument document = parse(load(MINI_EN));

        Sense hot = sense(document, "mini-en-hot-a-1");
        assertThat(hot.getWord()).isEqualTo("mini-en-hot-a");
        assertThat(hot.getSynset()).isEqualTo("mini-en-00005-a");
        assertThat(hot.getRank()).isEqualTo(1);
        assertThat(hot.getRelations()).containsExactly(new Relation(RelationType.ANTONYM, "mini-en-cold-a-1"));

        assertThat(sense(document, "mini-en-cat-n-1").getExamples().get(0).getText())
                .isEqualTo("the cat sat on the mat");

        Synset cat = synset(document, "mini-en-00003-n");
        assertThat(cat.getIli()).isEqualTo("i46593");
        assertThat(cat.getMembers()).containsExactly("mini-en-cat-n-1");
        assertThat(cat.getExamples().get(0).getText()).isEqualTo("cats are independent");
        assertThat(cat.getRelations()).containsExactly(new Relation(RelationType.HYPERNYM, "mini-en-00008-n"));

        Synset carnivore = synset(document, "mini-en-00008-n");
        assertThat(carnivore.hasIli()).isFalse();
        assertThat(carnivore.getIliDefinition()).isEqualTo("a flesh-eating mammal");

        Synset placeholder = synset(document, "mini-en-00009-n");
        assertThat(placeholder.isLexicalized()).isFalse();
        assertThat(placeholder.getMembers()).isEmpty();

        assertThat(synset(document, "mini-en-00006-a").getDefinition()).isEmpty();
    }

    @Test
    public void ordersMembersAndRanksSenses() throws IOException {
        LmfDocument document = parse(load(MEMBERS_1_1));

        assertThat(document.getLmfVersion()).isEqualTo("1.1");
        Word cat = word(document, "order-en-cat-n");
        assertThat(cat.getLemma()).isEqualTo("Cat");
        assertThat(cat.getScript()).isEqualTo("Latn");

        Sense second = sense(document, "order-en-cat-n-2");
        Sense first = sense(document, "order-en-cat-n-1");
        assertThat(second.getRank()).isEqualTo(2);
        assertThat(first.getRank()).isEqualTo(1);
        assertThat(first.getAdjposition()).isEqualTo("p");
        assertThat(first.getCounts()).containsExactly(12);

        Synset synset = synset(document, "order-en-0001-n");
        assertThat(synset.getMembers()).containsExactly("order-en-cat-n-1", "order-en-feline-n-1");
        assertThat(synset.getLexfile()).isEqualTo("noun.animal");
        assertThat(synset.getDefinitions())
                .containsExactly(new Definition("  keeps   its   spacing  ", "en", "order-en-cat-n-1"));
    }

    @Test
    public void sensesWithoutRankArePositional() throws IOException {
        LmfDocument document = parse(lexicon("    <LexicalEntry id=\"test-en-cat-n\">\n"
                + "      <Lemma writtenForm=\"cat\" partOfSpeech=\"n\"/>\n"
                + "      <Sense id=\"test-en-cat-n-1\" synset=\"test-en-1-n\"/>\n"
                + "      <Sense id=\"test-en-cat-n-2\" synset=\"test-en-2-n\"/>\n"
                + "    </LexicalEntry>\n"
                + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\"/>\n"
                + "    <Synset id=\"test-en-2-n\" partOfSpeech=\"n\"/>\n"));

        assertThat(sense(document, "test-en-cat-n-1").getRank()).isEqualTo(1);
        assertThat(sense(document, "test-en-cat-n-2").getRank()).isEqualTo(2);
    }

    @Test
    public void normalizesTextOnRequest() throws IOException {
        ParseOptions options = ParseOptions.builder().normalizeText(true).build();
        LmfDocument document = parse(load(MEMBERS_1_1), options);

        assertThat(synset(document, "order-en-0001-n").getDefinition()).contains("keeps its spacing");
    }

    @Test
    public void skipsByteOrderMark() throws IOException {
        String document = load(CAT_FELINE).replace("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n", "");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

        LmfDocument parsed = parse(concat(bom, document.getBytes(UTF_8)), ParseOptions.defaults());

        assertThat(synset(parsed, "test-en-0001-n").getDefinition())
                .contains("a small domesticated carnivorous mammal");
    }

    @Test
    public void expandsInternalSubsetEntities() throws IOException {
        String document = load(CAT_FELINE)
                .replace("WN-LMF-1.0.dtd\">", "WN-LMF-1.0.dtd\" [<!ENTITY pet \"domesticated\">]>")
                .replace("small domesticated carnivorous", "small &pet; carnivorous");

        LmfDocument parsed = parse(document);

        assertThat(parsed.getLmfVersion()).isEqualTo("1.0");
        assertThat(synset(parsed, "test-en-0001-n").getDefinition())
                .contains("a small domesticated carnivorous mammal");
    }

    @Test
    public void reportsProgressUpToCompletion() throws IOException {
        List<Double> fractions = new ArrayList<>();
        byte[] bytes = load(MINI_EN).getBytes(UTF_8);
        ParseOptions options = ParseOptions.builder()
                .progress(fractions::add)
                .expectedSize(bytes.length)
                .build();

        parser.parse(new ByteArrayInputStream(bytes), options, new DocumentCollector());

        assertThat(fractions).isNotEmpty().isSorted();
        assertThat(fractions.get(fractions.size() - 1)).isEqualTo(1.0);
    }

    @Test
    public void emitsEntitiesIncrementally() throws IOException {
        List<String> events = new ArrayList<>();
        LmfHandler handler = new LmfHandler() {
            @Override
            public void startLexicon(Lexicon lexicon) {
                events.add("lexicon " + lexicon.getId());
            }

            @Override
            public void entry(Word word, List<Sense> senses) {
                events.add("entry " + word.getId() + " " + senses.size());
            }

            @Override
            public void synset(Synset synset) {
                events.add("synset " + synset.getId());
            }

            @Override
            public void endLexicon(Lexicon lexicon) {
                events.add("end " + lexicon.getId());
            }
        };

        parser.parse(new ByteArrayInputStream(load(CAT_FELINE).getBytes(UTF_8)), ParseOptions.defaults(), handler);

        assertThat(events).containsExactly(
                "lexicon test-en",
                "entry test-en-cat-n 1",
                "entry test-en-feline-n 1",
                "synset test-en-0001-n",
                "end test-en");
    }

    @Test
    public void missingRequiredAttribute() {
        LmfParseException e = failure(SYNSET_WITHOUT_POS);
        assertThat(e.getElement()).isEqualTo("Synset");
        assertThat(e.getEntityId()).isEqualTo("test-en-1-n");
        assertThat(e.getMessage()).contains("partOfSpeech");
        assertThat(e.getPath()).isEqualTo("LexicalResource/Lexicon[test-en]/Synset[test-en-1-n]");
    }

    @Test
    public void invalidPartOfSpeech() {
        LmfParseException e = failure(INVALID_POS);
        assertThat(e.getElement()).isEqualTo("Synset");
        assertThat(e.getEntityId()).isEqualTo("test-en-1-n");
        assertThat(e.getMessage()).contains("Invalid part of speech x");
    }

    @Test
    public void partOfSpeechIsCaseSensitive() {
        LmfParseException e = failure(lexicon(ENTRY
                + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"N\"/>\n"));
        assertThat(e.getElement()).isEqualTo("Synset");
        assertThat(e.getMessage()).contains("Invalid part of speech N");
    }

    @Test
    public void danglingSenseSynset() {
        LmfParseException e = failure(DANGLING_SENSE);
        assertThat(e.getElement()).isEqualTo("Sense");
        assertThat(e.getEntityId()).isEqualTo("test-en-cat-n-1");
        assertThat(e.getMessage()).contains("test-en-1-n");
    }

    @Test
    public void danglingRelationTarget() {
        LmfParseException e = failure(DANGLING_RELATION);
        assertThat(e.getElement()).isEqualTo("SynsetRelation");
        assertThat(e.getEntityId()).isEqualTo("test-en-1-n");
        assertThat(e.getMessage()).contains("test-en-404-n");
    }

    @Test
    public void unknownRelationType() {
        LmfParseException e = failure(UNKNOWN_RELATION);
        assertThat(e.getElement()).isEqualTo("SynsetRelation");
        assertThat(e.getMessage()).contains("hypernymish");
    }

    @Test
    public void duplicateId() {
        LmfParseException e = failure(DUPLICATE_SYNSET);
        assertThat(e.getElement()).isEqualTo("Synset");
        assertThat(e.getEntityId()).isEqualTo("test-en-1-n");
        assertThat(e.getMessage()).contains("Duplicate id");
    }

    @Test
    public void relationNotAllowedOnSynsets() {
        LmfParseException e = failure(lexicon(ENTRY
                + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\">\n"
                + "      <SynsetRelation relType=\"derivation\" target=\"test-en-1-n\"/>\n"
                + "    </Synset>\n"));
        assertThat(e.getMessage()).contains("derivation");
    }

    @Test
    public void entriesMustPrecedeSynsets() {
        LmfParseException e = failure(lexicon("    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\"/>\n" + ENTRY));
        assertThat(e.getElement()).isEqualTo("LexicalEntry");
        assertThat(e.getEntityId()).isEqualTo("test-en-cat-n");
    }

    @Test
    public void entryWithoutLemma() {
        LmfParseException e = failure(lexicon("    <LexicalEntry id=\"test-en-cat-n\"/>\n"));
        assertThat(e.getElement()).isEqualTo("LexicalEntry");
    }

    @Test
    public void elementOutOfPlace() {
        LmfParseException e = failure(lexicon("    <Definition>floating</Definition>\n"));
        assertThat(e.getElement()).isEqualTo("Definition");
        assertThat(e.getMessage()).contains("not allowed in Lexicon");
    }

    @Test
    public void unknownElementFailsWhenStrict() {
        LmfParseException e = failure(UNKNOWN_ELEMENT);
        assertThat(e.getElement()).isEqualTo("Gloss");
        assertThat(e.getPath()).endsWith("Synset[test-en-1-n]");
    }

    @Test
    public void unknownElementSkippedWhenLenient() throws IOException {
        LmfDocument document = parse(UNKNOWN_ELEMENT, ParseOptions.builder().strict(false).build());
        assertThat(document.getSynsets()).hasSize(1);
        assertThat(document.getSynsets().get(0).getDefinitions()).isEmpty();
    }

    @Test
    public void malformedXml() {
        LmfParseException e = failure(MALFORMED);
        assertThat(e.getMessage()).startsWith("Malformed XML");
        assertThat(e.getLine()).isGreaterThan(0);
    }

    @Test
    public void undecodableBytesAreMalformed() {
        String[] halves = lexicon(ENTRY
                + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\">\n"
                + "      <Definition>x|z</Definition>\n"
                + "    </Synset>\n").split("\\|");
        byte[] document = concat(halves[0].getBytes(UTF_8), new byte[]{(byte) 0xFF}, halves[1].getBytes(UTF_8));

        assertThatThrownBy(() -> parse(document, ParseOptions.defaults()))
                .as("%s should reject the bytes", strategy)
                .isInstanceOf(LmfParseException.class)
                .hasMessageStartingWith("Malformed XML");
    }

    @Test
    public void truncatedDocument() {
        String document = load(MINI_EN);
        assertThatThrownBy(() -> parse(document.substring(0, document.indexOf("<Synset"))))
                .isInstanceOf(LmfParseException.class);
    }

    @Test
    public void wrongRootElement() {
        LmfParseException e = failure(HEADER + "<Lexicon id=\"x\"/>\n");
        assertThat(e.getElement()).isEqualTo("Lexicon");
        assertThat(e.getMessage()).contains("Root element must be LexicalResource");
    }

    @Test
    public void unsupportedSchemaVersion() {
        String document = load(CAT_FELINE).replace("WN-LMF-1.0.dtd", "WN-LMF-9.9.dtd");
        LmfParseException e = failure(document);
        assertThat(e.getMessage()).contains("Unsupported LMF version 9.9");
    }

    @Test
    public void readFailuresSurfaceAsIOException() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        };
        assertThatThrownBy(() -> parser.parse(broken, ParseOptions.defaults(), new DocumentCollector()))
                .isInstanceOf(IOException.class)
                .hasMessage("disk gone");
    }

    private LmfDocument parse(String document) throws IOException {
        return parse(document, ParseOptions.defaults());
    }

    private LmfDocument parse(String document, ParseOptions options) throws IOException {
        return parse(document.getBytes(UTF_8), options);
    }

    private LmfDocument parse(byte[] document, ParseOptions options) throws IOException {
        DocumentCollector collector = new DocumentCollector();
        parser.parse(new ByteArrayInputStream(document), options, collector);
        return collector.getDocument();
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.write(part, 0, part.length);
        }
        return out.toByteArray();
    }

    private LmfParseException failure(String document) {
        LmfParseException e = catchThrowableOfType(() -> parse(document), LmfParseException.class);
        assertThat(e).as("%s should reject the document", strategy).isNotNull();
        return e;
    }

    private static Word word(LmfDocument document, String id) {
        return find(document.getWords(), Word::getId, id);
    }

    private static Sense sense(LmfDocument document, String id) {
        return find(document.getSenses(), Sense::getId, id);
    }

    private static Synset synset(LmfDocument document, String id) {
        return find(document.getSynsets(), Synset::getId, id);
    }

    private static <T> T find(List<T> entities, Function<T, String> id, String expected) {
        return entities.stream()
                .filter(e -> expected.equals(id.apply(e)))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No entity " + expected));
    }
}
