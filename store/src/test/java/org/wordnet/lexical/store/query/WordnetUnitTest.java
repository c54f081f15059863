package org.wordnet.lexical.store.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.wordnet.lexical.store.ParsedFixtures.LOCK_WAIT;
import static org.wordnet.lexical.store.ParsedFixtures.openStore;
import static org.wordnet.lexical.store.ParsedFixtures.parse;
import static org.wordnet.lexical.test.CloseableRule.autoClose;
import static org.wordnet.lexical.test.LmfFixtures.MINI_EN;
import static org.wordnet.lexical.test.LmfFixtures.MINI_ES;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field.Store;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.RuleChain;
import org.junit.rules.TemporaryFolder;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.RelationType;
import org.wordnet.lexical.common.exception.StorageException;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.IliStatus;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;
import org.wordnet.lexical.store.LexicalStore;
import org.wordnet.lexical.store.StoreFields;
import org.wordnet.lexical.test.CloseableRule;

public class WordnetUnitTest {
    private final TemporaryFolder temp = new TemporaryFolder();
    private final CloseableRule<LexicalStore> store = autoClose(() -> openStore(temp));

    @Rule
    public RuleChain chain = RuleChain.outerRule(temp).around(store);

    private Wordnet wordnet;

    @Before
    public void addLexicons() {
        store.get().add(parse(MINI_EN, temp), false);
        store.get().add(parse(MINI_ES, temp), false);
        wordnet = new Wordnet(store.get(), LexiconFilter.ALL);
    }

    @Test
    public void exactForm() {
        assertThat(wordnet.words("cat")).extracting(Word::getId).containsExactly("mini-en-cat-n");
        assertThat(wordnet.words("ran")).extracting(Word::getId).containsExactly("mini-en-run-v");
    }

    @Test
    public void fanOutFollowsInstallationOrder() {
        assertThat(wordnet.words("animal")).extracting(Word::getId)
                .containsExactly("mini-en-animal-n", "mini-es-animal-n");
        assertThat(wordnet.synsets("animal", null)).extracting(Synset::getId)
                .containsExactly("mini-en-00002-n", "mini-es-00002-n");
    }

    @Test
    public void caseInsensitiveFallback() {
        assertThat(wordnet.words("Cat")).extracting(Word::getId).containsExactly("mini-en-cat-n");
    }

    @Test
    public void lemmatizedFallback() {
        assertThat(wordnet.words("carnivores")).extracting(Word::getId).containsExactly("mini-en-carnivore-n");
        assertThat(new Wordnet(store.get(), LexiconFilter.ALL, false).words("carnivores")).isEmpty();
    }

    @Test
    public void unknownWordIsEmpty() {
        assertThat(wordnet.words("nonexistentword")).isEmpty();
        assertThat(wordnet.senses("nonexistentword", null)).isEmpty();
        assertThat(wordnet.synsets("nonexistentword", null)).isEmpty();
    }

    @Test
    public void partOfSpeechFilter() {
        assertThat(wordnet.words(null, PartOfSpeech.VERB)).extracting(Word::getId).containsExactly("mini-en-run-v");
        assertThat(wordnet.words("hot", PartOfSpeech.ADJECTIVE)).extracting(Word::getId).containsExactly("mini-en-hot-a");
        assertThat(wordnet.words("hot", PartOfSpeech.NOUN)).isEmpty();
        assertThat(wordnet.senses(null, PartOfSpeech.ADJECTIVE)).extracting(Sense::getId)
                .containsExactly("mini-en-cold-a-1", "mini-en-hot-a-1");
    }

    @Test
    public void sensesOfAForm() {
        assertThat(wordnet.senses("cats", null)).extracting(Sense::getId).containsExactly("mini-en-cat-n-1");
        assertThat(wordnet.wordSenses("mini-en-dog-n")).extracting(Sense::getId).containsExactly("mini-en-dog-n-1");
    }

    @Test
    public void sharedIliJoinsLexicons() {
        assertThat(wordnet.synsetsByIli("i46593")).extracting(Synset::getId)
                .containsExactly("mini-en-00003-n", "mini-es-00003-n");
    }

    @Test
    public void lookupsById() {
        assertThat(wordnet.synset("mini-es-00004-n")).map(Synset::getLexicon).hasValue("mini-es");
        assertThat(wordnet.word("mini-en-cat-n")).map(Word::getLemma).hasValue("cat");
        assertThat(wordnet.sense("mini-en-cat-n-1")).map(Sense::getSynset).hasValue("mini-en-00003-n");
        assertThat(wordnet.synset("unknown")).isEmpty();
        assertThat(wordnet.synsetSenses("mini-en-00003-n")).extracting(Sense::getId).containsExactly("mini-en-cat-n-1");
        assertThat(wordnet.synsetWords("mini-en-00003-n")).extracting(Word::getLemma).containsExactly("cat");
        assertThat(wordnet.synsetSenses("mini-en-00009-n")).isEmpty();
    }

    @Test
    public void missingDefinitionIsEmpty() {
        assertThat(wordnet.definition("mini-es-00004-n")).isEmpty();
        assertThat(wordnet.definition("unknown")).isEmpty();
        assertThat(wordnet.definition("mini-en-00003-n"))
                .hasValue("feline mammal usually having thick soft fur and no ability to roar");
    }

    @Test
    public void lexiconFilter() {
        Wordnet spanish = wordnet.withFilter(LexiconFilter.parse("mini-es"));
        assertThat(spanish.words("animal")).extracting(Word::getId).containsExactly("mini-es-animal-n");
        assertThat(spanish.lexicons()).extracting(Lexicon::getId).containsExactly("mini-es");
        assertThat(spanish.ilis(null)).extracting(IliEntry::getId).containsExactly("i35563", "i46360", "i46593");
        assertThat(spanish.stats().getTotalWords()).isEqualTo(3);

        assertThat(wordnet.withFilter(LexiconFilter.parse("mini-es:1.0")).words("animal")).isEmpty();
        assertThat(wordnet.withFilter(LexiconFilter.parse("mini-es:2.0")).words("animal")).hasSize(1);
    }

    @Test
    public void relationsIncludeInverses() {
        Synset animal = wordnet.synset("mini-en-00002-n").get();
        Synset entity = wordnet.synset("mini-en-00001-n").get();

        assertThat(wordnet.related(animal, RelationType.HYPERNYM)).extracting(Synset::getId)
                .containsExactly("mini-en-00001-n");
        assertThat(wordnet.related(animal, RelationType.HYPONYM)).extracting(Synset::getId)
                .containsExactly("mini-en-00008-n");
        assertThat(wordnet.related(entity)).extracting(Synset::getId)
                .containsExactly("mini-en-00002-n", "mini-en-00009-n");
    }

    @Test
    public void senseRelations() {
        Sense hot = wordnet.sense("mini-en-hot-a-1").get();

        assertThat(wordnet.relatedSenses(hot, RelationType.ANTONYM)).extracting(Sense::getId)
                .containsExactly("mini-en-cold-a-1");
    }

    @Test
    public void relationsStayInTheirLexicon() {
        Synset gato = wordnet.synset("mini-es-00003-n").get();

        assertThat(wordnet.related(gato, RelationType.HYPERNYM)).extracting(Synset::getId)
                .containsExactly("mini-es-00002-n");
    }

    @Test
    public void translateHopsThroughTheIli() {
        Synset cat = wordnet.synset("mini-en-00003-n").get();
        Synset carnivore = wordnet.synset("mini-en-00008-n").get();

        assertThat(wordnet.translate(cat, LexiconFilter.of("mini-es"))).extracting(Synset::getId)
                .containsExactly("mini-es-00003-n");
        assertThat(wordnet.translate(cat, LexiconFilter.ALL)).extracting(Synset::getId)
                .containsExactly("mini-es-00003-n");
        assertThat(wordnet.translate(carnivore, LexiconFilter.ALL)).isEmpty();
    }

    @Test
    public void ilisOutliveTheirLexicons() {
        store.get().remove("mini-en");

        assertThat(wordnet.words("cat")).isEmpty();
        assertThat(wordnet.synset("mini-en-00003-n")).isEmpty();
        assertThat(wordnet.ili("i35545")).map(IliEntry::getStatus).hasValue(IliStatus.PRESUPPOSED);
        assertThat(wordnet.synsetsByIli("i46593")).extracting(Synset::getId).containsExactly("mini-es-00003-n");
    }

    @Test
    public void failingLexiconIsLeftOutOfFanOut() throws IOException {
        Path path = temp.newFolder("broken").toPath();
        try (LexicalStore other = LexicalStore.open(path, LOCK_WAIT)) {
            other.add(parse(MINI_EN, temp), false);
        }
        try (Directory directory = FSDirectory.open(path);
             IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig())) {
            writer.addDocument(brokenLexicon());
            writer.addDocument(brokenWord());
            writer.commit();
        }

        try (LexicalStore other = LexicalStore.open(path, LOCK_WAIT)) {
            Wordnet all = new Wordnet(other, LexiconFilter.ALL);
            assertThat(all.lexicons()).extracting(Lexicon::getId).containsExactly("mini-en", "broken");
            assertThat(all.words("cat")).extracting(Word::getId).containsExactly("mini-en-cat-n");

            Wordnet broken = new Wordnet(other, LexiconFilter.parse("broken"));
            assertThatThrownBy(() -> broken.words("cat")).isInstanceOf(StorageException.class);
        }
    }

    private static Document brokenLexicon() {
        Document doc = new Document();
        doc.add(new StringField(StoreFields.KIND, StoreFields.KIND_LEXICON, Store.NO));
        doc.add(new StringField(StoreFields.ID, "broken", Store.YES));
        doc.add(new StringField(StoreFields.LEXICON, "broken", Store.YES));
        doc.add(new StoredField(StoreFields.JSON,
                "{\"id\":\"broken\",\"label\":\"Broken\",\"language\":\"en\",\"version\":\"1\"}"));
        doc.add(new StoredField(StoreFields.SEQUENCE, 99L));
        doc.add(new NumericDocValuesField(StoreFields.SEQUENCE, 99L));
        return doc;
    }

    private static Document brokenWord() {
        Document doc = new Document();
        doc.add(new StringField(StoreFields.KIND, StoreFields.KIND_WORD, Store.NO));
        doc.add(new StringField(StoreFields.ID, "broken-cat-n", Store.YES));
        doc.add(new StringField(StoreFields.LEXICON, "broken", Store.YES));
        doc.add(new StringField(StoreFields.FORM, "cat", Store.NO));
        doc.add(new StringField(StoreFields.FORM_NORM, "cat", Store.NO));
        doc.add(new StringField(StoreFields.POS, "n", Store.NO));
        doc.add(new StoredField(StoreFields.JSON, "{not json"));
        return doc;
    }
}
