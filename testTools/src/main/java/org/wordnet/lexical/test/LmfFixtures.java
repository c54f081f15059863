package org.wordnet.lexical.test;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.common.io.Resources;

/**
 * WN-LMF documents shared by the test suites.
 *
 * <ul>
 * <li>{@link #MINI_EN}: 8 words, 8 senses, 9 synsets. A small noun
 * hierarchy (entity, animal, carnivore, cat, dog), an antonym pair, a verb,
 * a synset without definition or ILI, a synset without members and one
 * proposing a new ILI entry.
 * <li>{@link #MINI_ES}: 3 words and synsets linked to {@code MINI_EN} through
 * ILI ids.
 * <li>{@link #CAT_FELINE}: two words sensing into one defined synset.
 * <li>{@link #MEMBERS_1_1}: WN-LMF 1.1 with explicit {@code members}, sense
 * {@code n} ranks and whitespace in a definition.
 * </ul>
 */
public final class LmfFixtures {
    public static final String MINI_EN = "mini-en.xml";
    public static final String MINI_ES = "mini-es.xml";
    public static final String CAT_FELINE = "cat-feline.xml";
    public static final String MEMBERS_1_1 = "members-1.1.xml";
    /** Tab separated ILI file in the layout of the CILI project. */
    public static final String ILI_TSV = "ili.tsv";

    public static final String HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<!DOCTYPE LexicalResource SYSTEM \"http://globalwordnet.github.io/schemas/WN-LMF-1.0.dtd\">\n";

    private LmfFixtures() {
        // Utility class
    }

    /**
     * Content of a bundled fixture.
     */
    public static String load(String name) {
        try {
            return Resources.toString(Resources.getResource(LmfFixtures.class, name), UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load fixture " + name, e);
        }
    }

    /**
     * Copy a bundled fixture into a directory, keeping its name.
     */
    public static Path copy(String name, Path directory) throws IOException {
        return write(directory, name, load(name));
    }

    public static Path write(Path directory, String fileName, String content) throws IOException {
        Path file = directory.resolve(fileName);
        Files.createDirectories(directory);
        Files.write(file, content.getBytes(UTF_8));
        return file;
    }

    /**
     * Wrap lexicon content in a {@code test-en} lexicon of a WN-LMF 1.0
     * document.
     */
    public static String lexicon(String body) {
        return HEADER
                + "<LexicalResource>\n"
                + "  <Lexicon id=\"test-en\" label=\"Test\" language=\"en\" email=\"test@example.org\""
                + " license=\"https://creativecommons.org/licenses/by/4.0/\" version=\"1.0\">\n"
                + body
                + "  </Lexicon>\n"
                + "</LexicalResource>\n";
    }

    /** A single noun entry sensing into {@code test-en-1-n}. */
    public static final String ENTRY = "    <LexicalEntry id=\"test-en-cat-n\">\n"
            + "      <Lemma writtenForm=\"cat\" partOfSpeech=\"n\"/>\n"
            + "      <Sense id=\"test-en-cat-n-1\" synset=\"test-en-1-n\"/>\n"
            + "    </LexicalEntry>\n";

    public static final String SYNSET_WITHOUT_POS = lexicon(ENTRY
            + "    <Synset id=\"test-en-1-n\" ili=\"i1\"/>\n");

    public static final String INVALID_POS = lexicon(ENTRY
            + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"x\"/>\n");

    public static final String DANGLING_SENSE = lexicon(ENTRY
            + "    <Synset id=\"test-en-2-n\" partOfSpeech=\"n\"/>\n");

    public static final String DANGLING_RELATION = lexicon(ENTRY
            + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\">\n"
            + "      <SynsetRelation relType=\"hypernym\" target=\"test-en-404-n\"/>\n"
            + "    </Synset>\n");

    public static final String UNKNOWN_RELATION = lexicon(ENTRY
            + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\">\n"
            + "      <SynsetRelation relType=\"hypernymish\" target=\"test-en-1-n\"/>\n"
            + "    </Synset>\n");

    public static final String DUPLICATE_SYNSET = lexicon(ENTRY
            + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\"/>\n"
            + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\"/>\n");

    public static final String UNKNOWN_ELEMENT = lexicon(ENTRY
            + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\">\n"
            + "      <Gloss>not part of WN-LMF</Gloss>\n"
            + "    </Synset>\n");

    public static final String MALFORMED = lexicon(ENTRY
            + "    <Synset id=\"test-en-1-n\" partOfSpeech=\"n\">\n"
            + "      <Definition>unclosed\n"
            + "    </Synset>\n");
}
