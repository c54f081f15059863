package org.wordnet.lexical.lmf;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import org.wordnet.lexical.common.model.Definition;
import org.wordnet.lexical.common.model.Example;
import org.wordnet.lexical.common.model.Form;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Pronunciation;
import org.wordnet.lexical.common.model.Relation;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Tag;
import org.wordnet.lexical.common.model.Word;

import com.google.common.base.Joiner;
import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;

/**
 * Writes the entities it receives as a WN-LMF document. Feeding it the
 * events of a parse reproduces an equivalent document: sense ranks are
 * written as {@code n} and synset member order as {@code members}.
 *
 * <p>Markup is written directly. Carriage returns, and tabs and line feeds in
 * attribute values, go out as character references so a parser reads back
 * the same text.
 *
 * <p>The output stream is flushed but not closed on {@link #endDocument()}.
 */
@NotThreadSafe
public class LmfWriter implements LmfHandler {
    public static final String LMF_VERSION = "1.1";
    public static final String DOCTYPE = "<!DOCTYPE LexicalResource SYSTEM "
            + "\"http://globalwordnet.github.io/schemas/WN-LMF-" + LMF_VERSION + ".dtd\">";
    private static final String DC_NAMESPACE = "https://globalwordnet.github.io/schemas/dc/";
    private static final Joiner SPACE = Joiner.on(' ');
    private static final Escaper TEXT = XmlEscapers.xmlContentEscaper();
    private static final Escaper ATTRIBUTE = XmlEscapers.xmlAttributeEscaper();

    private final Writer writer;
    private final Deque<String> elements = new ArrayDeque<>();
    private boolean startTagOpen;
    /** Entry of every sense written in the current lexicon, to rebuild {@code members}. */
    private final Map<String, String> senseEntries = new HashMap<>();
    private int depth;

    public LmfWriter(OutputStream out) {
        writer = new BufferedWriter(new OutputStreamWriter(out, UTF_8));
    }

    @Override
    public void startDocument(String lmfVersion) {
        try {
            writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
            writer.write(DOCTYPE);
            writer.write('\n');
            startTag("LexicalResource");
            attribute("xmlns:dc", DC_NAMESPACE);
            depth++;
        } catch (IOException e) {
            throw failure(e);
        }
    }

    @Override
    public void startLexicon(Lexicon lexicon) {
        senseEntries.clear();
        try {
            start("Lexicon");
            attribute("id", lexicon.getId());
            attribute("label", lexicon.getLabel());
            attribute("language", lexicon.getLanguage());
            optional("email", lexicon.getEmail());
            optional("license", lexicon.getLicense());
            attribute("version", lexicon.getVersion());
            optional("url", lexicon.getUrl());
            optional("citation", lexicon.getCitation());
            optional("logo", lexicon.getLogo());
        } catch (IOException e) {
            throw failure(e);
        }
    }

    @Override
    public void entry(Word word, List<Sense> senses) {
        try {
            start("LexicalEntry");
            attribute("id", word.getId());

            start("Lemma");
            attribute("writtenForm", word.getLemma());
            attribute("partOfSpeech", word.getPartOfSpeech().tag());
            optional("script", word.getScript());
            for (Pronunciation pronunciation : word.getPronunciations()) {
                pronunciation(pronunciation);
            }
            tags(word.getTags());
            end();

            for (Form form : word.getForms()) {
                start("Form");
                optional("id", form.getId());
                attribute("writtenForm", form.getWrittenForm());
                optional("script", form.getScript());
                tags(form.getTags());
                end();
            }
            for (Sense sense : senses) {
                senseEntries.put(sense.getId(), word.getId());
                sense(sense);
            }
            end();
        } catch (IOException e) {
            throw failure(e);
        }
    }

    private void sense(Sense sense) throws IOException {
        start("Sense");
        attribute("id", sense.getId());
        attribute("synset", sense.getSynset());
        attribute("n", Integer.toString(sense.getRank()));
        optional("adjposition", sense.getAdjposition());
        if (!sense.isLexicalized()) {
            attribute("lexicalized", "false");
        }
        for (Relation relation : sense.getRelations()) {
            relation("SenseRelation", relation);
        }
        for (Example example : sense.getExamples()) {
            example(example);
        }
        for (Integer count : sense.getCounts()) {
            text("Count", count.toString());
        }
        end();
    }

    @Override
    public void synset(Synset synset) {
        try {
            start("Synset");
            attribute("id", synset.getId());
            optional("ili", synset.getIli());
            attribute("partOfSpeech", synset.getPartOfSpeech().tag());
            Set<String> members = new LinkedHashSet<>();
            for (String member : synset.getMembers()) {
                String entry = senseEntries.get(member);
                if (entry != null) {
                    members.add(entry);
                }
            }
            if (!members.isEmpty()) {
                attribute("members", SPACE.join(members));
            }
            optional("lexfile", synset.getLexfile());
            if (!synset.isLexicalized()) {
                attribute("lexicalized", "false");
            }
            for (Definition definition : synset.getDefinitions()) {
                startText("Definition");
                optional("language", definition.getLanguage());
                optional("sourceSense", definition.getSourceSense());
                endText(definition.getText());
            }
            if (synset.getIliDefinition() != null) {
                text("ILIDefinition", synset.getIliDefinition());
            }
            for (Relation relation : synset.getRelations()) {
                relation("SynsetRelation", relation);
            }
            for (Example example : synset.getExamples()) {
                example(example);
            }
            end();
        } catch (IOException e) {
            throw failure(e);
        }
    }

    @Override
    public void endLexicon(Lexicon lexicon) {
        try {
            end();
        } catch (IOException e) {
            throw failure(e);
        }
    }

    @Override
    public void endDocument() {
        try {
            end();
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw failure(e);
        }
    }

    private void pronunciation(Pronunciation pronunciation) throws IOException {
        startText("Pronunciation");
        optional("variety", pronunciation.getVariety());
        optional("notation", pronunciation.getNotation());
        if (!pronunciation.isPhonemic()) {
            attribute("phonemic", "false");
        }
        optional("audio", pronunciation.getAudio());
        endText(pronunciation.getValue());
    }

    private void tags(List<Tag> tags) throws IOException {
        for (Tag tag : tags) {
            startText("Tag");
            attribute("category", tag.getCategory());
            endText(tag.getValue());
        }
    }

    private void relation(String element, Relation relation) throws IOException {
        indent();
        startTag(element);
        attribute("relType", relation.getType().lmfName());
        attribute("target", relation.getTarget());
        endTag();
    }

    private void example(Example example) throws IOException {
        startText("Example");
        optional("language", example.getLanguage());
        endText(example.getText());
    }

    private void text(String element, String value) throws IOException {
        startText(element);
        endText(value);
    }

    private void startText(String element) throws IOException {
        indent();
        startTag(element);
    }

    private void endText(String value) throws IOException {
        characters(escapeText(value));
        endTag();
    }

    private void start(String element) throws IOException {
        indent();
        startTag(element);
        depth++;
    }

    private void end() throws IOException {
        depth--;
        indent();
        endTag();
    }

    private void indent() throws IOException {
        characters("\n");
        for (int i = 0; i < depth; i++) {
            writer.write("  ");
        }
    }

    private void startTag(String element) throws IOException {
        closeStartTag();
        writer.write('<');
        writer.write(element);
        elements.push(element);
        startTagOpen = true;
    }

    /**
     * Closes the innermost element, as an empty element if nothing was
     * written inside it.
     */
    private void endTag() throws IOException {
        String element = elements.pop();
        if (startTagOpen) {
            writer.write("/>");
            startTagOpen = false;
        } else {
            writer.write("</");
            writer.write(element);
            writer.write('>');
        }
    }

    private void characters(String escaped) throws IOException {
        closeStartTag();
        writer.write(escaped);
    }

    private void closeStartTag() throws IOException {
        if (startTagOpen) {
            writer.write('>');
            startTagOpen = false;
        }
    }

    private void attribute(String name, String value) throws IOException {
        writer.write(' ');
        writer.write(name);
        writer.write("=\"");
        writer.write(ATTRIBUTE.escape(value));
        writer.write('"');
    }

    private void optional(String name, @Nullable String value) throws IOException {
        if (value != null) {
            attribute(name, value);
        }
    }

    /**
     * A raw carriage return in content is read back as a line feed.
     */
    static String escapeText(String value) {
        return TEXT.escape(value).replace("\r", "&#xD;");
    }

    private static RuntimeException failure(IOException e) {
        return new UncheckedIOException("Failed to write WN-LMF", e);
    }
}
