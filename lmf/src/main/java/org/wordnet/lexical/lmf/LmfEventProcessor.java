package org.wordnet.lexical.lmf;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.RelationType;
import org.wordnet.lexical.common.exception.LmfParseException;
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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Turns the element events of a WN-LMF document into entities and validates
 * them. Every parsing strategy drives one instance of this class per
 * document, which is how they end up agreeing on the result.
 *
 * <p>Memory use is bounded by the element under construction plus, per
 * lexicon, the set of declared ids, the sense to synset map and the relation
 * targets still to be checked. Cross references are checked when the lexicon
 * closes, before {@link LmfHandler#endLexicon(Lexicon)}.
 */
@NotThreadSafe
public class LmfEventProcessor {
    private static final Logger log = LoggerFactory.getLogger(LmfEventProcessor.class);

    public static final String DEFAULT_LMF_VERSION = "1.0";
    public static final Set<String> SUPPORTED_VERSIONS = ImmutableSet.of("1.0", "1.1", "1.2", "1.3", "1.4");
    private static final Pattern SCHEMA_VERSION = Pattern.compile("WN-LMF-(\\d+\\.\\d+)\\.dtd");

    static final String ROOT = "LexicalResource";

    /** Allowed parents of every known element but the root. */
    private static final SetMultimap<String, String> PARENTS = ImmutableSetMultimap.<String, String>builder()
            .put("Lexicon", ROOT)
            .put("Requires", "Lexicon")
            .put("LexicalEntry", "Lexicon")
            .put("Lemma", "LexicalEntry")
            .put("Form", "LexicalEntry")
            .putAll("Tag", "Lemma", "Form")
            .putAll("Pronunciation", "Lemma", "Form")
            .put("Sense", "LexicalEntry")
            .put("SenseRelation", "Sense")
            .putAll("Example", "Sense", "Synset")
            .put("Count", "Sense")
            .putAll("SyntacticBehaviour", "Lexicon", "LexicalEntry")
            .put("Synset", "Lexicon")
            .put("Definition", "Synset")
            .put("ILIDefinition", "Synset")
            .put("SynsetRelation", "Synset")
            .build();
    /** Known elements whose content isn't part of the document model. */
    private static final Set<String> IGNORED_ELEMENTS = ImmutableSet.of("Requires", "SyntacticBehaviour");
    private static final Set<String> TEXT_ELEMENTS = ImmutableSet.of(
            "Tag", "Pronunciation", "Example", "Count", "Definition", "ILIDefinition");

    private static final Splitter MEMBER_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final double PROGRESS_STEP = 0.01;

    private final ParseOptions options;
    private final LmfHandler handler;
    private final LongSupplier bytesRead;

    private final Deque<String> elements = new ArrayDeque<>();
    private final Deque<String> elementIds = new ArrayDeque<>();
    private int line = -1;
    private int column = -1;

    @Nullable
    private String doctypeSystemId;
    private boolean documentStarted;
    private boolean documentEnded;
    /** Depth inside an unknown or ignored element being skipped, 0 when not skipping. */
    private int skipDepth;
    private double lastProgress;

    @Nullable
    private LexiconState lexicon;
    @Nullable
    private Word.WordBuilder word;
    @Nullable
    private String entryId;
    private boolean lemmaSeen;
    private final List<Sense.SenseBuilder> senses = new ArrayList<>();
    private final List<Integer> senseRanks = new ArrayList<>();
    @Nullable
    private Sense.SenseBuilder sense;
    @Nullable
    private String senseId;
    @Nullable
    private Form.FormBuilder form;
    @Nullable
    private Synset.SynsetBuilder synset;
    @Nullable
    private String synsetId;
    @Nullable
    private List<String> declaredMembers;
    @Nullable
    private Map<String, String> textAttributes;
    @Nullable
    private StringBuilder text;

    public LmfEventProcessor(ParseOptions options, LmfHandler handler, LongSupplier bytesRead) {
        this.options = options;
        this.handler = handler;
        this.bytesRead = bytesRead;
    }

    /**
     * Position of the next event, {@code -1} when the strategy can't tell.
     */
    public void setLocation(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public void doctype(@Nullable String systemId) {
        this.doctypeSystemId = systemId;
    }

    /**
     * @param name local name of the element
     * @param attributes attribute values by local name
     */
    public void startElement(String name, Map<String, String> attributes) {
        if (skipDepth > 0) {
            skipDepth++;
            return;
        }
        if (!documentStarted) {
            startDocument(name);
            push(name, null);
            return;
        }
        if (ROOT.equals(name)) {
            throw error("Nested " + ROOT, name, null);
        }
        if (!PARENTS.containsKey(name)) {
            if (options.isStrict()) {
                throw error("Unknown element " + name, name, null);
            }
            log.debug("Skipping unknown element {} in {}", name, options.getSourceName());
            skipDepth = 1;
            return;
        }
        if (!PARENTS.get(name).contains(elements.peek())) {
            throw error(name + " is not allowed in " + elements.peek(), name, attributes.get("id"));
        }
        if (IGNORED_ELEMENTS.contains(name)) {
            skipDepth = 1;
            return;
        }
        push(name, attributes.get("id"));
        switch (name) {
            case "Lexicon":
                startLexicon(attributes);
                break;
            case "LexicalEntry":
                startEntry(attributes);
                break;
            case "Lemma":
                startLemma(attributes);
                break;
            case "Form":
                startForm(attributes);
                break;
            case "Sense":
                startSense(attributes);
                break;
            case "SenseRelation":
                senseRelation(attributes);
                break;
            case "Synset":
                startSynset(attributes);
                break;
            case "SynsetRelation":
                synsetRelation(attributes);
                break;
            default:
                break;
        }
        if (TEXT_ELEMENTS.contains(name)) {
            text = new StringBuilder();
            textAttributes = attributes;
        }
    }

    public void characters(char[] ch, int start, int length) {
        if (text != null && skipDepth == 0) {
            text.append(ch, start, length);
        }
    }

    public void characters(String chars) {
        if (text != null && skipDepth == 0) {
            text.append(chars);
        }
    }

    public void endElement(String name) {
        if (skipDepth > 0) {
            skipDepth--;
            return;
        }
        switch (name) {
            case "Lexicon":
                endLexicon();
                break;
            case "LexicalEntry":
                endEntry();
                break;
            case "Form":
                word.form(form.build());
                form = null;
                break;
            case "Sense":
                senses.add(sense);
                sense = null;
                senseId = null;
                break;
            case "Synset":
                endSynset();
                break;
            case ROOT:
                endDocument();
                break;
            default:
                if (TEXT_ELEMENTS.contains(name)) {
                    endText(name);
                }
                break;
        }
        elements.pop();
        elementIds.pop();
    }

    /**
     * Called once the strategy has consumed all of its input.
     */
    public void endOfInput() {
        if (!documentEnded) {
            throw error("Premature end of document", elements.isEmpty() ? "#document" : elements.peek(), null);
        }
    }

    private void startDocument(String name) {
        if (!ROOT.equals(name)) {
            throw error("Root element must be " + ROOT + ", not " + name, name, null);
        }
        String version = lmfVersion();
        if (!SUPPORTED_VERSIONS.contains(version)) {
            throw error("Unsupported LMF version " + version, name, null);
        }
        documentStarted = true;
        handler.startDocument(version);
    }

    private String lmfVersion() {
        if (doctypeSystemId == null) {
            return DEFAULT_LMF_VERSION;
        }
        Matcher matcher = SCHEMA_VERSION.matcher(doctypeSystemId);
        return matcher.find() ? matcher.group(1) : DEFAULT_LMF_VERSION;
    }

    private void endDocument() {
        documentEnded = true;
        reportProgress(true);
        handler.endDocument();
    }

    private void startLexicon(Map<String, String> attributes) {
        Lexicon meta = Lexicon.builder()
                .id(required(attributes, "id"))
                .label(required(attributes, "label"))
                .language(required(attributes, "language"))
                .version(required(attributes, "version"))
                .email(attributes.get("email"))
                .license(attributes.get("license"))
                .url(attributes.get("url"))
                .citation(attributes.get("citation"))
                .logo(attributes.get("logo"))
                .build();
        lexicon = new LexiconState(meta);
        log.debug("Parsing lexicon {} from {}", meta.specifier(), options.getSourceName());
        handler.startLexicon(meta);
    }

    private void endLexicon() {
        LexiconState state = lexicon;
        for (Map.Entry<String, String> e : state.senseSynsets.entrySet()) {
            if (!state.synsetIds.contains(e.getValue())) {
                throw lexiconError("Sense refers to unknown synset " + e.getValue(), "Sense", e.getKey());
            }
        }
        for (Map.Entry<String, String> e : state.synsetTargets.entrySet()) {
            if (!state.synsetIds.contains(e.getKey())) {
                throw lexiconError("SynsetRelation targets unknown synset " + e.getKey(), "SynsetRelation", e.getValue());
            }
        }
        for (Map.Entry<String, String> e : state.senseTargets.entrySet()) {
            if (!state.senseSynsets.containsKey(e.getKey()) && !state.synsetIds.contains(e.getKey())) {
                throw lexiconError("SenseRelation targets unknown sense or synset " + e.getKey(), "SenseRelation", e.getValue());
            }
        }
        handler.endLexicon(state.meta);
        lexicon = null;
    }

    private void startEntry(Map<String, String> attributes) {
        String id = required(attributes, "id");
        if (!lexicon.synsetIds.isEmpty()) {
            throw error("LexicalEntry elements must precede Synset elements", "LexicalEntry", id);
        }
        declare(id, "LexicalEntry");
        entryId = id;
        word = Word.builder().id(id).lexicon(lexicon.meta.getId());
        lemmaSeen = false;
        senses.clear();
        senseRanks.clear();
    }

    private void startLemma(Map<String, String> attributes) {
        word.lemma(required(attributes, "writtenForm"))
                .partOfSpeech(partOfSpeech(attributes, "Lemma"))
                .script(attributes.get("script"));
        lemmaSeen = true;
    }

    private void startForm(Map<String, String> attributes) {
        form = Form.builder()
                .id(attributes.get("id"))
                .writtenForm(required(attributes, "writtenForm"))
                .script(attributes.get("script"));
    }

    private void startSense(Map<String, String> attributes) {
        String id = required(attributes, "id");
        String target = required(attributes, "synset");
        declare(id, "Sense");
        lexicon.senseSynsets.put(id, target);
        lexicon.senseEntries.put(id, entryId);
        lexicon.synsetSenses.computeIfAbsent(target, k -> new ArrayList<>(2)).add(id);
        sense = Sense.builder()
                .id(id)
                .lexicon(lexicon.meta.getId())
                .word(entryId)
                .synset(target)
                .adjposition(attributes.get("adjposition"))
                .lexicalized(!"false".equals(attributes.get("lexicalized")));
        senseId = id;
        senseRanks.add(rank(attributes.get("n")));
    }

    private void endEntry() {
        if (!lemmaSeen) {
            throw error("LexicalEntry without Lemma", "LexicalEntry", elementIds.peek());
        }
        Word built = word.build();
        List<Sense> entrySenses = new ArrayList<>(senses.size());
        for (int i = 0; i < senses.size(); i++) {
            Integer declared = senseRanks.get(i);
            entrySenses.add(senses.get(i).rank(declared == null ? i + 1 : declared).build());
        }
        handler.entry(built, entrySenses);
        word = null;
        entryId = null;
        senses.clear();
        senseRanks.clear();
        reportProgress(false);
    }

    private void senseRelation(Map<String, String> attributes) {
        RelationType type = relationType(attributes, "SenseRelation");
        if (options.isStrict() && !type.allowedOnSense()) {
            throw error("Relation " + type.lmfName() + " is not allowed on senses", "SenseRelation", null);
        }
        String target = required(attributes, "target");
        lexicon.senseTargets.putIfAbsent(target, senseId);
        sense.relation(new Relation(type, target));
    }

    private void startSynset(Map<String, String> attributes) {
        String id = required(attributes, "id");
        declare(id, "Synset");
        lexicon.synsetIds.add(id);
        String ili = attributes.get("ili");
        synsetId = id;
        synset = Synset.builder()
                .id(id)
                .lexicon(lexicon.meta.getId())
                .partOfSpeech(partOfSpeech(attributes, "Synset"))
                .ili(ili == null || ili.isEmpty() ? null : ili)
                .lexfile(attributes.get("lexfile"))
                .lexicalized(!"false".equals(attributes.get("lexicalized")));
        String members = attributes.get("members");
        declaredMembers = members == null ? null : MEMBER_SPLITTER.splitToList(members);
    }

    private void synsetRelation(Map<String, String> attributes) {
        RelationType type = relationType(attributes, "SynsetRelation");
        if (options.isStrict() && !type.allowedOnSynset()) {
            throw error("Relation " + type.lmfName() + " is not allowed on synsets", "SynsetRelation", null);
        }
        String target = required(attributes, "target");
        lexicon.synsetTargets.putIfAbsent(target, synsetId);
        synset.relation(new Relation(type, target));
    }

    private void endSynset() {
        synset.members(members(synsetId));
        handler.synset(synset.build());
        synset = null;
        synsetId = null;
        declaredMembers = null;
        reportProgress(false);
    }

    /**
     * Member senses of a synset. Senses of the entries listed in the
     * {@code members} attribute come first, in that order, then any other
     * sense in document order.
     */
    private List<String> members(String id) {
        List<String> appearance = lexicon.synsetSenses.getOrDefault(id, new ArrayList<>());
        if (declaredMembers == null || declaredMembers.isEmpty()) {
            return appearance;
        }
        List<String> ordered = new ArrayList<>(appearance.size());
        List<String> remaining = new ArrayList<>(appearance);
        for (String entry : declaredMembers) {
            if (!lexicon.ids.contains(entry)) {
                throw error("Synset member refers to unknown entry " + entry, "Synset", id);
            }
            for (Iterator<String> it = remaining.iterator(); it.hasNext();) {
                String senseId = it.next();
                if (entry.equals(lexicon.senseEntries.get(senseId))) {
                    ordered.add(senseId);
                    it.remove();
                }
            }
        }
        ordered.addAll(remaining);
        return ordered;
    }

    private void endText(String name) {
        String value = options.isNormalizeText()
                ? CharMatcher.whitespace().trimAndCollapseFrom(text, ' ')
                : text.toString();
        Map<String, String> attributes = textAttributes;
        text = null;
        textAttributes = null;
        String parent = elements.stream().skip(1).findFirst().orElse("");
        switch (name) {
            case "Definition":
                synset.definition(new Definition(value, attributes.get("language"), attributes.get("sourceSense")));
                break;
            case "ILIDefinition":
                synset.iliDefinition(value);
                break;
            case "Example":
                Example example = new Example(value, attributes.get("language"));
                if ("Sense".equals(parent)) {
                    sense.example(example);
                } else {
                    synset.example(example);
                }
                break;
            case "Count":
                try {
                    sense.count(Integer.valueOf(value.trim()));
                } catch (NumberFormatException e) {
                    throw error("Invalid count " + value, name, null);
                }
                break;
            case "Tag":
                Tag tag = new Tag(required(attributes, "category"), value);
                if ("Form".equals(parent)) {
                    form.tag(tag);
                } else {
                    word.tag(tag);
                }
                break;
            case "Pronunciation":
                word.pronunciation(Pronunciation.builder()
                        .value(value)
                        .variety(attributes.get("variety"))
                        .notation(attributes.get("notation"))
                        .phonemic(!"false".equals(attributes.get("phonemic")))
                        .audio(attributes.get("audio"))
                        .build());
                break;
            default:
                break;
        }
    }

    private void declare(String id, String element) {
        if (!lexicon.ids.add(id)) {
            throw error("Duplicate id " + id, element, id);
        }
    }

    @Nullable
    private Integer rank(@Nullable String n) {
        if (n == null) {
            return null;
        }
        try {
            return Integer.valueOf(n);
        } catch (NumberFormatException e) {
            throw error("Invalid sense rank " + n, "Sense", elementIds.peek());
        }
    }

    private PartOfSpeech partOfSpeech(Map<String, String> attributes, String element) {
        String tag = required(attributes, "partOfSpeech");
        PartOfSpeech pos = PartOfSpeech.lookup(tag);
        if (pos == null) {
            throw error("Invalid part of speech " + tag, element, elementIds.peek());
        }
        return pos;
    }

    private RelationType relationType(Map<String, String> attributes, String element) {
        String name = required(attributes, "relType");
        RelationType type = RelationType.lookup(name);
        if (type == null) {
            throw error("Unknown relation type " + name, element, null);
        }
        return type;
    }

    private String required(Map<String, String> attributes, String attribute) {
        String value = attributes.get(attribute);
        if (value == null) {
            String element = elements.peek();
            throw error("Missing required attribute " + attribute, element, attributes.get("id"));
        }
        return value;
    }

    private void push(String name, @Nullable String id) {
        elements.push(name);
        elementIds.push(id == null ? "" : id);
    }

    private void reportProgress(boolean done) {
        if (options.getProgress() == null) {
            return;
        }
        if (done) {
            options.getProgress().accept(1.0);
            return;
        }
        long size = options.getExpectedSize();
        if (size <= 0) {
            return;
        }
        double fraction = Math.min(1.0, (double) bytesRead.getAsLong() / size);
        if (fraction - lastProgress >= PROGRESS_STEP) {
            lastProgress = fraction;
            options.getProgress().accept(fraction);
        }
    }

    /**
     * Slash separated path of the open elements, with ids where known.
     */
    public String path() {
        StringBuilder b = new StringBuilder();
        Iterator<String> names = elements.descendingIterator();
        Iterator<String> ids = elementIds.descendingIterator();
        while (names.hasNext()) {
            if (b.length() > 0) {
                b.append('/');
            }
            b.append(names.next());
            String id = ids.next();
            if (!id.isEmpty()) {
                b.append('[').append(id).append(']');
            }
        }
        return b.length() == 0 ? "/" : b.toString();
    }

    public LmfParseException error(String message, String element, @Nullable String entityId) {
        return new LmfParseException(message, element, entityId, line, column, path());
    }

    /**
     * Wrap a syntax error reported by the underlying XML parser.
     */
    public LmfParseException malformed(String message, int errorLine, int errorColumn, Throwable cause) {
        String element = elements.isEmpty() ? "#document" : elements.peek();
        return new LmfParseException("Malformed XML: " + message, element, null, errorLine, errorColumn, path(), cause);
    }

    private LmfParseException lexiconError(String message, String element, String entityId) {
        return new LmfParseException(message, element, entityId, -1, -1, path());
    }

    private static final class LexiconState {
        final Lexicon meta;
        /** Every id declared in the lexicon: entries, senses and synsets. */
        final Set<String> ids = new HashSet<>();
        final Set<String> synsetIds = new HashSet<>();
        final Map<String, String> senseSynsets = new LinkedHashMap<>();
        final Map<String, String> senseEntries = new HashMap<>();
        final Map<String, List<String>> synsetSenses = new HashMap<>();
        /** Relation target to the first source referring to it. */
        final Map<String, String> synsetTargets = new LinkedHashMap<>();
        final Map<String, String> senseTargets = new LinkedHashMap<>();

        LexiconState(Lexicon meta) {
            this.meta = meta;
        }
    }
}
