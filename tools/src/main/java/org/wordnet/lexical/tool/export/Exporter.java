package org.wordnet.lexical.tool.export;

import static org.wordnet.lexical.common.MapperUtils.getObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.model.Example;
import org.wordnet.lexical.common.model.Lexicon;
import org.wordnet.lexical.common.model.Sense;
import org.wordnet.lexical.common.model.Synset;
import org.wordnet.lexical.common.model.Word;
import org.wordnet.lexical.lmf.LmfWriter;
import org.wordnet.lexical.store.LexicalStore;
import org.wordnet.lexical.store.StoreReader;
import org.wordnet.lexical.store.query.LexiconFilter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import lombok.Value;

/**
 * Serializes installed lexicons. Reads one snapshot of the store and never
 * writes to it.
 */
public class Exporter {
    private static final Logger log = LoggerFactory.getLogger(Exporter.class);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema CSV_SCHEMA = CSV_MAPPER.schemaFor(CsvRow.class).withHeader();

    private final LexicalStore store;
    private final Clock clock;

    public Exporter(LexicalStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Write the selected lexicons to {@code out}, which is left open. A CSV
     * export always starts with its header row, even when nothing is selected.
     *
     * @return the exported lexicons, in installation order
     */
    public List<Lexicon> export(ExportOptions options, OutputStream out) throws IOException {
        try (StoreReader reader = store.reader()) {
            List<Lexicon> lexicons = select(reader.lexicons(), options);
            switch (options.getFormat()) {
                case LMF:
                    writeLmf(reader, lexicons, out);
                    break;
                case JSON:
                    writeJson(reader, lexicons, out);
                    break;
                case CSV:
                    writeCsv(reader, lexicons, out);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported export format: " + options.getFormat());
            }
            out.flush();
            log.info("Exported {} lexicons as {}", lexicons.size(), options.getFormat());
            return lexicons;
        }
    }

    static List<Lexicon> select(List<Lexicon> installed, ExportOptions options) {
        LexiconFilter include = options.getInclude().isEmpty()
                ? LexiconFilter.ALL
                : LexiconFilter.parse(String.join(" ", options.getInclude()));
        LexiconFilter exclude = options.getExclude().isEmpty()
                ? null
                : LexiconFilter.parse(String.join(" ", options.getExclude()));
        return installed.stream()
                .filter(include::matches)
                .filter(lexicon -> exclude == null || !exclude.matches(lexicon))
                .collect(Collectors.toList());
    }

    private static void writeLmf(StoreReader reader, List<Lexicon> lexicons, OutputStream out) throws IOException {
        LmfWriter writer = new LmfWriter(out);
        writer.startDocument(LmfWriter.LMF_VERSION);
        for (Lexicon lexicon : lexicons) {
            writer.startLexicon(lexicon);
            for (Word word : reader.words(lexicon.getId())) {
                writer.entry(word, reader.sensesOfWord(word.getId(), lexicon.getId()));
            }
            for (Synset synset : reader.synsets(lexicon.getId(), null)) {
                writer.synset(synset);
            }
            writer.endLexicon(lexicon);
        }
        writer.endDocument();
    }

    private void writeJson(StoreReader reader, List<Lexicon> lexicons, OutputStream out) throws IOException {
        try (JsonGenerator json = getObjectMapper().getFactory().createGenerator(out)) {
            json.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            json.useDefaultPrettyPrinter();
            json.writeStartObject();
            json.writeStringField("format", "json");
            json.writeStringField("exportDate", clock.instant().toString());
            json.writeArrayFieldStart("lexicons");
            for (Lexicon lexicon : lexicons) {
                String id = lexicon.getId();
                json.writeStartObject();
                json.writeObjectField("lexicon", lexicon);
                writeArray(json, "words", reader.words(id));
                writeArray(json, "senses", reader.senses(id));
                writeArray(json, "synsets", reader.synsets(id, null));
                json.writeEndObject();
            }
            json.writeEndArray();
            json.writeEndObject();
        }
    }

    private static void writeArray(JsonGenerator json, String name, List<?> values) throws IOException {
        json.writeArrayFieldStart(name);
        for (Object value : values) {
            json.writeObject(value);
        }
        json.writeEndArray();
    }

    private static void writeCsv(StoreReader reader, List<Lexicon> lexicons, OutputStream out) throws IOException {
        try (SequenceWriter rows = CSV_MAPPER.writer(CSV_SCHEMA)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(out)) {
            for (Lexicon lexicon : lexicons) {
                String id = lexicon.getId();
                Map<String, Synset> synsets = reader.synsets(id, null).stream()
                        .collect(Collectors.toMap(Synset::getId, Function.identity()));
                for (Word word : reader.words(id)) {
                    for (Sense sense : reader.sensesOfWord(word.getId(), id)) {
                        Synset synset = synsets.get(sense.getSynset());
                        rows.write(new CsvRow("sense", sense.getId(), word.getLemma(),
                                word.getPartOfSpeech().tag(), lexicon.getLanguage(), id,
                                synset == null ? null : synset.getDefinition().orElse(null),
                                firstExample(sense, synset)));
                    }
                }
            }
        }
    }

    @Nullable
    private static String firstExample(Sense sense, @Nullable Synset synset) {
        if (!sense.getExamples().isEmpty()) {
            return sense.getExamples().get(0).getText();
        }
        if (synset != null && !synset.getExamples().isEmpty()) {
            Example example = synset.getExamples().get(0);
            return example.getText();
        }
        return null;
    }

    @Value
    @JsonPropertyOrder({"Type", "ID", "Lemma", "PartOfSpeech", "Language", "Lexicon", "Definition", "Example"})
    static class CsvRow {
        @JsonProperty("Type")
        String type;
        @JsonProperty("ID")
        String id;
        @JsonProperty("Lemma")
        String lemma;
        @JsonProperty("PartOfSpeech")
        String partOfSpeech;
        @JsonProperty("Language")
        String language;
        @JsonProperty("Lexicon")
        String lexicon;
        @Nullable
        @JsonProperty("Definition")
        String definition;
        @Nullable
        @JsonProperty("Example")
        String example;
    }
}
