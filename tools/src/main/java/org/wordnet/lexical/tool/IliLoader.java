package org.wordnet.lexical.tool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.ContainedException;
import org.wordnet.lexical.common.model.IliEntry;
import org.wordnet.lexical.common.model.IliStatus;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Reads tab separated ILI files in the layout of the CILI project: a header
 * row naming the columns, then one entry per row. Only the {@code ili}
 * column is required, {@code definition} and {@code status} are read when
 * present. A missing or blank status means {@link IliStatus#ACTIVE}.
 */
public final class IliLoader {
    private static final Logger log = LoggerFactory.getLogger(IliLoader.class);

    public static final String TSV_SUFFIX = ".tsv";

    private static final CsvMapper MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CsvSchema.emptySchema()
            .withColumnSeparator('\t')
            .withoutQuoteChar()
            .withoutEscapeChar();

    private IliLoader() {
        // Utility class
    }

    public static boolean isIliFile(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TSV_SUFFIX);
    }

    /**
     * Read every entry of a file.
     *
     * @throws ContainedException if the header has no {@code ili} column or
     *      a row has an unknown status
     */
    public static List<IliEntry> load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            List<IliEntry> entries = load(in, file.toString());
            log.info("Read {} ILI entries from {}", entries.size(), file);
            return entries;
        }
    }

    static List<IliEntry> load(InputStream in, String sourceName) throws IOException {
        List<IliEntry> entries = new ArrayList<>();
        try (MappingIterator<String[]> rows = MAPPER.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(SCHEMA)
                .readValues(in)) {
            if (!rows.hasNextValue()) {
                return entries;
            }
            Map<String, Integer> columns = header(rows.nextValue(), sourceName);
            int ili = columns.get("ili");
            Integer definition = columns.get("definition");
            Integer status = columns.get("status");
            int line = 1;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                line++;
                String id = cell(row, ili);
                if (id == null) {
                    log.debug("Skipping row {} of {} without an ILI id", line, sourceName);
                    continue;
                }
                entries.add(new IliEntry(id,
                        definition == null ? null : cell(row, definition),
                        status == null ? IliStatus.ACTIVE : status(cell(row, status), line, sourceName)));
            }
        }
        return entries;
    }

    private static Map<String, Integer> header(String[] names, String sourceName) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            columns.putIfAbsent(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        if (!columns.containsKey("ili")) {
            throw new ContainedException("No ili column in the header of " + sourceName);
        }
        return columns;
    }

    @Nullable
    private static String cell(String[] row, int column) {
        if (column >= row.length) {
            return null;
        }
        String value = row[column].trim();
        return value.isEmpty() ? null : value;
    }

    private static IliStatus status(@Nullable String value, int line, String sourceName) {
        if (value == null) {
            return IliStatus.ACTIVE;
        }
        try {
            return IliStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ContainedException("Unknown ILI status '" + value + "' on line " + line + " of " + sourceName, e);
        }
    }
}
