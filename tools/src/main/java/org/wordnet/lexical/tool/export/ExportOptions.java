package org.wordnet.lexical.tool.export;

import java.nio.file.Path;
import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ExportOptions {
    @Builder.Default
    ExportFormat format = ExportFormat.LMF;
    /** Lexicon specifiers ({@code id} or {@code id:version}) to export, all when empty. */
    @Singular("include")
    List<String> include;
    /** Lexicon specifiers left out, applied after {@link #include}. */
    @Singular("exclude")
    List<String> exclude;
    /** File written by the export, replaced when it exists. */
    @Nullable
    Path output;
}
