package org.wordnet.lexical.tool.download;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleConsumer;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class DownloadOptions {
    private static final DownloadOptions DEFAULTS = DownloadOptions.builder().build();

    /** Fetch again even when the resource is already cached. */
    boolean force;
    /** Times each url is tried before moving to the next one. */
    @Builder.Default
    int attempts = 1;
    /** Bound on the whole download, the session default when absent. */
    @Nullable
    Duration timeout;
    /** Receives the fraction transferred when the size is announced. */
    @Nullable
    DoubleConsumer progress;
    /** Polled while transferring, the download stops when it turns true. */
    @Nullable
    BooleanSupplier abort;

    public static DownloadOptions defaults() {
        return DEFAULTS;
    }

    boolean isAborted() {
        return abort != null && abort.getAsBoolean();
    }
}
