package org.wordnet.lexical.common.exception;

import java.net.URI;

import javax.annotation.Nullable;

/**
 * Transport level failure while fetching a project archive.
 */
public class DownloadException extends RetryableException {
    @Nullable
    private final URI uri;

    public DownloadException(String message, @Nullable URI uri, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public DownloadException(String message, @Nullable URI uri) {
        super(message);
        this.uri = uri;
    }

    @Nullable
    public URI getUri() {
        return uri;
    }
}
