package org.wordnet.lexical.common.exception;

import java.net.URI;
import java.time.Duration;

/**
 * The transfer did not complete within the caller supplied timeout, or the
 * caller aborted it.
 */
public class DownloadTimeoutException extends DownloadException {
    public DownloadTimeoutException(URI uri, Duration timeout) {
        super("Download of " + uri + " did not complete within " + timeout, uri);
    }

    public DownloadTimeoutException(URI uri, String reason) {
        super("Download of " + uri + " aborted: " + reason, uri);
    }
}
