package org.wordnet.lexical.tool.download;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.DownloadException;
import org.wordnet.lexical.common.exception.DownloadTimeoutException;
import org.wordnet.lexical.tool.IngestionMetrics;
import org.wordnet.lexical.tool.ProjectInfo;

import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.google.common.base.Stopwatch;

/**
 * Fetches project resources into the download cache.
 *
 * <p>A resource is cached as {@code <project>-<version>-<file>}. It is
 * written to a temporary file next to its final path and only moved there
 * once complete, so an interrupted transfer never leaves a partial file
 * where a cached one is expected.
 */
@ThreadSafe
public class Downloader implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Downloader.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final CloseableHttpClient client;
    private final Path downloadDirectory;
    private final Duration defaultTimeout;
    private final IngestionMetrics metrics;

    public Downloader(CloseableHttpClient client, Path downloadDirectory, Duration defaultTimeout,
                      IngestionMetrics metrics) {
        this.client = client;
        this.downloadDirectory = downloadDirectory;
        this.defaultTimeout = defaultTimeout;
        this.metrics = metrics;
    }

    /**
     * Download a project, trying each of its urls in turn.
     *
     * @return the cached file
     * @throws DownloadTimeoutException if the timeout elapsed or the caller
     *      aborted, remaining urls aren't tried
     * @throws DownloadException if every url failed
     */
    public Path download(ProjectInfo project, DownloadOptions options) throws DownloadException {
        if (project.getResourceUrls().isEmpty()) {
            throw new DownloadException("No resource url for " + project.specifier(), null);
        }
        Duration timeout = options.getTimeout() != null ? options.getTimeout() : defaultTimeout;
        Stopwatch stopwatch = Stopwatch.createStarted();
        DownloadException last = null;
        for (URI url : project.getResourceUrls()) {
            Path destination = cachePath(project, url);
            if (Files.isRegularFile(destination) && !options.isForce()) {
                log.info("Using cached {} for {}", destination, project.specifier());
                return destination;
            }
            try {
                Path downloaded = fetchWithRetries(url, destination, options, stopwatch, timeout);
                log.info("Downloaded {} from {} in {}", project.specifier(), url, stopwatch);
                return downloaded;
            } catch (DownloadTimeoutException e) {
                throw e;
            } catch (DownloadException e) {
                log.warn("Failed to download {} from {}: {}", project.specifier(), url, e.getMessage());
                last = e;
            }
        }
        throw new DownloadException("Failed to download " + project.specifier() + " from all sources: "
                + last.getMessage(), last.getUri(), last);
    }

    /**
     * Where a resource of a project is cached.
     */
    public Path cachePath(ProjectInfo project, URI url) {
        String path = url.getPath();
        String file = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        if (file.isEmpty()) {
            file = "resource";
        }
        return downloadDirectory.resolve(project.getId() + "-" + project.getVersion() + "-" + file);
    }

    private Path fetchWithRetries(URI url, Path destination, DownloadOptions options,
                                  Stopwatch stopwatch, Duration timeout) throws DownloadException {
        Retryer<Path> retryer = HttpClientUtils.buildDownloadRetryer(options.getAttempts());
        try {
            return retryer.call(() -> fetch(url, destination, options, stopwatch, timeout));
        } catch (ExecutionException e) {
            throw unwrap(url, e.getCause());
        } catch (RetryException e) {
            throw unwrap(url, e.getLastFailedAttempt().getExceptionCause());
        }
    }

    private Path fetch(URI url, Path destination, DownloadOptions options,
                       Stopwatch stopwatch, Duration timeout) throws DownloadException {
        checkTime(url, options, stopwatch, timeout);
        HttpGet get = new HttpGet(url);
        int remaining = Math.toIntExact(Math.max(1, timeout.minus(stopwatch.elapsed()).toMillis()));
        get.setConfig(RequestConfig.custom()
                .setConnectTimeout(remaining)
                .setConnectionRequestTimeout(remaining)
                .setSocketTimeout(remaining)
                .build());

        Path temp = null;
        try {
            Files.createDirectories(downloadDirectory);
            temp = Files.createTempFile(downloadDirectory, destination.getFileName().toString(), ".part");
            try (CloseableHttpResponse response = client.execute(get)) {
                int status = response.getStatusLine().getStatusCode();
                if (status != HttpStatus.SC_OK) {
                    throw new DownloadException("Failed to download " + url + ": " + status + " "
                            + response.getStatusLine().getReasonPhrase(), url);
                }
                HttpEntity entity = response.getEntity();
                if (entity == null) {
                    throw new DownloadException("Empty response from " + url, url);
                }
                long expected = entity.getContentLength();
                long received;
                try (InputStream in = entity.getContent();
                     OutputStream out = Files.newOutputStream(temp)) {
                    received = copy(get, in, out, expected, options, stopwatch, timeout);
                }
                if (expected >= 0 && received != expected) {
                    throw new DownloadException("Truncated download from " + url + ": received " + received
                            + " of " + expected + " bytes", url);
                }
                metrics.downloaded(received);
            }
            Files.move(temp, destination, REPLACE_EXISTING, ATOMIC_MOVE);
            return destination;
        } catch (InterruptedIOException e) {
            get.abort();
            throw new DownloadTimeoutException(url, timeout);
        } catch (IOException e) {
            get.abort();
            throw new DownloadException("Failed to download " + url + ": " + e.getMessage(), url, e);
        } finally {
            deleteTemp(temp);
        }
    }

    /**
     * Copy the body, aborting the request when out of time so that closing
     * the response doesn't drain the rest of it.
     */
    private static long copy(HttpGet get, InputStream in, OutputStream out, long expected, DownloadOptions options,
                             Stopwatch stopwatch, Duration timeout) throws IOException, DownloadTimeoutException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long received = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            received += read;
            if (options.getProgress() != null && expected > 0) {
                options.getProgress().accept((double) received / expected);
            }
            try {
                checkTime(get.getURI(), options, stopwatch, timeout);
            } catch (DownloadTimeoutException e) {
                get.abort();
                throw e;
            }
        }
        return received;
    }

    private static void checkTime(URI url, DownloadOptions options, Stopwatch stopwatch, Duration timeout)
            throws DownloadTimeoutException {
        if (options.isAborted()) {
            throw new DownloadTimeoutException(url, "aborted by caller");
        }
        if (stopwatch.elapsed().compareTo(timeout) >= 0) {
            throw new DownloadTimeoutException(url, timeout);
        }
    }

    private static DownloadException unwrap(URI url, Throwable cause) {
        if (cause instanceof DownloadException) {
            return (DownloadException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        return new DownloadException("Failed to download " + url, url, cause);
    }

    private static void deleteTemp(@Nullable Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Unable to delete partial download {}", temp, e);
        }
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
