package org.wordnet.lexical.tool.download;

import static com.github.rholder.retry.StopStrategies.stopAfterAttempt;
import static com.github.rholder.retry.WaitStrategies.exponentialWait;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import org.apache.http.HttpHost;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.config.SocketConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wordnet.lexical.common.exception.DownloadException;
import org.wordnet.lexical.common.exception.DownloadTimeoutException;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryListener;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;

/**
 * Utilities for dealing with HttpClient.
 */
public final class HttpClientUtils {
    private static final Logger log = LoggerFactory.getLogger(HttpClientUtils.class);

    /** Configuration name for proxy host. */
    public static final String HTTP_PROXY_PROPERTY = "http.proxyHost";

    /** Configuration name for proxy port. */
    public static final String HTTP_PROXY_PORT_PROPERTY = "http.proxyPort";

    /**
     * How long to delay after a failed download, in milliseconds. Next
     * retries are slower exponentially by 2x.
     */
    public static final int HTTP_RETRY_DELAY = 500;

    /** Longest pause between two attempts, in seconds. */
    private static final int MAX_RETRY_DELAY = 10;

    /**
     * Max number of connection pooled per route.
     */
    public static final int MAX_POOLED_CON_PER_ROUTE = 4;

    /**
     * Max number of connection pooled in total (per http client created).
     */
    public static final int MAX_POOLED_CON_PER_CLIENT = 16;

    private HttpClientUtils() {
        // Uncallable utility constructor
    }

    @Nullable
    public static String getHttpProxyHost() {
        return System.getProperty(HTTP_PROXY_PROPERTY);
    }

    @Nullable
    public static Integer getHttpProxyPort() {
        String p = System.getProperty(HTTP_PROXY_PORT_PROPERTY);
        if (p == null) return null;
        return Integer.valueOf(p);
    }

    /**
     * Retryer running a download exactly {@code attempts} times at most.
     * Only transport failures are retried, a timeout or an abort fails
     * immediately.
     */
    public static <T> Retryer<T> buildDownloadRetryer(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("At least one attempt is needed, got " + attempts);
        }
        return RetryerBuilder.<T>newBuilder()
                .retryIfException(e -> e instanceof DownloadException && !(e instanceof DownloadTimeoutException))
                .withWaitStrategy(exponentialWait(HTTP_RETRY_DELAY, MAX_RETRY_DELAY, TimeUnit.SECONDS))
                .withStopStrategy(stopAfterAttempt(attempts))
                .withRetryListener(new RetryListener() {
                    @Override
                    public <V> void onRetry(Attempt<V> attempt) {
                        if (attempt.hasException()) {
                            log.info("Download failed: {}, attempt {}, will {}",
                                    attempt.getExceptionCause().getMessage(),
                                    attempt.getAttemptNumber(),
                                    attempt.getAttemptNumber() < attempts ? "retry" : "fail");
                        }
                    }
                })
                .build();
    }

    /**
     * Client used to fetch project resources. It never retries on its own,
     * retries are driven by {@link #buildDownloadRetryer(int)}.
     *
     * @param requestTimeout bound on connecting and on each socket read
     */
    public static CloseableHttpClient createHttpClient(Duration requestTimeout, String userAgent) {
        return configureHttpClient(HttpClients.custom(), createConnectionManager(requestTimeout),
                requestTimeout, userAgent).build();
    }

    public static HttpClientBuilder configureHttpClient(HttpClientBuilder httpClientBuilder,
                                                        PoolingHttpClientConnectionManager connectionManager,
                                                        Duration requestTimeout,
                                                        String userAgent) {
        int timeout = Math.toIntExact(requestTimeout.toMillis());
        httpClientBuilder.setConnectionManager(connectionManager)
                .disableAutomaticRetries()
                .disableCookieManagement()
                .setUserAgent(userAgent)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setSocketTimeout(timeout)
                        .setConnectTimeout(timeout)
                        .setConnectionRequestTimeout(timeout)
                        .build());

        String proxyHost = getHttpProxyHost();
        Integer proxyPort = getHttpProxyPort();
        if (proxyHost != null && proxyPort != null) {
            httpClientBuilder.setProxy(new HttpHost(proxyHost, proxyPort));
        }
        return httpClientBuilder;
    }

    private static PoolingHttpClientConnectionManager createConnectionManager(Duration soTimeout) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setDefaultMaxPerRoute(MAX_POOLED_CON_PER_ROUTE);
        connectionManager.setMaxTotal(MAX_POOLED_CON_PER_CLIENT);
        connectionManager.setDefaultSocketConfig(SocketConfig.copy(SocketConfig.DEFAULT)
                .setSoTimeout(Math.toIntExact(soTimeout.toMillis()))
                .build());
        return connectionManager;
    }
}
