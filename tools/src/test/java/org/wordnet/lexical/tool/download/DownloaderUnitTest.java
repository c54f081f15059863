package org.wordnet.lexical.tool.download;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.wordnet.lexical.common.exception.DownloadException;
import org.wordnet.lexical.common.exception.DownloadTimeoutException;
import org.wordnet.lexical.tool.IngestionMetrics;
import org.wordnet.lexical.tool.ProjectInfo;

import com.codahale.metrics.MetricRegistry;
import com.github.tomakehurst.wiremock.core.Options;
import com.github.tomakehurst.wiremock.junit.WireMockRule;

public class DownloaderUnitTest {
    private static final byte[] BODY = "<LexicalResource/>".getBytes(UTF_8);

    @Rule
    public WireMockRule wireMockRule = new WireMockRule(wireMockConfig().dynamicPort()
            .useChunkedTransferEncoding(Options.ChunkedEncodingPolicy.NEVER));
    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private final MetricRegistry metricRegistry = new MetricRegistry();
    private Path downloads;
    private Downloader downloader;

    @Before
    public void createDownloader() {
        downloads = temp.getRoot().toPath().resolve("downloads");
        downloader = new Downloader(HttpClientUtils.createHttpClient(Duration.ofSeconds(5), "tests"),
                downloads, Duration.ofSeconds(5), new IngestionMetrics(metricRegistry));
    }

    @After
    public void closeDownloader() throws IOException {
        downloader.close();
    }

    @Test
    public void downloadsIntoTheCache() throws DownloadException {
        stubFor(get("/mini-en.xml").willReturn(aResponse().withStatus(200).withBody(BODY)));

        Path downloaded = downloader.download(project("/mini-en.xml"), DownloadOptions.defaults());

        assertThat(downloaded).isEqualTo(downloads.resolve("mini-en-1.0-mini-en.xml"));
        assertThat(downloaded).hasBinaryContent(BODY);
        assertThat(metricRegistry.meter("download-bytes").getCount()).isEqualTo(BODY.length);
        assertThat(partialFiles()).isEmpty();
    }

    @Test
    public void cachedDownloadsAreReusedUnlessForced() throws DownloadException {
        stubFor(get("/mini-en.xml").willReturn(aResponse().withStatus(200).withBody(BODY)));
        ProjectInfo project = project("/mini-en.xml");

        downloader.download(project, DownloadOptions.defaults());
        downloader.download(project, DownloadOptions.defaults());
        verify(1, getRequestedFor(urlEqualTo("/mini-en.xml")));

        downloader.download(project, DownloadOptions.builder().force(true).build());
        verify(2, getRequestedFor(urlEqualTo("/mini-en.xml")));
    }

    @Test
    public void failuresAreNotRetriedByDefault() {
        stubFor(get("/broken.xml").willReturn(aResponse().withStatus(500)));

        assertThatThrownBy(() -> downloader.download(project("/broken.xml"), DownloadOptions.defaults()))
                .isInstanceOf(DownloadException.class)
                .isNotInstanceOf(DownloadTimeoutException.class)
                .hasMessageContaining("500");
        verify(1, getRequestedFor(urlEqualTo("/broken.xml")));
        assertThat(downloads.resolve("mini-en-1.0-broken.xml")).doesNotExist();
    }

    @Test
    public void retriesAsManyTimesAsRequested() {
        stubFor(get("/broken.xml").willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> downloader.download(project("/broken.xml"),
                DownloadOptions.builder().attempts(2).build()))
                .isInstanceOf(DownloadException.class);
        verify(2, getRequestedFor(urlEqualTo("/broken.xml")));
    }

    @Test
    public void fallsBackToTheNextUrl() throws DownloadException {
        stubFor(get("/missing.xml").willReturn(aResponse().withStatus(404)));
        stubFor(get("/mirror.xml").willReturn(aResponse().withStatus(200).withBody(BODY)));

        Path downloaded = downloader.download(project("/missing.xml", "/mirror.xml"), DownloadOptions.defaults());

        assertThat(downloaded.getFileName().toString()).isEqualTo("mini-en-1.0-mirror.xml");
        assertThat(downloaded).hasBinaryContent(BODY);
    }

    @Test
    public void timeoutLeavesNoFile() {
        stubFor(get("/slow.xml").willReturn(aResponse().withStatus(200).withBody(BODY).withFixedDelay(2000)));

        assertThatThrownBy(() -> downloader.download(project("/slow.xml", "/never-tried.xml"),
                DownloadOptions.builder().timeout(Duration.ofMillis(200)).attempts(3).build()))
                .isInstanceOf(DownloadTimeoutException.class);

        assertThat(downloads.resolve("mini-en-1.0-slow.xml")).doesNotExist();
        assertThat(partialFiles()).isEmpty();
        verify(1, getRequestedFor(urlEqualTo("/slow.xml")));
        verify(0, getRequestedFor(urlEqualTo("/never-tried.xml")));
    }

    @Test
    public void abortStopsTheDownload() {
        stubFor(get("/mini-en.xml").willReturn(aResponse().withStatus(200).withBody(BODY)));

        assertThatThrownBy(() -> downloader.download(project("/mini-en.xml"),
                DownloadOptions.builder().abort(() -> true).build()))
                .isInstanceOf(DownloadTimeoutException.class)
                .hasMessageContaining("aborted");
        assertThat(downloads.resolve("mini-en-1.0-mini-en.xml")).doesNotExist();
    }

    @Test
    public void reportsProgress() throws DownloadException {
        stubFor(get("/mini-en.xml").willReturn(aResponse().withStatus(200).withBody(BODY)));
        List<Double> progress = new ArrayList<>();

        downloader.download(project("/mini-en.xml"), DownloadOptions.builder().progress(progress::add).build());

        assertThat(progress).isNotEmpty();
        assertThat(progress.get(progress.size() - 1)).isEqualTo(1.0);
    }

    private ProjectInfo project(String... paths) {
        ProjectInfo.ProjectInfoBuilder builder = ProjectInfo.builder().id("mini-en").version("1.0");
        for (String path : paths) {
            builder.resourceUrl(URI.create("http://localhost:" + wireMockRule.port() + path));
        }
        return builder.build();
    }

    private List<Path> partialFiles() {
        if (!Files.isDirectory(downloads)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(downloads)) {
            List<Path> partial = new ArrayList<>();
            files.filter(f -> f.getFileName().toString().endsWith(".part")).forEach(partial::add);
            return partial;
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }
}
