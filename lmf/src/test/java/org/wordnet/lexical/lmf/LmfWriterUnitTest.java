package org.wordnet.lexical.lmf;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.wordnet.lexical.test.LmfFixtures.CAT_FELINE;
import static org.wordnet.lexical.test.LmfFixtures.MEMBERS_1_1;
import static org.wordnet.lexical.test.LmfFixtures.MINI_EN;
import static org.wordnet.lexical.test.LmfFixtures.load;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.junit.Test;

public class LmfWriterUnitTest {
    private final LmfParser parser = new StaxLmfParser();

    @Test
    public void miniEnglishRoundTrips() throws IOException {
        assertRoundTrip(MINI_EN);
    }

    @Test
    public void memberOrderRanksAndWhitespaceRoundTrip() throws IOException {
        assertRoundTrip(MEMBERS_1_1);
    }

    @Test
    public void writesTheLatestSupportedDoctype() throws IOException {
        String written = write(CAT_FELINE);

        assertThat(written).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        assertThat(written).contains(LmfWriter.DOCTYPE);
        assertThat(written).contains("members=\"test-en-cat-n test-en-feline-n\"");
        assertThat(written).contains("<Sense id=\"test-en-cat-n-1\" synset=\"test-en-0001-n\" n=\"1\"");
    }

    @Test
    public void escapesText() throws IOException {
        String document = load(CAT_FELINE).replace("a small domesticated", "a &lt;small&gt; &amp; domesticated");
        LmfDocument parsed = parse(document.getBytes(UTF_8));
        assertThat(parsed.getSynsets().get(0).getDefinition())
                .hasValueSatisfying(d -> assertThat(d).startsWith("a <small> & domesticated"));

        LmfDocument reparsed = parse(write(document.getBytes(UTF_8)));
        assertThat(reparsed.sameEntities(parsed)).isTrue();
    }

    @Test
    public void keepsControlWhitespace() throws IOException {
        String document = load(CAT_FELINE)
                .replace("writtenForm=\"feline\"", "writtenForm=\"fe&#9;li&#10;ne&#13;\"")
                .replace("a small domesticated", "a small&#13;domesticated");
        LmfDocument parsed = parse(document.getBytes(UTF_8));
        assertThat(parsed.getWords().get(1).getLemma()).isEqualTo("fe\tli\nne\r");
        assertThat(parsed.getSynsets().get(0).getDefinition())
                .hasValueSatisfying(d -> assertThat(d).startsWith("a small\rdomesticated"));

        byte[] written = write(document.getBytes(UTF_8));
        assertThat(new String(written, UTF_8)).contains("writtenForm=\"fe&#x9;li&#xA;ne&#xD;\"");

        LmfDocument reparsed = parse(written);
        assertThat(reparsed.getWords().get(1).getLemma()).isEqualTo("fe\tli\nne\r");
        assertThat(reparsed.sameEntities(parsed)).isTrue();
    }

    @Test
    public void escapesCarriageReturnsInText() {
        assertThat(LmfWriter.escapeText("a\r\nb <c>")).isEqualTo("a&#xD;\nb &lt;c&gt;");
    }

    private void assertRoundTrip(String fixture) throws IOException {
        byte[] original = load(fixture).getBytes(UTF_8);
        LmfDocument expected = parse(original);
        LmfDocument actual = parse(write(original));

        assertThat(actual.sameEntities(expected)).isTrue();
        assertThat(actual.getLmfVersion()).isEqualTo(LmfWriter.LMF_VERSION);
    }

    private String write(String fixture) throws IOException {
        return new String(write(load(fixture).getBytes(UTF_8)), UTF_8);
    }

    private byte[] write(byte[] document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        parser.parse(new ByteArrayInputStream(document), ParseOptions.defaults(), new LmfWriter(out));
        return out.toByteArray();
    }

    private LmfDocument parse(byte[] document) throws IOException {
        DocumentCollector collector = new DocumentCollector();
        parser.parse(new ByteArrayInputStream(document), ParseOptions.defaults(), collector);
        return collector.getDocument();
    }
}
