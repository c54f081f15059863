package org.wordnet.lexical.lmf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.wordnet.lexical.test.LmfFixtures.CAT_FELINE;
import static org.wordnet.lexical.test.LmfFixtures.MEMBERS_1_1;
import static org.wordnet.lexical.test.LmfFixtures.MINI_EN;
import static org.wordnet.lexical.test.LmfFixtures.MINI_ES;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.wordnet.lexical.test.LmfFixtures;

public class StrategyAgreementUnitTest {
    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    @Test
    public void miniEnglish() throws IOException {
        assertAgree(MINI_EN);
    }

    @Test
    public void miniSpanish() throws IOException {
        assertAgree(MINI_ES);
    }

    @Test
    public void catFeline() throws IOException {
        assertAgree(CAT_FELINE);
    }

    @Test
    public void membersAndRanks() throws IOException {
        assertAgree(MEMBERS_1_1);
    }

    private void assertAgree(String fixture) throws IOException {
        Path file = LmfFixtures.copy(fixture, temp.getRoot().toPath());
        LmfDocument streaming = LmfParsers.forStrategy(ParserStrategy.STREAMING).parse(file, ParseOptions.defaults());
        for (ParserStrategy strategy : ParserStrategy.values()) {
            LmfDocument other = LmfParsers.forStrategy(strategy).parse(file, ParseOptions.defaults());
            assertThat(other.sameEntities(streaming)).as("%s agrees with STREAMING on %s", strategy, fixture).isTrue();
            assertThat(other.getLmfVersion()).isEqualTo(streaming.getLmfVersion());
        }
    }
}
