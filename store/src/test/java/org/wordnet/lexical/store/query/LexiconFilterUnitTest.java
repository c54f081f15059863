package org.wordnet.lexical.store.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.wordnet.lexical.common.model.Lexicon;

public class LexiconFilterUnitTest {
    private final Lexicon english = Lexicon.builder().id("oewn").version("2024").label("OEWN").language("en").build();
    private final Lexicon spanish = Lexicon.builder().id("omw-es").version("1.4").label("OMW es").language("es").build();
    private final List<Lexicon> installed = Arrays.asList(english, spanish);

    @Test
    public void allByDefault() {
        assertThat(LexiconFilter.parse(null).isAll()).isTrue();
        assertThat(LexiconFilter.parse("  ").isAll()).isTrue();
        assertThat(LexiconFilter.parse("*").isAll()).isTrue();
        assertThat(LexiconFilter.parse("oewn *").isAll()).isTrue();
        assertThat(LexiconFilter.ALL.select(installed)).containsExactly(english, spanish);
    }

    @Test
    public void idsAndVersions() {
        assertThat(LexiconFilter.parse("omw-es").select(installed)).containsExactly(spanish);
        assertThat(LexiconFilter.parse("omw-es:1.4 oewn").select(installed)).containsExactly(english, spanish);
        assertThat(LexiconFilter.parse("oewn:2023").select(installed)).isEmpty();
        assertThat(LexiconFilter.parse("oewn:*").matches(english)).isTrue();
        assertThat(LexiconFilter.parse("unknown").select(installed)).isEmpty();
    }

    @Test
    public void equality() {
        assertThat(LexiconFilter.parse("oewn  omw-es")).isEqualTo(LexiconFilter.of("oewn", "omw-es"));
        assertThat(LexiconFilter.parse("oewn").toString()).isEqualTo("oewn");
    }

    @Test
    public void missingId() {
        assertThatThrownBy(() -> LexiconFilter.parse(":1.0")).isInstanceOf(IllegalArgumentException.class);
    }
}
