package org.wordnet.lexical.store.query;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.wordnet.lexical.common.PartOfSpeech;

import com.google.common.collect.ImmutableList;

import edu.mit.jwi.item.POS;
import edu.mit.jwi.morph.IStemmer;
import edu.mit.jwi.morph.SimpleStemmer;

/**
 * English lemmatizer. Candidate base forms come from the WordNet detachment
 * rules and are kept only when they are words of the wordnet. Irregular
 * inflections are found by the store itself since they are indexed as forms
 * of their word.
 */
@ThreadSafe
public class Morphy {
    private static final List<PartOfSpeech> ANALYZED = ImmutableList.of(
            PartOfSpeech.NOUN, PartOfSpeech.VERB, PartOfSpeech.ADJECTIVE, PartOfSpeech.ADVERB);

    /**
     * Noun rules of the WN rule set missing from the classic morphy ones.
     */
    private static final String[][] EXTRA_NOUN_RULES = {
        {"ces", "x"},
        {"ves", "f"},
        {"ives", "ife"},
        {"xes", "xis"},
    };

    private final IStemmer stemmer = new SimpleStemmer();
    private final BiPredicate<String, PartOfSpeech> isWord;

    /**
     * @param isWord whether a form is a word of that part of speech
     */
    public Morphy(BiPredicate<String, PartOfSpeech> isWord) {
        this.isWord = isWord;
    }

    /**
     * Base forms of {@code form} by part of speech. Only parts of speech with
     * at least one base form are present.
     *
     * @param pos restrict the analysis to one part of speech, {@code null}
     *      for all of them
     */
    public Map<PartOfSpeech, Set<String>> analyze(String form, @Nullable PartOfSpeech pos) {
        Map<PartOfSpeech, Set<String>> result = new EnumMap<>(PartOfSpeech.class);
        if (form == null || form.trim().isEmpty()) {
            return result;
        }
        for (PartOfSpeech analyzed : ANALYZED) {
            if (pos != null && !analyzed.matches(pos) && !pos.matches(analyzed)) {
                continue;
            }
            Set<String> lemmas = lemmas(form, analyzed);
            if (!lemmas.isEmpty()) {
                result.put(analyzed, lemmas);
            }
        }
        return result;
    }

    /**
     * Base forms of {@code form} for one part of speech, the form itself
     * first when it is a word.
     */
    public Set<String> lemmas(String form, PartOfSpeech pos) {
        if (form == null || form.trim().isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> lemmas = new LinkedHashSet<>();
        for (String candidate : candidates(form.trim(), pos)) {
            if (isWord.test(candidate, pos)) {
                lemmas.add(candidate);
            }
        }
        return lemmas;
    }

    private Set<String> candidates(String form, PartOfSpeech pos) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(form);
        for (String stem : stemmer.findStems(form, jwiPos(pos))) {
            candidates.add(stem.replace('_', ' '));
        }
        if (pos == PartOfSpeech.NOUN) {
            String lower = form.toLowerCase(Locale.ROOT);
            for (String[] rule : EXTRA_NOUN_RULES) {
                if (lower.endsWith(rule[0])) {
                    candidates.add(lower.substring(0, lower.length() - rule[0].length()) + rule[1]);
                }
            }
        }
        return candidates;
    }

    private static POS jwiPos(PartOfSpeech pos) {
        switch (pos) {
            case NOUN: return POS.NOUN;
            case VERB: return POS.VERB;
            case ADVERB: return POS.ADVERB;
            default: return POS.ADJECTIVE;
        }
    }
}
