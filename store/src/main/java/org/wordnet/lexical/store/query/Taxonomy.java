package org.wordnet.lexical.store.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import org.wordnet.lexical.common.PartOfSpeech;
import org.wordnet.lexical.common.RelationType;
import org.wordnet.lexical.common.model.Synset;

/**
 * Hypernym hierarchy of a {@link Wordnet}: paths, depths and the
 * similarity measures built on them, either alone or weighted by
 * {@link InformationContent}. Hypernyms include instance hypernyms.
 *
 * <p>Lookups are cached for the lifetime of the instance, so it shouldn't
 * outlive a change of the store.
 */
@NotThreadSafe
public class Taxonomy {
    private final Wordnet wordnet;
    private final Map<String, List<Synset>> hypernyms = new HashMap<>();
    private final Map<String, Integer> maxDepths = new HashMap<>();

    Taxonomy(Wordnet wordnet) {
        this.wordnet = wordnet;
    }

    public List<Synset> hypernyms(Synset synset) {
        return hypernyms.computeIfAbsent(key(synset),
                k -> wordnet.related(synset, RelationType.HYPERNYM, RelationType.INSTANCE_HYPERNYM));
    }

    /**
     * Synsets without hypernyms.
     */
    public List<Synset> roots(@Nullable PartOfSpeech pos) {
        List<Synset> roots = new ArrayList<>();
        for (Synset synset : wordnet.synsets(null, pos)) {
            if (hypernyms(synset).isEmpty()) {
                roots.add(synset);
            }
        }
        return roots;
    }

    /**
     * Synsets that are nobody's hypernym.
     */
    public List<Synset> leaves(@Nullable PartOfSpeech pos) {
        List<Synset> leaves = new ArrayList<>();
        for (Synset synset : wordnet.synsets(null, pos)) {
            if (wordnet.related(synset, RelationType.HYPONYM, RelationType.INSTANCE_HYPONYM).isEmpty()) {
                leaves.add(synset);
            }
        }
        return leaves;
    }

    /**
     * Depth of the deepest synset of a part of speech.
     */
    public int taxonomyDepth(PartOfSpeech pos) {
        int depth = 0;
        for (Synset synset : wordnet.synsets(null, pos)) {
            depth = Math.max(depth, maxDepth(synset));
        }
        return depth;
    }

    /**
     * Every path from {@code synset} up to a root. Each path starts with
     * {@code synset} and ends with the root; a root has the single path made
     * of itself.
     */
    public List<List<Synset>> hypernymPaths(Synset synset) {
        List<List<Synset>> paths = new ArrayList<>();
        Deque<Synset> current = new ArrayDeque<>();
        collectPaths(synset, current, new HashSet<>(), paths);
        return paths;
    }

    private void collectPaths(Synset synset, Deque<Synset> current, Set<String> onPath, List<List<Synset>> paths) {
        current.addLast(synset);
        onPath.add(key(synset));
        boolean extended = false;
        for (Synset hypernym : hypernyms(synset)) {
            if (!onPath.contains(key(hypernym))) {
                collectPaths(hypernym, current, onPath, paths);
                extended = true;
            }
        }
        if (!extended) {
            paths.add(new ArrayList<>(current));
        }
        onPath.remove(key(synset));
        current.removeLast();
    }

    /**
     * Number of edges of the shortest path to a root.
     */
    public int minDepth(Synset synset) {
        int depth = Integer.MAX_VALUE;
        for (List<Synset> path : hypernymPaths(synset)) {
            depth = Math.min(depth, path.size() - 1);
        }
        return depth;
    }

    /**
     * Number of edges of the longest path to a root.
     */
    public int maxDepth(Synset synset) {
        Integer cached = maxDepths.get(key(synset));
        if (cached != null) {
            return cached;
        }
        int depth = 0;
        for (List<Synset> path : hypernymPaths(synset)) {
            depth = Math.max(depth, path.size() - 1);
        }
        maxDepths.put(key(synset), depth);
        return depth;
    }

    /**
     * Common hypernyms (each synset counting as its own hypernym) of greatest
     * depth.
     */
    public List<Synset> lowestCommonHypernyms(Synset a, Synset b) {
        Map<String, Synset> common = ancestors(a);
        common.keySet().retainAll(ancestors(b).keySet());
        if (common.isEmpty()) {
            return Collections.emptyList();
        }
        int deepest = -1;
        List<Synset> lowest = new ArrayList<>();
        for (Synset candidate : common.values()) {
            int depth = maxDepth(candidate);
            if (depth > deepest) {
                deepest = depth;
                lowest.clear();
            }
            if (depth == deepest) {
                lowest.add(candidate);
            }
        }
        lowest.sort((x, y) -> x.getId().compareTo(y.getId()));
        return lowest;
    }

    /**
     * Shortest path from {@code a} to {@code b} through a common hypernym,
     * both ends included. Empty when they share no hypernym.
     */
    public List<Synset> shortestPath(Synset a, Synset b) {
        if (key(a).equals(key(b))) {
            return Collections.singletonList(a);
        }
        Map<String, Integer> distancesA = distances(a);
        Map<String, Integer> distancesB = distances(b);
        String best = null;
        int bestLength = Integer.MAX_VALUE;
        for (Map.Entry<String, Integer> entry : distancesA.entrySet()) {
            Integer other = distancesB.get(entry.getKey());
            if (other != null && entry.getValue() + other < bestLength) {
                bestLength = entry.getValue() + other;
                best = entry.getKey();
            }
        }
        if (best == null) {
            return Collections.emptyList();
        }
        List<Synset> up = pathTo(a, best);
        List<Synset> down = pathTo(b, best);
        List<Synset> path = new ArrayList<>(up);
        for (int i = down.size() - 2; i >= 0; i--) {
            path.add(down.get(i));
        }
        return path;
    }

    /**
     * {@code 1 / (edges + 1)} over the shortest path, 0 when there is none.
     *
     * @throws IllegalArgumentException if the parts of speech differ
     */
    public double pathSimilarity(Synset a, Synset b) {
        checkComparable(a, b);
        List<Synset> path = shortestPath(a, b);
        if (path.isEmpty()) {
            return 0;
        }
        return 1.0 / path.size();
    }

    /**
     * Wu-Palmer similarity: {@code 2k / (i + j + 2k)} where {@code k} is the
     * depth of the lowest common hypernym counted in nodes, and {@code i},
     * {@code j} the edges from each synset to it. 0 when there is none.
     *
     * @throws IllegalArgumentException if the parts of speech differ
     */
    public double wupSimilarity(Synset a, Synset b) {
        checkComparable(a, b);
        if (key(a).equals(key(b))) {
            return 1.0;
        }
        List<Synset> lowest = lowestCommonHypernyms(a, b);
        if (lowest.isEmpty()) {
            return 0;
        }
        Synset lcs = lowest.get(0);
        int i = shortestPath(a, lcs).size() - 1;
        int j = shortestPath(b, lcs).size() - 1;
        int k = maxDepth(lcs) + 1;
        return 2.0 * k / (i + j + 2.0 * k);
    }

    /**
     * Leacock-Chodorow similarity: {@code -log((edges + 1) / (2 * depth))}.
     *
     * @param taxonomyDepth depth of the taxonomy, see {@link #taxonomyDepth(PartOfSpeech)}
     * @throws IllegalArgumentException if the parts of speech differ, the
     *      depth isn't positive or there is no path
     */
    public double lchSimilarity(Synset a, Synset b, int taxonomyDepth) {
        checkComparable(a, b);
        if (taxonomyDepth <= 0) {
            throw new IllegalArgumentException("Taxonomy depth must be positive: " + taxonomyDepth);
        }
        List<Synset> path = shortestPath(a, b);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("No path between " + a.getId() + " and " + b.getId());
        }
        return -Math.log(path.size() / (2.0 * taxonomyDepth));
    }

    /**
     * Resnik similarity: the information content of the most informative
     * lowest common hypernym.
     *
     * @throws IllegalArgumentException if the parts of speech differ or
     *      there is no common hypernym
     */
    public double resSimilarity(Synset a, Synset b, InformationContent ic) {
        checkComparable(a, b);
        return ic.informationContent(mostInformativeLcs(a, b, ic));
    }

    /**
     * Jiang-Conrath similarity: {@code 1 / (ic(a) + ic(b) - 2 * ic(lcs))}.
     * 1 for a synset and itself, 0 when the distance isn't positive.
     *
     * @throws IllegalArgumentException if the parts of speech differ or
     *      there is no common hypernym
     */
    public double jcnSimilarity(Synset a, Synset b, InformationContent ic) {
        checkComparable(a, b);
        if (key(a).equals(key(b))) {
            return 1.0;
        }
        double distance = ic.informationContent(a) + ic.informationContent(b)
                - 2 * ic.informationContent(mostInformativeLcs(a, b, ic));
        if (distance <= 0) {
            return 0;
        }
        return 1 / distance;
    }

    /**
     * Lin similarity: {@code 2 * ic(lcs) / (ic(a) + ic(b))}, at most 1.
     *
     * @throws IllegalArgumentException if the parts of speech differ or
     *      there is no common hypernym
     */
    public double linSimilarity(Synset a, Synset b, InformationContent ic) {
        checkComparable(a, b);
        if (key(a).equals(key(b))) {
            return 1.0;
        }
        double lcs = ic.informationContent(mostInformativeLcs(a, b, ic));
        double sum = ic.informationContent(a) + ic.informationContent(b);
        if (sum == 0) {
            return 0;
        }
        return Math.min(1, 2 * lcs / sum);
    }

    private Synset mostInformativeLcs(Synset a, Synset b, InformationContent ic) {
        List<Synset> lowest = lowestCommonHypernyms(a, b);
        if (lowest.isEmpty()) {
            throw new IllegalArgumentException("No common hypernym of " + a.getId() + " and " + b.getId());
        }
        Synset best = lowest.get(0);
        for (Synset candidate : lowest) {
            if (ic.informationContent(candidate) > ic.informationContent(best)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Hypernyms of {@code synset} including itself, keyed by lexicon and id.
     */
    private Map<String, Synset> ancestors(Synset synset) {
        Map<String, Synset> ancestors = new LinkedHashMap<>();
        Deque<Synset> queue = new ArrayDeque<>();
        queue.add(synset);
        while (!queue.isEmpty()) {
            Synset next = queue.removeFirst();
            if (ancestors.putIfAbsent(key(next), next) == null) {
                queue.addAll(hypernyms(next));
            }
        }
        return ancestors;
    }

    /**
     * Edges from {@code synset} to each of its hypernyms, breadth first.
     */
    private Map<String, Integer> distances(Synset synset) {
        Map<String, Integer> distances = new LinkedHashMap<>();
        Deque<Synset> queue = new ArrayDeque<>();
        distances.put(key(synset), 0);
        queue.add(synset);
        while (!queue.isEmpty()) {
            Synset next = queue.removeFirst();
            int distance = distances.get(key(next));
            for (Synset hypernym : hypernyms(next)) {
                if (!distances.containsKey(key(hypernym))) {
                    distances.put(key(hypernym), distance + 1);
                    queue.addLast(hypernym);
                }
            }
        }
        return distances;
    }

    /**
     * A shortest chain of hypernyms from {@code synset} to {@code ancestor},
     * both included.
     */
    private List<Synset> pathTo(Synset synset, String ancestor) {
        Map<String, Synset> previous = new HashMap<>();
        Map<String, Synset> seen = new HashMap<>();
        Deque<Synset> queue = new ArrayDeque<>();
        seen.put(key(synset), synset);
        queue.add(synset);
        Synset found = key(synset).equals(ancestor) ? synset : null;
        while (found == null && !queue.isEmpty()) {
            Synset next = queue.removeFirst();
            for (Synset hypernym : hypernyms(next)) {
                if (seen.putIfAbsent(key(hypernym), hypernym) == null) {
                    previous.put(key(hypernym), next);
                    if (key(hypernym).equals(ancestor)) {
                        found = hypernym;
                        break;
                    }
                    queue.addLast(hypernym);
                }
            }
        }
        List<Synset> path = new ArrayList<>();
        for (Synset step = found; step != null; step = previous.get(key(step))) {
            path.add(0, step);
        }
        return path;
    }

    private static void checkComparable(Synset a, Synset b) {
        PartOfSpeech posA = normalized(a.getPartOfSpeech());
        PartOfSpeech posB = normalized(b.getPartOfSpeech());
        if (posA != posB) {
            throw new IllegalArgumentException("Cannot compare synsets of different parts of speech: "
                    + a.getId() + " (" + a.getPartOfSpeech().tag() + ") and "
                    + b.getId() + " (" + b.getPartOfSpeech().tag() + ")");
        }
    }

    private static PartOfSpeech normalized(PartOfSpeech pos) {
        return pos == PartOfSpeech.ADJECTIVE_SATELLITE ? PartOfSpeech.ADJECTIVE : pos;
    }

    private static String key(Synset synset) {
        return synset.getLexicon() + ' ' + synset.getId();
    }
}
