package pl.marcinmilkowski.word_diff.paths;

import pl.marcinmilkowski.word_diff.engine.Node;
import pl.marcinmilkowski.word_diff.engine.ProvenanceForest;
import pl.marcinmilkowski.word_diff.engine.Side;

import java.util.*;

/**
 * Reads paths out of a provenance forest.
 *
 * <h2>Inner path</h2>
 * <p>The chain of terms from a side's seed down to a produced node.</p>
 *
 * <h2>Outer path</h2>
 * <p>A bridge between the two seeds. For every side-A inner path and every side-B inner
 * path sharing a term {@code t}:</p>
 * <pre>
 * A = [a, x, t]      B = [b, y, t]
 * fused = A[0..=i(t)] ++ reverse(B[0..j(t)))  =  [a, x, t, y, b]
 * </pre>
 * <p>where {@code i} and {@code j} are the first indices of {@code t}. A pair of paths
 * yields one fused path per distinct shared term; duplicates are dropped. Results keep
 * a stable order: side-A nodes, then side-B nodes, in forest order, then shared terms
 * in side-A path order.</p>
 */
public final class PathReconstructor {

    private PathReconstructor() {
    }

    /**
     * Terms from the root of {@code node}'s tree down to {@code node}.
     *
     * @throws IllegalArgumentException if the node is not in the forest
     */
    public static List<String> innerPath(ProvenanceForest forest, Node node) {
        Deque<String> path = new ArrayDeque<>();
        Optional<Node> current = Optional.of(node);
        while (current.isPresent()) {
            Node n = current.get();
            path.addFirst(n.term());
            current = forest.parent(n);
        }
        return List.copyOf(path);
    }

    /**
     * All fused paths bridging {@code seedA} and {@code seedB}.
     */
    public static Set<List<String>> outerPaths(ProvenanceForest forest, String seedA, String seedB) {
        List<List<String>> pathsA = rootedPaths(forest, Side.A, seedA);
        List<List<String>> pathsB = rootedPaths(forest, Side.B, seedB);

        List<Map<String, Integer>> indexB = new ArrayList<>(pathsB.size());
        for (List<String> path : pathsB) {
            indexB.add(firstIndices(path));
        }

        Set<List<String>> fused = new LinkedHashSet<>();
        for (List<String> pathA : pathsA) {
            Map<String, Integer> indexA = firstIndices(pathA);
            for (int k = 0; k < pathsB.size(); k++) {
                List<String> pathB = pathsB.get(k);
                Map<String, Integer> positionsB = indexB.get(k);
                for (Map.Entry<String, Integer> shared : indexA.entrySet()) {
                    Integer j = positionsB.get(shared.getKey());
                    if (j != null) {
                        fused.add(fuse(pathA, shared.getValue(), pathB, j));
                    }
                }
            }
        }
        return Collections.unmodifiableSet(fused);
    }

    static List<String> fuse(List<String> pathA, int i, List<String> pathB, int j) {
        List<String> result = new ArrayList<>(i + 1 + j);
        result.addAll(pathA.subList(0, i + 1));
        for (int k = j - 1; k >= 0; k--) {
            result.add(pathB.get(k));
        }
        return List.copyOf(result);
    }

    private static List<List<String>> rootedPaths(ProvenanceForest forest, Side side, String seed) {
        List<List<String>> paths = new ArrayList<>();
        for (Node node : forest.nodes(side)) {
            List<String> path = innerPath(forest, node);
            if (path.get(0).equals(seed)) {
                paths.add(path);
            }
        }
        return paths;
    }

    private static Map<String, Integer> firstIndices(List<String> path) {
        Map<String, Integer> indices = new LinkedHashMap<>();
        for (int i = 0; i < path.size(); i++) {
            indices.putIfAbsent(path.get(i), i);
        }
        return indices;
    }
}
