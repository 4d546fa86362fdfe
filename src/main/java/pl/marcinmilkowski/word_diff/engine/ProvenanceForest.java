package pl.marcinmilkowski.word_diff.engine;

import java.util.*;

/**
 * Parent links of every produced {@link Node}, one tree per side rooted at its seed.
 *
 * <p>A node at level {@code n} points at the node at level {@code n - 1} on the same side
 * that produced it first. Nodes are kept in insertion order: by level, then in the order
 * they were first produced.</p>
 */
public final class ProvenanceForest {

    private final Map<Node, Node> parents;
    private final List<Node> nodes;

    private ProvenanceForest(LinkedHashMap<Node, Node> parents) {
        this.parents = Collections.unmodifiableMap(parents);
        this.nodes = List.copyOf(parents.keySet());
    }

    public boolean contains(Node node) {
        return parents.containsKey(node);
    }

    /**
     * Parent of a node, empty for a root.
     *
     * @throws IllegalArgumentException if the node is not in the forest
     */
    public Optional<Node> parent(Node node) {
        if (!parents.containsKey(node)) {
            throw new IllegalArgumentException("Node not in provenance forest: " + node);
        }
        return Optional.ofNullable(parents.get(node));
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Node> nodes(Side side) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.side() == side) {
                result.add(node);
            }
        }
        return result;
    }

    public int size() {
        return nodes.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("ProvenanceForest[%d nodes]", nodes.size());
    }

    /**
     * Collects links during a run. The first link recorded for a node wins.
     */
    public static class Builder {
        private final LinkedHashMap<Node, Node> parents = new LinkedHashMap<>();

        public Builder root(Node node) {
            if (node.level() != 0) {
                throw new IllegalStateException("Root must be at level 0: " + node);
            }
            parents.putIfAbsent(node, null);
            return this;
        }

        public Builder link(Node child, Node parent) {
            if (parent.level() != child.level() - 1 || parent.side() != child.side()) {
                throw new IllegalStateException("Invalid provenance link " + child + " <- " + parent);
            }
            if (!parents.containsKey(child)) {
                parents.put(child, parent);
            }
            return this;
        }

        public ProvenanceForest build() {
            return new ProvenanceForest(new LinkedHashMap<>(parents));
        }
    }
}
