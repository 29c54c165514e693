package io.github.cyfko.boolexpr.core.eval;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.GroupNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonical mapping from identifier letter to bit position.
 * <p>
 * Identifiers are collected from every node of the tree, deduplicated and sorted ascending;
 * the {@code i}-th letter owns bit {@code i} of a pass mask. The same tree always yields the
 * same index, whatever order the letters appear in the source.
 * </p>
 *
 * <pre>{@code
 * IdentifierIndex index = IdentifierIndex.of(parser.parse("c & a | b", true));
 * index.bitOf('a'); // 0
 * index.bitOf('c'); // 2
 * }</pre>
 *
 * @since 1.0
 */
public final class IdentifierIndex {

    private final Map<Character, Integer> bits;
    private final List<Character> identifiers;

    private IdentifierIndex(TreeSet<Character> sorted) {
        Map<Character, Integer> map = new TreeMap<>();
        int bit = 0;
        for (Character identifier : sorted) {
            map.put(identifier, bit++);
        }
        this.bits = Collections.unmodifiableMap(map);
        this.identifiers = List.copyOf(sorted);
    }

    /**
     * Builds the index with a single breadth-first traversal of the tree.
     *
     * @param ast the tree
     * @return the canonical index
     */
    public static IdentifierIndex of(Node ast) {
        TreeSet<Character> found = new TreeSet<>();
        Deque<Node> toVisit = new ArrayDeque<>();
        toVisit.add(ast);

        while (!toVisit.isEmpty()) {
            Node node = toVisit.poll();
            if (node instanceof IdentifierNode identifier) {
                found.add(identifier.name());
            } else if (node instanceof SingleOpNode single) {
                toVisit.add(single.operand());
            } else if (node instanceof DoubleOpNode pair) {
                toVisit.add(pair.left());
                toVisit.add(pair.right());
            } else if (node instanceof GroupNode group) {
                toVisit.add(group.inner());
            }
        }
        return new IdentifierIndex(found);
    }

    /**
     * @param identifier a variable letter
     * @return its bit position
     * @throws IllegalArgumentException if the tree has no such variable
     */
    public int bitOf(char identifier) {
        Integer bit = bits.get(identifier);
        if (bit == null) {
            throw new IllegalArgumentException("Unknown identifier: '" + identifier + "'");
        }
        return bit;
    }

    public boolean contains(char identifier) {
        return bits.containsKey(identifier);
    }

    /**
     * @return identifiers in ascending order, i.e. by bit position
     */
    public List<Character> identifiers() {
        return identifiers;
    }

    public int size() {
        return identifiers.size();
    }

    @Override
    public String toString() {
        return "IdentifierIndex" + bits;
    }
}
