package org.syntaxforge.cst.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.syntaxforge.cst.tree.CompositeNode;
import org.syntaxforge.cst.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the structural invariants of a subtree using only the public read API:
 * <ul>
 *     <li>a composite has no head and no tail exactly when its child count is 0,</li>
 *     <li>the forward walk from head visits child-count nodes and ends at tail,
 *         the backward walk from tail is its exact reverse,</li>
 *     <li>every child points back at its parent,</li>
 *     <li>every property binding references a current child.</li>
 * </ul>
 */
public final class TreeVerifier {

    private static final Logger log = LoggerFactory.getLogger(TreeVerifier.class);

    private TreeVerifier() {}

    /**
     * Verifies a subtree.
     * @param root The composite to start from.
     * @return The violations found, empty for a consistent tree.
     */
    public static List<Diagnostic> verify(CompositeNode root) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        verify(root, diagnostics, Collections.newSetFromMap(new IdentityHashMap<>()));
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Verifies a subtree and fails on the first inconsistent state.
     * @param root The composite to start from.
     * @throws IllegalStateException listing all violations, if any.
     */
    public static void assertValid(CompositeNode root) {
        List<Diagnostic> diagnostics = verify(root);
        if (!diagnostics.isEmpty()) {
            String summary = diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
            log.error("Syntax tree invariants violated under {}:\n{}", root.getClass().getSimpleName(), summary);
            throw new IllegalStateException("Syntax tree invariants violated:\n" + summary);
        }
    }

    private static void verify(CompositeNode node, List<Diagnostic> out, Set<Node> visited) {
        if (!visited.add(node)) {
            error(out, node, "node reached twice; the tree contains a cycle");
            return;
        }
        int count = node.getChildCount();
        Optional<Node> head = node.getFirst();
        Optional<Node> tail = node.getLast();

        if ((count == 0) != head.isEmpty() || head.isEmpty() != tail.isEmpty()) {
            error(out, node, String.format("childCount=%d but head %s and tail %s",
                    count, head.isPresent() ? "set" : "absent", tail.isPresent() ? "set" : "absent"));
            return;
        }

        List<Node> forward = new ArrayList<>();
        Node last = null;
        for (Node child = head.orElse(null); child != null; child = child.getNext().orElse(null)) {
            if (forward.size() > count) {
                error(out, node, "forward walk exceeds childCount=" + count);
                return;
            }
            forward.add(child);
            last = child;
        }
        if (forward.size() != count) {
            error(out, node, String.format("forward walk visits %d nodes, childCount=%d", forward.size(), count));
        }
        if (last != tail.orElse(null)) {
            error(out, node, "forward walk does not end at tail");
        }

        List<Node> backward = new ArrayList<>();
        for (Node child = tail.orElse(null); child != null && backward.size() <= count; child = child.getPrevious().orElse(null)) {
            backward.add(child);
        }
        Collections.reverse(backward);
        if (!sameNodes(forward, backward)) {
            error(out, node, "backward walk is not the reverse of the forward walk");
        }

        Set<Node> children = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node child : forward) {
            children.add(child);
            if (child.getParent().orElse(null) != node) {
                error(out, child, "child does not point back at its parent " + node.getClass().getSimpleName());
            }
        }

        for (String name : node.propertyNames()) {
            node.getProperty(name).ifPresent(value -> {
                if (!children.contains(value)) {
                    error(out, node, "property '" + name + "' references a node that is not a child");
                }
            });
            for (Node value : node.getSequence(name)) {
                if (!children.contains(value)) {
                    error(out, node, "sequence '" + name + "' references a node that is not a child");
                }
            }
        }

        for (Node child : forward) {
            if (child instanceof CompositeNode composite) {
                verify(composite, out, visited);
            }
        }
    }

    private static boolean sameNodes(List<Node> a, List<Node> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }

    private static void error(List<Diagnostic> out, Node node, String message) {
        out.add(new Diagnostic(Diagnostic.Type.ERROR, message, node.getSourcePosition()));
    }
}
