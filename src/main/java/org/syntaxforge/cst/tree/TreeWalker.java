package org.syntaxforge.cst.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing a syntax tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * so that printers and indexers only register the node kinds they care about.
 */
public class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    private final Map<Class<? extends Node>, Consumer<Node>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their handlers. A node is handled by the
     *                 handler of its own class or, failing that, of its nearest registered superclass.
     */
    public TreeWalker(Map<Class<? extends Node>, Consumer<Node>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * Walks a list of nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends Node> nodes) {
        for (Node node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single node and its descendants in document order, parents before children.
     * The children of a composite are read before its handler returns them, so a handler
     * may detach the node it is given.
     * @param node The node to walk.
     */
    public void walk(Node node) {
        if (node == null) {
            return;
        }
        List<Node> children = node instanceof CompositeNode composite ? composite.children() : List.of();
        Consumer<Node> handler = handlerFor(node.getClass());
        if (handler != null) {
            handler.accept(node);
        }
        for (Node child : children) {
            walk(child);
        }
    }

    private Consumer<Node> handlerFor(Class<?> type) {
        for (Class<?> c = type; c != null && Node.class.isAssignableFrom(c); c = c.getSuperclass()) {
            Consumer<Node> handler = handlers.get(c);
            if (handler != null) {
                return handler;
            }
        }
        return null;
    }

    /**
     * Replaces nodes of a tree in place. Each key is swapped for its value through
     * {@link Node#replaceWith(Node)}, so positions and property bindings carry over.
     * @param root The root of the tree to transform.
     * @param replacements A map from current nodes to detached replacements.
     * @return The root after the transformation; the replacement if the root itself was replaced.
     */
    public static Node transform(Node root, Map<Node, Node> replacements) {
        Map<Node, Node> pending = new IdentityHashMap<>(replacements);
        if (pending.containsKey(root) && !root.isAttached()) {
            return pending.get(root);
        }
        List<Node> targets = new ArrayList<>();
        new TreeWalker(Map.of(Node.class, n -> {
            if (pending.containsKey(n)) {
                targets.add(n);
            }
        })).walk(root);

        Node treeRoot = root.getRoot();
        int replaced = 0;
        for (Node target : targets) {
            // A replaced ancestor takes its subtree with it.
            if (target.getRoot() != treeRoot) {
                continue;
            }
            target.replaceWith(pending.get(target));
            replaced++;
        }
        log.debug("Replaced {} of {} requested nodes", replaced, replacements.size());
        return pending.getOrDefault(root, root);
    }

    /**
     * Collects the tokens of a subtree in document order.
     * @param root The subtree to scan.
     * @return All tokens, left to right.
     */
    public static List<TokenNode> collectTokens(Node root) {
        List<TokenNode> tokens = new ArrayList<>();
        new TreeWalker(Map.of(TokenNode.class, n -> tokens.add((TokenNode) n))).walk(root);
        return tokens;
    }
}
