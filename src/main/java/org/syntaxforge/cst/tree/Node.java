package org.syntaxforge.cst.tree;

import org.syntaxforge.cst.api.SourcePosition;
import org.syntaxforge.cst.api.TreeErrorCode;
import org.syntaxforge.cst.api.TreeStructureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The base class for all members of a concrete syntax tree.
 * <p>
 * A node only navigates: its parent and siblings are owned by the enclosing
 * {@link CompositeNode}, which is the only class that rewrites these links.
 * Nodes use identity semantics; two nodes with the same text are still different nodes.
 */
public abstract class Node {

    CompositeNode parent;
    Node previous;
    Node next;

    /**
     * Only {@link CompositeNode} and {@link TokenNode} extend this class directly,
     * so every node is either a composite or a leaf token.
     */
    Node() {
    }

    /**
     * @return The composite this node is linked under, empty for a root or detached node.
     */
    public Optional<CompositeNode> getParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * @return The sibling before this node, empty for a first child.
     */
    public Optional<Node> getPrevious() {
        return Optional.ofNullable(previous);
    }

    /**
     * @return The sibling after this node, empty for a last child.
     */
    public Optional<Node> getNext() {
        return Optional.ofNullable(next);
    }

    /**
     * @return {@code true} if this node is linked under a parent.
     */
    public boolean isAttached() {
        return parent != null;
    }

    /**
     * @return The position in the source where this node starts.
     */
    public abstract SourcePosition getSourcePosition();

    /**
     * Returns the exact source text covered by this node.
     */
    @Override
    public abstract String toString();

    /**
     * Same as {@link #toString()}, named for readability at call sites.
     * @return The source text of this node.
     */
    public String getText() {
        return toString();
    }

    /**
     * Appends the source text of this node. Composites override this to avoid
     * building intermediate strings for every level of the tree.
     */
    void appendText(StringBuilder out) {
        out.append(toString());
    }

    // region Navigation

    /**
     * @return The topmost ancestor, or this node if it has no parent.
     */
    public Node getRoot() {
        Node root = this;
        while (root.parent != null) {
            root = root.parent;
        }
        return root;
    }

    /**
     * @return All ancestors, nearest first.
     */
    public List<CompositeNode> ancestors() {
        List<CompositeNode> result = new ArrayList<>();
        for (CompositeNode p = parent; p != null; p = p.parent) {
            result.add(p);
        }
        return result;
    }

    /**
     * Checks whether the given composite is a proper ancestor of this node.
     * @param ancestor The candidate ancestor.
     * @return {@code true} if {@code ancestor} is found on the parent chain.
     */
    public boolean isDescendantOf(CompositeNode ancestor) {
        for (CompositeNode p = parent; p != null; p = p.parent) {
            if (p == ancestor) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds this node or its nearest ancestor that matches the predicate.
     * @param predicate The test to apply.
     * @return The closest match, empty if none.
     */
    public Optional<Node> closest(Predicate<? super Node> predicate) {
        for (Node n = this; n != null; n = n.parent) {
            if (predicate.test(n)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds this node or its nearest ancestor of the given type.
     * @param type The node class to look for.
     * @param <T> The node type.
     * @return The closest match, empty if none.
     */
    public <T extends Node> Optional<T> closest(Class<T> type) {
        return closest(type::isInstance).map(type::cast);
    }

    /**
     * @param type The node class to test against.
     * @return {@code true} if this node is an instance of {@code type}.
     */
    public boolean is(Class<?> type) {
        return type.isInstance(this);
    }

    /**
     * @return The 0-based position among the siblings, or -1 if this node is detached.
     */
    public int index() {
        if (parent == null) {
            return -1;
        }
        int index = 0;
        for (Node n = previous; n != null; n = n.previous) {
            index++;
        }
        return index;
    }

    // endregion

    // region Mutation through the parent

    /**
     * Detaches this node from its parent.
     * @return This node, now detached.
     * @throws TreeStructureException if the node has no parent.
     */
    public Node remove() {
        requireParent().removeChild(this);
        return this;
    }

    /**
     * Puts another node in place of this one, keeping position and property bindings.
     * @param replacement The detached node to put in place.
     * @return The replacement.
     * @throws TreeStructureException if this node has no parent or the replacement is attached.
     */
    public Node replaceWith(Node replacement) {
        requireParent().replaceChild(this, replacement);
        return replacement;
    }

    /**
     * Inserts a detached node as the previous sibling of this node.
     * @param node The node to insert.
     * @return This node.
     */
    public Node insertBefore(Node node) {
        requireParent().insertBeforeChild(this, node);
        return this;
    }

    /**
     * Inserts a detached node as the next sibling of this node.
     * @param node The node to insert.
     * @return This node.
     */
    public Node insertAfter(Node node) {
        requireParent().insertAfterChild(this, node);
        return this;
    }

    private CompositeNode requireParent() {
        if (parent == null) {
            throw new TreeStructureException(TreeErrorCode.NO_PARENT, describe());
        }
        return parent;
    }

    // endregion

    /**
     * Short, non-recursive description for messages and logs.
     * @return The node kind and where it starts.
     */
    public String describe() {
        return getClass().getSimpleName() + "@" + getSourcePosition();
    }
}
