package org.syntaxforge.cst.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.syntaxforge.cst.api.SourcePosition;
import org.syntaxforge.cst.api.TreeErrorCode;
import org.syntaxforge.cst.api.TreeStructureException;
import org.syntaxforge.cst.config.BindingUpdate;
import org.syntaxforge.cst.config.TreeOptions;
import org.syntaxforge.cst.diagnostics.TreeVerifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A tree node that owns an ordered list of children.
 * <p>
 * Children form a doubly-linked sibling chain between {@code head} and {@code tail}.
 * In addition, children can be bound to names ("properties") so that callers reach
 * semantic parts of a construct, such as the condition of an if-statement, without
 * counting positions. Every public operation keeps the chain, the parent links, the
 * head/tail cache and the property bindings consistent, and validates its arguments
 * before touching any of them.
 * <p>
 * Instances are not thread-safe.
 */
public class CompositeNode extends Node {

    private static final Logger log = LoggerFactory.getLogger(CompositeNode.class);

    private Node head;
    private Node tail;
    private int childCount;
    private final Map<String, Binding> properties = new LinkedHashMap<>();

    // region Read API

    /**
     * @return The number of direct children.
     */
    public int getChildCount() {
        return childCount;
    }

    /**
     * @return {@code true} if this node has no children.
     */
    public boolean isEmpty() {
        return childCount == 0;
    }

    /**
     * @return The first child, empty if there are no children.
     */
    public Optional<Node> getFirst() {
        return Optional.ofNullable(head);
    }

    /**
     * @return The last child, empty if there are no children.
     */
    public Optional<Node> getLast() {
        return Optional.ofNullable(tail);
    }

    /**
     * Returns the child at the given position, walking from the nearer end of the chain.
     * @param index The 0-based position.
     * @return The child.
     * @throws IndexOutOfBoundsException if there is no child at {@code index}.
     */
    public Node getChild(int index) {
        Objects.checkIndex(index, childCount);
        if (index < childCount / 2) {
            Node child = head;
            for (int i = 0; i < index; i++) {
                child = child.next;
            }
            return child;
        }
        Node child = tail;
        for (int i = childCount - 1; i > index; i--) {
            child = child.previous;
        }
        return child;
    }

    /**
     * @return A snapshot of the direct children in document order.
     */
    public List<Node> children() {
        List<Node> result = new ArrayList<>(childCount);
        for (Node child = head; child != null; child = child.next) {
            result.add(child);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the direct children of the given type, in document order. Does not descend.
     * @param type The node class to match.
     * @param <T> The node type.
     * @return The matching children.
     */
    public <T extends Node> List<T> filter(Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (Node child = head; child != null; child = child.next) {
            if (type.isInstance(child)) {
                matches.add(type.cast(child));
            }
        }
        return matches;
    }

    /**
     * Returns the direct children accepted by the predicate, in document order. Does not descend.
     * @param predicate The test to apply.
     * @return The matching children.
     */
    public List<Node> filter(Predicate<? super Node> predicate) {
        List<Node> matches = new ArrayList<>();
        for (Node child = head; child != null; child = child.next) {
            if (predicate.test(child)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Finds this node and all descendants of the given type, pre-order, in document order.
     * @param type The node class to match.
     * @param <T> The node type.
     * @return The matching nodes, each listed once.
     */
    public <T extends Node> List<T> find(Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (Node match : find(type::isInstance)) {
            matches.add(type.cast(match));
        }
        return matches;
    }

    /**
     * Finds this node and all descendants accepted by the predicate, pre-order, in document order.
     * @param predicate The test to apply.
     * @return The matching nodes, each listed once.
     */
    public List<Node> find(Predicate<? super Node> predicate) {
        List<Node> matches = new ArrayList<>();
        collectMatches(predicate, matches);
        return matches;
    }

    private void collectMatches(Predicate<? super Node> predicate, List<Node> matches) {
        if (predicate.test(this)) {
            matches.add(this);
        }
        for (Node child = head; child != null; child = child.next) {
            if (child instanceof CompositeNode composite) {
                composite.collectMatches(predicate, matches);
            } else if (predicate.test(child)) {
                matches.add(child);
            }
        }
    }

    /**
     * Returns the leftmost token of this subtree by following first children.
     * @return The first token in document order.
     * @throws TreeStructureException with {@link TreeErrorCode#EMPTY_SUBTREE} if a composite
     *         without children is reached on the way down.
     */
    public TokenNode getFirstToken() {
        Node current = this;
        while (current instanceof CompositeNode composite) {
            if (composite.head == null) {
                throw new TreeStructureException(TreeErrorCode.EMPTY_SUBTREE, composite.describe());
            }
            current = composite.head;
        }
        return (TokenNode) current;
    }

    /**
     * Returns the rightmost token of this subtree by following last children.
     * @return The last token in document order.
     * @throws TreeStructureException with {@link TreeErrorCode#EMPTY_SUBTREE} if a composite
     *         without children is reached on the way down.
     */
    public TokenNode getLastToken() {
        Node current = this;
        while (current instanceof CompositeNode composite) {
            if (composite.tail == null) {
                throw new TreeStructureException(TreeErrorCode.EMPTY_SUBTREE, composite.describe());
            }
            current = composite.tail;
        }
        return (TokenNode) current;
    }

    /**
     * Returns the position of the first token of this subtree. A node without tokens
     * reports where it would appear, i.e. the position of its parent.
     */
    @Override
    public SourcePosition getSourcePosition() {
        Optional<TokenNode> first = firstTokenSkippingEmpty();
        if (first.isPresent()) {
            return first.get().getSourcePosition();
        }
        return parent == null ? SourcePosition.UNKNOWN : parent.getSourcePosition();
    }

    private Optional<TokenNode> firstTokenSkippingEmpty() {
        for (Node child = head; child != null; child = child.next) {
            if (child instanceof CompositeNode composite) {
                Optional<TokenNode> token = composite.firstTokenSkippingEmpty();
                if (token.isPresent()) {
                    return token;
                }
            } else {
                return Optional.of((TokenNode) child);
            }
        }
        return Optional.empty();
    }

    /**
     * Concatenates the text of all tokens in document order. For a tree that has not been
     * mutated since parsing this is the original source, byte for byte.
     * @return The source text of this subtree.
     */
    public String serialize() {
        StringBuilder out = new StringBuilder();
        appendText(out);
        return out.toString();
    }

    @Override
    void appendText(StringBuilder out) {
        for (Node child = head; child != null; child = child.next) {
            child.appendText(out);
        }
    }

    @Override
    public String toString() {
        return serialize();
    }

    // endregion

    // region Properties

    /**
     * Binds the name to an empty sequence, so that subsequent {@code appendChild(node, name)}
     * calls collect children under it in order. Replaces any previous binding of the name.
     * @param name The property name.
     * @return This node.
     */
    public CompositeNode declareSequence(String name) {
        properties.put(Objects.requireNonNull(name, "name"), Binding.sequence());
        return this;
    }

    /**
     * Binds an existing child to a name as a single value.
     * @param name The property name.
     * @param child A current child of this node.
     * @return This node.
     * @throws TreeStructureException if {@code child} is not a child of this node.
     */
    public CompositeNode setProperty(String name, Node child) {
        Objects.requireNonNull(name, "name");
        requireChild(child);
        properties.put(name, Binding.single(child));
        return this;
    }

    /**
     * @param name The property name.
     * @return The child bound to the name, empty if unbound, cleared, or bound to a sequence.
     */
    public Optional<Node> getProperty(String name) {
        Binding binding = properties.get(name);
        if (binding == null || binding.isSequence()) {
            return Optional.empty();
        }
        return Optional.ofNullable(binding.value);
    }

    /**
     * @param name The property name.
     * @param type The expected node class.
     * @param <T> The node type.
     * @return The child bound to the name if it is of the given type.
     */
    public <T extends Node> Optional<T> getProperty(String name, Class<T> type) {
        return getProperty(name).filter(type::isInstance).map(type::cast);
    }

    /**
     * @param name The property name.
     * @return The children bound to the name as a sequence; empty if the name is not a sequence.
     */
    public List<Node> getSequence(String name) {
        Binding binding = properties.get(name);
        if (binding == null || !binding.isSequence()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(binding.sequence));
    }

    /**
     * @param name The property name.
     * @return {@code true} if the name has been bound, even if its value was later cleared.
     */
    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }

    /**
     * @return The bound property names in binding order.
     */
    public Set<String> propertyNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(properties.keySet()));
    }

    private void bind(String name, Node node) {
        Binding binding = properties.get(name);
        if (binding != null && binding.isSequence()) {
            binding.sequence.add(node);
        } else {
            properties.put(name, Binding.single(node));
        }
    }

    /**
     * Points bindings of {@code child} at {@code replacement}, or drops them when the
     * replacement is {@code null}.
     */
    private void rebind(Node child, Node replacement) {
        boolean firstOnly = TreeOptions.current().bindingUpdate() == BindingUpdate.FIRST;
        for (Binding binding : properties.values()) {
            if (binding.substitute(child, replacement, firstOnly) && firstOnly) {
                return;
            }
        }
    }

    // endregion

    // region Construction API

    /**
     * Makes the node the new first child.
     * @param node A detached node.
     * @return This node.
     */
    public CompositeNode prependChild(Node node) {
        requireInsertable(node);
        if (head == null) {
            linkOnly(node);
        } else {
            linkBefore(head, node);
        }
        trace("prepend", node);
        afterMutation();
        return this;
    }

    /**
     * Makes the node the new last child.
     * @param node A detached node.
     * @return This node.
     */
    public CompositeNode appendChild(Node node) {
        return appendChild(node, null);
    }

    /**
     * Makes the node the new last child and optionally binds it to a property name. If the
     * name holds a sequence the node is added to its end; otherwise the name is bound to the node.
     * @param node A detached node.
     * @param propertyName The property to bind, or {@code null} for none.
     * @return This node.
     */
    public CompositeNode appendChild(Node node, String propertyName) {
        requireInsertable(node);
        linkLast(node);
        if (propertyName != null) {
            bind(propertyName, node);
        }
        trace("append", node);
        afterMutation();
        return this;
    }

    /**
     * Appends the nodes in order. Either all of them are appended or, if one is rejected, none.
     * @param nodes Detached nodes.
     * @return This node.
     */
    public CompositeNode appendChildren(Iterable<? extends Node> nodes) {
        List<Node> batch = new ArrayList<>();
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node node : nodes) {
            requireInsertable(node);
            if (!seen.add(node)) {
                throw new TreeStructureException(TreeErrorCode.ALREADY_ATTACHED, node.describe(), describe());
            }
            batch.add(node);
        }
        for (Node node : batch) {
            linkLast(node);
            trace("append", node);
        }
        afterMutation();
        return this;
    }

    /**
     * Appends the nodes in order.
     * @param nodes Detached nodes.
     * @return This node.
     * @see #appendChildren(Iterable)
     */
    public CompositeNode appendChildren(Node... nodes) {
        return appendChildren(List.of(nodes));
    }

    /**
     * Inserts a node at the given position.
     * @param index The position the node will have, from 0 to {@link #getChildCount()}.
     * @param node A detached node.
     * @return This node.
     */
    public CompositeNode insertChildAt(int index, Node node) {
        Objects.checkIndex(index, childCount + 1);
        if (index == childCount) {
            return appendChild(node);
        }
        return insertBeforeChild(getChild(index), node);
    }

    /**
     * Moves every child of {@code other} to the end of this node, in order, and copies its
     * property bindings over the bindings of this node; on a name collision the binding
     * from {@code other} wins. A binding of {@code other} that still names a node it no longer
     * owns arrives cleared. Afterwards {@code other} has no children and no bindings.
     * @param other The node to drain.
     * @return This node.
     */
    public CompositeNode mergeNode(CompositeNode other) {
        Objects.requireNonNull(other, "other");
        if (other == this || isDescendantOf(other)) {
            throw new TreeStructureException(TreeErrorCode.SELF_REFERENCE, other.describe(), describe());
        }
        List<Node> moved = other.unlinkAll();
        Set<Node> owned = Collections.newSetFromMap(new IdentityHashMap<>());
        owned.addAll(moved);
        Map<String, Binding> carried = new LinkedHashMap<>();
        other.properties.forEach((name, binding) -> carried.put(name, binding.copyOwned(owned)));
        other.properties.clear();

        for (Node node : moved) {
            linkLast(node);
        }
        properties.putAll(carried);
        log.trace("Merged {} children of {} into {}", moved.size(), other.getClass().getSimpleName(), getClass().getSimpleName());
        other.afterMutation();
        afterMutation();
        return this;
    }

    /**
     * Inserts a node as the previous sibling of an existing child.
     * @param child A current child of this node.
     * @param node A detached node.
     * @return This node.
     */
    protected CompositeNode insertBeforeChild(Node child, Node node) {
        requireChild(child);
        requireInsertable(node);
        linkBefore(child, node);
        trace("insert-before", node);
        afterMutation();
        return this;
    }

    /**
     * Inserts a node as the next sibling of an existing child.
     * @param child A current child of this node.
     * @param node A detached node.
     * @return This node.
     */
    protected CompositeNode insertAfterChild(Node child, Node node) {
        requireChild(child);
        requireInsertable(node);
        linkAfter(child, node);
        trace("insert-after", node);
        afterMutation();
        return this;
    }

    // endregion

    // region Mutation API

    /**
     * Detaches a child. Bindings referencing it are cleared: a single-valued binding becomes
     * empty and a sequence loses the entry.
     * @param child A current child of this node.
     * @return This node.
     */
    public CompositeNode removeChild(Node child) {
        requireChild(child);
        rebind(child, null);
        unlink(child);
        trace("remove", child);
        afterMutation();
        return this;
    }

    /**
     * Detaches the first child.
     * @return The removed child, empty if there were no children.
     */
    public Optional<Node> removeFirst() {
        Node first = head;
        if (first == null) {
            return Optional.empty();
        }
        removeChild(first);
        return Optional.of(first);
    }

    /**
     * Detaches all children and clears the values of all bindings; the names stay bound.
     * @return The removed children in document order.
     */
    public List<Node> removeAll() {
        List<Node> removed = unlinkAll();
        properties.values().forEach(Binding::clear);
        log.trace("Removed all {} children of {}", removed.size(), getClass().getSimpleName());
        afterMutation();
        return removed;
    }

    /**
     * Puts {@code replacement} at the position of {@code child} and substitutes it in the
     * bindings that referenced {@code child}, which ends up detached.
     * @param child A current child of this node.
     * @param replacement A detached node.
     * @return This node.
     */
    public CompositeNode replaceChild(Node child, Node replacement) {
        requireChild(child);
        requireInsertable(replacement);
        rebind(child, replacement);

        replacement.parent = this;
        replacement.previous = child.previous;
        replacement.next = child.next;
        if (child.previous == null) {
            head = replacement;
        } else {
            child.previous.next = replacement;
        }
        if (child.next == null) {
            tail = replacement;
        } else {
            child.next.previous = replacement;
        }
        detach(child);
        trace("replace", replacement);
        afterMutation();
        return this;
    }

    // endregion

    // region Preconditions

    private void requireChild(Node child) {
        Objects.requireNonNull(child, "child");
        if (child.parent != this) {
            throw new TreeStructureException(TreeErrorCode.NOT_A_CHILD, child.describe(), describe());
        }
    }

    private void requireInsertable(Node node) {
        Objects.requireNonNull(node, "node");
        if (node == this || (node instanceof CompositeNode composite && isDescendantOf(composite))) {
            throw new TreeStructureException(TreeErrorCode.SELF_REFERENCE, node.describe(), describe());
        }
        if (node.parent != null) {
            throw new TreeStructureException(TreeErrorCode.ALREADY_ATTACHED, node.describe(), node.parent.describe());
        }
    }

    // endregion

    // region Link primitives (no checks)

    private void linkOnly(Node node) {
        node.parent = this;
        node.previous = null;
        node.next = null;
        head = node;
        tail = node;
        childCount++;
    }

    private void linkLast(Node node) {
        if (tail == null) {
            linkOnly(node);
        } else {
            linkAfter(tail, node);
        }
    }

    private void linkBefore(Node child, Node node) {
        node.parent = this;
        node.previous = child.previous;
        node.next = child;
        if (child.previous == null) {
            head = node;
        } else {
            child.previous.next = node;
        }
        child.previous = node;
        childCount++;
    }

    private void linkAfter(Node child, Node node) {
        node.parent = this;
        node.previous = child;
        node.next = child.next;
        if (child.next == null) {
            tail = node;
        } else {
            child.next.previous = node;
        }
        child.next = node;
        childCount++;
    }

    private void unlink(Node child) {
        if (child.previous == null) {
            head = child.next;
        } else {
            child.previous.next = child.next;
        }
        if (child.next == null) {
            tail = child.previous;
        } else {
            child.next.previous = child.previous;
        }
        detach(child);
        childCount--;
    }

    private List<Node> unlinkAll() {
        List<Node> removed = new ArrayList<>(childCount);
        Node child = head;
        while (child != null) {
            Node next = child.next;
            detach(child);
            removed.add(child);
            child = next;
        }
        head = null;
        tail = null;
        childCount = 0;
        return removed;
    }

    private static void detach(Node node) {
        node.parent = null;
        node.previous = null;
        node.next = null;
    }

    // endregion

    private void afterMutation() {
        if (TreeOptions.current().verifyInvariants()) {
            TreeVerifier.assertValid(this);
        }
    }

    private void trace(String operation, Node node) {
        if (log.isTraceEnabled()) {
            log.trace("{} {} under {} (childCount={})", operation, node.describe(), getClass().getSimpleName(), childCount);
        }
    }

    /**
     * The value of one property: either a single child (possibly cleared) or an ordered
     * sequence of children.
     */
    private static final class Binding {
        private Node value;
        private final List<Node> sequence;

        private Binding(Node value, List<Node> sequence) {
            this.value = value;
            this.sequence = sequence;
        }

        static Binding single(Node value) {
            return new Binding(value, null);
        }

        static Binding sequence() {
            return new Binding(null, new ArrayList<>());
        }

        boolean isSequence() {
            return sequence != null;
        }

        /**
         * Copies this binding, keeping only references to nodes in {@code owned}.
         */
        Binding copyOwned(Set<Node> owned) {
            if (!isSequence()) {
                return single(owned.contains(value) ? value : null);
            }
            List<Node> kept = new ArrayList<>(sequence);
            kept.removeIf(node -> !owned.contains(node));
            return new Binding(null, kept);
        }

        void clear() {
            if (isSequence()) {
                sequence.clear();
            } else {
                value = null;
            }
        }

        /**
         * @return {@code true} if at least one reference was updated.
         */
        boolean substitute(Node child, Node replacement, boolean firstOnly) {
            if (!isSequence()) {
                if (value != child) {
                    return false;
                }
                value = replacement;
                return true;
            }
            boolean changed = false;
            ListIterator<Node> it = sequence.listIterator();
            while (it.hasNext()) {
                if (it.next() != child) {
                    continue;
                }
                if (replacement == null) {
                    it.remove();
                } else {
                    it.set(replacement);
                }
                changed = true;
                if (firstOnly) {
                    break;
                }
            }
            return changed;
        }
    }
}
