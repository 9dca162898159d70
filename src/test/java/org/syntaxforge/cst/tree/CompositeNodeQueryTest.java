package org.syntaxforge.cst.tree;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.syntaxforge.cst.api.SourcePosition;
import org.syntaxforge.cst.api.TreeErrorCode;
import org.syntaxforge.cst.api.TreeStructureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.syntaxforge.cst.tree.Trees.composite;
import static org.syntaxforge.cst.tree.Trees.id;
import static org.syntaxforge.cst.tree.Trees.punct;
import static org.syntaxforge.cst.tree.Trees.ws;

/**
 * Tests for the read-only queries of {@link CompositeNode}.
 */
@Tag("unit")
class CompositeNodeQueryTest {

    @Test
    void filter_ReturnsMatchingDirectChildrenOnly() {
        TokenNode a = id("a");
        Trees.StatementNode statement = new Trees.StatementNode();
        statement.appendChild(id("nested"));
        TokenNode space = ws(" ");
        CompositeNode root = composite(a, space, statement);

        assertThat(root.filter(TokenNode.class)).containsExactly(a, space);
        assertThat(root.filter(Trees.StatementNode.class)).containsExactly(statement);
        assertThat(root.filter(n -> n instanceof TokenNode t && t.getType().isTrivia())).containsExactly(space);
    }

    @Test
    void find_IsPreOrderInDocumentOrder() {
        TokenNode a = id("A");
        TokenNode c = id("C");
        TokenNode d = id("D");
        CompositeNode b = composite(c, d);
        CompositeNode root = composite(a, b);

        assertThat(root.find(TokenNode.class)).containsExactly(a, c, d);
    }

    @Test
    void find_IncludesSelfFirst_AndListsEachMatchOnce() {
        Trees.StatementNode inner = new Trees.StatementNode();
        inner.appendChild(id("x"));
        Trees.StatementNode outer = new Trees.StatementNode();
        outer.appendChildren(id("y"), inner);

        List<Trees.StatementNode> found = outer.find(Trees.StatementNode.class);

        assertThat(found).containsExactly(outer, inner);
    }

    @Test
    void find_WithPredicate_MatchesOnTokenType() {
        CompositeNode root = Trees.parse("if (a == 1) { return b; }");

        List<Node> identifiers = root.find(n -> n instanceof TokenNode t && t.getType() == TokenType.IDENTIFIER);

        assertThat(identifiers).extracting(Node::getText).containsExactly("a", "b");
    }

    @Test
    void getFirstAndLastToken_DescendThroughNestedComposites() {
        TokenNode first = punct("(");
        TokenNode last = punct(")");
        CompositeNode root = composite(composite(composite(first), id("x")), composite(id("y"), last));

        assertThat(root.getFirstToken()).isSameAs(first);
        assertThat(root.getLastToken()).isSameAs(last);
    }

    @Test
    void getFirstToken_OnEmptyBoundaryComposite_ThrowsEmptySubtree() {
        CompositeNode root = composite(new CompositeNode(), id("x"));

        assertThatThrownBy(root::getFirstToken)
                .isInstanceOf(TreeStructureException.class)
                .hasFieldOrPropertyWithValue("code", TreeErrorCode.EMPTY_SUBTREE);
        assertThat(root.getLastToken().getText()).isEqualTo("x");
        assertThatThrownBy(() -> new CompositeNode().getLastToken())
                .isInstanceOf(TreeStructureException.class);
    }

    @Test
    void getSourcePosition_IsPositionOfFirstToken() {
        CompositeNode root = Trees.parse("a\n  (b c)");
        CompositeNode group = root.filter(Trees.GroupNode.class).get(0);

        assertThat(root.getSourcePosition()).isEqualTo(new SourcePosition("test.src", 1, 1));
        assertThat(group.getSourcePosition()).isEqualTo(new SourcePosition("test.src", 2, 3));
    }

    @Test
    void getSourcePosition_OfEmptyNode_DelegatesToParent() {
        TokenNode token = new TokenNode(TokenType.IDENTIFIER, "x", SourcePosition.at(4, 2));
        CompositeNode empty = new CompositeNode();
        CompositeNode root = composite(empty, token);

        assertThat(empty.getSourcePosition()).isEqualTo(SourcePosition.at(4, 2));
        assertThat(root.getSourcePosition()).isEqualTo(SourcePosition.at(4, 2));
        assertThat(new CompositeNode().getSourcePosition()).isEqualTo(SourcePosition.UNKNOWN);
    }

    @Test
    void serialize_ConcatenatesTokensRecursively() {
        CompositeNode root = composite(id("f"), composite(punct("("), id("x"), punct(")")), punct(";"));

        assertThat(root.serialize()).isEqualTo("f(x);");
        assertThat(root.toString()).isEqualTo("f(x);");
        assertThat(new CompositeNode().serialize()).isEmpty();
    }

    @Test
    void children_IsASnapshot() {
        TokenNode a = id("a");
        CompositeNode root = composite(a);
        List<Node> before = root.children();

        root.appendChild(id("b"));

        assertThat(before).containsExactly(a);
        assertThatThrownBy(() -> before.add(id("c"))).isInstanceOf(UnsupportedOperationException.class);
    }
}
