package org.syntaxforge.cst.diagnostics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.syntaxforge.cst.config.BindingUpdate;
import org.syntaxforge.cst.config.TreeOptions;
import org.syntaxforge.cst.junit.extensions.logging.ExpectLog;
import org.syntaxforge.cst.junit.extensions.logging.LogLevel;
import org.syntaxforge.cst.junit.extensions.logging.LogWatchExtension;
import org.syntaxforge.cst.tree.CompositeNode;
import org.syntaxforge.cst.tree.TokenNode;
import org.syntaxforge.cst.tree.TokenType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link TreeVerifier} class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TreeVerifierTest {

    @AfterEach
    void tearDown() {
        TreeOptions.reset();
    }

    @Test
    void verify_ConsistentTree_ReportsNothing() {
        CompositeNode inner = new CompositeNode()
                .appendChild(TokenNode.of(TokenType.PUNCTUATION, "("))
                .appendChild(TokenNode.of(TokenType.IDENTIFIER, "x"), "value")
                .appendChild(TokenNode.of(TokenType.PUNCTUATION, ")"));
        CompositeNode root = new CompositeNode()
                .appendChild(TokenNode.of(TokenType.IDENTIFIER, "f"))
                .appendChild(inner, "arguments");

        assertThat(TreeVerifier.verify(root)).isEmpty();
        TreeVerifier.assertValid(root);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*TreeVerifier", messagePattern = "Syntax tree invariants violated.*")
    void assertValid_StaleBinding_LogsAndThrows() {
        TreeOptions.install(new TreeOptions(BindingUpdate.FIRST, false));
        TokenNode shared = TokenNode.of(TokenType.IDENTIFIER, "x");
        CompositeNode root = new CompositeNode().appendChild(shared, "first");
        root.setProperty("second", shared);
        root.removeChild(shared);

        assertThat(TreeVerifier.verify(root))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
                    assertThat(d.message()).contains("'second'");
                });
        assertThatThrownBy(() -> TreeVerifier.assertValid(root))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("property 'second' references a node that is not a child");
    }
}
