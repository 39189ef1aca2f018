package org.oxygen.compiler.frontend.parser.ast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FunctionDeclareStatementTest {

    private static final ReturnStatement RETURN_ZERO = new ReturnStatement(new IntegerLiteralTerm("0"));

    @Test
    @Tag("unit")
    void testBodyMustEndWithReturn() {
        FunctionDeclareStatement inner = new FunctionDeclareStatement("f", ValueType.INT, List.of(RETURN_ZERO));

        assertThatThrownBy(() -> new FunctionDeclareStatement("main", ValueType.INT, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("main");
        assertThatThrownBy(() -> new FunctionDeclareStatement("main", ValueType.INT, List.of(RETURN_ZERO, inner)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testBodyIsCopiedAndExposedAsChildren() {
        // Arrange
        List<Statement> body = new ArrayList<>(List.of(RETURN_ZERO));
        FunctionDeclareStatement function = new FunctionDeclareStatement("main", ValueType.INT, body);

        // Act
        body.clear();

        // Assert
        assertThat(function.body()).containsExactly(RETURN_ZERO);
        assertThat(function.getChildren()).containsExactly(RETURN_ZERO);
        assertThat(RETURN_ZERO.getChildren()).containsExactly(new IntegerLiteralTerm("0"));
        assertThat(new IntegerLiteralTerm("0").getChildren()).isEmpty();
    }
}
