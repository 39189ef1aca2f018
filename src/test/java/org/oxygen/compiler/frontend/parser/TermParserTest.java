package org.oxygen.compiler.frontend.parser;

import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.lexer.TokenType;
import org.oxygen.compiler.frontend.parser.ast.IntegerLiteralTerm;
import org.oxygen.compiler.frontend.parser.error.TermError;
import org.oxygen.compiler.frontend.parser.error.TermException;
import org.oxygen.compiler.frontend.parser.error.TokenTypeError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the term rule.
 */
public class TermParserTest {

    @Test
    @Tag("unit")
    void testParseIntegerLiteral() throws TermException {
        // Arrange
        Parser parser = new Parser(List.of(new Token(TokenType.INTEGER_LITERAL, "0", 1, 7)));

        // Act & Assert
        assertThat(TermParser.parseTerm(parser)).isEqualTo(new IntegerLiteralTerm("0"));
        assertThat(parser.isAtEnd()).isTrue();
    }

    @Test
    @Tag("unit")
    void testNoTermAtEndOfStream() {
        // Arrange
        Parser parser = new Parser(List.of());

        // Act
        TermException exception = catchThrowableOfType(() -> TermParser.parseTerm(parser), TermException.class);

        // Assert
        assertThat(exception.getError()).isEqualTo(new TermError.NoTerm());
    }

    @Test
    @Tag("unit")
    void testOtherTokenIsExpectedIntegerLiteral() {
        // Arrange
        Token semicolon = Token.of(TokenType.SYMBOL_SEMICOLON, 1, 8);
        Parser parser = new Parser(List.of(semicolon));

        // Act
        TermException exception = catchThrowableOfType(() -> TermParser.parseTerm(parser), TermException.class);

        // Assert
        assertThat(exception.getError()).isEqualTo(new TermError.TokenMismatch(
                new TokenTypeError.Expected(TokenType.INTEGER_LITERAL, semicolon)));
        assertThat(exception.getMessage()).isEqualTo("expected integer literal, found ';'");
        assertThat(parser.peek(0)).contains(semicolon);
    }
}
