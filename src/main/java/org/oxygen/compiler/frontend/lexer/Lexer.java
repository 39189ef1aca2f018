package org.oxygen.compiler.frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * source lines into a sequence of tokens.
 * <p>
 * Lines are scanned one at a time, left to right, without backtracking. The position
 * is kept in a {@link ScanState} supplied by the caller, so a single state threaded
 * through all lines of a file yields continuous line and column numbers.
 * Unknown characters are reported and skipped; they never abort the scan.
 */
public class Lexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    /**
     * Tokenizes all lines of a file, starting at line 1, column 1.
     * @param lines The lines of the file, without line terminators.
     * @return The tokens and lexical errors of the whole file.
     */
    public LexResult scanLines(List<String> lines) {
        ScanState state = new ScanState();
        List<Token> tokens = new ArrayList<>();
        List<LexerError> errors = new ArrayList<>();
        for (String line : lines) {
            errors.addAll(tokenize(line, tokens, state));
        }
        LOGGER.debug("Scanned {} lines into {} tokens with {} lexical errors.", lines.size(), tokens.size(), errors.size());
        return new LexResult(tokens, errors);
    }

    /**
     * Tokenizes a single line. Tokens are appended to {@code sink}; afterwards the state
     * points to column 1 of the following line.
     *
     * @param lineText The text of the line, without line terminator.
     * @param sink The list receiving the tokens of the line.
     * @param state The current scan position; updated in place.
     * @return The lexical errors found on this line, possibly empty.
     */
    public List<LexerError> tokenize(String lineText, List<Token> sink, ScanState state) {
        List<LexerError> errors = new ArrayList<>();
        int[] chars = lineText.codePoints().toArray();
        int index = 0;

        while (index < chars.length) {
            int c = chars[index];
            switch (c) {
                case '(': addSymbol(TokenType.SYMBOL_OPEN_PAREN, sink, state); index++; break;
                case ')': addSymbol(TokenType.SYMBOL_CLOSE_PAREN, sink, state); index++; break;
                case '{': addSymbol(TokenType.SYMBOL_OPEN_CURLY, sink, state); index++; break;
                case '}': addSymbol(TokenType.SYMBOL_CLOSE_CURLY, sink, state); index++; break;
                case ';': addSymbol(TokenType.SYMBOL_SEMICOLON, sink, state); index++; break;
                case ' ':
                    state.advance(1);
                    index++;
                    break;
                default:
                    if (isAlpha(c)) {
                        int start = index;
                        while (index < chars.length && isAlphaNumeric(chars[index])) index++;
                        String text = new String(chars, start, index - start);
                        addRun(word(text), text, sink, state);
                    } else if (isDigit(c)) {
                        int start = index;
                        while (index < chars.length && isDigit(chars[index])) index++;
                        addRun(TokenType.INTEGER_LITERAL, new String(chars, start, index - start), sink, state);
                    } else {
                        errors.add(new LexerError.UnknownCharacter(Character.toString(c), lineText, state.line(), state.column()));
                        state.advance(1);
                        index++;
                    }
                    break;
            }
        }

        state.nextLine();
        return errors;
    }

    private static TokenType word(String text) {
        return switch (text) {
            case "return" -> TokenType.KEYWORD_RETURN;
            case "int" -> TokenType.TYPE_INT;
            default -> TokenType.IDENTIFIER;
        };
    }

    private void addSymbol(TokenType type, List<Token> sink, ScanState state) {
        sink.add(Token.of(type, state.line(), state.column()));
        state.advance(1);
    }

    // The run has already been read; the token starts where the run began.
    private void addRun(TokenType type, String text, List<Token> sink, ScanState state) {
        int length = text.codePointCount(0, text.length());
        state.advance(length);
        sink.add(new Token(type, text, state.line(), state.column() - length));
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }
}
