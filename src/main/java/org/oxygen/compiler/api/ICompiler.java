package org.oxygen.compiler.api;

import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.parser.ast.Statement;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface for the Oxygen compiler front end.
 */
public interface ICompiler {

    /**
     * Tokenizes the given source code.
     *
     * @param sourceLines The lines of the source file, in file order.
     * @param programName A name for the program, used in diagnostics.
     * @return The tokens of the whole file.
     * @throws CompilationException carrying every lexical error of the file.
     */
    List<Token> tokenize(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Parses a token stream produced by {@link #tokenize(List, String)}.
     *
     * @param tokens The tokens of the whole file.
     * @param sourceLines The lines the tokens were scanned from, used in diagnostics.
     * @param programName A name for the program, used in diagnostics.
     * @return The top-level statements.
     * @throws CompilationException carrying the first parse error.
     */
    List<Statement> parse(List<Token> tokens, List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Tokenizes and parses the given source code.
     *
     * @param sourceLines The lines of the source file, in file order.
     * @param programName A name for the program, used in diagnostics.
     * @return The compiled {@link Program}.
     * @throws CompilationException if errors occur during the compilation process.
     */
    Program compile(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Compiles the source code from a UTF-8 file.
     * @param programPath The path to the source file.
     * @return The compiled {@link Program}.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default Program compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readAllLines(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
