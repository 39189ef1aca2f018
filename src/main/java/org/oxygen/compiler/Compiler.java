package org.oxygen.compiler;

import org.oxygen.compiler.api.CompilationException;
import org.oxygen.compiler.api.ICompiler;
import org.oxygen.compiler.api.Program;
import org.oxygen.compiler.api.SourceInfo;
import org.oxygen.compiler.diagnostics.DiagnosticsEngine;
import org.oxygen.compiler.frontend.lexer.LexResult;
import org.oxygen.compiler.frontend.lexer.Lexer;
import org.oxygen.compiler.frontend.lexer.LexerError;
import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.parser.Parser;
import org.oxygen.compiler.frontend.parser.ast.Statement;
import org.oxygen.compiler.frontend.parser.error.StatementError;
import org.oxygen.compiler.frontend.parser.error.StatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the front end pipeline:
 * the whole file is tokenized first, and only a file without lexical errors is parsed.
 * <p>
 * Each call works on its own state, so one instance can be reused.
 */
public class Compiler implements ICompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

    @Override
    public List<Token> tokenize(List<String> sourceLines, String programName) throws CompilationException {
        // Phase 1: Lexical Analysis
        LexResult result = new Lexer().scanLines(sourceLines);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (LexerError error : result.errors()) {
            diagnostics.reportError(error.code(), error.message(),
                    new SourceInfo(programName, error.line(), error.column(), error.lineText()));
        }
        if (diagnostics.hasErrors()) {
            LOGGER.debug("Lexical analysis of {} failed with {} errors.", programName, result.errors().size());
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        LOGGER.debug("Lexical analysis of {} produced {} tokens.", programName, result.tokens().size());
        return result.tokens();
    }

    @Override
    public List<Statement> parse(List<Token> tokens, List<String> sourceLines, String programName) throws CompilationException {
        // Phase 2: Parsing (builds AST)
        try {
            List<Statement> statements = new Parser(tokens).parse();
            LOGGER.debug("Parsed {} top-level statements in {}.", statements.size(), programName);
            return statements;
        } catch (StatementException e) {
            StatementError error = e.getError();
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            diagnostics.reportError(error.code(), error.message(), locate(error, sourceLines, programName));
            LOGGER.debug("Parsing of {} failed: {}", programName, error);
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics(), e);
        }
    }

    @Override
    public Program compile(List<String> sourceLines, String programName) throws CompilationException {
        List<Token> tokens = tokenize(sourceLines, programName);
        List<Statement> statements = parse(tokens, sourceLines, programName);
        return new Program(programName, tokens, statements);
    }

    /**
     * Positions a parse error at its token, or just after the end of the input if the
     * error was caused by the input running out.
     */
    private static SourceInfo locate(StatementError error, List<String> sourceLines, String programName) {
        if (sourceLines.isEmpty()) {
            return new SourceInfo(programName, 1, 1, "");
        }
        return error.location()
                .map(token -> new SourceInfo(programName, token.line(), token.column(), lineAt(sourceLines, token.line())))
                .orElseGet(() -> {
                    String lastLine = sourceLines.get(sourceLines.size() - 1);
                    return new SourceInfo(programName, sourceLines.size(),
                            lastLine.codePointCount(0, lastLine.length()) + 1, lastLine);
                });
    }

    private static String lineAt(List<String> sourceLines, int line) {
        return line <= sourceLines.size() ? sourceLines.get(line - 1) : "";
    }
}
