package org.oxygen.cli.commands;

import com.typesafe.config.ConfigException;
import org.oxygen.cli.CommandLineInterface;
import org.oxygen.cli.config.CompilerConfig;
import org.oxygen.cli.config.LoggingConfigurator;
import org.oxygen.cli.rendering.DiagnosticRenderer;
import org.oxygen.compiler.Compiler;
import org.oxygen.compiler.api.CompilationException;
import org.oxygen.compiler.api.CompilerErrorCode;
import org.oxygen.compiler.diagnostics.Diagnostic;
import org.oxygen.compiler.diagnostics.DiagnosticsEngine;
import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.parser.ast.AstPrinter;
import org.oxygen.compiler.frontend.parser.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "compile",
    mixinStandardHelpOptions = true,
    description = "Tokenizes and parses an Oxygen source file."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "<file>", description = "The Oxygen source file.")
    private Path file;

    @Option(names = "--display-tokens", description = "Display the tokens representing the input file.")
    private boolean displayTokens;

    @Option(names = "--display-ast", description = "Display the syntax tree of the input file.")
    private boolean displayAst;

    @Option(names = {"-v", "--verbose"}, description = "Log the compiler phases at DEBUG level.")
    private boolean verbose;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final CompilerConfig compilerConfig;
        try {
            compilerConfig = CompilerConfig.fromConfig(parent.getConfig());
        } catch (ConfigException e) {
            LOGGER.error("Failed to load or parse configuration: {}", e.getMessage());
            return 1;
        }
        if (verbose) {
            LoggingConfigurator.setLevel("org.oxygen", "DEBUG");
        }
        final DiagnosticRenderer renderer = new DiagnosticRenderer(compilerConfig.color());

        final String programName = file.toString();
        if (!compilerConfig.isSourceFile(programName)) {
            final DiagnosticsEngine warnings = new DiagnosticsEngine();
            warnings.reportWarning(CompilerErrorCode.UNEXPECTED_FILE_EXTENSION,
                    "'" + programName + "' does not have the extension '." + compilerConfig.sourceExtension() + "', compiling it anyway", null);
            warnings.getDiagnostics().forEach(d -> err.println(renderer.render(d)));
            err.flush();
        }

        final List<String> sourceLines;
        try {
            sourceLines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException | AccessDeniedException e) {
            LOGGER.debug("Cannot open {}", programName, e);
            err.println(renderer.render(fileError(CompilerErrorCode.FILE_NOT_FOUND, "unable to open file '" + programName + "'")));
            return 1;
        } catch (IOException e) {
            LOGGER.debug("Cannot read {}", programName, e);
            err.println(renderer.render(fileError(CompilerErrorCode.IO_ERROR_READING_FILE, "unable to read file '" + programName + "'")));
            return 1;
        }

        final Compiler compiler = new Compiler();
        try {
            final List<Token> tokens = compiler.tokenize(sourceLines, programName);
            if (displayTokens) {
                tokens.forEach(out::println);
            }
            final List<Statement> statements = compiler.parse(tokens, sourceLines, programName);
            if (displayAst) {
                out.print(AstPrinter.print(statements));
            }
        } catch (CompilationException e) {
            e.getDiagnostics().forEach(d -> err.println(renderer.render(d)));
            err.flush();
            return 1;
        }

        out.flush();
        LOGGER.info("Compiled {} successfully.", programName);
        return 0;
    }

    private static Diagnostic fileError(CompilerErrorCode code, String message) {
        return new Diagnostic(Diagnostic.Type.ERROR, code, message, null);
    }
}
