package org.oxygen.cli.commands;

import picocli.AutoComplete;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Prints a completion script for the {@code oxygen} command. The script generated by
 * picocli serves bash directly and zsh through {@code bashcompinit}, which it loads itself.
 */
@Command(
    name = "completions",
    description = "Prints a shell completion script for oxygen."
)
public class CompletionsCommand implements Callable<Integer> {

    /** The shells a completion script can be generated for. */
    public enum Shell { BASH, ZSH }

    @Parameters(index = "0", paramLabel = "<shell>", description = "The target shell: ${COMPLETION-CANDIDATES}.")
    private Shell shell;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final CommandLine root = spec.root().commandLine();
        final PrintWriter out = spec.commandLine().getOut();
        out.println("# " + root.getCommandName() + " completion for " + shell.name().toLowerCase(Locale.ROOT));
        out.print(AutoComplete.bash(root.getCommandName(), root));
        out.flush();
        return 0;
    }
}
