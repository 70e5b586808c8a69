package gitclone.cli.exceptions;

import gitclone.exceptions.GitException;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;

/**
 * Reports failures of a command as a single line: {@code fatal:} for the
 * known error kinds, {@code error:} for anything unexpected. The stack trace
 * is only printed with {@code --debug}.
 */
public class GitExecutionExceptionHandler implements IExecutionExceptionHandler {

    @Override
    public int handleExecutionException(
            Exception ex,
            CommandLine commandLine,
            CommandLine.ParseResult parseResult) {

        if (ex instanceof GitException) {
            commandLine.getErr().println("fatal: " + ex.getMessage());
        } else {
            commandLine.getErr().println("error: " + ex.getMessage());
        }

        if (hasDebug(parseResult)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return 1;
    }

    private static boolean hasDebug(CommandLine.ParseResult parseResult) {
        for (CommandLine.ParseResult current = parseResult; current != null; current = current.subcommand()) {
            if (current.hasMatchedOption("--debug")) {
                return true;
            }
        }
        return false;
    }
}
