package gitclone.cli.exceptions;

import picocli.CommandLine;
import picocli.CommandLine.IParameterExceptionHandler;
import picocli.CommandLine.ParameterException;

/**
 * Prints the parse error followed by the usage of the offending command.
 */
public class GitParameterExceptionHandler implements IParameterExceptionHandler {

    @Override
    public int handleParseException(ParameterException ex, String[] args) {
        CommandLine cmd = ex.getCommandLine();

        cmd.getErr().println("error: " + ex.getMessage());
        cmd.getErr().println();
        cmd.usage(cmd.getErr());

        return 2;
    }
}
