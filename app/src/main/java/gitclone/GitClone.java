package gitclone;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import gitclone.cli.commands.CatFileCommand;
import gitclone.cli.commands.CloneCommand;
import gitclone.cli.mixins.GlobalOptionsMixin;
import gitclone.cli.mixins.VersionProvider;
import gitclone.cli.exceptions.GitExecutionExceptionHandler;
import gitclone.cli.exceptions.GitParameterExceptionHandler;

@Command(name = "git-clone", description = "Clone a repository over smart HTTP into a new directory", versionProvider = VersionProvider.class, mixinStandardHelpOptions = true, subcommands = {
                CloneCommand.class,
                CatFileCommand.class,
                CommandLine.HelpCommand.class
}, footer = {
                "",
                "Examples:",
                "  git-clone clone https://example.com/repo.git          Clone into ./repo",
                "  git-clone clone https://example.com/repo.git target   Clone into ./target",
                "  git-clone cat-file -p <object>                        Show an object",
                "  git-clone --version                                   Show version information"
})
public class GitClone implements Runnable {
        @Mixin
        private GlobalOptionsMixin globalOptions;

        public static void main(String[] args) {
                System.exit(newCommandLine().execute(args));
        }

        static CommandLine newCommandLine() {
                CommandLine commandLine = new CommandLine(new GitClone())
                                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
                                .setExecutionExceptionHandler(new GitExecutionExceptionHandler())
                                .setParameterExceptionHandler(new GitParameterExceptionHandler())
                                .setUsageHelpAutoWidth(true);

                commandLine.setAbbreviatedSubcommandsAllowed(true);
                commandLine.setAbbreviatedOptionsAllowed(true);
                return commandLine;
        }

        @Override
        public void run() {
                // When no subcommand is specified, show help
                CommandLine.usage(this, System.out);
        }
}
