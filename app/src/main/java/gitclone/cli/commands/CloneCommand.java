package gitclone.cli.commands;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import gitclone.cli.mixins.GlobalOptionsMixin;
import gitclone.config.ClientConfig;
import gitclone.core.clone.CloneOperation;
import gitclone.core.clone.CloneResult;

@Command(name = "clone", description = "Clone a repository into a new directory", mixinStandardHelpOptions = true, header = "Fetch every ref of an anonymous smart-HTTP remote and check out HEAD", footer = {
        "",
        "Examples:",
        "  git-clone clone https://example.com/repo.git",
        "  git-clone clone --timeout 60 https://example.com/repo.git work"
})
public class CloneCommand implements Callable<Integer> {

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Parameters(index = "0", paramLabel = "<repository>", description = "URL of the remote repository")
    private String url;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<directory>", description = "Target directory (default: derived from the URL)")
    private Path directory;

    @Option(names = { "--timeout" }, paramLabel = "<seconds>", description = "Timeout for each HTTP request")
    private Long timeoutSeconds;

    @Option(names = { "--no-verify-checksum" }, description = "Do not verify the pack's trailing checksum")
    private boolean noVerifyChecksum;

    @Override
    public Integer call() throws Exception {
        globalOptions.configureLogging();

        ClientConfig config = ClientConfig.load();
        if (timeoutSeconds != null) {
            config = config.withRequestTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (noVerifyChecksum) {
            config = config.withVerifyPackChecksum(false);
        }

        Path target = directory != null ? directory : Paths.get(humanishName(url));
        if (!globalOptions.isQuiet()) {
            System.err.println("Cloning into '" + target + "'...");
        }

        CloneResult result = new CloneOperation(config).run(url, target);

        if (globalOptions.isVerbose()) {
            result.getPackResult().ifPresent(pack -> System.err.println(
                    "Received " + pack.getEntryCount() + " objects (" + pack.getDeltaCount() + " deltas)"));
            result.getCheckoutResult().ifPresent(checkout -> System.err.println(
                    "Checked out " + checkout.getFiles().size() + " files at " + checkout.getCommitSha()));
        }
        return 0;
    }

    /**
     * Directory name git would pick: last path segment without ".git".
     */
    static String humanishName(String url) {
        String path = url;
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.endsWith(".git")) {
            path = path.substring(0, path.length() - 4);
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf(':'));
        String name = path.substring(slash + 1);
        return name.isEmpty() ? "repository" : name;
    }
}
