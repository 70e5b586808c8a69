package gitclone.cli.mixins;

import gitclone.core.repository.GitRepository;
import gitclone.exceptions.RepositoryException;
import picocli.CommandLine.Option;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Mixin for commands that read from an existing repository.
 *
 * The repository is searched for from {@code --work-tree} (or the current
 * directory) upwards.
 */
public class RepositoryMixin {

    @Option(names = { "--work-tree" }, paramLabel = "<path>", description = "Set the path to the working tree")
    private String workTree;

    public GitRepository getRepository() throws RepositoryException {
        Path searchPath = workTree != null ? Paths.get(workTree) : Paths.get(".");

        return GitRepository.findRepository(searchPath)
                .orElseThrow(() -> new RepositoryException(
                        "not a git repository (or any of the parent directories): .git"));
    }
}
