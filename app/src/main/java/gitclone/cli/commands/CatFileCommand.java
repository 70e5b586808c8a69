package gitclone.cli.commands;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import gitclone.cli.mixins.GlobalOptionsMixin;
import gitclone.cli.mixins.RepositoryMixin;
import gitclone.core.objects.RawObject;
import gitclone.core.objects.tree.GitTree;
import gitclone.core.objects.tree.GitTreeEntry;
import gitclone.core.repository.GitRepository;
import gitclone.exceptions.ObjectNotFoundException;

@Command(name = "cat-file", description = "Provide content or type and size information for repository objects", mixinStandardHelpOptions = true, header = "Display information about objects", footer = {
        "",
        "Examples:",
        "  git-clone cat-file -p <object>  Pretty-print object content",
        "  git-clone cat-file -t <object>  Show object type",
        "  git-clone cat-file -s <object>  Show object size"
})
public class CatFileCommand implements Callable<Integer> {

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private RepositoryMixin repositoryMixin;

    @Parameters(index = "0", paramLabel = "<object>", description = "The object to display")
    private String objectId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Mode mode;

    static class Mode {
        @Option(names = { "-p", "--pretty-print" }, description = "Pretty-print the contents of the object")
        boolean prettyPrint;

        @Option(names = { "-t", "--type" }, description = "Show the object type")
        boolean showType;

        @Option(names = { "-s", "--size" }, description = "Show the object size")
        boolean showSize;

        @Option(names = { "-e", "--exists" }, description = "Suppress output; exit with zero status if object exists")
        boolean checkExists;
    }

    @Override
    public Integer call() throws Exception {
        globalOptions.configureLogging();

        GitRepository repo = repositoryMixin.getRepository();

        if (mode.checkExists) {
            return repo.getObjectStore().hasObject(objectId) ? 0 : 1;
        }

        RawObject object;
        try {
            object = repo.getObjectStore().readRawObject(objectId);
        } catch (ObjectNotFoundException e) {
            System.err.println("fatal: Not a valid object name " + objectId);
            return 1;
        }

        if (mode.showType) {
            System.out.println(object.getType().getTypeName());
        } else if (mode.showSize) {
            System.out.println(object.getSize());
        } else {
            prettyPrint(object);
        }
        return 0;
    }

    private void prettyPrint(RawObject object) throws Exception {
        switch (object.getType()) {
            case BLOB:
                System.out.write(object.getContent());
                System.out.flush();
                break;
            case TREE:
                for (GitTreeEntry entry : GitTree.decode(object.getContent())) {
                    System.out.println(entry);
                }
                break;
            case COMMIT:
                System.out.print(new String(object.getContent(), StandardCharsets.UTF_8));
                break;
            default:
                throw new IllegalStateException("Unhandled object type: " + object.getType());
        }
    }
}
