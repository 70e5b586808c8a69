package gitclone.core.checkout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.core.objects.ObjectStore;
import gitclone.core.objects.ObjectType;
import gitclone.core.objects.RawObject;
import gitclone.core.objects.commit.GitCommit;
import gitclone.core.objects.tree.GitTree;
import gitclone.core.objects.tree.GitTreeEntry;
import gitclone.core.refs.RefStore;
import gitclone.exceptions.CorruptObjectException;
import gitclone.exceptions.GitException;
import gitclone.exceptions.ObjectException;
import gitclone.exceptions.RepositoryException;
import gitclone.utils.io.FileUtils;

/**
 * Writes the tree of the commit HEAD points at into a working directory.
 *
 * Trees are walked breadth first from an explicit queue of
 * (tree id, relative path) pairs: every entry of a directory is written before
 * any of its subdirectories is opened. Directories are created when their
 * first file is written, so empty trees leave no trace.
 *
 * Nothing is ever written through a symbolic link: a tree may not list the
 * same name twice, and every path is refused when one of its components
 * inside the work tree is already a link.
 */
public class CheckoutMaterializer {
    private static final Logger logger = LoggerFactory.getLogger(CheckoutMaterializer.class);

    private final ObjectStore objectStore;
    private final RefStore refStore;

    public CheckoutMaterializer(ObjectStore objectStore, RefStore refStore) {
        this.objectStore = objectStore;
        this.refStore = refStore;
    }

    /**
     * A tree still to be written and where it goes, relative to the work tree.
     */
    private static final class PendingTree {
        final String treeSha;
        final Path relativePath;

        PendingTree(String treeSha, Path relativePath) {
            this.treeSha = treeSha;
            this.relativePath = relativePath;
        }
    }

    /**
     * Resolves HEAD and checks its tree out into {@code workTree}.
     */
    public CheckoutResult checkoutHead(Path workTree) throws GitException {
        String commitSha = refStore.resolveHead();
        return checkoutCommit(commitSha, workTree);
    }

    public CheckoutResult checkoutCommit(String commitSha, Path workTree) throws GitException {
        RawObject commit = objectStore.readRawObject(commitSha);
        if (commit.getType() != ObjectType.COMMIT) {
            throw new CorruptObjectException("HEAD names " + commit.getType().getTypeName() + " " + commitSha
                    + ", expected a commit");
        }
        String treeSha = GitCommit.readTreeSha(commit.getContent());
        logger.debug("Checking out commit {} (tree {}) into {}", commitSha, treeSha, workTree);

        List<Path> files = new ArrayList<>();
        Deque<PendingTree> queue = new ArrayDeque<>();
        queue.add(new PendingTree(treeSha, Paths.get("")));
        int treesVisited = 0;

        while (!queue.isEmpty()) {
            PendingTree current = queue.poll();
            treesVisited++;

            for (GitTreeEntry entry : readTree(current.treeSha)) {
                Path relative = current.relativePath.resolve(checkedName(entry, current.treeSha));

                switch (entry.getType()) {
                    case DIRECTORY:
                        queue.add(new PendingTree(entry.getSha(), relative));
                        break;
                    case REGULAR_FILE:
                    case EXECUTABLE_FILE:
                        ensureNoLinkOnPath(workTree, relative);
                        writeFile(workTree.resolve(relative), readBlob(entry.getSha()), entry.getType().isExecutable());
                        files.add(relative);
                        break;
                    case SYMBOLIC_LINK:
                        ensureNoLinkOnPath(workTree, relative);
                        writeSymlink(workTree.resolve(relative), readBlob(entry.getSha()));
                        files.add(relative);
                        break;
                    case SUBMODULE:
                        logger.warn("Skipping submodule {} at {}", relative, entry.getSha());
                        break;
                    default:
                        throw new IllegalStateException("Unhandled tree entry type: " + entry.getType());
                }
            }
        }

        logger.info("Checked out {} files from {} trees", files.size(), treesVisited);
        return new CheckoutResult(commitSha, treeSha, files, treesVisited);
    }

    private List<GitTreeEntry> readTree(String treeSha) throws ObjectException {
        RawObject tree = objectStore.readRawObject(treeSha);
        if (tree.getType() != ObjectType.TREE) {
            throw new CorruptObjectException("Expected tree " + treeSha + ", found "
                    + tree.getType().getTypeName());
        }
        List<GitTreeEntry> entries;
        try {
            entries = GitTree.decode(tree.getContent());
        } catch (CorruptObjectException e) {
            throw new CorruptObjectException("Corrupt tree " + treeSha + ": " + e.getMessage(), e);
        }

        Set<String> names = new HashSet<>();
        for (GitTreeEntry entry : entries) {
            if (!names.add(entry.getName())) {
                throw new CorruptObjectException("Tree " + treeSha + " lists '" + entry.getName()
                        + "' more than once");
            }
        }
        return entries;
    }

    private byte[] readBlob(String blobSha) throws ObjectException {
        RawObject blob = objectStore.readRawObject(blobSha);
        if (blob.getType() != ObjectType.BLOB) {
            throw new CorruptObjectException("Expected blob " + blobSha + ", found "
                    + blob.getType().getTypeName());
        }
        return blob.getContent();
    }

    private static String checkedName(GitTreeEntry entry, String treeSha) throws CorruptObjectException {
        String name = entry.getName();
        if (name.equals(".") || name.equals("..") || name.equalsIgnoreCase(".git") || name.contains("\\")) {
            throw new CorruptObjectException("Tree " + treeSha + " contains unsafe entry name '" + name + "'");
        }
        return name;
    }

    private static void ensureNoLinkOnPath(Path workTree, Path relative) throws CorruptObjectException {
        Path current = workTree;
        for (Path component : relative) {
            current = current.resolve(component);
            if (Files.isSymbolicLink(current)) {
                throw new CorruptObjectException("Refusing to write " + relative + ": " + current
                        + " is a symbolic link");
            }
        }
    }

    private void writeFile(Path path, byte[] content, boolean executable) throws RepositoryException {
        try {
            FileUtils.createNewFile(path, content);
            if (!FileUtils.setExecutable(path, executable)) {
                logger.debug("File system has no POSIX permissions, leaving mode of {} unchanged", path);
            }
        } catch (IOException e) {
            throw new RepositoryException("Failed to write " + path, e);
        }
    }

    private void writeSymlink(Path path, byte[] target) throws RepositoryException {
        String linkTarget = new String(target, StandardCharsets.UTF_8);
        try {
            FileUtils.createDirectories(path.getParent());
            Files.createSymbolicLink(path, Paths.get(linkTarget));
        } catch (UnsupportedOperationException e) {
            logger.debug("Symbolic links unsupported, writing {} as a plain file", path);
            writeFile(path, target, false);
        } catch (IOException e) {
            throw new RepositoryException("Failed to create symbolic link " + path, e);
        }
    }
}
