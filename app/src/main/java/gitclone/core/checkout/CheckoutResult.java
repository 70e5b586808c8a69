package gitclone.core.checkout;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * What a checkout wrote: the commit and tree it started from, the files in
 * the order they were written, and the number of trees visited.
 */
public final class CheckoutResult {
    private final String commitSha;
    private final String treeSha;
    private final List<Path> files;
    private final int treesVisited;

    public CheckoutResult(String commitSha, String treeSha, List<Path> files, int treesVisited) {
        this.commitSha = commitSha;
        this.treeSha = treeSha;
        this.files = Collections.unmodifiableList(files);
        this.treesVisited = treesVisited;
    }

    public String getCommitSha() {
        return commitSha;
    }

    public String getTreeSha() {
        return treeSha;
    }

    /**
     * Paths relative to the work tree, in breadth-first write order.
     */
    public List<Path> getFiles() {
        return files;
    }

    public int getTreesVisited() {
        return treesVisited;
    }
}
