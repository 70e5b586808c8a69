package gitclone.core.objects.commit;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import gitclone.core.objects.GitObject;
import gitclone.core.objects.ObjectType;
import gitclone.core.objects.RawObject;
import gitclone.exceptions.CorruptObjectException;
import gitclone.exceptions.ObjectException;
import gitclone.utils.crypto.HashUtils;

// @formatter:off
/**
 * Commit object: a snapshot pointer plus authorship and history.
 *
 * Payload layout:
 * ┌──────────────────────────────────────────────┐
 * │ tree <sha>\n                                  │
 * │ parent <sha>\n            (zero or more)      │
 * │ author <ident>\n                              │
 * │ committer <ident>\n                           │
 * │ \n                                            │
 * │ <message>                                     │
 * └──────────────────────────────────────────────┘
 *
 * Other headers a remote may send (gpgsig, encoding, mergetag) are skipped
 * on read and not reproduced on write.
 */
// @formatter:on
public class GitCommit implements GitObject {

    private String treeSha;
    private List<String> parentShas;
    private String author;
    private String committer;
    private String message;

    public GitCommit() {
        this.parentShas = new ArrayList<>();
        this.message = "";
    }

    public GitCommit(String treeSha, List<String> parentShas, String author, String committer, String message) {
        if (!HashUtils.isValidSha(treeSha)) {
            throw new IllegalArgumentException("Invalid tree id: " + treeSha);
        }
        this.treeSha = treeSha.toLowerCase();
        this.parentShas = new ArrayList<>(parentShas != null ? parentShas : Collections.emptyList());
        this.author = Objects.requireNonNull(author, "Author cannot be null");
        this.committer = Objects.requireNonNull(committer, "Committer cannot be null");
        this.message = message != null ? message : "";
    }

    @Override
    public ObjectType getType() {
        return ObjectType.COMMIT;
    }

    @Override
    public byte[] getContent() {
        StringBuilder sb = new StringBuilder();
        sb.append("tree ").append(treeSha).append('\n');
        for (String parent : parentShas) {
            sb.append("parent ").append(parent).append('\n');
        }
        sb.append("author ").append(author).append('\n');
        sb.append("committer ").append(committer).append('\n');
        sb.append('\n');
        sb.append(message);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    public String getTreeSha() {
        return treeSha;
    }

    public List<String> getParentShas() {
        return Collections.unmodifiableList(parentShas);
    }

    public String getAuthor() {
        return author;
    }

    public String getCommitter() {
        return committer;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public void deserialize(byte[] data) throws ObjectException {
        RawObject raw = RawObject.parse(data);
        if (raw.getType() != ObjectType.COMMIT) {
            throw new CorruptObjectException("Expected commit type, got: " + raw.getType().getTypeName());
        }
        parsePayload(new String(raw.getContent(), StandardCharsets.UTF_8));
    }

    /**
     * Reads the tree id from the first header line of a commit payload. Used
     * by checkout, which needs nothing else from the commit.
     */
    public static String readTreeSha(byte[] payload) throws CorruptObjectException {
        String text = new String(payload, StandardCharsets.UTF_8);
        int eol = text.indexOf('\n');
        String firstLine = eol < 0 ? text : text.substring(0, eol);
        if (!firstLine.startsWith("tree ")) {
            throw new CorruptObjectException("Commit does not start with a tree header");
        }
        String sha = firstLine.substring("tree ".length()).trim();
        if (!HashUtils.isValidSha(sha)) {
            throw new CorruptObjectException("Invalid tree id in commit: " + sha);
        }
        return sha.toLowerCase();
    }

    private void parsePayload(String text) throws CorruptObjectException {
        int bodyStart = text.indexOf("\n\n");
        String headers = bodyStart < 0 ? text : text.substring(0, bodyStart);

        String tree = null;
        List<String> parents = new ArrayList<>();
        String authorLine = null;
        String committerLine = null;

        for (String line : headers.split("\n")) {
            if (line.startsWith(" ")) {
                continue; // continuation of a multi-line header such as gpgsig
            }
            int space = line.indexOf(' ');
            if (space < 0) {
                throw new CorruptObjectException("Malformed commit header line: " + line);
            }
            String key = line.substring(0, space);
            String value = line.substring(space + 1);
            switch (key) {
                case "tree":
                    tree = value;
                    break;
                case "parent":
                    parents.add(value);
                    break;
                case "author":
                    authorLine = value;
                    break;
                case "committer":
                    committerLine = value;
                    break;
                default:
                    break;
            }
        }

        if (tree == null || !HashUtils.isValidSha(tree)) {
            throw new CorruptObjectException("Commit has no valid tree header");
        }
        for (String parent : parents) {
            if (!HashUtils.isValidSha(parent)) {
                throw new CorruptObjectException("Invalid parent id in commit: " + parent);
            }
        }

        this.treeSha = tree.toLowerCase();
        this.parentShas = parents;
        this.author = authorLine;
        this.committer = committerLine;
        this.message = bodyStart < 0 ? "" : text.substring(bodyStart + 2);
    }

    @Override
    public String toString() {
        return "GitCommit{tree=" + treeSha + ", parents=" + parentShas + ", author=" + author + "}";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        GitCommit that = (GitCommit) obj;
        return Objects.equals(treeSha, that.treeSha)
                && Objects.equals(parentShas, that.parentShas)
                && Objects.equals(author, that.author)
                && Objects.equals(committer, that.committer)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(treeSha, parentShas, author, committer, message);
    }
}
