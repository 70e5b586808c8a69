package gitclone.core.refs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.exceptions.RefNotFoundException;
import gitclone.exceptions.RepositoryException;
import gitclone.utils.crypto.HashUtils;
import gitclone.utils.io.FileUtils;

/**
 * Loose refs stored as files under the git directory.
 *
 * ┌─ .git/
 * │ ├─ HEAD ← "ref: refs/heads/main\n" or "<sha>\n"
 * │ └─ refs/
 * │   ├─ heads/main ← "<sha>\n"
 * │   └─ tags/v1.0 ← "<sha>\n"
 */
public class FileRefStore implements RefStore {
    private static final Logger logger = LoggerFactory.getLogger(FileRefStore.class);

    private static final String SYMREF_PREFIX = "ref: ";

    private final Path gitDirectory;

    public FileRefStore(Path gitDirectory) {
        this.gitDirectory = gitDirectory;
    }

    @Override
    public void writeRef(Ref ref) throws RepositoryException {
        String content = ref.isSymbolic()
                ? SYMREF_PREFIX + ref.getTarget() + "\n"
                : ref.getSha() + "\n";
        Path path = resolvePath(ref.getName());
        try {
            FileUtils.writeAtomically(path, content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RepositoryException("Failed to write ref " + ref.getName(), e);
        }
        logger.debug("Wrote ref {}", ref);
    }

    @Override
    public Ref readRef(String name) throws RepositoryException {
        Path path = resolvePath(name);
        String content;
        try {
            content = new String(FileUtils.readFile(path), StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException e) {
            throw new RefNotFoundException("Ref not found: " + name, e);
        } catch (IOException e) {
            throw new RepositoryException("Failed to read ref " + name, e);
        }

        if (content.startsWith(SYMREF_PREFIX)) {
            return Ref.symbolic(name, content.substring(SYMREF_PREFIX.length()).trim());
        }
        if (!HashUtils.isValidSha(content)) {
            throw new RepositoryException("Malformed ref " + name + ": '" + content + "'");
        }
        return Ref.direct(name, content);
    }

    @Override
    public String resolve(String name) throws RepositoryException {
        Ref ref = readRef(name);
        if (!ref.isSymbolic()) {
            return ref.getSha();
        }

        Ref target;
        try {
            target = readRef(ref.getTarget());
        } catch (RefNotFoundException e) {
            throw new RefNotFoundException(name + " points at missing ref " + ref.getTarget(), e);
        }
        if (target.isSymbolic()) {
            throw new RepositoryException("Symbolic ref " + name + " points at another symbolic ref "
                    + target.getName());
        }
        return target.getSha();
    }

    private Path resolvePath(String name) throws RepositoryException {
        if (!Ref.isValidName(name)) {
            throw new RepositoryException("Invalid ref name: " + name);
        }
        Path path = gitDirectory.resolve(name).normalize();
        if (!path.startsWith(gitDirectory.normalize())) {
            throw new RepositoryException("Ref name escapes the git directory: " + name);
        }
        return path;
    }
}
