package gitclone.core.repository;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.io.IOException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.core.objects.GitObject;
import gitclone.core.objects.ObjectStore;
import gitclone.core.objects.impl.FileObjectStore;
import gitclone.core.refs.FileRefStore;
import gitclone.core.refs.RefStore;
import gitclone.exceptions.ObjectException;
import gitclone.exceptions.RepositoryException;
import gitclone.utils.io.FileUtils;

/**
 * Repository on the local file system: a working directory with a .git
 * metadata directory inside it.
 *
 * ┌─ <working-directory>/
 * │ ├─ .git/ ← metadata directory
 * │ │ ├─ objects/ ← loose objects (blobs, trees, commits)
 * │ │ │ ├─ ab/ ← object subdirectories (first 2 chars of SHA)
 * │ │ │ │ └─ cdef123... ← object files (remaining 38 chars of SHA)
 * │ │ │ └─ ...
 * │ │ ├─ refs/ ← references (branches and tags)
 * │ │ │ ├─ heads/
 * │ │ │ └─ tags/
 * │ │ ├─ HEAD ← current branch pointer
 * │ │ └─ config ← repository configuration
 * │ ├─ file1.txt ← checked out files
 * │ └─ ...
 */
public final class GitRepository implements Repository {
    private static final Logger logger = LoggerFactory.getLogger(GitRepository.class);

    static final String DEFAULT_GIT_DIR = ".git";
    private static final String DEFAULT_REFS_DIR = "refs";
    private static final String DEFAULT_HEAD_FILE = "HEAD";
    private static final String DEFAULT_CONFIG_FILE = "config";

    private Path workingDirectory;
    private Path gitDirectory;
    private final ObjectStore objectStore;
    private RefStore refStore;

    public GitRepository() {
        this.objectStore = new FileObjectStore();
    }

    /**
     * Creates the metadata layout. The working directory may already exist
     * but must not contain a repository.
     */
    @Override
    public void init(Path path) throws RepositoryException {
        this.workingDirectory = path.toAbsolutePath().normalize();
        this.gitDirectory = workingDirectory.resolve(DEFAULT_GIT_DIR);

        if (Repository.exists(workingDirectory)) {
            throw new RepositoryException("Already a git repository: " + workingDirectory);
        }

        try {
            FileUtils.createDirectories(gitDirectory.resolve(DEFAULT_REFS_DIR).resolve("heads"));
            FileUtils.createDirectories(gitDirectory.resolve(DEFAULT_REFS_DIR).resolve("tags"));

            objectStore.initialize(gitDirectory);
            createInitialFiles();
        } catch (IOException | ObjectException e) {
            throw new RepositoryException("Failed to initialize repository at " + workingDirectory, e);
        }
        this.refStore = new FileRefStore(gitDirectory);
        logger.debug("Initialized repository at {}", gitDirectory);
    }

    @Override
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    @Override
    public Path getGitDirectory() {
        return gitDirectory;
    }

    @Override
    public ObjectStore getObjectStore() {
        return objectStore;
    }

    @Override
    public RefStore getRefStore() {
        return refStore;
    }

    @Override
    public GitObject readObject(String sha) throws RepositoryException {
        try {
            return objectStore.readObject(sha);
        } catch (ObjectException e) {
            throw new RepositoryException("Failed to read object " + sha + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String writeObject(GitObject object) throws RepositoryException {
        try {
            return objectStore.writeObject(object);
        } catch (ObjectException e) {
            throw new RepositoryException("Failed to write object: " + e.getMessage(), e);
        }
    }

    /**
     * Records the remote a clone came from in the repository config.
     */
    public void addRemote(String name, String url) throws RepositoryException {
        String section = "[remote \"" + name + "\"]\n" +
                "\turl = " + url + "\n" +
                "\tfetch = +refs/heads/*:refs/remotes/" + name + "/*\n";
        Path configPath = gitDirectory.resolve(DEFAULT_CONFIG_FILE);
        try {
            byte[] existing = FileUtils.exists(configPath) ? FileUtils.readFile(configPath) : new byte[0];
            String updated = new String(existing, StandardCharsets.UTF_8) + section;
            FileUtils.writeAtomically(configPath, updated.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RepositoryException("Failed to record remote " + name, e);
        }
    }

    /**
     * Find repository by walking up the directory tree from current path
     */
    public static Optional<GitRepository> findRepository(Path startPath) {
        Path current = startPath.toAbsolutePath().normalize();

        while (current != null) {
            if (Repository.exists(current)) {
                try {
                    return Optional.of(open(current));
                } catch (RepositoryException e) {
                    logger.debug("Ignoring unusable repository at {}: {}", current, e.getMessage());
                    return Optional.empty();
                }
            }
            current = current.getParent();
        }

        return Optional.empty();
    }

    /**
     * Opens an existing repository whose working directory is {@code path}.
     */
    public static GitRepository open(Path path) throws RepositoryException {
        GitRepository repo = new GitRepository();
        repo.workingDirectory = path.toAbsolutePath().normalize();
        repo.gitDirectory = repo.workingDirectory.resolve(DEFAULT_GIT_DIR);
        if (!FileUtils.isDirectory(repo.gitDirectory)) {
            throw new RepositoryException("Not a git repository: " + repo.workingDirectory);
        }
        try {
            repo.objectStore.initialize(repo.gitDirectory);
        } catch (ObjectException e) {
            throw new RepositoryException("Failed to open object store of " + repo.workingDirectory, e);
        }
        repo.refStore = new FileRefStore(repo.gitDirectory);
        return repo;
    }

    private void createInitialFiles() throws IOException {
        String headContent = "ref: refs/heads/master\n";
        FileUtils.createFile(gitDirectory.resolve(DEFAULT_HEAD_FILE), headContent.getBytes(StandardCharsets.UTF_8));

        String config = "[core]\n" +
                "\trepositoryformatversion = 0\n" +
                "\tfilemode = true\n" +
                "\tbare = false\n";
        FileUtils.createFile(gitDirectory.resolve(DEFAULT_CONFIG_FILE), config.getBytes(StandardCharsets.UTF_8));
    }
}
