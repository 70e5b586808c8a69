package gitclone.core.repository;

import java.nio.file.Path;

import gitclone.core.objects.GitObject;
import gitclone.core.objects.ObjectStore;
import gitclone.core.refs.RefStore;
import gitclone.exceptions.RepositoryException;

public interface Repository {
    /**
     * Initialize a new repository at the given path
     */
    void init(Path path) throws RepositoryException;

    /**
     * Get the working directory path
     */
    Path getWorkingDirectory();

    /**
     * Get the .git directory path
     */
    Path getGitDirectory();

    /**
     * Get the object store
     */
    ObjectStore getObjectStore();

    /**
     * Get the ref store
     */
    RefStore getRefStore();

    /**
     * Read an object from the repository
     */
    GitObject readObject(String sha) throws RepositoryException;

    /**
     * Write an object to the repository
     */
    String writeObject(GitObject object) throws RepositoryException;

    /**
     * Check if repository exists at path
     */
    static boolean exists(Path path) {
        return path.resolve(GitRepository.DEFAULT_GIT_DIR).toFile().isDirectory();
    }
}
