package gitclone.core.objects;

import java.nio.file.Path;

import gitclone.exceptions.ObjectException;

public interface ObjectStore {
    /**
     * Write an object to storage
     *
     * @param object The object to store
     * @return The SHA-1 hash of the stored object
     */
    String writeObject(GitObject object) throws ObjectException;

    /**
     * Write a payload of the given kind to storage
     *
     * @return The SHA-1 hash of the stored object
     */
    String writeObject(ObjectType type, byte[] content) throws ObjectException;

    /**
     * Read an object's kind and payload from storage
     *
     * @param sha The SHA-1 hash of the object
     * @throws gitclone.exceptions.ObjectNotFoundException if no such object
     *                                                     is stored
     * @throws gitclone.exceptions.CorruptObjectException  if the stored bytes
     *                                                     cannot be decoded
     */
    RawObject readRawObject(String sha) throws ObjectException;

    /**
     * Read an object from storage as its typed model (blob, tree or commit)
     */
    GitObject readObject(String sha) throws ObjectException;

    /**
     * Check if an object exists in storage
     *
     * @param sha The SHA-1 hash of the object
     * @return true if object exists, false otherwise
     */
    boolean hasObject(String sha);

    /**
     * Initialize the object store
     *
     * @param gitDir The .git directory path
     */
    void initialize(Path gitDir) throws ObjectException;
}
