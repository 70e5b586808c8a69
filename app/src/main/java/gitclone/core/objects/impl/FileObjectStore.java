package gitclone.core.objects.impl;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.io.IOException;
import java.util.zip.DataFormatException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.core.objects.GitObject;
import gitclone.core.objects.ObjectStore;
import gitclone.core.objects.ObjectType;
import gitclone.core.objects.RawObject;
import gitclone.core.objects.commit.GitCommit;
import gitclone.core.objects.tree.GitTree;
import gitclone.exceptions.CorruptObjectException;
import gitclone.exceptions.ObjectException;
import gitclone.exceptions.ObjectNotFoundException;
import gitclone.utils.crypto.CompressionUtils;
import gitclone.utils.crypto.HashUtils;
import gitclone.utils.io.FileUtils;

/**
 * File-based implementation of the loose object database.
 *
 * Each object is:
 * 1. Serialized as {@code "<kind> <len>\0"} followed by its payload
 * 2. Compressed with zlib
 * 3. Stored in a file named by the SHA-1 of the serialized bytes
 *
 * Directory Structure:
 * ┌─ .git/objects/
 * │ ├─ ab/ ← First 2 characters of SHA
 * │ │ └─ cdef123... ← Remaining 38 characters of SHA
 * │ ├─ cd/
 * │ │ └─ ef456789...
 * │ └─ ...
 *
 * Files are written to a temporary name inside the shard and renamed into
 * place, so a crash never leaves a truncated object under a valid name.
 */
public class FileObjectStore implements ObjectStore {
    private static final Logger logger = LoggerFactory.getLogger(FileObjectStore.class);

    private Path objectsPath;

    public FileObjectStore() {
    }

    public FileObjectStore(Path gitDir) throws ObjectException {
        initialize(gitDir);
    }

    /**
     * Sets up the base objects directory at {@code <gitDir>/objects}, creating
     * it if it doesn't exist.
     */
    @Override
    public void initialize(Path gitDir) throws ObjectException {
        this.objectsPath = gitDir.resolve("objects");
        try {
            FileUtils.createDirectories(objectsPath);
        } catch (IOException e) {
            throw new ObjectException("Failed to initialize object store at " + objectsPath, e);
        }
    }

    @Override
    public String writeObject(GitObject object) throws ObjectException {
        return writeObject(object.getType(), object.getContent());
    }

    /**
     * Writes a payload using the standard storage format. If an object with
     * the same SHA already exists it's not written again; identical content
     * always has an identical hash.
     */
    @Override
    public String writeObject(ObjectType type, byte[] content) throws ObjectException {
        byte[] serialized = new RawObject(type, content).serialize();
        String sha = HashUtils.sha1Hex(serialized);

        Path filePath = resolveObjectPath(sha);
        if (FileUtils.exists(filePath)) {
            logger.trace("Object {} already present", sha);
            return sha;
        }

        try {
            FileUtils.writeAtomically(filePath, CompressionUtils.compress(serialized));
        } catch (IOException e) {
            throw new ObjectException("Failed to write " + type.getTypeName() + " object " + sha, e);
        }
        logger.debug("Wrote {} {} ({} bytes)", type.getTypeName(), sha, content.length);
        return sha;
    }

    @Override
    public RawObject readRawObject(String sha) throws ObjectException {
        if (!HashUtils.isValidSha(sha)) {
            throw new ObjectNotFoundException("Not a valid object name: " + sha);
        }

        Path filePath = resolveObjectPath(sha);
        byte[] compressed;
        try {
            compressed = FileUtils.readFile(filePath);
        } catch (NoSuchFileException e) {
            throw new ObjectNotFoundException("Object not found: " + sha, e);
        } catch (IOException e) {
            throw new ObjectException("Failed to read object: " + sha, e);
        }

        byte[] decompressed;
        try {
            decompressed = CompressionUtils.decompress(compressed);
        } catch (DataFormatException e) {
            throw new CorruptObjectException("Failed to inflate object " + sha + ": " + e.getMessage(), e);
        }

        try {
            return RawObject.parse(decompressed);
        } catch (CorruptObjectException e) {
            throw new CorruptObjectException("Corrupt object " + sha + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads and reconstructs a typed object. The kind comes from the stored
     * header; the payload is then decoded by the matching model class.
     */
    @Override
    public GitObject readObject(String sha) throws ObjectException {
        RawObject raw = readRawObject(sha);
        GitObject object = createObject(raw.getType());
        object.deserialize(raw.serialize());
        return object;
    }

    @Override
    public boolean hasObject(String sha) {
        if (!HashUtils.isValidSha(sha)) {
            return false;
        }
        return FileUtils.exists(resolveObjectPath(sha));
    }

    /**
     * Converts a SHA-1 hash to its path in the two-level storage layout.
     */
    private Path resolveObjectPath(String sha) {
        String normalized = sha.toLowerCase();
        String dirName = normalized.substring(0, 2);
        String fileName = normalized.substring(2);

        return objectsPath.resolve(dirName).resolve(fileName);
    }

    private static GitObject createObject(ObjectType objectType) {
        switch (objectType) {
            case BLOB:
                return new GitBlob();
            case TREE:
                return new GitTree();
            case COMMIT:
                return new GitCommit();
            default:
                throw new IllegalStateException("Unhandled object type: " + objectType);
        }
    }
}
