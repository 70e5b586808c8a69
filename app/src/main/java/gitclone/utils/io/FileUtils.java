package gitclone.utils.io;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public class FileUtils {

    private static final Set<PosixFilePermission> EXECUTE_BITS = EnumSet.of(
            PosixFilePermission.OWNER_EXECUTE,
            PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.OTHERS_EXECUTE);

    /**
     * Creates directories for the given path if they do not exist.
     */
    public static void createDirectories(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            Files.createDirectories(path);
        }
    }

    /**
     * Creates a file at the given path with the given content, creating
     * missing parent directories first.
     */
    public static void createFile(Path path, byte[] content) throws IOException {
        createDirectories(path.getParent());
        Files.write(path, content);
    }

    /**
     * Creates a file that must not exist yet. A symbolic link already sitting
     * at {@code path} is never followed; the call fails instead.
     */
    public static void createNewFile(Path path, byte[] content) throws IOException {
        createDirectories(path.getParent());
        Files.write(path, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE,
                LinkOption.NOFOLLOW_LINKS);
    }

    /**
     * Writes the content to a temporary file next to the target and moves it
     * into place, so readers never observe a partially written file.
     */
    public static void writeAtomically(Path path, byte[] content) throws IOException {
        Path parent = path.getParent();
        createDirectories(parent);

        Path temp = Files.createTempFile(parent, "tmp_", ".part");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (FileAlreadyExistsException e) {
            // same content-addressed file was produced by another writer
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    /**
     * Reads the content of a file as a byte array.
     */
    public static byte[] readFile(Path path) throws IOException {
        return Files.readAllBytes(path);
    }

    /**
     * Checks if a file exists at the given path.
     */
    public static boolean exists(Path path) {
        return Files.exists(path);
    }

    /**
     * Checks if a path is a directory.
     */
    public static boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    /**
     * Checks if a directory has no children. A missing directory counts as
     * empty.
     */
    public static boolean isEmptyDirectory(Path path) throws IOException {
        if (!Files.exists(path)) {
            return true;
        }
        if (!Files.isDirectory(path)) {
            return false;
        }
        try (Stream<Path> children = Files.list(path)) {
            return children.findAny().isEmpty();
        }
    }

    /**
     * Adds or removes the execute bits of a file. Returns false when the file
     * system has no POSIX permissions.
     */
    public static boolean setExecutable(Path path, boolean executable) throws IOException {
        Set<PosixFilePermission> permissions;
        try {
            permissions = Files.getPosixFilePermissions(path);
        } catch (UnsupportedOperationException e) {
            return false;
        }

        Set<PosixFilePermission> updated = EnumSet.noneOf(PosixFilePermission.class);
        updated.addAll(permissions);
        if (executable) {
            updated.addAll(EXECUTE_BITS);
        } else {
            updated.removeAll(EXECUTE_BITS);
        }
        Files.setPosixFilePermissions(path, updated);
        return true;
    }
}
