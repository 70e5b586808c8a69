package gitclone.core.refs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gitclone.exceptions.RefNotFoundException;
import gitclone.exceptions.RepositoryException;

public class FileRefStoreTest {

    private static final String SHA = "1111111111111111111111111111111111111111";

    @TempDir
    Path gitDir;

    private FileRefStore refs;

    @BeforeEach
    void setUp() {
        refs = new FileRefStore(gitDir);
    }

    private String read(String relative) throws Exception {
        return new String(Files.readAllBytes(gitDir.resolve(relative)), StandardCharsets.UTF_8);
    }

    @Test
    void testDirectRefFileContent() throws Exception {
        refs.writeRef(Ref.direct("refs/heads/main", SHA));

        assertEquals(SHA + "\n", read("refs/heads/main"));
    }

    @Test
    void testSymbolicHeadFileContent() throws Exception {
        refs.writeRef(Ref.symbolic("HEAD", "refs/heads/main"));

        assertEquals("ref: refs/heads/main\n", read("HEAD"));
    }

    @Test
    void testNestedRefNamesCreateDirectories() throws Exception {
        refs.writeRef(Ref.direct("refs/heads/feature/deep/topic", SHA));

        assertTrue(Files.isRegularFile(gitDir.resolve("refs/heads/feature/deep/topic")));
        assertEquals(SHA, refs.resolve("refs/heads/feature/deep/topic"));
    }

    @Test
    void testResolveFollowsOneSymbolicLevel() throws Exception {
        refs.writeRef(Ref.direct("refs/heads/main", SHA));
        refs.writeRef(Ref.symbolic("HEAD", "refs/heads/main"));

        assertEquals(SHA, refs.resolveHead());
        assertEquals(Ref.symbolic("HEAD", "refs/heads/main"), refs.readRef("HEAD"));
    }

    @Test
    void testDetachedHead() throws Exception {
        refs.writeRef(Ref.direct("HEAD", SHA));

        assertEquals(SHA + "\n", read("HEAD"));
        assertEquals(SHA, refs.resolveHead());
    }

    @Test
    void testDanglingSymbolicRef() throws Exception {
        refs.writeRef(Ref.symbolic("HEAD", "refs/heads/missing"));

        assertThrows(RefNotFoundException.class, () -> refs.resolveHead());
    }

    @Test
    void testMissingRef() {
        assertThrows(RefNotFoundException.class, () -> refs.readRef("refs/heads/nope"));
    }

    @Test
    void testMalformedRefFile() throws Exception {
        Files.write(gitDir.resolve("HEAD"), "garbage\n".getBytes(StandardCharsets.UTF_8));

        assertThrows(RepositoryException.class, () -> refs.readRef("HEAD"));
    }

    @Test
    void testRefNamesCannotEscape() {
        assertThrows(IllegalArgumentException.class, () -> Ref.direct("../outside", SHA));
    }

    @Test
    void testOnlyHeadAndRefsNamespaceAccepted() {
        assertThrows(IllegalArgumentException.class, () -> Ref.direct("config", SHA));
        assertThrows(IllegalArgumentException.class, () -> Ref.direct("objects/ce/0136", SHA));
        assertThrows(IllegalArgumentException.class, () -> Ref.symbolic("HEAD", "config"));
        assertThrows(RepositoryException.class, () -> refs.readRef("config"));
    }
}
