package gitclone.core.objects.commit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import gitclone.core.objects.ObjectType;
import gitclone.core.objects.RawObject;
import gitclone.exceptions.CorruptObjectException;

public class GitCommitTest {

    private static final String TREE = "aaa96ced2d9a1c8e72c56b253a0e2fe78393feb7";
    private static final String PARENT = "ce013625030ba8dba906f756967f9e9ca394464a";
    private static final String IDENT = "Ada Lovelace <ada@example.com> 1700000000 +0000";

    @Test
    void testContentLayout() {
        GitCommit commit = new GitCommit(TREE, List.of(PARENT), IDENT, IDENT, "first\n");

        assertEquals("tree " + TREE + "\n"
                + "parent " + PARENT + "\n"
                + "author " + IDENT + "\n"
                + "committer " + IDENT + "\n"
                + "\n"
                + "first\n", new String(commit.getContent(), StandardCharsets.UTF_8));
    }

    @Test
    void testDeserializeRestoresFields() throws Exception {
        GitCommit original = new GitCommit(TREE, List.of(PARENT), IDENT, IDENT, "subject\n\nbody\n");

        GitCommit read = new GitCommit();
        read.deserialize(original.serialize());

        assertEquals(original, read);
        assertEquals("subject\n\nbody\n", read.getMessage());
    }

    @Test
    void testUnknownHeadersAndContinuationLinesSkipped() throws Exception {
        String payload = "tree " + TREE + "\n"
                + "author " + IDENT + "\n"
                + "committer " + IDENT + "\n"
                + "gpgsig -----BEGIN PGP SIGNATURE-----\n"
                + " iQEzBAABCAAdFiEE\n"
                + " -----END PGP SIGNATURE-----\n"
                + "\n"
                + "signed\n";
        GitCommit commit = new GitCommit();
        commit.deserialize(new RawObject(ObjectType.COMMIT, payload.getBytes(StandardCharsets.UTF_8)).serialize());

        assertEquals(TREE, commit.getTreeSha());
        assertEquals(List.of(), commit.getParentShas());
        assertEquals("signed\n", commit.getMessage());
    }

    @Test
    void testReadTreeShaFromFirstLine() throws Exception {
        byte[] payload = ("tree " + TREE + "\nauthor " + IDENT + "\n\nmsg").getBytes(StandardCharsets.UTF_8);

        assertEquals(TREE, GitCommit.readTreeSha(payload));
    }

    @Test
    void testReadTreeShaRequiresTreeFirst() {
        byte[] payload = ("parent " + PARENT + "\ntree " + TREE + "\n").getBytes(StandardCharsets.UTF_8);

        assertThrows(CorruptObjectException.class, () -> GitCommit.readTreeSha(payload));
    }

    @Test
    void testWrongKindRejected() {
        byte[] blob = new RawObject(ObjectType.BLOB, "tree x".getBytes(StandardCharsets.UTF_8)).serialize();

        assertThrows(CorruptObjectException.class, () -> new GitCommit().deserialize(blob));
    }
}
