package gitclone.core.objects.impl;

import java.nio.charset.StandardCharsets;

import gitclone.core.objects.GitObject;
import gitclone.core.objects.ObjectType;
import gitclone.core.objects.RawObject;
import gitclone.exceptions.CorruptObjectException;
import gitclone.exceptions.ObjectException;

// @formatter:off
/**
 * BLOB (Binary Large Object) - Represents the content of a file.
 * Stores the actual file data without any metadata like filename or
 * permissions; those live in the tree entry that points at the blob.
 *
 * Example for "hello\n" content:
 * ┌──────────────────────────────────────────────────────┐
 * │ "blob 6\0hello\n"                                     │
 * │ ^    ^ ^                                             │
 * │ │    │ └─ null terminator (0x00)                     │
 * │ │    └─ size as decimal string                       │
 * │ └─ object type                                       │
 * └──────────────────────────────────────────────────────┘
 * SHA-1: ce013625030ba8dba906f756967f9e9ca394464a
 */
// @formatter:on
public final class GitBlob implements GitObject {
    private byte[] content;
    private String cachedSha;

    public GitBlob() {
        this.content = new byte[0];
    }

    public GitBlob(byte[] content) {
        this.content = content != null ? content.clone() : new byte[0];
    }

    public GitBlob(String content) {
        this.content = content.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public ObjectType getType() {
        return ObjectType.BLOB;
    }

    @Override
    public byte[] getContent() {
        return content.clone();
    }

    @Override
    public long getSize() {
        return content.length;
    }

    @Override
    public String getSha() {
        if (cachedSha == null) {
            cachedSha = GitObject.super.getSha();
        }
        return cachedSha;
    }

    @Override
    public void deserialize(byte[] data) throws ObjectException {
        RawObject raw = RawObject.parse(data);
        if (raw.getType() != ObjectType.BLOB) {
            throw new CorruptObjectException("Expected blob type, got: " + raw.getType().getTypeName());
        }
        this.content = raw.getContent();
        this.cachedSha = null;
    }

    @Override
    public String toString() {
        return "GitBlob{sha=" + getSha() + ", size=" + getSize() + "}";
    }
}
