package gitclone.core.objects.tree;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import gitclone.core.objects.GitObject;
import gitclone.core.objects.ObjectType;
import gitclone.core.objects.RawObject;
import gitclone.exceptions.CorruptObjectException;
import gitclone.exceptions.ObjectException;

// @formatter:off
/**
 * Tree Object Implementation
 *
 * A tree object represents a directory snapshot. It contains entries for
 * files and subdirectories, each with their mode, name, and SHA-1 hash.
 *
 * Tree Object Structure:
 * ┌─────────────────────────────────────────────────────────────────┐
 * │ Header: "tree" SPACE size NULL                                  │
 * │ Entry 1: mode SPACE name NULL [20-byte SHA-1]                   │
 * │ Entry 2: mode SPACE name NULL [20-byte SHA-1]                   │
 * │ ...                                                             │
 * │ Entry N: mode SPACE name NULL [20-byte SHA-1]                   │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * Entry order is part of the object's identity: an unsorted tree hashes
 * differently from the canonical one. This class keeps entries in the order
 * it was given or decoded them in; use {@link #sorted(List)} to build a
 * canonical listing.
 */
// @formatter:on
public class GitTree implements GitObject {

    private final List<GitTreeEntry> entries;

    public GitTree() {
        this.entries = new ArrayList<>();
    }

    public GitTree(List<GitTreeEntry> entries) {
        this.entries = new ArrayList<>(entries != null ? entries : Collections.emptyList());
    }

    @Override
    public ObjectType getType() {
        return ObjectType.TREE;
    }

    @Override
    public byte[] getContent() {
        return encode(entries);
    }

    public List<GitTreeEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public void deserialize(byte[] data) throws ObjectException {
        RawObject raw = RawObject.parse(data);
        if (raw.getType() != ObjectType.TREE) {
            throw new CorruptObjectException("Expected tree type, got: " + raw.getType().getTypeName());
        }
        entries.clear();
        entries.addAll(decode(raw.getContent()));
    }

    /**
     * Decodes a tree payload (header already stripped) into its entries, in
     * payload order.
     */
    public static List<GitTreeEntry> decode(byte[] payload) throws CorruptObjectException {
        List<GitTreeEntry> result = new ArrayList<>();
        int offset = 0;
        while (offset < payload.length) {
            GitTreeEntry.ParseResult parsed = GitTreeEntry.parseFrom(payload, offset, payload.length);
            result.add(parsed.entry);
            offset = parsed.nextOffset;
        }
        return result;
    }

    /**
     * Concatenates the serialized entries. No sorting happens here.
     */
    public static byte[] encode(List<GitTreeEntry> entries) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (GitTreeEntry entry : entries) {
            out.writeBytes(entry.serialize());
        }
        return out.toByteArray();
    }

    /**
     * Returns a copy of the entries in canonical tree order.
     */
    public static List<GitTreeEntry> sorted(List<GitTreeEntry> entries) {
        List<GitTreeEntry> copy = new ArrayList<>(entries);
        Collections.sort(copy);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("GitTree{sha=").append(getSha())
                .append(", entries=").append(entries.size())
                .append("}\n");

        for (GitTreeEntry entry : entries) {
            sb.append("  ").append(entry.toString()).append("\n");
        }

        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        GitTree gitTree = (GitTree) obj;
        return Objects.equals(entries, gitTree.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }
}
