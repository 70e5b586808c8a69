package gitclone.core.pack;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.core.objects.ObjectStore;
import gitclone.core.objects.RawObject;
import gitclone.exceptions.CorruptDeltaException;
import gitclone.exceptions.ObjectException;
import gitclone.exceptions.ObjectNotFoundException;
import gitclone.exceptions.PackException;
import gitclone.exceptions.ProtocolException;
import gitclone.exceptions.UnsupportedPackEntryException;
import gitclone.utils.crypto.HashUtils;

// @formatter:off
/**
 * Decodes a pack stream and writes every object it carries into an
 * {@link ObjectStore}.
 *
 * Pack layout:
 * ┌────────┬─────────┬─────────────┬─────────────────────────┬──────────────┐
 * │ "PACK" │ version │ entry count │ entries, back to back   │ SHA-1 trailer│
 * │ 4 bytes│ 4 bytes │ 4 bytes     │                         │ 20 bytes     │
 * └────────┴─────────┴─────────────┴─────────────────────────┴──────────────┘
 *
 * Entry layout:
 * ┌──────────────────┬──────────────────────────┬─────────────────────────┐
 * │ type+size varint │ base id (ref-delta only) │ zlib stream             │
 * └──────────────────┴──────────────────────────┴─────────────────────────┘
 *
 * Whole objects are stored under their own kind. A ref-delta is rebuilt
 * against its base and stored under the base's kind. Bases that only show up
 * later in the same pack are resolved after the last entry has been read.
 */
// @formatter:on
public class PackParser {
    private static final Logger logger = LoggerFactory.getLogger(PackParser.class);

    private static final byte[] MAGIC = "PACK".getBytes(StandardCharsets.US_ASCII);
    private static final int HEADER_LENGTH = 12;

    private final ObjectStore objectStore;
    private final boolean verifyChecksum;

    public PackParser(ObjectStore objectStore) {
        this(objectStore, true);
    }

    public PackParser(ObjectStore objectStore, boolean verifyChecksum) {
        this.objectStore = objectStore;
        this.verifyChecksum = verifyChecksum;
    }

    /**
     * A ref-delta whose base was not in the store when the entry was read.
     */
    private static final class PendingDelta {
        final int index;
        final int offset;
        final String baseSha;
        final byte[] delta;

        PendingDelta(int index, int offset, String baseSha, byte[] delta) {
            this.index = index;
            this.offset = offset;
            this.baseSha = baseSha;
            this.delta = delta;
        }
    }

    public PackParseResult parse(byte[] pack) throws PackException, ObjectException {
        if (pack.length < HEADER_LENGTH) {
            throw new ProtocolException("Pack stream too short: " + pack.length + " bytes");
        }

        verifyChecksum(pack);

        PackReader in = new PackReader(pack);
        byte[] magic = in.readBytes(MAGIC.length);
        if (!Arrays.equals(MAGIC, magic)) {
            throw new ProtocolException("Missing PACK signature, got '"
                    + new String(magic, StandardCharsets.ISO_8859_1) + "'");
        }

        int version = in.readInt();
        if (version != 2 && version != 3) {
            logger.warn("Unexpected pack version {}, decoding entries as version 2", version);
        }

        long entryCount = Integer.toUnsignedLong(in.readInt());
        if (entryCount > Integer.MAX_VALUE) {
            throw new ProtocolException("Unsupported pack entry count " + entryCount);
        }
        logger.debug("Pack version {} with {} entries ({} bytes)", version, entryCount, pack.length);

        List<String> written = new ArrayList<>();
        List<PendingDelta> pending = new ArrayList<>();
        int deltaCount = 0;

        for (int index = 0; index < entryCount; index++) {
            int entryOffset = in.position();
            PackEntryHeader header = VarInt.readPackEntryHeader(in);
            logger.debug("Entry #{} at offset {}: {} ({} bytes)", index, entryOffset, header.getType(), header.getSize());

            switch (header.getType()) {
                case COMMIT:
                case TREE:
                case BLOB: {
                    byte[] data = in.inflate(header.getSize());
                    written.add(objectStore.writeObject(header.getType().getObjectType(), data));
                    break;
                }
                case REF_DELTA: {
                    deltaCount++;
                    String baseSha = HashUtils.toHex(in.readBytes(HashUtils.RAW_LENGTH));
                    byte[] delta = in.inflate(header.getSize());
                    if (objectStore.hasObject(baseSha)) {
                        written.add(resolveDelta(index, entryOffset, baseSha, delta));
                    } else {
                        logger.debug("Deferring delta #{}: base {} not yet available", index, baseSha);
                        pending.add(new PendingDelta(index, entryOffset, baseSha, delta));
                    }
                    break;
                }
                case TAG:
                case OFS_DELTA:
                    throw new UnsupportedPackEntryException(header.getType(), "Unsupported pack entry #" + index
                            + " of type " + header.getType() + " at offset " + entryOffset);
                default:
                    throw new IllegalStateException("Unhandled pack entry type: " + header.getType());
            }
        }

        verifyTrailerPosition(in);
        resolvePending(pending, written);

        logger.info("Unpacked {} objects ({} deltas)", entryCount, deltaCount);
        return new PackParseResult(version, (int) entryCount, deltaCount, written);
    }

    private String resolveDelta(int index, int offset, String baseSha, byte[] delta)
            throws ObjectException, CorruptDeltaException {
        RawObject base = objectStore.readRawObject(baseSha);
        byte[] target;
        try {
            target = DeltaApplier.apply(base.getContent(), delta);
        } catch (CorruptDeltaException e) {
            throw new CorruptDeltaException("Delta entry #" + index + " at offset " + offset
                    + " against base " + baseSha + ": " + e.getMessage(), e);
        }
        return objectStore.writeObject(base.getType(), target);
    }

    private void resolvePending(List<PendingDelta> pending, List<String> written)
            throws ObjectException, CorruptDeltaException {
        boolean progress = true;
        while (!pending.isEmpty() && progress) {
            progress = false;
            Iterator<PendingDelta> it = pending.iterator();
            while (it.hasNext()) {
                PendingDelta delta = it.next();
                if (objectStore.hasObject(delta.baseSha)) {
                    written.add(resolveDelta(delta.index, delta.offset, delta.baseSha, delta.delta));
                    it.remove();
                    progress = true;
                }
            }
        }

        if (!pending.isEmpty()) {
            PendingDelta first = pending.get(0);
            throw new ObjectNotFoundException("Base object " + first.baseSha + " for delta entry #"
                    + first.index + " at offset " + first.offset + " not found ("
                    + pending.size() + " unresolved deltas)");
        }
    }

    /**
     * Checks the trailing SHA-1 over everything before it. Done before any
     * entry is decoded so a damaged stream writes nothing to the store.
     */
    private void verifyChecksum(byte[] pack) throws ProtocolException {
        if (!verifyChecksum) {
            return;
        }
        if (pack.length < HEADER_LENGTH + HashUtils.RAW_LENGTH) {
            throw new ProtocolException("Pack stream too short to carry a checksum: " + pack.length + " bytes");
        }

        int packEnd = pack.length - HashUtils.RAW_LENGTH;
        MessageDigest digest = HashUtils.newSha1();
        digest.update(pack, 0, packEnd);
        byte[] actual = digest.digest();
        byte[] expected = Arrays.copyOfRange(pack, packEnd, pack.length);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new ProtocolException("Pack checksum mismatch: trailer " + HashUtils.toHex(expected)
                    + ", computed " + HashUtils.toHex(actual));
        }
    }

    /**
     * With checksums on, the last entry must end exactly where the trailer
     * starts.
     */
    private void verifyTrailerPosition(PackReader in) throws ProtocolException {
        if (verifyChecksum && in.remaining() != HashUtils.RAW_LENGTH) {
            throw new ProtocolException("Expected the " + HashUtils.RAW_LENGTH + "-byte pack checksum after offset "
                    + in.position() + ", found " + in.remaining() + " bytes");
        }
    }
}
