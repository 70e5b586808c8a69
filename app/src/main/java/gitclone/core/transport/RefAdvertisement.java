package gitclone.core.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.core.refs.Ref;
import gitclone.exceptions.ProtocolException;
import gitclone.utils.crypto.HashUtils;

// @formatter:off
/**
 * Parsed response of {@code GET info/refs?service=git-upload-pack}.
 *
 * ┌────────────────────────────────────────────────────────────────────┐
 * │ 001e# service=git-upload-pack\n                                     │
 * │ 0000                                                               │
 * │ 00xx<sha> HEAD\0multi_ack symref=HEAD:refs/heads/main ...\n          │
 * │ 003f<sha> refs/heads/main\n                                         │
 * │ 0000                                                               │
 * └────────────────────────────────────────────────────────────────────┘
 *
 * The service banner and its flush are optional. Capabilities ride on the
 * first ref line after a NUL byte.
 */
// @formatter:on
public final class RefAdvertisement {
    private static final Logger logger = LoggerFactory.getLogger(RefAdvertisement.class);

    private static final String SERVICE_PREFIX = "# service=";
    private static final String CAPABILITIES_PLACEHOLDER = "capabilities^{}";
    private static final String PEELED_SUFFIX = "^{}";
    private static final String SYMREF_HEAD = "symref=HEAD:";

    private final List<AdvertisedRef> refs;
    private final Set<String> capabilities;
    private final String headTarget;

    private RefAdvertisement(List<AdvertisedRef> refs, Set<String> capabilities, String headTarget) {
        this.refs = Collections.unmodifiableList(refs);
        this.capabilities = Collections.unmodifiableSet(capabilities);
        this.headTarget = headTarget;
    }

    public static RefAdvertisement parse(byte[] body) throws ProtocolException {
        List<PktLine.Packet> packets = PktLine.decode(body);

        int index = 0;
        if (!packets.isEmpty() && !packets.get(0).isFlush()
                && packets.get(0).asLine().startsWith(SERVICE_PREFIX)) {
            index++;
            if (index < packets.size() && packets.get(index).isFlush()) {
                index++;
            }
        }

        List<AdvertisedRef> refs = new ArrayList<>();
        Set<String> capabilities = new LinkedHashSet<>();
        boolean first = true;

        for (; index < packets.size(); index++) {
            PktLine.Packet packet = packets.get(index);
            if (packet.isFlush()) {
                break;
            }

            String line = packet.asLine();
            if (line.startsWith("ERR ")) {
                throw new ProtocolException("Remote error: " + line.substring(4));
            }

            if (first) {
                int nul = line.indexOf('\0');
                if (nul >= 0) {
                    for (String capability : line.substring(nul + 1).trim().split(" ")) {
                        if (!capability.isEmpty()) {
                            capabilities.add(capability);
                        }
                    }
                    line = line.substring(0, nul);
                }
                first = false;
            }

            AdvertisedRef ref = parseRefLine(line);
            if (ref.getName().equals(CAPABILITIES_PLACEHOLDER) || ref.getName().endsWith(PEELED_SUFFIX)) {
                continue;
            }
            refs.add(ref);
        }

        String headTarget = null;
        for (String capability : capabilities) {
            if (capability.startsWith(SYMREF_HEAD)) {
                headTarget = capability.substring(SYMREF_HEAD.length());
                break;
            }
        }

        return new RefAdvertisement(refs, capabilities, headTarget);
    }

    private static AdvertisedRef parseRefLine(String line) throws ProtocolException {
        int space = line.indexOf(' ');
        if (space != HashUtils.HEX_LENGTH) {
            throw new ProtocolException("Malformed ref advertisement line: '" + line + "'");
        }
        String sha = line.substring(0, space);
        String name = line.substring(space + 1);
        if (!HashUtils.isValidSha(sha) || name.isEmpty()) {
            throw new ProtocolException("Malformed ref advertisement line: '" + line + "'");
        }
        return new AdvertisedRef(name, sha.toLowerCase());
    }

    public List<AdvertisedRef> getRefs() {
        return refs;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public boolean isEmpty() {
        return refs.isEmpty();
    }

    /**
     * The branch HEAD points at, when the remote advertised a
     * {@code symref=HEAD:} capability.
     */
    public Optional<String> getHeadTarget() {
        return Optional.ofNullable(headTarget);
    }

    public Optional<AdvertisedRef> findRef(String name) {
        return refs.stream().filter(ref -> ref.getName().equals(name)).findFirst();
    }

    /**
     * Refs to persist locally. HEAD becomes symbolic when the remote named its
     * target, otherwise it keeps the advertised id. Names other than HEAD and
     * those under {@code refs/} are skipped.
     */
    public List<Ref> toLocalRefs() throws ProtocolException {
        List<Ref> result = new ArrayList<>();
        for (AdvertisedRef ref : refs) {
            if (!Ref.isValidName(ref.getName())) {
                logger.warn("Ignoring advertised ref with unusable name '{}'", ref.getName());
                continue;
            }
            try {
                if (ref.getName().equals(Ref.HEAD) && headTarget != null) {
                    result.add(Ref.symbolic(Ref.HEAD, headTarget));
                } else {
                    result.add(Ref.direct(ref.getName(), ref.getSha()));
                }
            } catch (IllegalArgumentException e) {
                throw new ProtocolException("Remote advertised an unusable ref: " + e.getMessage(), e);
            }
        }
        return result;
    }
}
