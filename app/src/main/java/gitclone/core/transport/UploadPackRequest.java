package gitclone.core.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Body of the single-round-trip clone negotiation: one {@code want} line per
 * distinct advertised id, a flush, then {@code done}. No capabilities are
 * requested, so the server answers with a plain pack (no side-band).
 */
public final class UploadPackRequest {
    private final List<String> wants;

    private UploadPackRequest(List<String> wants) {
        this.wants = Collections.unmodifiableList(wants);
    }

    /**
     * Distinct ids of the given refs, in advertisement order.
     */
    public static UploadPackRequest forRefs(List<AdvertisedRef> refs) {
        Set<String> distinct = new LinkedHashSet<>();
        for (AdvertisedRef ref : refs) {
            distinct.add(ref.getSha());
        }
        return new UploadPackRequest(new ArrayList<>(distinct));
    }

    public List<String> getWants() {
        return wants;
    }

    public byte[] encode() {
        if (wants.isEmpty()) {
            throw new IllegalStateException("Nothing to fetch: want list is empty");
        }
        PktLine.Writer writer = new PktLine.Writer();
        for (String sha : wants) {
            writer.line("want " + sha + "\n");
        }
        return writer.flush().line("done\n").toByteArray();
    }
}
