package gitclone.core.transport;

import java.util.Objects;

/**
 * A ref name and the object id the remote advertised for it.
 */
public final class AdvertisedRef {
    private final String name;
    private final String sha;

    public AdvertisedRef(String name, String sha) {
        this.name = Objects.requireNonNull(name, "name");
        this.sha = Objects.requireNonNull(sha, "sha");
    }

    public String getName() {
        return name;
    }

    public String getSha() {
        return sha;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        AdvertisedRef that = (AdvertisedRef) obj;
        return name.equals(that.name) && sha.equals(that.sha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sha);
    }

    @Override
    public String toString() {
        return sha + " " + name;
    }
}
