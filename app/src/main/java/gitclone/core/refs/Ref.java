package gitclone.core.refs;

import java.util.Objects;

import gitclone.utils.crypto.HashUtils;

/**
 * A named pointer: either directly at an object id, or symbolically at
 * another ref (as HEAD usually is).
 */
public final class Ref {
    public static final String HEAD = "HEAD";
    public static final String REFS_PREFIX = "refs/";

    private final String name;
    private final String sha;
    private final String target;

    private Ref(String name, String sha, String target) {
        this.name = validateName(name);
        this.sha = sha;
        this.target = target;
    }

    public static Ref direct(String name, String sha) {
        if (!HashUtils.isValidSha(sha)) {
            throw new IllegalArgumentException("Invalid object id for ref " + name + ": " + sha);
        }
        return new Ref(name, sha.toLowerCase(), null);
    }

    public static Ref symbolic(String name, String target) {
        return new Ref(name, null, validateName(target));
    }

    public String getName() {
        return name;
    }

    public boolean isSymbolic() {
        return target != null;
    }

    /**
     * Object id of a direct ref, null for a symbolic one.
     */
    public String getSha() {
        return sha;
    }

    /**
     * Name of the ref a symbolic ref points at, null for a direct one.
     */
    public String getTarget() {
        return target;
    }

    /**
     * Whether {@code name} may be stored as a ref: {@code HEAD}, or a name
     * under {@code refs/} that stays inside the git directory.
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        if (!name.equals(HEAD) && !name.startsWith(REFS_PREFIX)) {
            return false;
        }
        return !(name.endsWith("/") || name.contains("..") || name.contains("\\") || name.contains("//")
                || name.chars().anyMatch(c -> c < 0x20 || c == ' '));
    }

    private static String validateName(String name) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid ref name: " + name);
        }
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        Ref that = (Ref) obj;
        return name.equals(that.name) && Objects.equals(sha, that.sha) && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sha, target);
    }

    @Override
    public String toString() {
        return isSymbolic() ? name + " -> " + target : name + " " + sha;
    }
}
