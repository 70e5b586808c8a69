package gitclone.core.objects;

/**
 * The kinds of object the loose object store holds. Annotated tags are not
 * modelled; a pack carrying them is rejected before anything reaches the
 * store.
 */
public enum ObjectType {
    BLOB("blob"),
    TREE("tree"),
    COMMIT("commit");

    private final String typeName;

    ObjectType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public static ObjectType fromString(String type) {
        for (ObjectType objectType : values()) {
            if (objectType.typeName.equals(type)) {
                return objectType;
            }
        }
        throw new IllegalArgumentException("Unknown object type: " + type);
    }
}
