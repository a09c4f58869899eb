package org.tanzu.vcenterperf.soap;

import java.util.Objects;

/**
 * Reference to a server-side managed object (vim25 ManagedObjectReference).
 *
 * Both parts are opaque and only meaningful within the session that produced them.
 */
public final class ObjectRef {

    private final String kind;
    private final String id;

    public ObjectRef(String kind, String id) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getKind() { return kind; }
    public String getId() { return id; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectRef)) return false;
        ObjectRef other = (ObjectRef) o;
        return kind.equals(other.kind) && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
