package com.xbe.cli.jsonapi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved presence of one named relationship on a resource.
 *
 * <p>{@link Kind#ABSENT} (the relationship was not sent) and {@link Kind#NULL} (the server sent
 * {@code "data": null}) are distinct states. A to-many relationship with {@code "data": []} is
 * {@link Kind#TO_MANY} with no refs, which means "known to be empty".
 */
public record RelationshipState(Kind kind, List<ResourceRef> refs) {
    private static final RelationshipState ABSENT = new RelationshipState(Kind.ABSENT, List.of());
    private static final RelationshipState NULL = new RelationshipState(Kind.NULL, List.of());

    public RelationshipState {
        Objects.requireNonNull(kind, "kind");
        refs = refs == null ? List.of() : List.copyOf(refs);
        if (kind == Kind.TO_ONE && refs.size() != 1) {
            throw new IllegalArgumentException("A to-one state holds exactly one ref, got " + refs.size());
        }
        if ((kind == Kind.ABSENT || kind == Kind.NULL) && !refs.isEmpty()) {
            throw new IllegalArgumentException(kind + " state cannot hold refs");
        }
    }

    public static RelationshipState absent() {
        return ABSENT;
    }

    public static RelationshipState nullValue() {
        return NULL;
    }

    public static RelationshipState toOne(ResourceRef ref) {
        return new RelationshipState(Kind.TO_ONE, List.of(Objects.requireNonNull(ref, "ref")));
    }

    public static RelationshipState toMany(List<ResourceRef> refs) {
        return new RelationshipState(Kind.TO_MANY, refs);
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isToOne() {
        return kind == Kind.TO_ONE;
    }

    public boolean isToMany() {
        return kind == Kind.TO_MANY;
    }

    /**
     * True for {@link Kind#TO_ONE} and {@link Kind#TO_MANY}, including an empty to-many.
     */
    public boolean isPopulated() {
        return kind == Kind.TO_ONE || kind == Kind.TO_MANY;
    }

    public Optional<ResourceRef> ref() {
        return kind == Kind.TO_ONE ? Optional.of(refs.get(0)) : Optional.empty();
    }

    public List<String> ids() {
        var ids = new ArrayList<String>(refs.size());
        for (var ref : refs) {
            ids.add(ref.id());
        }
        return ids;
    }

    public enum Kind {
        ABSENT,
        NULL,
        TO_ONE,
        TO_MANY
    }
}
