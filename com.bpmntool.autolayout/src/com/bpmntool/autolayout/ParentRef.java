package com.bpmntool.autolayout;

import java.util.Objects;

/**
 * The resolved container of a shape. Computed once per resolve call by
 * {@link ContainmentResolver#analyze} and then switched on wherever a
 * parent-relative offset is needed.
 */
public final class ParentRef {

    public enum Kind {
        /** Drawn directly on the canvas */
        NONE,
        /** Member of a lane */
        LANE,
        /** Direct child of a pool without lanes */
        POOL,
        /** Drawn inside a collapsible sub-container shape */
        SUB_CONTAINER,
        /** Attached to the boundary of a host shape */
        HOST
    }

    private static final ParentRef NO_PARENT = new ParentRef(Kind.NONE, null);

    private final Kind kind;
    private final String id;

    private ParentRef(Kind kind, String id) {
        this.kind = kind;
        this.id = id;
    }

    public static ParentRef none() {
        return NO_PARENT;
    }

    public static ParentRef lane(String laneId) {
        return new ParentRef(Kind.LANE, Objects.requireNonNull(laneId));
    }

    public static ParentRef pool(String poolId) {
        return new ParentRef(Kind.POOL, Objects.requireNonNull(poolId));
    }

    public static ParentRef subContainer(String containerId) {
        return new ParentRef(Kind.SUB_CONTAINER, Objects.requireNonNull(containerId));
    }

    public static ParentRef host(String hostId) {
        return new ParentRef(Kind.HOST, Objects.requireNonNull(hostId));
    }

    public Kind getKind() {
        return kind;
    }

    /** Container id; null for {@link Kind#NONE}. */
    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ParentRef)) {
            return false;
        }
        ParentRef other = (ParentRef) obj;
        return kind == other.kind && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return kind == Kind.NONE ? "NONE" : kind + "(" + id + ")";
    }
}
