package io.responseparser.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable structural descriptor of an expected response value.
 *
 * <p>
 * Structures keep their members in declaration order. Lists have a single {@link #member()},
 * maps a {@link #key()} and {@link #value()}. Scalars have none of these. Instances are built once,
 * before any parsing, and are safe to share between threads.
 */
public final class Shape {

    private final ShapeKind kind;
    private final Serialization serialization;
    private final Map<String, Shape> members;
    private final Shape member;
    private final Shape key;
    private final Shape value;

    private Shape(
            ShapeKind kind,
            Serialization serialization,
            Map<String, Shape> members,
            Shape member,
            Shape key,
            Shape value) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.serialization = serialization != null ? serialization : Serialization.empty();
        this.members = members;
        this.member = member;
        this.key = key;
        this.value = value;
    }

    // ── Factory methods ──

    /** Creates a structure shape; member order is preserved. */
    public static Shape structure(Map<String, Shape> members) {
        return structure(members, Serialization.empty());
    }

    public static Shape structure(Map<String, Shape> members, Serialization serialization) {
        Objects.requireNonNull(members, "members must not be null");
        return new Shape(
                ShapeKind.STRUCTURE,
                serialization,
                Collections.unmodifiableMap(new LinkedHashMap<>(members)),
                null,
                null,
                null);
    }

    public static Shape list(Shape member) {
        return list(member, Serialization.empty());
    }

    public static Shape list(Shape member, Serialization serialization) {
        Objects.requireNonNull(member, "member must not be null");
        return new Shape(ShapeKind.LIST, serialization, Map.of(), member, null, null);
    }

    public static Shape map(Shape key, Shape value) {
        return map(key, value, Serialization.empty());
    }

    public static Shape map(Shape key, Shape value, Serialization serialization) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        return new Shape(ShapeKind.MAP, serialization, Map.of(), null, key, value);
    }

    public static Shape scalar(ShapeKind kind) {
        return scalar(kind, Serialization.empty());
    }

    /**
     * Creates a scalar shape.
     *
     * @throws IllegalArgumentException if {@code kind} is a container kind
     */
    public static Shape scalar(ShapeKind kind, Serialization serialization) {
        if (kind.isContainer()) {
            throw new IllegalArgumentException("Container kind " + kind + " needs its dedicated factory");
        }
        return new Shape(kind, serialization, Map.of(), null, null, null);
    }

    /** Returns a copy of this shape with a different serialization descriptor. */
    public Shape withSerialization(Serialization newSerialization) {
        return new Shape(kind, newSerialization, members, member, key, value);
    }

    // ── Accessors ──

    public ShapeKind kind() {
        return kind;
    }

    public Serialization serialization() {
        return serialization;
    }

    /** Structure members in declaration order; empty for non-structures. */
    public Map<String, Shape> members() {
        return members;
    }

    /** List element shape, or {@code null}. */
    public Shape member() {
        return member;
    }

    /** Map key shape, or {@code null}. */
    public Shape key() {
        return key;
    }

    /** Map value shape, or {@code null}. */
    public Shape value() {
        return value;
    }

    /** True for a list whose elements are not wrapped in an enclosing element. */
    public boolean isFlattenedList() {
        return kind == ShapeKind.LIST && serialization.flattened();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shape that)) return false;
        return kind == that.kind
                && serialization.equals(that.serialization)
                && members.equals(that.members)
                && Objects.equals(member, that.member)
                && Objects.equals(key, that.key)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, serialization, members, member, key, value);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case STRUCTURE -> "Shape[structure" + members.keySet() + "]";
            case LIST -> "Shape[list<" + member.kind().typeName() + ">]";
            case MAP -> "Shape[map<" + key.kind().typeName() + ", " + value.kind().typeName() + ">]";
            default -> "Shape[" + kind.typeName() + "]";
        };
    }
}
