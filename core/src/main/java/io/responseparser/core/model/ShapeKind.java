package io.responseparser.core.model;

/**
 * Closed set of shape kinds understood by the decoders. Each kind carries the type name used in
 * service-model documents ({@code "structure"}, {@code "timestamp"}, ...).
 */
public enum ShapeKind {
    STRUCTURE("structure"),
    LIST("list"),
    MAP("map"),
    STRING("string"),
    CHARACTER("character"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    LONG("long"),
    FLOAT("float"),
    DOUBLE("double"),
    BLOB("blob"),
    TIMESTAMP("timestamp");

    private final String typeName;

    ShapeKind(String typeName) {
        this.typeName = typeName;
    }

    /** The model document type name, e.g. {@code "structure"}. */
    public String typeName() {
        return typeName;
    }

    /** True for {@link #STRUCTURE}, {@link #LIST} and {@link #MAP}. */
    public boolean isContainer() {
        return this == STRUCTURE || this == LIST || this == MAP;
    }

    /**
     * Resolves a model type name.
     *
     * @param typeName the type name (case-sensitive)
     * @return the matching kind
     * @throws IllegalArgumentException if the name is not a known kind
     */
    public static ShapeKind fromTypeName(String typeName) {
        for (ShapeKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown shape type: '" + typeName + "'");
    }
}
