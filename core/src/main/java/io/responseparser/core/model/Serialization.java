package io.responseparser.core.model;

/**
 * Wire-encoding descriptor attached to every {@link Shape}.
 *
 * <p>
 * {@code payload} and {@code resultWrapper} are only meaningful on the top-level output shape.
 * All string fields are nullable; {@code null} means "not declared".
 *
 * @param name          explicit wire name (XML tag, JSON key, header name or header prefix)
 * @param location      non-body location, or {@code null} for body members
 * @param flattened     true if list elements appear as siblings without a wrapper element
 * @param payload       name of the member that receives the whole body
 * @param resultWrapper XML element wrapping the output structure (query dialect)
 */
public record Serialization(
        String name, Location location, boolean flattened, String payload, String resultWrapper) {

    private static final Serialization EMPTY = new Serialization(null, null, false, null, null);

    /** Returns the descriptor with nothing declared. */
    public static Serialization empty() {
        return EMPTY;
    }

    /** Returns a descriptor declaring only an explicit wire name. */
    public static Serialization named(String name) {
        return new Serialization(name, null, false, null, null);
    }

    public Serialization withName(String newName) {
        return new Serialization(newName, location, flattened, payload, resultWrapper);
    }

    public Serialization withLocation(Location newLocation) {
        return new Serialization(name, newLocation, flattened, payload, resultWrapper);
    }

    public Serialization withFlattened(boolean newFlattened) {
        return new Serialization(name, location, newFlattened, payload, resultWrapper);
    }

    public Serialization withPayload(String newPayload) {
        return new Serialization(name, location, flattened, newPayload, resultWrapper);
    }

    public Serialization withResultWrapper(String newResultWrapper) {
        return new Serialization(name, location, flattened, payload, newResultWrapper);
    }

    /** True if the member is read from headers or the status line instead of the body. */
    public boolean hasLocation() {
        return location != null;
    }

    /** The explicit name if declared, else {@code fallback}. */
    public String nameOr(String fallback) {
        return name != null ? name : fallback;
    }
}
