package io.responseparser.core.model;

/** Where a non-body structure member is read from in a REST response. */
public enum Location {
    /** The numeric HTTP status code. */
    STATUS_CODE("statusCode"),
    /** A single header, named by the member's serialization name. */
    HEADER("header"),
    /** Every header sharing the serialization name as a prefix. */
    HEADERS("headers");

    private final String wireName;

    Location(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a model location name.
     *
     * @throws IllegalArgumentException if the name is not a known location
     */
    public static Location fromWireName(String wireName) {
        for (Location location : values()) {
            if (location.wireName.equals(wireName)) {
                return location;
            }
        }
        throw new IllegalArgumentException("Unknown member location: '" + wireName + "'");
    }
}
