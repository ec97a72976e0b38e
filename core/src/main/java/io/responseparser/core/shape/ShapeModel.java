package io.responseparser.core.shape;

import io.responseparser.core.model.Shape;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Named shapes resolved from one model document. Immutable. */
public final class ShapeModel {

    private final String source;
    private final Map<String, Shape> shapes;

    ShapeModel(String source, Map<String, Shape> shapes) {
        this.source = source;
        this.shapes = Collections.unmodifiableMap(new LinkedHashMap<>(shapes));
    }

    /** The named shape, or empty if the model does not define it. */
    public Optional<Shape> find(String name) {
        return Optional.ofNullable(shapes.get(name));
    }

    /**
     * The named shape.
     *
     * @throws IllegalArgumentException if the model does not define it
     */
    public Shape shape(String name) {
        return find(name)
                .orElseThrow(() -> new IllegalArgumentException("Shape '" + name + "' is not defined in " + source));
    }

    public Set<String> names() {
        return shapes.keySet();
    }

    /** The file path or resource identifier the model was read from. */
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "ShapeModel[" + source + ", " + shapes.size() + " shapes]";
    }
}
