package io.responseparser.core.parser;

import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import io.responseparser.core.spi.TimestampParser;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive-descent decoding core shared by the XML and JSON body decoders.
 *
 * <p>
 * Each decoder registers one handler per {@link ShapeKind} it understands; several kinds may share a
 * routine (e.g. {@code float} and {@code double}). A kind without a registered handler falls through
 * to {@link #defaultHandle}, which body formats use to pass already-native scalars through.
 *
 * <p>
 * List decoding is common to all formats: the body decoder isolates the element nodes via
 * {@link #listItems} and the member shape is decoded against each of them in order.
 *
 * <p>
 * Thread-safe once constructed: the handler table is only written from constructors and decode
 * state lives on the call stack.
 *
 * @param <N> the decoded-body node type ({@code Element} for XML, {@code JsonNode} for JSON)
 */
public abstract class ShapeDecoder<N> {

    /** Decodes one node against one shape. */
    @FunctionalInterface
    protected interface Handler<N> {
        Object handle(Shape shape, N node);
    }

    private final Map<ShapeKind, Handler<N>> handlers = new EnumMap<>(ShapeKind.class);

    protected final TimestampParser timestampParser;

    protected ShapeDecoder(TimestampParser timestampParser) {
        this.timestampParser = Objects.requireNonNull(timestampParser, "timestampParser must not be null");
        register(this::handleList, ShapeKind.LIST);
    }

    /**
     * Binds {@code handler} to every kind in {@code kinds}, replacing any earlier binding.
     */
    protected final void register(Handler<N> handler, ShapeKind... kinds) {
        for (ShapeKind kind : kinds) {
            handlers.put(kind, handler);
        }
    }

    /**
     * Decodes {@code node} against {@code shape}.
     *
     * @throws io.responseparser.core.error.ShapeDecodeException if the node violates the shape
     */
    public Object decode(Shape shape, N node) {
        Handler<N> handler = handlers.get(shape.kind());
        if (handler == null) {
            return defaultHandle(shape, node);
        }
        return handler.handle(shape, node);
    }

    /** Decodes every item against the list's member shape, preserving order. */
    protected final List<Object> decodeItems(Shape listShape, Iterable<N> items) {
        Shape memberShape = listShape.member();
        List<Object> parsed = new ArrayList<>();
        for (N item : items) {
            parsed.add(decode(memberShape, item));
        }
        return parsed;
    }

    protected Object handleList(Shape shape, N node) {
        return decodeItems(shape, listItems(shape, node));
    }

    /** Isolates the element nodes of a list node. */
    protected abstract Iterable<N> listItems(Shape shape, N node);

    /** Fallback for kinds without a registered handler. */
    protected abstract Object defaultHandle(Shape shape, N node);
}
