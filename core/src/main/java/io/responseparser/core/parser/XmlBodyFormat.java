package io.responseparser.core.parser;

import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import io.responseparser.core.spi.BodyFormat;
import java.util.LinkedHashMap;
import java.util.Objects;
import org.w3c.dom.Element;

/** XML body strategy for the REST decoder: the document element is decoded against the shape. */
public final class XmlBodyFormat implements BodyFormat {

    private final XmlShapeDecoder decoder;

    public XmlBodyFormat(XmlShapeDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    }

    /** An empty body yields an empty map for structures and {@code null} otherwise. */
    @Override
    public Object decode(Shape shape, byte[] body) {
        Element root = XmlDocuments.parse(body);
        if (root == null) {
            return shape.kind() == ShapeKind.STRUCTURE ? new LinkedHashMap<String, Object>() : null;
        }
        return decoder.decode(shape, root);
    }
}
