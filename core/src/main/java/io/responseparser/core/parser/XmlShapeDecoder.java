package io.responseparser.core.parser;

import io.responseparser.core.error.ShapeDecodeException;
import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import io.responseparser.core.spi.TimestampParser;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

/**
 * Decodes XML DOM elements against shapes.
 *
 * <p>
 * Structures are decoded through a tag index of the element's children (see
 * {@link XmlDocuments#indexChildren}). A repeated tag is only legal for a flattened list or
 * flattened map member; anywhere else it is a {@link ShapeDecodeException}. A member missing from
 * the body is omitted from the result.
 *
 * <p>
 * Thread-safe: holds only the injected timestamp parser.
 */
public final class XmlShapeDecoder extends ShapeDecoder<Element> {

    private static final String DEFAULT_KEY_NAME = "key";
    private static final String DEFAULT_VALUE_NAME = "value";

    public XmlShapeDecoder(TimestampParser timestampParser) {
        super(timestampParser);
        register(this::handleStructure, ShapeKind.STRUCTURE);
        register(this::handleMap, ShapeKind.MAP);
        register(this::handleBoolean, ShapeKind.BOOLEAN);
        register(this::handleInteger, ShapeKind.INTEGER, ShapeKind.LONG);
        register(this::handleFloat, ShapeKind.FLOAT, ShapeKind.DOUBLE);
        register(this::handleTimestamp, ShapeKind.TIMESTAMP);
        register(this::handleBlob, ShapeKind.BLOB);
        register(this::handleString, ShapeKind.STRING, ShapeKind.CHARACTER);
    }

    private Object handleStructure(Shape shape, Element node) {
        Map<String, Object> parsed = new LinkedHashMap<>();
        Map<String, List<Element>> index = XmlDocuments.indexChildren(node);
        shape.members().forEach((memberName, memberShape) -> {
            if (memberShape.serialization().hasLocation()) {
                // headers and status code are read by the REST decoder
                return;
            }
            List<Element> memberNodes = index.get(memberKeyName(memberShape, memberName));
            if (memberNodes != null) {
                parsed.put(memberName, decodeMember(memberName, memberShape, memberNodes));
            }
        });
        return parsed;
    }

    private Object decodeMember(String memberName, Shape memberShape, List<Element> memberNodes) {
        if (memberShape.isFlattenedList()) {
            return decodeItems(memberShape, memberNodes);
        }
        if (memberShape.kind() == ShapeKind.MAP && memberShape.serialization().flattened()) {
            return decodeEntries(memberShape, memberNodes);
        }
        if (memberNodes.size() > 1) {
            throw new ShapeDecodeException("Member '" + memberName + "' occurs " + memberNodes.size()
                    + " times but its shape is not a flattened collection");
        }
        return decode(memberShape, memberNodes.get(0));
    }

    /**
     * The XML tag a member is read from: the inner member name of a flattened list, else the
     * member's explicit name, else the member key.
     */
    static String memberKeyName(Shape memberShape, String memberName) {
        if (memberShape.isFlattenedList()) {
            String itemName = memberShape.member().serialization().name();
            if (itemName != null) {
                return itemName;
            }
        }
        return memberShape.serialization().nameOr(memberName);
    }

    @Override
    protected Iterable<Element> listItems(Shape shape, Element node) {
        if (shape.isFlattenedList()) {
            // a lone flattened element is indistinguishable from a scalar at this point
            return List.of(node);
        }
        return XmlDocuments.childElements(node);
    }

    private Object handleMap(Shape shape, Element node) {
        return decodeEntries(shape, XmlDocuments.childElements(node));
    }

    private Map<Object, Object> decodeEntries(Shape shape, List<Element> entries) {
        String keyName = shape.key().serialization().nameOr(DEFAULT_KEY_NAME);
        String valueName = shape.value().serialization().nameOr(DEFAULT_VALUE_NAME);
        Map<Object, Object> parsed = new LinkedHashMap<>();
        for (Element entry : entries) {
            Element keyNode = null;
            Element valueNode = null;
            for (Element child : XmlDocuments.childElements(entry)) {
                String tag = XmlDocuments.localName(child);
                if (tag.equals(keyName)) {
                    keyNode = requireSingle(keyNode, child, tag);
                } else if (tag.equals(valueName)) {
                    valueNode = requireSingle(valueNode, child, tag);
                } else {
                    throw new ShapeDecodeException("Unknown tag in map entry: <" + tag + ">");
                }
            }
            if (keyNode == null || valueNode == null) {
                throw new ShapeDecodeException("Map entry must contain exactly one <" + keyName + "> and one <"
                        + valueName + ">");
            }
            parsed.put(decode(shape.key(), keyNode), decode(shape.value(), valueNode));
        }
        return parsed;
    }

    private static Element requireSingle(Element existing, Element candidate, String tag) {
        if (existing != null) {
            throw new ShapeDecodeException("Duplicate <" + tag + "> in map entry");
        }
        return candidate;
    }

    private Object handleBoolean(Shape shape, Element node) {
        return ScalarValues.toBoolean(XmlDocuments.text(node));
    }

    private Object handleInteger(Shape shape, Element node) {
        return ScalarValues.toLong(XmlDocuments.text(node));
    }

    private Object handleFloat(Shape shape, Element node) {
        return ScalarValues.toDouble(XmlDocuments.text(node));
    }

    private Object handleTimestamp(Shape shape, Element node) {
        return ScalarValues.toTimestamp(XmlDocuments.text(node), timestampParser);
    }

    private Object handleBlob(Shape shape, Element node) {
        return ScalarValues.toBytes(XmlDocuments.text(node));
    }

    private Object handleString(Shape shape, Element node) {
        return XmlDocuments.text(node);
    }

    /** Unregistered kinds read the element text. */
    @Override
    protected Object defaultHandle(Shape shape, Element node) {
        return XmlDocuments.text(node);
    }
}
