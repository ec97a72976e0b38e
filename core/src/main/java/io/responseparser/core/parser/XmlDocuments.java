package io.responseparser.core.parser;

import io.responseparser.core.error.MalformedBodyException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Shared XML DOM helpers: hardened parsing, namespace-free tag names, tag indexes and leaf
 * collapsing.
 *
 * <p>
 * Thread-safe: stateless utility class. A fresh {@link DocumentBuilder} is created per parse.
 */
public final class XmlDocuments {

    private XmlDocuments() {}

    /**
     * Parses a body into its root element.
     *
     * @return the document element, or {@code null} for an empty or blank body
     * @throws MalformedBodyException if the bytes are not well-formed XML
     */
    public static Element parse(byte[] body) {
        if (body == null || isBlank(body)) {
            return null;
        }
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new ByteArrayInputStream(body)).getDocumentElement();
        } catch (SAXException | IOException e) {
            throw new MalformedBodyException("xml", e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private static boolean isBlank(byte[] body) {
        for (byte b : body) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }

    /** Tag name with any namespace prefix removed. */
    public static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String name = node.getNodeName();
        int brace = name.lastIndexOf('}');
        if (brace >= 0) {
            return name.substring(brace + 1);
        }
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /** Immediate child elements in document order; empty for {@code null}. */
    public static List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        if (parent == null) {
            return children;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element child) {
                children.add(child);
            }
        }
        return children;
    }

    public static boolean hasChildElements(Element element) {
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    /**
     * Groups the immediate children of {@code parent} by local tag name. Repeated tags accumulate
     * in document order, so a single occurrence is a one-element list.
     */
    public static Map<String, List<Element>> indexChildren(Element parent) {
        Map<String, List<Element>> index = new LinkedHashMap<>();
        for (Element child : childElements(parent)) {
            index.computeIfAbsent(localName(child), k -> new ArrayList<>()).add(child);
        }
        return index;
    }

    /** Text content of an element, never null. */
    public static String text(Element element) {
        String text = element.getTextContent();
        return text != null ? text : "";
    }

    /**
     * Collapses the subtree under {@code parent} into nested maps: an element with children becomes
     * a map, a leaf becomes its text. Repeated sibling tags become a list of collapsed values.
     */
    public static Map<String, Object> collapseChildren(Element parent) {
        Map<String, Object> collapsed = new LinkedHashMap<>();
        indexChildren(parent).forEach((tag, elements) -> {
            if (elements.size() == 1) {
                collapsed.put(tag, collapse(elements.get(0)));
            } else {
                List<Object> values = new ArrayList<>(elements.size());
                elements.forEach(element -> values.add(collapse(element)));
                collapsed.put(tag, values);
            }
        });
        return collapsed;
    }

    private static Object collapse(Element element) {
        return hasChildElements(element) ? collapseChildren(element) : text(element);
    }
}
