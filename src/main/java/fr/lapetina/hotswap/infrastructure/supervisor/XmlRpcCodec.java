package fr.lapetina.hotswap.infrastructure.supervisor;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal XML-RPC codec covering the value types the supervisord API uses:
 * string, int/i4, boolean, double, array and struct.
 */
final class XmlRpcCodec {

    private XmlRpcCodec() {
    }

    /**
     * Encodes a {@code methodCall} document.
     */
    static String encodeCall(String methodName, Object... params) {
        StringBuilder xml = new StringBuilder(256);
        xml.append("<?xml version=\"1.0\"?><methodCall><methodName>")
                .append(escape(methodName))
                .append("</methodName><params>");
        for (Object param : params) {
            xml.append("<param>");
            encodeValue(xml, param);
            xml.append("</param>");
        }
        xml.append("</params></methodCall>");
        return xml.toString();
    }

    private static void encodeValue(StringBuilder xml, Object value) {
        xml.append("<value>");
        if (value instanceof Boolean b) {
            xml.append("<boolean>").append(b ? '1' : '0').append("</boolean>");
        } else if (value instanceof Integer i) {
            xml.append("<int>").append(i).append("</int>");
        } else if (value instanceof Double d) {
            xml.append("<double>").append(d).append("</double>");
        } else if (value instanceof List<?> list) {
            xml.append("<array><data>");
            for (Object item : list) {
                encodeValue(xml, item);
            }
            xml.append("</data></array>");
        } else if (value instanceof Map<?, ?> map) {
            xml.append("<struct>");
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                xml.append("<member><name>").append(escape(String.valueOf(entry.getKey()))).append("</name>");
                encodeValue(xml, entry.getValue());
                xml.append("</member>");
            }
            xml.append("</struct>");
        } else {
            xml.append("<string>").append(escape(String.valueOf(value))).append("</string>");
        }
        xml.append("</value>");
    }

    /**
     * Decodes a {@code methodResponse} document.
     *
     * @return the single returned value
     * @throws GatewayException carrying the fault code when the response is a fault
     */
    static Object decodeResponse(byte[] body) throws GatewayException {
        Document document = parse(body);
        Element root = document.getDocumentElement();
        if (!"methodResponse".equals(root.getTagName())) {
            throw new GatewayException("Unexpected XML-RPC root element: " + root.getTagName());
        }

        Element fault = firstChild(root, "fault");
        if (fault != null) {
            Object faultValue = decodeValue(requireChild(fault, "value"));
            if (faultValue instanceof Map<?, ?> struct) {
                int code = struct.get("faultCode") instanceof Integer c ? c : 0;
                String faultString = String.valueOf(struct.get("faultString"));
                throw new GatewayException("Supervisor fault " + code + ": " + faultString, code, null);
            }
            throw new GatewayException("Malformed XML-RPC fault");
        }

        Element params = requireChild(root, "params");
        Element param = requireChild(params, "param");
        return decodeValue(requireChild(param, "value"));
    }

    private static Object decodeValue(Element value) throws GatewayException {
        Element typed = firstElement(value);
        if (typed == null) {
            // Untyped value defaults to string
            return value.getTextContent();
        }
        String text = typed.getTextContent().trim();
        try {
            return switch (typed.getTagName()) {
                case "string" -> typed.getTextContent();
                case "int", "i4" -> Integer.parseInt(text);
                case "boolean" -> "1".equals(text) || "true".equalsIgnoreCase(text);
                case "double" -> Double.parseDouble(text);
                case "array" -> decodeArray(typed);
                case "struct" -> decodeStruct(typed);
                default -> text;
            };
        } catch (NumberFormatException e) {
            throw new GatewayException("Malformed XML-RPC " + typed.getTagName() + ": " + text, e);
        }
    }

    private static List<Object> decodeArray(Element array) throws GatewayException {
        List<Object> items = new ArrayList<>();
        Element data = requireChild(array, "data");
        for (Element value : children(data, "value")) {
            items.add(decodeValue(value));
        }
        return items;
    }

    private static Map<String, Object> decodeStruct(Element struct) throws GatewayException {
        Map<String, Object> members = new LinkedHashMap<>();
        for (Element member : children(struct, "member")) {
            String name = requireChild(member, "name").getTextContent();
            members.put(name, decodeValue(requireChild(member, "value")));
        }
        return members;
    }

    private static Document parse(byte[] body) throws GatewayException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new GatewayException("Unreadable XML-RPC response: " + e.getMessage(), e);
        }
    }

    private static Element requireChild(Element parent, String tagName) throws GatewayException {
        Element child = firstChild(parent, tagName);
        if (child == null) {
            throw new GatewayException("Missing <" + tagName + "> in <" + parent.getTagName() + ">");
        }
        return child;
    }

    private static Element firstChild(Element parent, String tagName) {
        List<Element> matches = children(parent, tagName);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static Element firstElement(Element parent) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                return (Element) nodes.item(i);
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(((Element) node).getTagName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
