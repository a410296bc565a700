package org.dxworks.docmark.math;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element of the structured math markup (OMML). Names are local names in the
 * {@code m:} namespace; attribute names may carry their own prefix
 * ({@code xml:space}).
 */
public final class MathMarkup {

    public static final String NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String PREFIX = "m";
    private static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";

    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<MathMarkup> children = new ArrayList<>();
    private String text;

    public MathMarkup(String name) {
        this.name = name;
    }

    public MathMarkup attribute(String attributeName, String value) {
        attributes.put(attributeName, value);
        return this;
    }

    public MathMarkup text(String value) {
        this.text = value;
        return this;
    }

    public MathMarkup add(MathMarkup child) {
        children.add(child);
        return this;
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<MathMarkup> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /** First direct child with the given name, or null. */
    public MathMarkup child(String childName) {
        for (MathMarkup child : children) {
            if (child.name.equals(childName)) {
                return child;
            }
        }
        return null;
    }

    public String toXml() {
        StringWriter buffer = new StringWriter();
        try {
            XMLStreamWriter writer = XMLOutputFactory.newInstance().createXMLStreamWriter(buffer);
            writer.setPrefix(PREFIX, NAMESPACE);
            write(writer, true);
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to serialize math markup", e);
        }
        return buffer.toString();
    }

    private void write(XMLStreamWriter writer, boolean root) throws XMLStreamException {
        boolean empty = children.isEmpty() && text == null;
        if (empty) {
            writer.writeEmptyElement(PREFIX, name, NAMESPACE);
        } else {
            writer.writeStartElement(PREFIX, name, NAMESPACE);
        }
        if (root) {
            writer.writeNamespace(PREFIX, NAMESPACE);
        }
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            String key = attribute.getKey();
            if (key.startsWith("xml:")) {
                writer.writeAttribute("xml", XML_NAMESPACE, key.substring(4), attribute.getValue());
            } else {
                writer.writeAttribute(PREFIX, NAMESPACE, key, attribute.getValue());
            }
        }
        if (empty) {
            return;
        }
        if (text != null) {
            writer.writeCharacters(text);
        }
        for (MathMarkup child : children) {
            child.write(writer, false);
        }
        writer.writeEndElement();
    }
}
