package com.codemap.dgml.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import com.codemap.dgml.model.Category;
import com.codemap.dgml.model.CategoryRef;
import com.codemap.dgml.model.Condition;
import com.codemap.dgml.model.DirectedGraph;
import com.codemap.dgml.model.GraphElement;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Setter;
import com.codemap.dgml.model.Style;

import lombok.extern.log4j.Log4j2;

/**
 * Serializes a {@link DirectedGraph} as a DGML document.
 *
 * <p>
 * Layout: a {@code DirectedGraph} root holding {@code Nodes}, {@code Links},
 * {@code Categories}, {@code Properties} and {@code Styles} groups; empty
 * groups are omitted. Custom properties of nodes and links become attributes.
 * A custom property with no schema entry gets one declared on the fly, typed
 * from its first value seen.
 *
 * <p>
 * The output depends only on the graph, so equal graphs serialize to equal
 * documents.
 */
@Log4j2
public final class DgmlWriter {
    public static final String NAMESPACE = "http://schemas.microsoft.com/vs/2009/dgml";

    private static final XMLOutputFactory FACTORY = XMLOutputFactory.newInstance();
    private static final String INDENT = "  ";

    /** Renders the document to a string. */
    public String write(DirectedGraph graph) {
        StringWriter out = new StringWriter(4096);
        write(graph, out);
        return out.toString();
    }

    /** Writes the document to a UTF-8 file, replacing it if present. */
    public void write(DirectedGraph graph, Path path) {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(graph, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write DGML to " + path, e);
        }
    }

    /** Writes the document; the writer is flushed but not closed. */
    public void write(DirectedGraph graph, Writer out) {
        try {
            XMLStreamWriter x = FACTORY.createXMLStreamWriter(out);
            x.writeStartDocument("utf-8", "1.0");
            newline(x, 0);
            x.writeStartElement("DirectedGraph");
            x.writeDefaultNamespace(NAMESPACE);

            if (!graph.getNodes().isEmpty()) {
                open(x, "Nodes", 1);
                for (Node n : graph.getNodes())
                    writeNode(x, n);
                close(x, 1);
            }
            if (!graph.getLinks().isEmpty()) {
                open(x, "Links", 1);
                for (Link l : graph.getLinks())
                    writeLink(x, l);
                close(x, 1);
            }
            if (!graph.getCategories().isEmpty()) {
                open(x, "Categories", 1);
                for (Category c : graph.getCategories()) {
                    empty(x, "Category", 2);
                    attribute(x, "Id", c.getId());
                    attribute(x, "Label", c.getLabel());
                }
                close(x, 1);
            }
            List<Property> schema = effectiveSchema(graph);
            if (!schema.isEmpty()) {
                open(x, "Properties", 1);
                for (Property p : schema) {
                    empty(x, "Property", 2);
                    attribute(x, "Id", p.getId());
                    attribute(x, "Label", p.getLabel());
                    attribute(x, "Description", p.getDescription());
                    attribute(x, "DataType", p.getDataType());
                }
                close(x, 1);
            }
            if (!graph.getStyles().isEmpty()) {
                open(x, "Styles", 1);
                for (Style s : graph.getStyles())
                    writeStyle(x, s);
                close(x, 1);
            }

            newline(x, 0);
            x.writeEndElement();
            x.writeEndDocument();
            x.flush();
            x.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to write DGML document", e);
        }
    }

    private static void writeNode(XMLStreamWriter x, Node n) throws XMLStreamException {
        boolean hasRefs = !n.getCategoryRefs().isEmpty();
        if (hasRefs)
            open(x, "Node", 2);
        else
            empty(x, "Node", 2);
        attribute(x, "Id", n.getId());
        attribute(x, "Label", n.getLabel());
        attribute(x, "Category", n.getCategory());
        customAttributes(x, n);
        if (hasRefs) {
            for (CategoryRef r : n.getCategoryRefs()) {
                empty(x, "Category", 3);
                attribute(x, "Ref", r.getRef());
            }
            close(x, 2);
        }
    }

    private static void writeLink(XMLStreamWriter x, Link l) throws XMLStreamException {
        empty(x, "Link", 2);
        attribute(x, "Source", l.getSource());
        attribute(x, "Target", l.getTarget());
        attribute(x, "Label", l.getLabel());
        attribute(x, "Category", l.getCategory());
        customAttributes(x, l);
    }

    private static void writeStyle(XMLStreamWriter x, Style s) throws XMLStreamException {
        open(x, "Style", 2);
        attribute(x, "TargetType", s.getTargetType() != null ? s.getTargetType().markupName() : null);
        attribute(x, "GroupLabel", s.getGroupLabel());
        attribute(x, "ValueLabel", s.getValueLabel());
        for (Condition c : s.getConditions()) {
            empty(x, "Condition", 3);
            attribute(x, "Expression", c.getExpression());
        }
        for (Setter st : s.getSetters()) {
            empty(x, "Setter", 3);
            attribute(x, "Property", st.getProperty());
            attribute(x, "Value", st.getValue());
            attribute(x, "Expression", st.getExpression());
        }
        close(x, 2);
    }

    private static void customAttributes(XMLStreamWriter x, GraphElement e) throws XMLStreamException {
        for (Map.Entry<String, Object> p : e.getProperties().entrySet())
            attribute(x, p.getKey(), format(p.getValue()));
    }

    /** Declared properties, followed by any custom attribute in use but not declared. */
    static List<Property> effectiveSchema(DirectedGraph graph) {
        Map<String, Property> schema = new LinkedHashMap<>();
        for (Property p : graph.getProperties())
            schema.putIfAbsent(p.getId(), p);
        int declared = schema.size();
        for (Node n : graph.getNodes())
            declareUsed(schema, n);
        for (Link l : graph.getLinks())
            declareUsed(schema, l);
        if (schema.size() > declared)
            log.debug("Declared {} undeclared custom propert(ies) implicitly", schema.size() - declared);
        return new ArrayList<>(schema.values());
    }

    private static void declareUsed(Map<String, Property> schema, GraphElement e) {
        for (Map.Entry<String, Object> p : e.getProperties().entrySet()) {
            if (p.getValue() != null && !schema.containsKey(p.getKey()))
                schema.put(p.getKey(), Property.of(p.getKey(), dataType(p.getValue()), null));
        }
    }

    static String dataType(Object value) {
        if (value instanceof Boolean)
            return Property.BOOLEAN;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte)
            return Property.INT;
        if (value instanceof Long)
            return "System.Int64";
        if (value instanceof Double || value instanceof Float)
            return Property.DOUBLE;
        return Property.STRING;
    }

    static String format(Object value) {
        if (value == null)
            return null;
        if (value instanceof Boolean b)
            return b ? "True" : "False";
        return value.toString();
    }

    private static void attribute(XMLStreamWriter x, String name, String value) throws XMLStreamException {
        if (value != null)
            x.writeAttribute(name, value);
    }

    private static void open(XMLStreamWriter x, String name, int depth) throws XMLStreamException {
        newline(x, depth);
        x.writeStartElement(name);
    }

    private static void empty(XMLStreamWriter x, String name, int depth) throws XMLStreamException {
        newline(x, depth);
        x.writeEmptyElement(name);
    }

    private static void close(XMLStreamWriter x, int depth) throws XMLStreamException {
        newline(x, depth);
        x.writeEndElement();
    }

    private static void newline(XMLStreamWriter x, int depth) throws XMLStreamException {
        x.writeCharacters("\n" + INDENT.repeat(depth));
    }
}
