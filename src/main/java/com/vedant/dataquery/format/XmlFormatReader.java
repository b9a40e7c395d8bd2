package com.vedant.dataquery.format;

import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.util.TypeInference;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * XML where every element child of the document root is a row. A row's attributes and the text
 * of its child elements are the columns.
 */
public class XmlFormatReader implements FormatReader {

    @Override
    public FileFormat format() {
        return FileFormat.XML;
    }

    @Override
    public List<ReadResult> read(byte[] content, LoadOptions options) {
        Element root = parse(content).getDocumentElement();

        List<Map<String, String>> records = new ArrayList<>();
        NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element row) {
                records.add(fields(row));
            }
        }
        if (records.isEmpty()) {
            throw new IngestionException("No row elements found under <" + root.getTagName() + ">");
        }

        Set<String> keys = new LinkedHashSet<>();
        for (Map<String, String> r : records) keys.addAll(r.keySet());

        List<Column> columns = new ArrayList<>(keys.size());
        for (String key : keys) {
            List<String> samples = new ArrayList<>(records.size());
            for (Map<String, String> r : records) samples.add(r.get(key));
            columns.add(new Column(key, TypeInference.infer(samples)));
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, String> r : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (Column c : columns) {
                row.add(TypeInference.cell(r.get(c.name()), c.type()));
            }
            rows.add(row);
        }
        try {
            return List.of(ReadResult.single(DataTable.of(columns, rows)));
        } catch (IllegalArgumentException e) {
            throw new IngestionException(e.getMessage(), e);
        }
    }

    private static Map<String, String> fields(Element row) {
        Map<String, String> out = new LinkedHashMap<>();
        NamedNodeMap attrs = row.getAttributes();
        for (int a = 0; a < attrs.getLength(); a++) {
            Attr attr = (Attr) attrs.item(a);
            out.put(attr.getName(), attr.getValue());
        }
        StringBuilder ownText = new StringBuilder();
        NodeList children = row.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n instanceof Element child) {
                out.put(child.getTagName(), hasElementChildren(child) ? null : child.getTextContent());
            } else if (n.getNodeType() == Node.TEXT_NODE || n.getNodeType() == Node.CDATA_SECTION_NODE) {
                ownText.append(n.getNodeValue());
            }
        }
        if (!ownText.toString().isBlank()) {
            out.put(row.getTagName(), ownText.toString().trim());
        }
        return out;
    }

    private static boolean hasElementChildren(Element e) {
        NodeList children = e.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) return true;
        }
        return false;
    }

    private static Document parse(byte[] content) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(content));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IngestionException("Invalid XML: " + e.getMessage(), e);
        }
    }
}
