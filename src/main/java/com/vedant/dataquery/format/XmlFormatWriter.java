package com.vedant.dataquery.format;

import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * {@code <data><row><column>value</column>...</row>...</data>}; null values are empty elements.
 */
public class XmlFormatWriter implements FormatWriter {

    static final String ROOT = "data";
    static final String ROW = "row";

    private static final Pattern ELEMENT_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9._-]*$");

    @Override
    public FileFormat format() {
        return FileFormat.XML;
    }

    @Override
    public void write(DataTable table, ExportOptions options, OutputStream out) throws IOException {
        List<String> names = table.columnNames();
        for (String name : names) {
            if (!ELEMENT_NAME.matcher(name).matches() || name.toLowerCase(Locale.ROOT).startsWith("xml")) {
                throw new IllegalArgumentException("Invalid name for an XML element: '" + name + "'");
            }
        }
        try {
            XMLStreamWriter xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out, "UTF-8");
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement(ROOT);
            for (List<Object> row : table.rows()) {
                xml.writeStartElement(ROW);
                for (int c = 0; c < names.size(); c++) {
                    Object v = row.get(c);
                    if (v == null) {
                        xml.writeEmptyElement(names.get(c));
                    } else {
                        xml.writeStartElement(names.get(c));
                        xml.writeCharacters(ValueText.of(v));
                        xml.writeEndElement();
                    }
                }
                xml.writeEndElement();
            }
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("XML writing error: " + e.getMessage(), e);
        }
    }
}
