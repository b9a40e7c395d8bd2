package com.vedant.dataquery.format;

import com.vedant.dataquery.exception.UnsupportedFormatException;
import com.vedant.dataquery.model.FileFormat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps every readable {@link FileFormat} to its reader.
 */
public class FormatReaderRegistry {

    private final Map<FileFormat, FormatReader> readers = new EnumMap<>(FileFormat.class);

    public FormatReaderRegistry(List<FormatReader> readers) {
        for (FormatReader r : readers) {
            FormatReader previous = this.readers.put(r.format(), r);
            if (previous != null) {
                throw new IllegalStateException("Two readers registered for " + r.format());
            }
        }
    }

    public static FormatReaderRegistry withDefaults() {
        CsvFormatReader csv = new CsvFormatReader(FileFormat.CSV);
        CsvFormatReader txt = new CsvFormatReader(FileFormat.TXT);
        return new FormatReaderRegistry(List.of(csv, txt, new XlsxFormatReader(), new ParquetFormatReader(),
                new AvroFormatReader(), new JsonFormatReader(), new XmlFormatReader()));
    }

    public boolean supports(FileFormat format) {
        return readers.containsKey(format);
    }

    public Set<FileFormat> supportedFormats() {
        return Collections.unmodifiableSet(readers.keySet());
    }

    public FormatReader readerFor(String fileName, FileFormat format) {
        FormatReader reader = readers.get(format);
        if (reader == null) {
            throw new UnsupportedFormatException(fileName, format);
        }
        return reader;
    }
}
