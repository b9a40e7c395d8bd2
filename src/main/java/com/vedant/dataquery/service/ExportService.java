package com.vedant.dataquery.service;

import com.vedant.dataquery.exception.ExportErrorKind;
import com.vedant.dataquery.exception.ExportException;
import com.vedant.dataquery.format.AvroFormatWriter;
import com.vedant.dataquery.format.CsvFormatWriter;
import com.vedant.dataquery.format.FormatWriter;
import com.vedant.dataquery.format.JsonFormatWriter;
import com.vedant.dataquery.format.ParquetFormatWriter;
import com.vedant.dataquery.format.XlsxFormatWriter;
import com.vedant.dataquery.format.XmlFormatWriter;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.session.WorkspaceSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a result table to bytes in the requested format. Bytes are only handed out after a
 * complete write.
 */
@Service
public class ExportService {

    private static final Logger logger = LoggerFactory.getLogger(ExportService.class);

    static final String FILE_BASE_NAME = "query_result";

    private final Map<FileFormat, FormatWriter> writers = new EnumMap<>(FileFormat.class);

    public ExportService() {
        this(List.of(new CsvFormatWriter(FileFormat.CSV), new CsvFormatWriter(FileFormat.TXT),
                new XlsxFormatWriter(), new JsonFormatWriter(), new ParquetFormatWriter(),
                new XmlFormatWriter(), new AvroFormatWriter()));
    }

    public ExportService(List<FormatWriter> writers) {
        for (FormatWriter w : writers) this.writers.put(w.format(), w);
    }

    public record ExportedFile(byte[] content, String fileName, String mimeType) {}

    /** Exports the session's current (edited if present) result. */
    public ExportedFile exportCurrent(WorkspaceSession session, FileFormat format, ExportOptions options) {
        DataTable table;
        synchronized (session) {
            table = session.currentResult();
        }
        if (table == null) {
            throw new ExportException(ExportErrorKind.NO_RESULT, "Run a query before exporting its result.");
        }
        return export(table, format, options);
    }

    public ExportedFile export(DataTable table, FileFormat format, ExportOptions options) {
        FormatWriter writer = writers.get(format);
        if (writer == null || !format.isExportable()) {
            throw new ExportException(ExportErrorKind.UNSUPPORTED_FORMAT, "Unsupported file format: " + format);
        }
        ExportOptions opts = options == null ? ExportOptions.defaults() : options;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            writer.write(table, opts, buffer);
        } catch (ExportException ex) {
            logger.warn("{} export of {} rows refused: {}", format, table.rowCount(), ex.getMessage());
            throw ex;
        } catch (IOException | RuntimeException ex) {
            logger.error("{} export failed", format, ex);
            throw new ExportException(ExportErrorKind.UNAVAILABLE, format.extension()
                    + " export not available for your data. Please select a different format. ("
                    + ex.getMessage() + ")", ex);
        }
        logger.info("Exported {} rows as {} ({} bytes)", table.rowCount(), format, buffer.size());
        return new ExportedFile(buffer.toByteArray(), FILE_BASE_NAME + "." + format.extension(), format.mimeType());
    }
}
