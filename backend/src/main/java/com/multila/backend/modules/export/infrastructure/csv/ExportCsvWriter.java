package com.multila.backend.modules.export.infrastructure.csv;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

import com.multila.backend.modules.export.application.ExportRowSource.RowHandler;
import com.multila.backend.modules.export.domain.ExportFileKind;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import org.springframework.stereotype.Component;

/**
 * Writes export rows as CSV with a header line in the column order of the file kind.
 */
@Component
public class ExportCsvWriter {

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Opens a row writer on {@code target}. Closing the returned writer flushes and closes the target.
     */
    public CsvRowWriter open(ExportFileKind kind, Writer target) throws IOException {
        SequenceWriter sequenceWriter = csvMapper.writerFor(Map.class)
                .with(schemaFor(kind))
                .writeValues(target);
        return new CsvRowWriter(sequenceWriter);
    }

    public CsvSchema schemaFor(ExportFileKind kind) {
        CsvSchema.Builder builder = CsvSchema.builder();
        kind.columns().forEach(builder::addColumn);
        return builder.setUseHeader(true).build();
    }

    public static final class CsvRowWriter implements RowHandler, AutoCloseable {

        private final SequenceWriter sequenceWriter;
        private long rows;

        private CsvRowWriter(SequenceWriter sequenceWriter) {
            this.sequenceWriter = sequenceWriter;
        }

        @Override
        public void handle(Map<String, Object> row) throws IOException {
            sequenceWriter.write(row);
            rows++;
        }

        public long rowCount() {
            return rows;
        }

        @Override
        public void close() throws IOException {
            sequenceWriter.close();
        }
    }
}
