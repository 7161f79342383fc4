package com.multila.backend.modules.export.application;

import java.io.IOException;
import java.util.Map;

import com.multila.backend.modules.export.domain.ExportFileKind;
import com.multila.backend.modules.export.domain.ExportFilter;

/**
 * Streams the denormalised rows of one export file, keyed by column name, in file order.
 */
public interface ExportRowSource {

    void stream(ExportFileKind kind, ExportFilter filter, RowHandler handler);

    @FunctionalInterface
    interface RowHandler {
        void handle(Map<String, Object> row) throws IOException;
    }
}
