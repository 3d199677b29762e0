package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.CellAddress;

import java.io.Closeable;
import java.util.List;

/**
 * Read-only view of a workbook's last-computed cell values.
 */
public interface WorkbookReader extends Closeable {

    List<String> getSheetNames();

    boolean hasSheet(String sheetName);

    /**
     * Returns the cell value as String, Double, Boolean or LocalDateTime, or null when the cell is empty,
     * out of range, or holds an error.
     * @param sheetName tab name; must exist
     * @param address absolute cell address
     */
    Object getCellValue(String sheetName, CellAddress address);

    /** Cell value as trimmed text, or null when the cell has no value. */
    default String getCellText(String sheetName, CellAddress address) {
        Object value = getCellValue(sheetName, address);
        if (value == null) {
            return null;
        }
        if (value instanceof Double) {
            return ValueCoercer.plainNumber((Double) value);
        }
        return value.toString().trim();
    }
}
