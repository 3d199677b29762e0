package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.CellAddress;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.util.RecordFormatException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link WorkbookReader} over an Apache POI workbook. Formulas are never evaluated; their cached results are read.
 */
@Slf4j
public class PoiWorkbookReader implements WorkbookReader {

    private final Workbook workbook;

    public PoiWorkbookReader(Workbook workbook) {
        this.workbook = workbook;
    }

    /**
     * Opens .xlsx, .xlsm or .xls content.
     * @throws IOException when the bytes are not a readable workbook, including encrypted and corrupt packages
     */
    public static PoiWorkbookReader open(byte[] content) throws IOException {
        try (InputStream in = new ByteArrayInputStream(content)) {
            return new PoiWorkbookReader(WorkbookFactory.create(in));
        } catch (IllegalArgumentException e) {
            // POI signals unknown and empty formats with IllegalArgumentException subclasses
            throw new IOException("Not a readable workbook: " + e.getMessage(), e);
        } catch (EncryptedDocumentException e) {
            throw new IOException("Workbook is password protected: " + e.getMessage(), e);
        } catch (POIXMLException | OpenXML4JRuntimeException | RecordFormatException e) {
            throw new IOException("Workbook content is corrupt: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> getSheetNames() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return names;
    }

    @Override
    public boolean hasSheet(String sheetName) {
        return workbook.getSheet(sheetName) != null;
    }

    @Override
    public Object getCellValue(String sheetName, CellAddress address) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            throw new IllegalArgumentException("No such sheet: " + sheetName);
        }
        SpreadsheetVersion version = workbook.getSpreadsheetVersion();
        if (address.getRow() > version.getMaxRows() || isBeyondLastColumn(address, version)) {
            return null;
        }
        Row row = sheet.getRow(address.getRow() - 1);
        if (row == null) {
            return null;
        }
        Cell cell = row.getCell(CellReference.convertColStringToIndex(address.getColumn()));
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case ERROR:
                log.debug("Cell {}!{} holds an error value; treated as empty", sheetName, address);
                return null;
            default:
                return null;
        }
    }

    private static boolean isBeyondLastColumn(CellAddress address, SpreadsheetVersion version) {
        if (address.getColumn().length() > version.getLastColumnName().length()) {
            return true;
        }
        return address.getColumnNumber() > version.getMaxColumns();
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }
}
