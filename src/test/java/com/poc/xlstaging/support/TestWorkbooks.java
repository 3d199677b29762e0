package com.poc.xlstaging.support;

import com.poc.xlstaging.dto.CellAddress;
import com.poc.xlstaging.service.excel.CellAddressing;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.poifs.crypt.EncryptionInfo;
import org.apache.poi.poifs.crypt.EncryptionMode;
import org.apache.poi.poifs.crypt.Encryptor;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Builds landfill feedback workbooks with Apache POI, laid out the way the bundled schema expects.
 */
public final class TestWorkbooks {

    public static final String FORM_TAB = "Feedback Form";

    /** Field name to {label, row} for the landfill schema. */
    private static final Map<String, Object[]> LANDFILL_LAYOUT = new LinkedHashMap<>();

    static {
        LANDFILL_LAYOUT.put("id_incidence", new Object[]{"Incidence/Emission ID:", 15});
        LANDFILL_LAYOUT.put("facility_name", new Object[]{"Facility Name:", 16});
        LANDFILL_LAYOUT.put("id_arb_swis", new Object[]{"SWIS ID:", 17});
        LANDFILL_LAYOUT.put("contact_name", new Object[]{"Contact Name:", 18});
        LANDFILL_LAYOUT.put("contact_email", new Object[]{"Contact Email:", 19});
        LANDFILL_LAYOUT.put("lat_and_long", new Object[]{"Latitude, Longitude:", 20});
        LANDFILL_LAYOUT.put("inspection_timestamp", new Object[]{"Inspection Date and Time:", 21});
        LANDFILL_LAYOUT.put("initial_leak_concentration", new Object[]{"Initial Leak Concentration (ppmv):", 22});
        LANDFILL_LAYOUT.put("emission_identified_flag_fk", new Object[]{"Emission Identified:", 23});
        LANDFILL_LAYOUT.put("additional_notes", new Object[]{"Additional Notes:", 24});
    }

    private TestWorkbooks() {
    }

    public static Map<String, Object> sampleLandfillValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id_incidence", 1002001d);
        values.put("facility_name", "Acme Landfill");
        values.put("id_arb_swis", "19-AA-0001");
        values.put("contact_name", "Dana Reyes");
        values.put("contact_email", "dana.reyes@example.com");
        values.put("lat_and_long", "34.05,-118.25");
        values.put("inspection_timestamp", LocalDateTime.of(2025, 3, 14, 9, 30));
        values.put("initial_leak_concentration", 512.5d);
        values.put("emission_identified_flag_fk", "Yes");
        return values;
    }

    /**
     * Workbook with the reserved manifest and metadata tabs plus one landfill form tab holding the given values.
     */
    public static Workbook landfillWorkbook(Map<String, Object> values) {
        return landfillWorkbook(values, "landfill_v01_00");
    }

    public static Workbook landfillWorkbook(Map<String, Object> values, String schemaName) {
        Workbook workbook = new XSSFWorkbook();
        Sheet manifest = workbook.createSheet("_json_schema");
        set(workbook, manifest, "$B$15", FORM_TAB);
        set(workbook, manifest, "$C$15", schemaName);

        Sheet metadata = workbook.createSheet("_json_metadata");
        set(workbook, metadata, "$B$15", "sector");
        set(workbook, metadata, "$C$15", "Landfill");

        Sheet form = workbook.createSheet(FORM_TAB);
        LANDFILL_LAYOUT.forEach((field, layout) -> {
            int row = (Integer) layout[1];
            set(workbook, form, "$B$" + row, layout[0]);
            if (values.containsKey(field)) {
                set(workbook, form, "$C$" + row, values.get(field));
            }
        });
        return workbook;
    }

    public static byte[] landfillBytes(Map<String, Object> values) {
        return toBytes(landfillWorkbook(values));
    }

    public static void set(Workbook workbook, Sheet sheet, String absoluteAddress, Object value) {
        CellAddress address = CellAddressing.parse(absoluteAddress).getValue();
        Row row = sheet.getRow(address.getRow() - 1);
        if (row == null) {
            row = sheet.createRow(address.getRow() - 1);
        }
        Cell cell = row.createCell((int) address.getColumnNumber() - 1);
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            CellStyle style = workbook.createCellStyle();
            style.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm"));
            cell.setCellValue((LocalDateTime) value);
            cell.setCellStyle(style);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    public static byte[] toBytes(Workbook workbook) {
        try (Workbook closing = workbook; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            closing.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Agile-encrypts an .xlsx package the way Excel does for password-protected files. */
    public static byte[] encrypt(byte[] xlsx, String password) {
        try (POIFSFileSystem fs = new POIFSFileSystem(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            EncryptionInfo info = new EncryptionInfo(EncryptionMode.agile);
            Encryptor encryptor = info.getEncryptor();
            encryptor.confirmPassword(password);
            try (OPCPackage pkg = OPCPackage.open(new ByteArrayInputStream(xlsx));
                 OutputStream encrypted = encryptor.getDataStream(fs)) {
                pkg.save(encrypted);
            }
            fs.writeFilesystem(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (GeneralSecurityException | InvalidFormatException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Copy of a zip package with one entry's content replaced. */
    public static byte[] replaceEntry(byte[] zip, String entryName, String content) {
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip));
             ByteArrayOutputStream bytes = new ByteArrayOutputStream()) {
            try (ZipOutputStream out = new ZipOutputStream(bytes)) {
                ZipEntry entry;
                while ((entry = in.getNextEntry()) != null) {
                    out.putNextEntry(new ZipEntry(entry.getName()));
                    if (entry.getName().equals(entryName)) {
                        out.write(content.getBytes(StandardCharsets.UTF_8));
                    } else {
                        in.transferTo(out);
                    }
                    out.closeEntry();
                }
            }
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
