package org.openphc.patientvault.ingest;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.openphc.patientvault.api.exception.SpreadsheetParseException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads patient rows from the first sheet of an .xlsx/.xls upload.
 * Structural problems (unreadable file, missing columns, too many rows) fail the
 * whole upload; row content is left to validation.
 */
@Component
@Slf4j
public class SpreadsheetParser {

    public static final String COL_PATIENT_ID = "Patient ID";
    public static final String COL_FIRST_NAME = "First Name";
    public static final String COL_LAST_NAME = "Last Name";
    public static final String COL_DATE_OF_BIRTH = "Date of Birth";
    public static final String COL_GENDER = "Gender";

    public static final List<String> REQUIRED_COLUMNS = List.of(
            COL_PATIENT_ID, COL_FIRST_NAME, COL_LAST_NAME, COL_DATE_OF_BIRTH, COL_GENDER);

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".xlsx", ".xls");

    private final int maxRows;

    public SpreadsheetParser(@Value("${patientvault.ingestion.max-rows:10000}") int maxRows) {
        this.maxRows = maxRows;
    }

    /**
     * Parse all non-blank data rows, in file order.
     */
    public List<PatientRow> parse(String fileName, InputStream content) {
        requireSupportedFormat(fileName);

        try (Workbook workbook = WorkbookFactory.create(content)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new SpreadsheetParseException("Spreadsheet contains no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getPhysicalNumberOfRows() > 0 ? sheet.getRow(sheet.getFirstRowNum()) : null;
            if (header == null) {
                throw new SpreadsheetParseException("Spreadsheet is empty");
            }

            // DataFormatter is not thread-safe, one per parse
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Map<String, Integer> columns = readHeader(header, formatter);
            List<String> missing = REQUIRED_COLUMNS.stream()
                    .filter(c -> !columns.containsKey(normalizeHeader(c)))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new SpreadsheetParseException("Missing required columns: " + String.join(", ", missing));
            }

            List<PatientRow> rows = new ArrayList<>();
            for (int i = header.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }
                PatientRow parsed = toPatientRow(row, columns, formatter, evaluator);
                if (isBlank(parsed)) {
                    continue;
                }
                if (rows.size() >= maxRows) {
                    throw new SpreadsheetParseException(
                            "Spreadsheet exceeds the maximum of " + maxRows + " data rows");
                }
                rows.add(parsed);
            }

            log.debug("Parsed {} data rows from '{}'", rows.size(), fileName);
            return rows;
        } catch (SpreadsheetParseException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable spreadsheet '{}': {}", fileName, e.getMessage());
            throw new SpreadsheetParseException("Failed to read spreadsheet: file is corrupt or not a spreadsheet", e);
        }
    }

    private void requireSupportedFormat(String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        boolean supported = SUPPORTED_EXTENSIONS.stream().anyMatch(lower::endsWith);
        if (!supported) {
            throw new SpreadsheetParseException("Invalid file format. Only .xlsx and .xls are supported.");
        }
    }

    private Map<String, Integer> readHeader(Row header, DataFormatter formatter) {
        Map<String, Integer> columns = new HashMap<>();
        for (Cell cell : header) {
            String name = formatter.formatCellValue(cell);
            if (name != null && !name.isBlank()) {
                columns.putIfAbsent(normalizeHeader(name), cell.getColumnIndex());
            }
        }
        return columns;
    }

    private PatientRow toPatientRow(Row row, Map<String, Integer> columns,
                                    DataFormatter formatter, FormulaEvaluator evaluator) {
        Cell dobCell = cell(row, columns, COL_DATE_OF_BIRTH);
        return PatientRow.builder()
                .rowNumber(row.getRowNum() + 1)
                .patientId(identifier(cell(row, columns, COL_PATIENT_ID), formatter, evaluator))
                .firstName(text(cell(row, columns, COL_FIRST_NAME), formatter, evaluator))
                .lastName(text(cell(row, columns, COL_LAST_NAME), formatter, evaluator))
                .dateOfBirth(text(dobCell, formatter, evaluator))
                .dateOfBirthCell(dateValue(dobCell))
                .gender(text(cell(row, columns, COL_GENDER), formatter, evaluator))
                .build();
    }

    private Cell cell(Row row, Map<String, Integer> columns, String column) {
        return row.getCell(columns.get(normalizeHeader(column)), Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
    }

    private String text(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return null;
        }
        String value = formatter.formatCellValue(cell, evaluator).trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Numeric IDs are rendered in full; General formatting would turn long ones into
     * scientific notation and shorter ones into decimals.
     */
    private String identifier(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? evaluator.evaluateFormulaCell(cell)
                : cell.getCellType();
        if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
        }
        return text(cell, formatter, evaluator);
    }

    private LocalDate dateValue(Cell cell) {
        if (cell == null || cell.getCellType() != CellType.NUMERIC || !DateUtil.isCellDateFormatted(cell)) {
            return null;
        }
        return cell.getLocalDateTimeCellValue().toLocalDate();
    }

    private boolean isBlank(PatientRow row) {
        return row.getPatientId() == null && row.getFirstName() == null && row.getLastName() == null
                && row.getDateOfBirth() == null && row.getGender() == null;
    }

    private static String normalizeHeader(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
