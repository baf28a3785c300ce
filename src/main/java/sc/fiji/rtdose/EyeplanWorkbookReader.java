/*-
 * #%L
 * Eyeplan RT Dose plugin for Fiji.
 * %%
 * Copyright (C) 2008 - 2024 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.rtdose;

import ij.IJ;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the dose export of Eyeplan: an Excel sheet with the patient name in A1, the patient ID in A2,
 * a header row on row 3 naming the X, Y, Z and Dose columns, and one dose point per row below it.
 * @author Andre Faubert 2024-04
 */
public final class EyeplanWorkbookReader {
    public static final int HEADER_ROW = 2;
    public static final String[] COLUMNS = {"X", "Y", "Z", "DOSE"};

    private EyeplanWorkbookReader() {
    }

    public static EyeplanDoseTable read(Path path) throws IOException, MalformedGridException {
        if (IJ.debugMode) IJ.log("Reading Eyeplan workbook: " + path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /**
     * @param in    The workbook bytes, in .xlsx or .xls format. The stream is not closed.
     */
    public static EyeplanDoseTable read(InputStream in) throws IOException, MalformedGridException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0)
                throw new MalformedGridException("The workbook has no sheets.");
            return read(workbook.getSheetAt(workbook.getActiveSheetIndex()));
        }
    }

    static EyeplanDoseTable read(Sheet sheet) throws MalformedGridException {
        DataFormatter formatter = new DataFormatter(Locale.ROOT);
        String patientName = text(formatter, sheet, 0);
        String patientId = text(formatter, sheet, 1);

        Row header = sheet.getRow(HEADER_ROW);
        if (header == null)
            throw new MalformedGridException("The sheet has no header row on row " + (HEADER_ROW + 1) + ".");
        int[] columns = new int[COLUMNS.length];
        for (int c = 0; c < COLUMNS.length; c++) {
            columns[c] = findColumn(formatter, header, COLUMNS[c]);
            if (columns[c] < 0)
                throw new MalformedGridException("The header row has no '" + COLUMNS[c] + "' column.");
        }

        List<DosePoint> points = new ArrayList<>();
        for (int r = HEADER_ROW + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null || isBlank(row, columns)) continue;
            double[] v = new double[COLUMNS.length];
            for (int c = 0; c < COLUMNS.length; c++)
                v[c] = number(row, columns[c]);
            points.add(new DosePoint(v[0], v[1], v[2], v[3]));
        }
        if (IJ.debugMode) IJ.log("Eyeplan table: " + points.size() + " points for patient " + patientId);
        return new EyeplanDoseTable(patientName, patientId, points);
    }

    private static String text(DataFormatter formatter, Sheet sheet, int rowIndex) {
        Row row = sheet.getRow(rowIndex);
        if (row == null) return null;
        Cell cell = row.getCell(0);
        if (cell == null) return null;
        String value = formatter.formatCellValue(cell).trim();
        return value.isEmpty() ? null : value;
    }

    private static int findColumn(DataFormatter formatter, Row header, String name) {
        for (Cell cell : header) {
            if (formatter.formatCellValue(cell).trim().equalsIgnoreCase(name))
                return cell.getColumnIndex();
        }
        return -1;
    }

    private static boolean isBlank(Row row, int[] columns) {
        for (int column : columns) {
            Cell cell = row.getCell(column);
            if (cell != null && cell.getCellType() != CellType.BLANK
                    && !(cell.getCellType() == CellType.STRING && cell.getStringCellValue().trim().isEmpty()))
                return false;
        }
        return true;
    }

    private static double number(Row row, int column) throws MalformedGridException {
        Cell cell = row.getCell(column);
        String ref = new CellReference(row.getRowNum(), column).formatAsString();
        if (cell == null)
            throw new MalformedGridException("Cell " + ref + " is empty.");
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC:
                return cell.getNumericCellValue();
            case STRING:
                try {
                    return Double.parseDouble(cell.getStringCellValue().trim());
                } catch (NumberFormatException e) {
                    throw new MalformedGridException("Cell " + ref + " is not a number: '"
                            + cell.getStringCellValue() + "'", e);
                }
            default:
                throw new MalformedGridException("Cell " + ref + " is not a number.");
        }
    }
}
