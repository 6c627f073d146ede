package com.tablerewriter.util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Builds the input workbooks the batch endpoint accepts, each with one sample row.
 */
public final class ExcelTemplateGenerator {

    public static final String[] QUERY_HEADERS = {"Query Name", "Query Description", "Query"};
    public static final String[] MAPPING_HEADERS = {"Source Table", "Target Table"};

    // autoSizeColumn needs AWT fonts, which headless servers often lack
    public static final int COLUMN_WIDTH = 40 * 256;

    private ExcelTemplateGenerator() {
    }

    public static byte[] queryTemplate() throws IOException {
        return generate("Queries", QUERY_HEADERS, new String[][] {
                {"Example Query", "Sample query for testing", "SELECT o.id, o.status FROM sales.orders o LIMIT 10"}
        });
    }

    public static byte[] mappingTemplate() throws IOException {
        return generate("Mappings", MAPPING_HEADERS, new String[][] {
                {"sales.orders", "lake.sales_v2.orders"},
                {"staging.*", "lake.staging.*"}
        });
    }

    /**
     * Single-sheet workbook with a styled header row followed by {@code rows}.
     */
    public static byte[] generate(String sheetName, String[] headers, String[][] rows) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(sheetName);

            CellStyle headerStyle = headerStyle(workbook);
            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < headers.length; i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(headers[i]);
                cell.setCellStyle(headerStyle);
            }

            for (int r = 0; r < rows.length; r++) {
                Row dataRow = sheet.createRow(r + 1);
                for (int c = 0; c < rows[r].length; c++) {
                    dataRow.createCell(c).setCellValue(rows[r][c]);
                }
            }

            for (int i = 0; i < headers.length; i++) {
                sheet.setColumnWidth(i, COLUMN_WIDTH);
            }

            workbook.write(out);
            return out.toByteArray();
        }
    }

    public static CellStyle headerStyle(Workbook workbook) {
        CellStyle headerStyle = workbook.createCellStyle();
        headerStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        Font boldFont = workbook.createFont();
        boldFont.setBold(true);
        headerStyle.setFont(boldFont);
        return headerStyle;
    }
}
