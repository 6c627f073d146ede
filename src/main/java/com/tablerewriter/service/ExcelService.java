package com.tablerewriter.service;

import com.tablerewriter.config.RewriterConfig;
import com.tablerewriter.dto.MappingEntry;
import com.tablerewriter.dto.QueryDTO;
import com.tablerewriter.util.ExcelTemplateGenerator;
import com.tablerewriter.util.MappingEntryParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class ExcelService {

    public static final String REPORT_FILE_NAME = "rewritten_queries.xlsx";

    private final Path reportsDir;

    public ExcelService(RewriterConfig config) {
        this.reportsDir = Paths.get(config.getReportsDir()).toAbsolutePath().normalize();
        try {
            if (!Files.exists(reportsDir)) {
                Files.createDirectories(reportsDir);
                log.info("Created reports directory: {}", reportsDir);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create reports directory " + reportsDir, e);
        }
    }

    public List<QueryDTO> readQueryFile(MultipartFile file) throws IOException {
        List<QueryDTO> queries = new ArrayList<>();

        try (InputStream is = file.getInputStream();
             Workbook workbook = new XSSFWorkbook(is)) {

            Sheet sheet = workbook.getSheetAt(0);

            // Skip header row
            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                String queryName = getCellValueAsString(row.getCell(0));
                if (queryName.isEmpty()) {
                    continue; // Skip rows without a query name
                }

                queries.add(new QueryDTO(queryName,
                        getCellValueAsString(row.getCell(1)),
                        getCellValueAsString(row.getCell(2))));
            }
        }

        log.info("Read {} queries from query file", queries.size());
        return queries;
    }

    public List<MappingEntry> readMappingFile(MultipartFile file) throws IOException {
        List<MappingEntry> mappings = new ArrayList<>();

        try (InputStream is = file.getInputStream();
             Workbook workbook = new XSSFWorkbook(is)) {

            Sheet sheet = workbook.getSheetAt(0);

            // Skip header row
            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                String sourceObject = getCellValueAsString(row.getCell(0));
                String targetObject = getCellValueAsString(row.getCell(1));

                if (sourceObject.isEmpty()) {
                    continue;
                }

                try {
                    mappings.add(MappingEntryParser.parse(sourceObject, targetObject));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Mapping file row " + (i + 1) + ": " + e.getMessage(), e);
                }
            }
        }

        log.info("Read {} mappings from mapping file", mappings.size());
        return mappings;
    }

    /**
     * Writes one row per query to {@value #REPORT_FILE_NAME} in the reports directory.
     *
     * @return the report file name, for {@link #resolveReport(String)}
     */
    public String saveRewriteReport(List<QueryDTO> queries) throws IOException {
        Path filePath = reportsDir.resolve(REPORT_FILE_NAME);

        try (Workbook workbook = new XSSFWorkbook();
             OutputStream fileOut = Files.newOutputStream(filePath)) {

            CellStyle headerStyle = ExcelTemplateGenerator.headerStyle(workbook);

            Sheet sheet = workbook.createSheet("Rewritten Queries");
            String[] headers = {"queryName", "description", "originalQuery", "updatedQuery", "status", "error"};
            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < headers.length; i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(headers[i]);
                cell.setCellStyle(headerStyle);
            }

            int rowNum = 1;
            for (QueryDTO query : queries) {
                Row row = sheet.createRow(rowNum++);
                row.createCell(0).setCellValue(query.getQueryName());
                row.createCell(1).setCellValue(nullToEmpty(query.getDescription()));
                row.createCell(2).setCellValue(nullToEmpty(query.getOriginalQuery()));
                row.createCell(3).setCellValue(nullToEmpty(query.getUpdatedQuery()));
                row.createCell(4).setCellValue(query.getStatus() != null ? query.getStatus().name() : "");
                row.createCell(5).setCellValue(nullToEmpty(query.getError()));
            }

            for (int i = 0; i < headers.length; i++) {
                sheet.setColumnWidth(i, ExcelTemplateGenerator.COLUMN_WIDTH);
            }

            workbook.write(fileOut);
            log.info("Saved rewrite report with {} queries to: {}", queries.size(), filePath);
            return REPORT_FILE_NAME;
        }
    }

    /**
     * Resolves a report name inside the reports directory. Names that escape it are rejected.
     */
    public Path resolveReport(String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            throw new IllegalArgumentException("fileName is required");
        }
        Path resolved = reportsDir.resolve(fileName).normalize();
        if (!resolved.startsWith(reportsDir) || resolved.equals(reportsDir)) {
            throw new IllegalArgumentException("Report '" + fileName + "' is outside the reports directory");
        }
        return resolved;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private String getCellValueAsString(Cell cell) {
        if (cell == null) {
            return "";
        }

        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue() != null ? cell.getStringCellValue().trim() : "";
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getDateCellValue().toString();
                }
                return String.valueOf(cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case FORMULA:
                if (cell.getCachedFormulaResultType() == CellType.STRING) {
                    return cell.getStringCellValue().trim();
                }
                return cell.getCellFormula();
            default:
                return "";
        }
    }
}
