package com.tablerewriter.service;

import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import com.tablerewriter.config.RewriterConfig;
import com.tablerewriter.dto.MappingEntry;
import com.tablerewriter.dto.QueryDTO;
import com.tablerewriter.dto.RewriteStatus;
import com.tablerewriter.util.ExcelTemplateGenerator;

public class ExcelServiceTest {

    @TempDir
    Path tempDir;

    private Path reportsDir;
    private ExcelService excelService;

    @BeforeEach
    void setUp() {
        reportsDir = tempDir.resolve("reports");
        RewriterConfig config = new RewriterConfig();
        config.setReportsDir(reportsDir.toString());
        excelService = new ExcelService(config);
    }

    private static MockMultipartFile xlsx(String name, byte[] content) {
        return new MockMultipartFile(name, name + ".xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", content);
    }

    @Test
    void createsReportsDirectory() {
        assertTrue(Files.isDirectory(reportsDir));
    }

    @Test
    void readsQueryTemplate() throws Exception {
        List<QueryDTO> queries = excelService.readQueryFile(xlsx("queries", ExcelTemplateGenerator.queryTemplate()));

        assertEquals(1, queries.size());
        assertEquals("Example Query", queries.get(0).getQueryName());
        assertTrue(queries.get(0).getOriginalQuery().contains("sales.orders"));
        assertNull(queries.get(0).getStatus());
    }

    @Test
    void skipsRowsWithoutQueryName() throws Exception {
        byte[] workbook = ExcelTemplateGenerator.generate("Queries", ExcelTemplateGenerator.QUERY_HEADERS, new String[][] {
                {"", "no name", "SELECT 1"},
                {"kept", "", "SELECT * FROM db.t"}
        });
        List<QueryDTO> queries = excelService.readQueryFile(xlsx("queries", workbook));

        assertEquals(1, queries.size());
        assertEquals("kept", queries.get(0).getQueryName());
    }

    @Test
    void readsMappingTemplate() throws Exception {
        List<MappingEntry> mappings = excelService.readMappingFile(xlsx("mappings", ExcelTemplateGenerator.mappingTemplate()));

        assertEquals(2, mappings.size());
        assertEquals("lake", mappings.get(0).getTargetCatalog());
        assertTrue(mappings.get(1).isDatabaseLevelMapping());
    }

    @Test
    void invalidMappingRowNamesTheRow() throws Exception {
        byte[] workbook = ExcelTemplateGenerator.generate("Mappings", ExcelTemplateGenerator.MAPPING_HEADERS, new String[][] {
                {"sales.orders", "lake.sales.orders"},
                {"a.b.c.d", "x"}
        });

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> excelService.readMappingFile(xlsx("mappings", workbook)));
        assertTrue(thrown.getMessage().startsWith("Mapping file row 3"));
    }

    @Test
    void writesReportWithStatusAndError() throws Exception {
        QueryDTO rewritten = new QueryDTO("q1", "first", "SELECT * FROM sales.orders");
        rewritten.setUpdatedQuery("SELECT * FROM lake.sales.orders");
        rewritten.setStatus(RewriteStatus.REWRITTEN);
        QueryDTO failed = new QueryDTO("q2", null, "SELEC 1");
        failed.setStatus(RewriteStatus.FAILED);
        failed.setError("parse error");

        String fileName = excelService.saveRewriteReport(List.of(rewritten, failed));
        Path report = excelService.resolveReport(fileName);
        assertTrue(Files.isRegularFile(report));

        try (InputStream in = Files.newInputStream(report);
             Workbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals(2, sheet.getLastRowNum());

            Row first = sheet.getRow(1);
            assertEquals("q1", first.getCell(0).getStringCellValue());
            assertEquals("SELECT * FROM lake.sales.orders", first.getCell(3).getStringCellValue());
            assertEquals("REWRITTEN", first.getCell(4).getStringCellValue());

            Row second = sheet.getRow(2);
            assertEquals("", second.getCell(1).getStringCellValue());
            assertEquals("FAILED", second.getCell(4).getStringCellValue());
            assertEquals("parse error", second.getCell(5).getStringCellValue());
        }
    }

    @Test
    void reportNamesCannotEscapeReportsDirectory() {
        assertThrows(IllegalArgumentException.class, () -> excelService.resolveReport("../secrets.xlsx"));
        assertThrows(IllegalArgumentException.class, () -> excelService.resolveReport(""));
        assertEquals(reportsDir.toAbsolutePath().normalize().resolve("x.xlsx"), excelService.resolveReport("x.xlsx"));
    }
}
