package com.tablerewriter.controller;

import com.tablerewriter.dto.MappingEntry;
import com.tablerewriter.dto.QueryDTO;
import com.tablerewriter.dto.RewriteBatchResponse;
import com.tablerewriter.dto.RewriteRequest;
import com.tablerewriter.dto.RewriteResponse;
import com.tablerewriter.dto.RewriteStatus;
import com.tablerewriter.rewrite.TableIdentifier;
import com.tablerewriter.service.ExcelService;
import com.tablerewriter.service.QueryRewriteService;
import com.tablerewriter.util.ExcelTemplateGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class QueryRewriteController {

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ExcelService excelService;
    private final QueryRewriteService queryRewriteService;

    @PostMapping(value = "/rewrite", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RewriteResponse> rewrite(@RequestBody RewriteRequest request) throws JSQLParserException {
        log.info("Received rewrite request");
        RewriteResponse response = queryRewriteService.rewrite(request.getSql(), request.getIncludeUnqualified());
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/table-references", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<TableIdentifier>> tableReferences(@RequestBody RewriteRequest request)
            throws JSQLParserException {
        return ResponseEntity.ok(queryRewriteService.findTableReferences(request.getSql(), request.getIncludeUnqualified()));
    }

    @PostMapping(value = "/rewrite-queries", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RewriteBatchResponse> rewriteQueries(
            @RequestParam("queryFile") MultipartFile queryFile,
            @RequestParam(value = "mappingFile", required = false) MultipartFile mappingFile,
            @RequestParam(value = "includeUnqualified", required = false) Boolean includeUnqualified)
            throws IOException {

        log.info("Received batch rewrite request with queryFile: {}, mappingFile: {}",
                queryFile.getOriginalFilename(), mappingFile != null ? mappingFile.getOriginalFilename() : "<configured>");

        validateFile(queryFile, "queryFile");
        List<QueryDTO> queries = excelService.readQueryFile(queryFile);

        List<MappingEntry> mappings;
        if (mappingFile != null && !mappingFile.isEmpty()) {
            validateFile(mappingFile, "mappingFile");
            mappings = excelService.readMappingFile(mappingFile);
        } else {
            mappings = queryRewriteService.getConfiguredMappings();
        }
        log.info("Loaded {} queries and {} mappings", queries.size(), mappings.size());

        List<QueryDTO> results = queryRewriteService.rewriteQueries(queries, mappings, includeUnqualified);
        String reportFileName = excelService.saveRewriteReport(results);

        long rewritten = results.stream().filter(QueryDTO::isRewritten).count();
        long failed = results.stream().filter(q -> q.getStatus() == RewriteStatus.FAILED).count();

        RewriteBatchResponse response = RewriteBatchResponse.builder()
                .success(failed == 0)
                .message(failed == 0
                        ? "Rewrite completed successfully."
                        : "Rewrite completed with " + failed + " failed queries.")
                .totalQueries(results.size())
                .rewrittenQueries((int) rewritten)
                .failedQueries((int) failed)
                .reportFileName(reportFileName)
                .build();
        return ResponseEntity.ok(response);
    }

    private void validateFile(MultipartFile file, String paramName) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException(paramName + " is required and cannot be empty");
        }

        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase().endsWith(".xlsx")) {
            throw new IllegalArgumentException(paramName + " must be an .xlsx file");
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Table Identifier Rewriter Service is running");
    }

    @GetMapping("/download-report")
    public ResponseEntity<Resource> downloadReport(@RequestParam("fileName") String fileName) {
        Path report = excelService.resolveReport(fileName);
        if (!Files.isRegularFile(report)) {
            log.error("Report file not found: {}", report);
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + report.getFileName())
                .contentType(XLSX)
                .body(new FileSystemResource(report));
    }

    @GetMapping("/templates/{kind}")
    public ResponseEntity<Resource> template(@PathVariable("kind") String kind) throws IOException {
        byte[] workbook;
        switch (kind) {
            case "queries":
                workbook = ExcelTemplateGenerator.queryTemplate();
                break;
            case "mappings":
                workbook = ExcelTemplateGenerator.mappingTemplate();
                break;
            default:
                throw new IllegalArgumentException("Unknown template '" + kind + "', expected queries or mappings");
        }

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + kind + "_template.xlsx")
                .contentType(XLSX)
                .body(new ByteArrayResource(workbook));
    }
}
