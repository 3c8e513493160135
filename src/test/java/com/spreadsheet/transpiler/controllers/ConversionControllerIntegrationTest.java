package com.spreadsheet.transpiler.controllers;

import com.spreadsheet.transpiler.TranspilerApplication;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = TranspilerApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class ConversionControllerIntegrationTest {

    @LocalServerPort
    int port;

    private RestTemplate restTemplate;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
    }

    private String url(String path) {
        return "http://localhost:" + port + "/conversions" + path;
    }

    private long convert(String cellsJson) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> request = new HttpEntity<>("{\"cells\": " + cellsJson + "}", headers);

        ResponseEntity<Long> response = restTemplate.postForEntity(url(""), request, Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    /**
     * Converts A1 = 5, B1 = 10, C1 = A1+B1 and reads the program, a value and a formula back.
     */
    @Test
    void testConvertAndInspect() {
        long id = convert("{\"C1\": \"=A1+B1\", \"A1\": 5, \"B1\": 10}");

        String program = restTemplate.getForObject(url("/" + id + "/program"), String.class);
        assertEquals("var A1 = 5;\nvar B1 = 10;\nvar C1 = A1+B1;", program);

        Map<?, ?> value = restTemplate.getForObject(url("/" + id + "/cells/C1/value"), Map.class);
        assertEquals("C1", value.get("cell"));
        assertEquals(15.0, ((Number) value.get("value")).doubleValue());

        Map<?, ?> formula = restTemplate.getForObject(url("/" + id + "/cells/C1/formula"), Map.class);
        assertEquals("=A1+B1", formula.get("formula"));

        Map<?, ?> literal = restTemplate.getForObject(url("/" + id + "/cells/$A$1/formula"), Map.class);
        assertEquals("A1", literal.get("cell"));
        assertEquals("5", literal.get("formula"));
    }

    @Test
    void testSummaryListsRemovedDependencies() {
        long id = convert("{\"A1\": \"=B1\", \"B1\": \"=A1+1\"}");

        Map<?, ?> summary = restTemplate.getForObject(url("/" + id), Map.class);

        assertEquals(id, ((Number) summary.get("id")).longValue());
        assertEquals(List.of("B1", "A1"), summary.get("definitionOrder"));
        assertEquals(List.of("B1->A1"), summary.get("removedDependencies"));
    }

    @Test
    void testDependencyTrees() {
        long id = convert("{\"A1\": 5, \"B1\": \"=A1*2\", \"C1\": \"=A1+B1\"}");

        List<?> dependencies = restTemplate.getForObject(url("/" + id + "/dependencies?cell=C1"), List.class);
        Map<?, ?> c1 = (Map<?, ?>) dependencies.get(0);
        assertEquals("C1", c1.get("cellId"));
        assertEquals("A1+B1", c1.get("expression"));
        assertEquals(15.0, ((Number) c1.get("value")).doubleValue());
        assertEquals(Boolean.FALSE, c1.get("circular"));
        assertEquals(2, ((List<?>) c1.get("children")).size());

        List<?> dependants = restTemplate.getForObject(url("/" + id + "/dependants?cell=A1"), List.class);
        Map<?, ?> a1 = (Map<?, ?>) dependants.get(0);
        assertEquals("A1", a1.get("cellId"));
        assertEquals(2, ((List<?>) a1.get("children")).size());

        List<?> roots = restTemplate.getForObject(url("/" + id + "/dependencies"), List.class);
        assertEquals(1, roots.size());
        assertEquals("C1", ((Map<?, ?>) roots.get(0)).get("cellId"));
    }

    @Test
    void testUploadWorkbook() throws IOException {
        byte[] content;
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Row row = workbook.createSheet("Sheet1").createRow(0);
            row.createCell(0).setCellValue(2);
            row.createCell(1).setCellFormula("A1*21");
            workbook.write(out);
            content = out.toByteArray();
        }

        ResponseEntity<Long> response = upload("book.xlsx", content);
        assertEquals(HttpStatus.OK, response.getStatusCode());

        Map<?, ?> value = restTemplate.getForObject(url("/" + response.getBody() + "/cells/B1/value"), Map.class);
        assertEquals(42.0, ((Number) value.get("value")).doubleValue());
    }

    @Test
    void testUploadUnreadableFile() {
        HttpClientErrorException e = assertThrows(HttpClientErrorException.class,
                () -> upload("notes.xlsx", "plain text, not a workbook".getBytes()));
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        assertTrue(e.getResponseBodyAsString().contains("SHEET_UNREADABLE"));
    }

    private ResponseEntity<Long> upload(String filename, byte[] content) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return restTemplate.postForEntity(url("/upload"), new HttpEntity<>(parts, headers), Long.class);
    }

    @Test
    void testErrors() {
        long id = convert("{\"A1\": 1, \"B1\": \"=IF(A1>1,2,3)\"}");

        HttpClientErrorException missingConversion = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForObject(url("/999999"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missingConversion.getStatusCode());
        assertTrue(missingConversion.getResponseBodyAsString().contains("CONVERSION_NOT_FOUND"));

        HttpClientErrorException missingCell = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForObject(url("/" + id + "/cells/Q9/value"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missingCell.getStatusCode());
        assertTrue(missingCell.getResponseBodyAsString().contains("CELL_NOT_FOUND"));

        HttpClientErrorException badReference = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForObject(url("/" + id + "/cells/1A/value"), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, badReference.getStatusCode());
        assertTrue(badReference.getResponseBodyAsString().contains("INVALID_CELL_REFERENCE"));

        HttpClientErrorException failed = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForObject(url("/" + id + "/cells/B1/value"), Map.class));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, failed.getStatusCode());
        assertTrue(failed.getResponseBodyAsString().contains("EVALUATION_FAILED"));
    }
}
