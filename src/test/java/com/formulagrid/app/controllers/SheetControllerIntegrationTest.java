package com.formulagrid.app.controllers;

import com.formulagrid.app.AppApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();
    private HttpHeaders textHeaders;

    @BeforeEach
    void setUp() {
        textHeaders = new HttpHeaders();
        textHeaders.setContentType(MediaType.TEXT_PLAIN);
    }

    private String url(String path) {
        return "http://localhost:" + port + "/sheet" + path;
    }

    private long createSheet() {
        ResponseEntity<Long> createResponse = restTemplate.postForEntity(url(""), null, Long.class);
        assertEquals(HttpStatus.OK, createResponse.getStatusCode());
        Long sheetId = createResponse.getBody();
        assertNotNull(sheetId);
        return sheetId;
    }

    private List<String> put(long sheetId, String cell, String contents) {
        ResponseEntity<List> response = restTemplate.exchange(url("/" + sheetId + "/cell/" + cell),
                HttpMethod.PUT, new HttpEntity<>(contents, textHeaders), List.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    private Map<String, Object> getSheet(long sheetId) {
        return restTemplate.getForObject(url("/" + sheetId), Map.class);
    }

    /**
     * Sets a chain of formulas and checks the returned recalculation order and values.
     */
    @Test
    void testSetCellsAndRecalculate() {
        long sheetId = createSheet();

        assertEquals(Collections.singletonList("A1"), put(sheetId, "A1", "5"));
        put(sheetId, "B1", "=A1+2");
        put(sheetId, "C1", "=A1+B1");

        assertEquals(Arrays.asList("A1", "B1", "C1"), put(sheetId, "A1", "5"));

        Map<String, Object> data = getSheet(sheetId);
        assertEquals(5.0, data.get("A1"));
        assertEquals(7.0, data.get("B1"));
        assertEquals(12.0, data.get("C1"));
    }

    @Test
    void testNamesAreNormalized() {
        long sheetId = createSheet();
        put(sheetId, "a1", "hello");

            Map<String, Object> cell = restTemplate.getForObject(url("/" + sheetId + "/cell/A1"), Map.class);
        assertEquals("A1", cell.get("name"));
        assertEquals("hello", cell.get("contents"));
        assertEquals("hello", cell.get("value"));
    }

    /**
     * A1 -> "=A1" should fail with a 400 and leave the old value in place.
     */
    @Test
    void testSingleCellCycleIntegration() {
        long sheetId = createSheet();
        put(sheetId, "A10", "hello");

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "A10", "=A10"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("CIRCULAR_REFERENCE"));

        assertEquals("hello", getSheet(sheetId).get("A10"));
    }

    @Test
    void testRejectedContents() {
        long sheetId = createSheet();

        HttpClientErrorException badFormula = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "A1", "=1+"));
        assertEquals(HttpStatus.BAD_REQUEST, badFormula.getStatusCode());
        assertTrue(badFormula.getResponseBodyAsString().contains("FORMULA_FORMAT"));

        HttpClientErrorException badName = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "1A", "1"));
        assertEquals(HttpStatus.BAD_REQUEST, badName.getStatusCode());
        assertTrue(badName.getResponseBodyAsString().contains("INVALID_NAME"));

        assertTrue(getSheet(sheetId).isEmpty());
    }

    @Test
    void testUnknownSheet() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForObject(url("/987654321"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("SHEET_NOT_FOUND"));
    }

    @Test
    void testErrorValues() {
        long sheetId = createSheet();
        put(sheetId, "A1", "=1/0");

        Map<String, Object> data = getSheet(sheetId);
        assertEquals(Collections.singletonMap("reason", "division by zero"), data.get("A1"));
    }

    @Test
    void testGetDependencyGraphs() {
        long sheetId = createSheet();
        put(sheetId, "B1", "=C2");
        put(sheetId, "A1", "=B1");

        Map<String, List<String>> forwardGraph =
                restTemplate.getForObject(url("/" + sheetId + "/forwardDependencies"), Map.class);
        assertNotNull(forwardGraph);
        assertEquals(Collections.singletonList("C2"), forwardGraph.get("B1"));
        assertEquals(Collections.singletonList("B1"), forwardGraph.get("A1"));
        assertTrue(forwardGraph.get("C2").isEmpty());

        Map<String, List<String>> reverseGraph =
                restTemplate.getForObject(url("/" + sheetId + "/reverseDependencies"), Map.class);
        assertNotNull(reverseGraph);
        assertEquals(Collections.singletonList("B1"), reverseGraph.get("C2"));
        assertEquals(Collections.singletonList("A1"), reverseGraph.get("B1"));
        assertTrue(reverseGraph.get("A1").isEmpty());
    }

    @Test
    void testSaveAndLoad() {
        long sheetId = createSheet();
        put(sheetId, "A1", "3");
        put(sheetId, "B1", "=A1*A1");
        assertEquals(Boolean.TRUE, restTemplate.getForObject(url("/" + sheetId + "/changed"), Boolean.class));

        String file = "integration-" + sheetId + ".json";
        restTemplate.postForEntity(url("/" + sheetId + "/save?file=" + file), null, Void.class);
        assertEquals(Boolean.FALSE, restTemplate.getForObject(url("/" + sheetId + "/changed"), Boolean.class));

        Long loadedId = restTemplate.postForObject(url("/load?file=" + file), null, Long.class);
        assertNotNull(loadedId);
        assertEquals(getSheet(sheetId), getSheet(loadedId));

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForObject(url("/load?file=" + file + "&version=other"), null, Long.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("READ_WRITE_ERROR"));
    }
}
