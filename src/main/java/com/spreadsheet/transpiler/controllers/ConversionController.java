package com.spreadsheet.transpiler.controllers;

import com.spreadsheet.transpiler.config.TranspilerProperties;
import com.spreadsheet.transpiler.exceptions.SheetReadException;
import com.spreadsheet.transpiler.models.CellId;
import com.spreadsheet.transpiler.models.Conversion;
import com.spreadsheet.transpiler.models.ConversionSummary;
import com.spreadsheet.transpiler.models.DependencyNode;
import com.spreadsheet.transpiler.readers.ExcelSheetReader;
import com.spreadsheet.transpiler.readers.GridSheetReader;
import com.spreadsheet.transpiler.services.ConversionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for converting sheets and inspecting the results.
 * "/conversions" is the base path.
 */
@RestController
@RequestMapping("/conversions")
public class ConversionController {

    @Autowired
    private ConversionService conversionService;

    @Autowired
    private TranspilerProperties properties;

    /**
     * POST /conversions
     * Expects a JSON body containing a "cells" object of reference -> value,
     * e.g. { "cells": { "A1": 5, "B1": 10, "C1": "=A1+B1" } }.
     * Converts it and returns the new conversion's ID.
     */
    @PostMapping
    public ResponseEntity<Long> convertCells(@RequestBody Map<String, Map<String, Object>> request) {
        Map<String, Object> cells = request.getOrDefault("cells", Collections.emptyMap());
        Conversion conversion = conversionService.convert(new GridSheetReader(cells));
        return ResponseEntity.ok(conversion.getId());
    }

    /**
     * POST /conversions/upload
     * Multipart form with a "file" part holding an .xlsx or .xls workbook.
     * Converts the configured sheet and returns the new conversion's ID.
     */
    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Long> convertWorkbook(@RequestPart("file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new SheetReadException("Cannot read upload " + file.getOriginalFilename(), e);
        }
        ExcelSheetReader reader = ExcelSheetReader.fromBytes(file.getOriginalFilename(), content, properties.getSheetIndex());
        return ResponseEntity.ok(conversionService.convert(reader).getId());
    }

    /**
     * GET /conversions/{conversionId}
     * Returns the program, its definition order and the dependencies removed to break cycles.
     */
    @GetMapping("/{conversionId}")
    public ResponseEntity<ConversionSummary> getConversion(@PathVariable long conversionId) {
        return ResponseEntity.ok(new ConversionSummary(conversionService.getConversion(conversionId)));
    }

    /**
     * GET /conversions/{conversionId}/program
     * Returns the program text as plain text.
     */
    @GetMapping(path = "/{conversionId}/program", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getProgram(@PathVariable long conversionId) {
        return ResponseEntity.ok(conversionService.getConversion(conversionId).getProgram());
    }

    /**
     * GET /conversions/{conversionId}/cells/{cell}/value
     * Runs the program and returns { "cell": "C1", "value": 15.0 }.
     */
    @GetMapping("/{conversionId}/cells/{cell}/value")
    public ResponseEntity<Map<String, Object>> getCellValue(@PathVariable long conversionId,
                                                            @PathVariable String cell) {
        CellId cellId = CellId.parse(cell);
        double value = conversionService.requireCellValue(conversionId, cellId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cell", cellId);
        body.put("value", value);
        return ResponseEntity.ok(body);
    }

    /**
     * GET /conversions/{conversionId}/cells/{cell}/formula
     * Returns { "cell": "C1", "formula": "=A1+B1" }; literal cells return their number.
     */
    @GetMapping("/{conversionId}/cells/{cell}/formula")
    public ResponseEntity<Map<String, Object>> getCellFormula(@PathVariable long conversionId,
                                                              @PathVariable String cell) {
        CellId cellId = CellId.parse(cell);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cell", cellId);
        body.put("formula", conversionService.requireOriginalFormula(conversionId, cellId));
        return ResponseEntity.ok(body);
    }

    /**
     * GET /conversions/{conversionId}/dependencies[?cell=C1]
     * Returns the tree of cells the given cell uses, or the trees of every root cell.
     */
    @GetMapping("/{conversionId}/dependencies")
    public ResponseEntity<List<DependencyNode>> getDependencies(@PathVariable long conversionId,
                                                                @RequestParam(required = false) String cell) {
        Conversion conversion = conversionService.getConversion(conversionId);
        return ResponseEntity.ok(conversionService.dependencies(conversion, cell == null ? null : CellId.parse(cell)));
    }

    /**
     * GET /conversions/{conversionId}/dependants[?cell=A1]
     * Returns the tree of cells that use the given cell, or the trees of every root cell.
     */
    @GetMapping("/{conversionId}/dependants")
    public ResponseEntity<List<DependencyNode>> getDependants(@PathVariable long conversionId,
                                                              @RequestParam(required = false) String cell) {
        Conversion conversion = conversionService.getConversion(conversionId);
        return ResponseEntity.ok(conversionService.dependants(conversion, cell == null ? null : CellId.parse(cell)));
    }
}
