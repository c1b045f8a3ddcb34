package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.graph.CycleSearchResult;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.RecalculationResult;
import com.spreadsheet.engine.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheets" is the base path.
 */
@RestController
@RequestMapping("/sheets")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheets
     * Body: { "rows": 10, "columns": 5 }.
     * Creates an empty sheet of that size, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody Map<String, Integer> request) {
        int rows = request.getOrDefault("rows", 0);
        int columns = request.getOrDefault("columns", 0);
        long sheetId = sheetService.createSheet(rows, columns);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheets/{sheetId}
     * Body: { "cells": { "A1": "1", "B1": "=A1*2" } }.
     * Replaces the whole sheet content and recalculates everything.
     */
    @PutMapping("/{sheetId}")
    public ResponseEntity<RecalculationResult> loadSnapshot(
            @PathVariable long sheetId,
            @RequestBody Map<String, Map<String, String>> request
    ) {
        return ResponseEntity.ok(sheetService.loadSnapshot(sheetId, request.get("cells")));
    }

    /**
     * PUT /sheets/{sheetId}/cells/{address}
     * Body: raw text (literal, or a formula starting with "=").
     * Formula problems do not fail the request; they show up as cell errors.
     */
    @PutMapping("/{sheetId}/cells/{address}")
    public ResponseEntity<RecalculationResult> setCellContent(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(sheetService.setCellContent(sheetId, address, rawValue == null ? "" : rawValue));
    }

    /**
     * PATCH /sheets/{sheetId}/cells
     * Body: { "A1": "...", "B2": "..." }, written together with one recalculation.
     */
    @PatchMapping("/{sheetId}/cells")
    public ResponseEntity<RecalculationResult> setCellContents(
            @PathVariable long sheetId,
            @RequestBody Map<String, String> contents
    ) {
        return ResponseEntity.ok(sheetService.setCellContents(sheetId, contents));
    }

    @GetMapping("/{sheetId}/cells/{address}")
    public ResponseEntity<Cell> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, address));
    }

    /**
     * GET /sheets/{sheetId}
     * Returns the display value of every non-empty cell,
     * in the format: { "A1": "hello", "B2": "42", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * POST /sheets/{sheetId}/calculate
     * Optional body { "range": "A1:C3" }; without it every formula cell is recalculated.
     */
    @PostMapping("/{sheetId}/calculate")
    public ResponseEntity<RecalculationResult> calculate(
            @PathVariable long sheetId,
            @RequestBody(required = false) Map<String, String> request
    ) {
        String range = request == null ? null : request.get("range");
        return ResponseEntity.ok(sheetService.recalculate(sheetId, range));
    }

    /**
     * GET /sheets/{sheetId}/forwardDependencies
     * For each formula cell, the cells and ranges it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardGraph(sheetId));
    }

    /**
     * GET /sheets/{sheetId}/reverseDependencies
     * For each referenced cell or range, the formula cells that read it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseGraph(sheetId));
    }

    @GetMapping("/{sheetId}/cells/{address}/cycle")
    public ResponseEntity<CycleSearchResult> findCycle(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.findCycle(sheetId, address));
    }
}
