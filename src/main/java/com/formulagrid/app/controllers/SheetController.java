package com.formulagrid.app.controllers;

import com.formulagrid.app.models.CellView;
import com.formulagrid.app.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body { "version": "..." }.
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) Map<String, String> request) {
        String version = request == null ? null : request.get("version");
        long sheetId = sheetService.createSheet(version);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{cellName}
     * Body: raw contents ("5", "=A1+2", "hello"); an empty body clears the cell.
     * On success: 200 OK with the recalculated cell names in evaluation order.
     * Bad names, malformed formulas and circular references are turned into a 400
     * by the GlobalExceptionHandler.
     */
    @PutMapping("/{sheetId}/cell/{cellName}")
    public ResponseEntity<List<String>> setCellContents(
            @PathVariable long sheetId,
            @PathVariable String cellName,
            @RequestBody(required = false) String content
    ) {
        List<String> recalculated = sheetService.setCellContents(sheetId, cellName, content == null ? "" : content);
        return ResponseEntity.ok(recalculated);
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the value of every non-empty cell,
     * in the format: { "A1": 5.0, "B1": "hello", "C1": { "reason": "division by zero" } }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/cell/{cellName}
     * Returns { "name", "contents", "value" } for one cell.
     */
    @GetMapping("/{sheetId}/cell/{cellName}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String cellName) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, cellName));
    }

    @GetMapping("/{sheetId}/cells")
    public ResponseEntity<Set<String>> getNonEmptyCells(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getNonEmptyCellNames(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/changed
     * True if the sheet has unsaved modifications.
     */
    @GetMapping("/{sheetId}/changed")
    public ResponseEntity<Boolean> isChanged(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.isChanged(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each cell => the set of cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each cell => the set of cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }

    /**
     * POST /sheet/{sheetId}/save?file=budget.sprd
     * Writes the sheet into the storage directory.
     */
    @PostMapping("/{sheetId}/save")
    public ResponseEntity<Void> saveSheet(@PathVariable long sheetId, @RequestParam("file") String file) {
        sheetService.saveSheet(sheetId, file);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /sheet/load?file=budget.sprd&version=v1
     * Loads a stored sheet as a new one and returns its sheetId.
     */
    @PostMapping("/load")
    public ResponseEntity<Long> loadSheet(@RequestParam("file") String file,
                                          @RequestParam(value = "version", required = false) String version) {
        return ResponseEntity.ok(sheetService.loadSheet(file, version));
    }
}
