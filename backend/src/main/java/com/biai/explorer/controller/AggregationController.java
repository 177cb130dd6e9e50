package com.biai.explorer.controller;

import com.biai.explorer.dto.request.SurvivalCurveRequest;
import com.biai.explorer.dto.response.ColumnAggregation;
import com.biai.explorer.dto.response.ColumnAggregationResponse;
import com.biai.explorer.dto.response.SurvivalCurvePoint;
import com.biai.explorer.dto.response.SurvivalCurveResponse;
import com.biai.explorer.dto.response.TableAggregationsResponse;
import com.biai.explorer.model.query.CountBy;
import com.biai.explorer.service.AggregationService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for dataset exploration: per-column statistics and survival
 * curves of a dataset table, under an optional filter tree and counting mode.
 */
@Slf4j
@RestController
@RequestMapping("/api/datasets/{datasetId}/tables/{tableId}")
public class AggregationController {

    private final AggregationService aggregationService;
    private final FilterParameterParser filterParser;

    public AggregationController(AggregationService aggregationService, FilterParameterParser filterParser) {
        this.aggregationService = aggregationService;
        this.filterParser = filterParser;
    }

    // ========================================================================
    // Aggregations
    // ========================================================================

    /**
     * Statistics of every visible column.
     */
    @GetMapping("/aggregations")
    public ResponseEntity<TableAggregationsResponse> getTableAggregations(
            @PathVariable String datasetId,
            @PathVariable String tableId,
            @RequestParam(required = false) String filters,
            @RequestParam(required = false) String countBy) {

        List<ColumnAggregation> aggregations = aggregationService.getTableAggregations(
            datasetId, tableId, filterParser.parse(filters), CountBy.fromQueryParameter(countBy));
        return ResponseEntity.ok(new TableAggregationsResponse(aggregations));
    }

    /**
     * Statistics of a single column, optionally as another display type.
     */
    @GetMapping("/columns/{column}/aggregation")
    public ResponseEntity<ColumnAggregationResponse> getColumnAggregation(
            @PathVariable String datasetId,
            @PathVariable String tableId,
            @PathVariable String column,
            @RequestParam(required = false) String displayType,
            @RequestParam(required = false) String filters,
            @RequestParam(required = false) String countBy) {

        ColumnAggregation aggregation = aggregationService.getColumnAggregation(
            datasetId, tableId, column, displayType, filterParser.parse(filters), CountBy.fromQueryParameter(countBy));
        return ResponseEntity.ok(new ColumnAggregationResponse(aggregation));
    }

    // ========================================================================
    // Survival
    // ========================================================================

    @GetMapping("/survival")
    public ResponseEntity<SurvivalCurveResponse> getSurvivalCurve(
            @PathVariable String datasetId,
            @PathVariable String tableId,
            @Valid @ModelAttribute SurvivalCurveRequest request) {

        List<SurvivalCurvePoint> curve = aggregationService.getSurvivalCurve(
            datasetId, tableId, request.timeColumn(), request.statusColumn(),
            filterParser.parse(request.filters()), CountBy.fromQueryParameter(request.countBy()));
        return ResponseEntity.ok(new SurvivalCurveResponse(curve));
    }

    // ========================================================================
    // Exception Handlers
    // ========================================================================

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, String>> handleInvalidParameters(BindException ex) {
        FieldError fieldError = ex.getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request parameters";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", message));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleQueryFailure(DataAccessException ex) {
        log.error("Analytics query failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "Failed to query the analytics store"));
    }
}
