package com.tripmate.routeplanner.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripmate.routeplanner.model.RouteRequest;
import com.tripmate.routeplanner.model.RouteResult;
import com.tripmate.routeplanner.routing.InsufficientPointsException;
import com.tripmate.routeplanner.routing.RouteOptimizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "Route", description = "Waypoint ordering and leg estimation")
@Slf4j
@RestController
@RequestMapping("/api/v1/route")
@RequiredArgsConstructor
public class RouteController {

    static final String OPTIMIZE_FAILED = "Failed to optimize route.";

    private final RouteRequestValidator routeRequestValidator;
    private final RouteOptimizationService routeOptimizationService;

    @Operation(summary = "Optimize a route",
            description = "Orders waypoints by nearest neighbor from the start and estimates every leg with Kakao, ODsay or a geometric fallback")
    @ApiResponse(responseCode = "200", description = "Ordered points, segments, totals and warnings")
    @ApiResponse(responseCode = "400", description = "Invalid payload or fewer than two points")
    @ApiResponse(responseCode = "500", description = "Route could not be optimized")
    @PostMapping("/optimize")
    public ResponseEntity<Map<String, Object>> optimizeRoute(@RequestBody(required = false) JsonNode body) {
        RouteRequest request;
        try {
            request = routeRequestValidator.validate(body);
        } catch (RouteValidationException e) {
            return ResponseEntity.badRequest().body(ApiExceptionHandler.errorBody(
                    "Bad Request", e.getMessage(), e.getDetails()));
        }

        try {
            RouteResult result = routeOptimizationService.optimize(request);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (InsufficientPointsException e) {
            // a client fault, so 400 with the same public message instead of the generic 500
            return ResponseEntity.badRequest().body(ApiExceptionHandler.errorBody(
                    "Bad Request", InsufficientPointsException.MESSAGE, null));
        } catch (RuntimeException e) {
            log.error("❌ Route optimization failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiExceptionHandler.errorBody(
                    "Internal Server Error", OPTIMIZE_FAILED, null));
        }
    }
}
