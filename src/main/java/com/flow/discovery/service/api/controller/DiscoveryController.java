package com.flow.discovery.service.api.controller;

import com.flow.discovery.service.api.dto.AlgorithmInfoResponse;
import com.flow.discovery.service.api.dto.ApiResponse;
import com.flow.discovery.service.api.dto.DiscoveryRequest;
import com.flow.discovery.service.api.dto.DiscoveryResponse;
import com.flow.discovery.service.engine.Algorithm;
import com.flow.discovery.service.engine.DiscoveryResult;
import com.flow.discovery.service.engine.DiscoveryService;
import com.flow.discovery.service.engine.MiningParameters;
import com.flow.discovery.service.log.EventLog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for process discovery.
 *
 * Mines process trees from posted event logs and exposes the supported
 * algorithms with their parameter defaults.
 */
@Slf4j
@RestController
@RequestMapping("/discovery")
@Tag(name = "Process Discovery", description = "Endpoints for mining process trees from event logs")
@RequiredArgsConstructor
public class DiscoveryController {

    private final DiscoveryService discoveryService;

    // ==================== Endpoints ====================

    /**
     * Mines a process tree.
     *
     * @param request the event log, algorithm and parameter overrides
     * @return 200 with the tree, 400 if the log or a parameter is invalid
     */
    @PostMapping
    @Operation(
            summary = "Discover a process tree",
            description = "Runs the selected Inductive Miner variant on the posted event log"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Process tree discovered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid log or parameters")
    })
    public ResponseEntity<ApiResponse<DiscoveryResponse>> discover(@Valid @RequestBody DiscoveryRequest request) {
        EventLog eventLog = request.toEventLog();
        MiningParameters parameters = request.resolveParameters(discoveryService.defaultParameters());
        log.debug("Received {} discovery request: {} variants", request.getAlgorithm(), eventLog.size());

        DiscoveryResult result = discoveryService.discover(eventLog, request.getAlgorithm(), parameters);
        return ResponseEntity.ok(ApiResponse.success(DiscoveryResponse.from(result)));
    }

    /**
     * Lists the supported algorithms.
     */
    @GetMapping("/algorithms")
    @Operation(summary = "List algorithms", description = "Returns the supported miners and the configured parameter defaults")
    public ResponseEntity<ApiResponse<List<AlgorithmInfoResponse>>> listAlgorithms() {
        MiningParameters defaults = discoveryService.defaultParameters();
        List<AlgorithmInfoResponse> algorithms = discoveryService.supportedAlgorithms().stream()
                .map(algorithm -> AlgorithmInfoResponse.builder()
                        .name(algorithm.name())
                        .displayName(algorithm.getDisplayName())
                        .description(algorithm.getDescription())
                        .defaults(defaultsOf(algorithm, defaults))
                        .build())
                .toList();
        return ResponseEntity.ok(ApiResponse.success(algorithms));
    }

    /**
     * Empties the mining cache.
     */
    @DeleteMapping("/cache")
    @Operation(summary = "Clear the mining cache", description = "Drops every memoized graph, binning and filtered log")
    public ResponseEntity<ApiResponse<String>> clearCache() {
        discoveryService.clearCache();
        log.info("Mining cache cleared on request");
        return ResponseEntity.ok(ApiResponse.success("Cache cleared"));
    }

    private static Map<String, Object> defaultsOf(Algorithm algorithm, MiningParameters defaults) {
        var values = new LinkedHashMap<String, Object>();
        values.put("activityThreshold", defaults.activityThreshold());
        values.put("tracesThreshold", defaults.tracesThreshold());
        values.put("maxRecursionDepth", defaults.maxRecursionDepth());
        if (algorithm == Algorithm.INFREQUENT) {
            values.put("noiseThreshold", defaults.noiseThreshold());
        }
        if (algorithm == Algorithm.APPROXIMATE) {
            values.put("simplificationThreshold", defaults.simplificationThreshold());
            values.put("minBinFreq", defaults.minBinFreq());
            values.put("sampleSize", defaults.sampleSize());
            values.put("sampleRatio", defaults.sampleRatio());
        }
        return values;
    }
}
