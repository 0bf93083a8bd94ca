package uk.gegc.ergtracker.features.performance.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.ergtracker.features.performance.api.dto.CreatePerformanceTestRequest;
import uk.gegc.ergtracker.features.performance.api.dto.PerformanceTestDto;
import uk.gegc.ergtracker.features.performance.api.dto.SubjectStatsDto;
import uk.gegc.ergtracker.features.performance.application.PerformanceTestService;

import java.util.List;
import java.util.UUID;

@Tag(name = "Performance tests", description = "Ergometer results, derived metrics and per-distance statistics")
@RestController
@RequestMapping("/api/v1/tests")
@RequiredArgsConstructor
public class PerformanceTestController {

    private final PerformanceTestService performanceTestService;

    @Operation(summary = "Record a test", description = "Split, watts and watts per kg are computed from distance, time and weight.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Test recorded"),
            @ApiResponse(responseCode = "400", description = "Validation errors",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller may not record tests for this subject",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Subject not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<PerformanceTestDto> createTest(
            @Valid @RequestBody CreatePerformanceTestRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(performanceTestService.createTest(authentication, request));
    }

    @Operation(summary = "List visible tests", description = "Newest date first, optionally narrowed to one subject.")
    @GetMapping
    public ResponseEntity<List<PerformanceTestDto>> listTests(
            @Parameter(description = "Only tests of this subject") @RequestParam(required = false) UUID subjectId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(performanceTestService.listTests(authentication, subjectId));
    }

    @Operation(summary = "Per-distance statistics of a subject")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics computed"),
            @ApiResponse(responseCode = "403", description = "Statistics not visible to the caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Subject not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/subjects/{subjectId}/stats")
    public ResponseEntity<SubjectStatsDto> getSubjectStats(
            @PathVariable UUID subjectId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(performanceTestService.getSubjectStats(authentication, subjectId));
    }
}
