package uk.gegc.ergtracker.features.society.api;

import io.swagger.v3.oas.annotations.Operation;
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
import uk.gegc.ergtracker.features.society.api.dto.CreateSocietyChangeRequest;
import uk.gegc.ergtracker.features.society.api.dto.SocietyChangeRequestDto;
import uk.gegc.ergtracker.features.society.application.SocietyChangeWorkflow;

import java.util.List;
import java.util.UUID;

@Tag(name = "Society changes", description = "Athlete transfers between societies")
@RestController
@RequestMapping("/api/v1/society-changes")
@RequiredArgsConstructor
public class SocietyChangeController {

    private final SocietyChangeWorkflow societyChangeWorkflow;

    @Operation(summary = "Request a move to another society", description = "Athletes only; one pending request at a time.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Request filed"),
            @ApiResponse(responseCode = "400", description = "Already a member of only that society",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not an athlete",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Society not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Another request is pending",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<SocietyChangeRequestDto> request(
            @Valid @RequestBody CreateSocietyChangeRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(societyChangeWorkflow.request(authentication, request.newSocietyId()));
    }

    @Operation(
            summary = "List society change requests",
            description = "Super admins see all pending requests, coaches the pending ones targeting their societies, athletes their own."
    )
    @GetMapping
    public ResponseEntity<List<SocietyChangeRequestDto>> list(Authentication authentication) {
        return ResponseEntity.ok(societyChangeWorkflow.list(authentication));
    }

    @Operation(summary = "Approve a society change", description = "Replaces the athlete's memberships with the target society.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request approved"),
            @ApiResponse(responseCode = "403", description = "Caller may not review this request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Request already processed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{id}/approve")
    public ResponseEntity<SocietyChangeRequestDto> approve(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(societyChangeWorkflow.approve(authentication, id));
    }

    @Operation(summary = "Reject a society change")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request rejected"),
            @ApiResponse(responseCode = "403", description = "Caller may not review this request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Request already processed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{id}/reject")
    public ResponseEntity<SocietyChangeRequestDto> reject(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(societyChangeWorkflow.reject(authentication, id));
    }
}
