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
import uk.gegc.ergtracker.features.society.api.dto.CreateSocietyRequest;
import uk.gegc.ergtracker.features.society.api.dto.SocietyDto;
import uk.gegc.ergtracker.features.society.application.SocietyService;

import java.util.List;

@Tag(name = "Societies", description = "Rowing societies that scope membership and visibility")
@RestController
@RequestMapping("/api/v1/societies")
@RequiredArgsConstructor
public class SocietyController {

    private final SocietyService societyService;

    @Operation(summary = "List societies", description = "Public, so the registration form can offer the choices. Ordered by name.")
    @ApiResponse(responseCode = "200", description = "Societies")
    @GetMapping
    public ResponseEntity<List<SocietyDto>> listSocieties() {
        return ResponseEntity.ok(societyService.listSocieties());
    }

    @Operation(summary = "Create a society", description = "Super admin only.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Society created"),
            @ApiResponse(responseCode = "400", description = "Invalid name",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not a super admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Name already taken",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<SocietyDto> createSociety(
            @Valid @RequestBody CreateSocietyRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(societyService.createSociety(authentication, request));
    }
}
