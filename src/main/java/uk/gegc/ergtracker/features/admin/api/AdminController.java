package uk.gegc.ergtracker.features.admin.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.ergtracker.features.account.api.dto.CategoryRecomputeResponse;
import uk.gegc.ergtracker.features.account.application.AccountService;
import uk.gegc.ergtracker.features.auth.api.dto.TokenSweepResponse;
import uk.gegc.ergtracker.features.auth.application.AuthService;

@Tag(name = "Admin", description = "Super admin maintenance operations")
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AccountService accountService;
    private final AuthService authService;

    @Operation(
            summary = "Recompute stored age categories",
            description = "Re-derives the stored category of every account with a birth year against the current year."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recompute finished"),
            @ApiResponse(responseCode = "403", description = "Caller is not a super admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/categories/recompute")
    public ResponseEntity<CategoryRecomputeResponse> recomputeCategories(Authentication authentication) {
        return ResponseEntity.ok(accountService.recomputeCategories(authentication));
    }

    @Operation(summary = "Delete expired password reset tokens")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sweep finished"),
            @ApiResponse(responseCode = "403", description = "Caller is not a super admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/password-reset-tokens/sweep")
    public ResponseEntity<TokenSweepResponse> sweepResetTokens(Authentication authentication) {
        return ResponseEntity.ok(new TokenSweepResponse(authService.sweepExpiredResetTokens(authentication)));
    }
}
