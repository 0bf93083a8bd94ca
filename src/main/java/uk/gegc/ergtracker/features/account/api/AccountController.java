package uk.gegc.ergtracker.features.account.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.account.api.dto.DesignatedCoachRequest;
import uk.gegc.ergtracker.features.account.application.AccountService;

import java.util.List;
import java.util.UUID;

@Tag(name = "Accounts", description = "Role-scoped account listing, registration approval and designated coaches")
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @Operation(
            summary = "List accounts",
            description = "Super admins see every account, coaches see accounts sharing one of their societies. Athletes are refused."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accounts visible to the caller"),
            @ApiResponse(responseCode = "403", description = "Caller may not list accounts",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<List<AccountDto>> listAccounts(Authentication authentication) {
        return ResponseEntity.ok(accountService.listAccounts(authentication));
    }

    @Operation(summary = "List pending registrations the caller may review")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pending accounts"),
            @ApiResponse(responseCode = "403", description = "Caller may not review registrations",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/pending")
    public ResponseEntity<List<AccountDto>> listPending(Authentication authentication) {
        return ResponseEntity.ok(accountService.listPending(authentication));
    }

    @Operation(summary = "Get an account profile")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account found"),
            @ApiResponse(responseCode = "403", description = "Profile not visible to the caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Account not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<AccountDto> getAccount(
            @Parameter(description = "Account id", required = true) @PathVariable UUID id,
            Authentication authentication
    ) {
        return ResponseEntity.ok(accountService.getAccount(authentication, id));
    }

    @Operation(summary = "Approve a pending registration")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account approved"),
            @ApiResponse(responseCode = "403", description = "Caller may not review this account",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Account not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Account is no longer pending",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{id}/approve")
    public ResponseEntity<AccountDto> approve(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(accountService.approve(authentication, id));
    }

    @Operation(summary = "Reject a pending registration")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account rejected"),
            @ApiResponse(responseCode = "403", description = "Caller may not review this account",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Account is no longer pending",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{id}/reject")
    public ResponseEntity<AccountDto> reject(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(accountService.reject(authentication, id));
    }

    @Operation(
            summary = "Set or clear the designated coach",
            description = "Super admin only. The designee must be a coach; a null coachId clears the grant."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Designated coach updated"),
            @ApiResponse(responseCode = "400", description = "Target or designee has the wrong role",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not a super admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/{id}/designated-coach")
    public ResponseEntity<AccountDto> setDesignatedCoach(
            @PathVariable UUID id,
            @RequestBody DesignatedCoachRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(accountService.setDesignatedCoach(authentication, id, request.coachId()));
    }
}
