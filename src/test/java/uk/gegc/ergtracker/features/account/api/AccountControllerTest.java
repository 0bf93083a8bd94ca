package uk.gegc.ergtracker.features.account.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.ergtracker.features.account.application.AccountService;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.shared.exception.ConflictException;
import uk.gegc.ergtracker.shared.exception.ForbiddenException;
import uk.gegc.ergtracker.shared.exception.ResourceNotFoundException;
import uk.gegc.ergtracker.shared.exception.ValidationException;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.ergtracker.testsupport.Fixtures.account;
import static uk.gegc.ergtracker.testsupport.Fixtures.accountDto;
import static uk.gegc.ergtracker.testsupport.Fixtures.authenticationOf;

@WebMvcTest(AccountController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("AccountController")
class AccountControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AccountService accountService;

    private final Account coach = account(AccountRole.COACH, UUID.randomUUID());
    private final Authentication coachAuth = authenticationOf(coach);

    @Test
    @DisplayName("GET /api/v1/users: returns the scoped accounts")
    void listAccounts_returnsAccounts() throws Exception {
        UUID society = coach.getPrimarySocietyId();
        when(accountService.listAccounts(any(Authentication.class))).thenReturn(List.of(
                accountDto(UUID.randomUUID(), "a@example.com", AccountRole.ATHLETE, ApprovalStatus.APPROVED, society)));

        mockMvc.perform(get("/api/v1/users").principal(coachAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].primarySocietyId").value(society.toString()));
    }

    @Test
    @DisplayName("GET /api/v1/users: athletes receive 403 as problem detail")
    void listAccounts_athlete_returns403() throws Exception {
        when(accountService.listAccounts(any(Authentication.class)))
                .thenThrow(new ForbiddenException("Athletes cannot list accounts"));

        mockMvc.perform(get("/api/v1/users").principal(authenticationOf(account(AccountRole.ATHLETE))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value("Athletes cannot list accounts"));
    }

    @Test
    @DisplayName("GET /api/v1/users/pending: returns pending accounts")
    void listPending_returnsPending() throws Exception {
        when(accountService.listPending(any(Authentication.class))).thenReturn(List.of(
                accountDto(UUID.randomUUID(), "p@example.com", AccountRole.ATHLETE, ApprovalStatus.PENDING)));

        mockMvc.perform(get("/api/v1/users/pending").principal(coachAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("PENDING"));
    }

    @Test
    @DisplayName("GET /api/v1/users/{id}: missing account is 404, malformed id is 400")
    void getAccount_errors() throws Exception {
        UUID id = UUID.randomUUID();
        when(accountService.getAccount(any(Authentication.class), eq(id)))
                .thenThrow(new ResourceNotFoundException("Account " + id + " not found"));

        mockMvc.perform(get("/api/v1/users/{id}", id).principal(coachAuth))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/users/{id}", "not-a-uuid").principal(coachAuth))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /api/v1/users/{id}/approve: approved account, or 409 when no longer pending")
    void approve() throws Exception {
        UUID id = UUID.randomUUID();
        when(accountService.approve(any(Authentication.class), eq(id)))
                .thenReturn(accountDto(id, "p@example.com", AccountRole.ATHLETE, ApprovalStatus.APPROVED))
                .thenThrow(new ConflictException("Account is already approved"));

        mockMvc.perform(post("/api/v1/users/{id}/approve", id).principal(coachAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));
        mockMvc.perform(post("/api/v1/users/{id}/approve", id).principal(coachAuth))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /api/v1/users/{id}/reject: returns the rejected account")
    void reject() throws Exception {
        UUID id = UUID.randomUUID();
        when(accountService.reject(any(Authentication.class), eq(id)))
                .thenReturn(accountDto(id, "p@example.com", AccountRole.COACH, ApprovalStatus.REJECTED));

        mockMvc.perform(post("/api/v1/users/{id}/reject", id).principal(coachAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }

    @Test
    @DisplayName("PUT /api/v1/users/{id}/designated-coach: sets or clears the designated coach")
    void setDesignatedCoach() throws Exception {
        UUID id = UUID.randomUUID();
        UUID coachId = UUID.randomUUID();
        when(accountService.setDesignatedCoach(any(Authentication.class), eq(id), eq(coachId)))
                .thenReturn(accountDto(id, "c@example.com", AccountRole.COACH, ApprovalStatus.APPROVED));
        when(accountService.setDesignatedCoach(any(Authentication.class), eq(id), isNull()))
                .thenThrow(new ValidationException("Designated coach can only be set on coach or super admin accounts"));

        mockMvc.perform(put("/api/v1/users/{id}/designated-coach", id)
                        .principal(coachAuth)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coachId\":\"" + coachId + "\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(put("/api/v1/users/{id}/designated-coach", id)
                        .principal(coachAuth)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coachId\":null}"))
                .andExpect(status().isBadRequest());

        verify(accountService).setDesignatedCoach(any(Authentication.class), eq(id), eq(coachId));
    }
}
