package uk.gegc.ergtracker.features.society.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.features.society.api.dto.SocietyChangeRequestDto;
import uk.gegc.ergtracker.features.society.domain.model.Society;
import uk.gegc.ergtracker.features.society.domain.model.SocietyChangeRequest;
import uk.gegc.ergtracker.features.society.domain.repository.SocietyChangeRequestRepository;
import uk.gegc.ergtracker.features.society.domain.repository.SocietyRepository;
import uk.gegc.ergtracker.features.society.infra.mapping.SocietyMapper;
import uk.gegc.ergtracker.shared.exception.ConflictException;
import uk.gegc.ergtracker.shared.exception.ForbiddenException;
import uk.gegc.ergtracker.shared.exception.ResourceNotFoundException;
import uk.gegc.ergtracker.shared.exception.ValidationException;
import uk.gegc.ergtracker.shared.security.AccessControlEngine;
import uk.gegc.ergtracker.shared.security.CallerResolver;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static uk.gegc.ergtracker.testsupport.Fixtures.account;
import static uk.gegc.ergtracker.testsupport.Fixtures.callerOf;

@ExtendWith(MockitoExtension.class)
@DisplayName("SocietyChangeWorkflowImpl")
class SocietyChangeWorkflowImplTest {

    private static final Instant NOW = Instant.parse("2024-04-01T08:30:00Z");

    @Mock
    private SocietyChangeRequestRepository requestRepository;
    @Mock
    private SocietyRepository societyRepository;
    @Mock
    private AccountRepository accountRepository;
    @Mock
    private CallerResolver callerResolver;

    private final Authentication authentication = mock(Authentication.class);
    private SocietyChangeWorkflowImpl workflow;

    private final UUID oldSociety = UUID.randomUUID();
    private final UUID newSociety = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        workflow = new SocietyChangeWorkflowImpl(
                requestRepository,
                societyRepository,
                accountRepository,
                new SocietyMapper(),
                new AccessControlEngine(),
                callerResolver,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private void signIn(Account account) {
        when(callerResolver.resolve(authentication)).thenReturn(callerOf(account));
    }

    private Society society(UUID id, String name) {
        Society society = new Society();
        society.setId(id);
        society.setName(name);
        return society;
    }

    private SocietyChangeRequest pendingRequest(Account athlete) {
        SocietyChangeRequest request = new SocietyChangeRequest();
        request.setId(UUID.randomUUID());
        request.setAthleteId(athlete.getId());
        request.setAthleteName(athlete.getName());
        request.setOldSocietyId(athlete.getPrimarySocietyId());
        request.setNewSocietyId(newSociety);
        request.setNewSocietyName("Canottieri Lario");
        request.setStatus(ApprovalStatus.PENDING);
        return request;
    }

    @Nested
    @DisplayName("request")
    class Request {

        @Test
        @DisplayName("files a pending request recording the primary society as the old one")
        void request_filesPendingRequest() {
            Account athlete = account(AccountRole.ATHLETE, oldSociety);
            signIn(athlete);
            when(societyRepository.findById(newSociety)).thenReturn(Optional.of(society(newSociety, "Canottieri Lario")));
            when(accountRepository.findById(athlete.getId())).thenReturn(Optional.of(athlete));
            when(requestRepository.existsByAthleteIdAndStatus(athlete.getId(), ApprovalStatus.PENDING)).thenReturn(false);
            when(requestRepository.saveAndFlush(any(SocietyChangeRequest.class))).thenAnswer(inv -> inv.getArgument(0));

            SocietyChangeRequestDto result = workflow.request(authentication, newSociety);

            assertThat(result.oldSocietyId()).isEqualTo(oldSociety);
            assertThat(result.newSocietyId()).isEqualTo(newSociety);
            assertThat(result.newSocietyName()).isEqualTo("Canottieri Lario");
            assertThat(result.status()).isEqualTo(ApprovalStatus.PENDING);
        }

        @Test
        @DisplayName("a second pending request is a conflict")
        void request_secondPending_conflict() {
            Account athlete = account(AccountRole.ATHLETE, oldSociety);
            signIn(athlete);
            when(societyRepository.findById(newSociety)).thenReturn(Optional.of(society(newSociety, "Lario")));
            when(accountRepository.findById(athlete.getId())).thenReturn(Optional.of(athlete));
            when(requestRepository.existsByAthleteIdAndStatus(athlete.getId(), ApprovalStatus.PENDING)).thenReturn(true);

            assertThatThrownBy(() -> workflow.request(authentication, newSociety))
                    .isInstanceOf(ConflictException.class);
            verify(requestRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("a pending request inserted concurrently surfaces as a conflict")
        void request_concurrentPending_conflict() {
            Account athlete = account(AccountRole.ATHLETE, oldSociety);
            signIn(athlete);
            when(societyRepository.findById(newSociety)).thenReturn(Optional.of(society(newSociety, "Lario")));
            when(accountRepository.findById(athlete.getId())).thenReturn(Optional.of(athlete));
            when(requestRepository.existsByAthleteIdAndStatus(athlete.getId(), ApprovalStatus.PENDING)).thenReturn(false);
            when(requestRepository.saveAndFlush(any(SocietyChangeRequest.class)))
                    .thenThrow(new DataIntegrityViolationException("uq_society_change_requests_pending"));

            assertThatThrownBy(() -> workflow.request(authentication, newSociety))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("already pending");
        }

        @Test
        @DisplayName("moving to the society the athlete solely belongs to is invalid")
        void request_sameSoleSociety_invalid() {
            Account athlete = account(AccountRole.ATHLETE, newSociety);
            signIn(athlete);
            when(societyRepository.findById(newSociety)).thenReturn(Optional.of(society(newSociety, "Lario")));
            when(accountRepository.findById(athlete.getId())).thenReturn(Optional.of(athlete));

            assertThatThrownBy(() -> workflow.request(authentication, newSociety))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("unknown society is not found")
        void request_unknownSociety_notFound() {
            signIn(account(AccountRole.ATHLETE, oldSociety));
            when(societyRepository.findById(newSociety)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> workflow.request(authentication, newSociety))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("coaches cannot file requests")
        void request_coach_forbidden() {
            signIn(account(AccountRole.COACH, oldSociety));

            assertThatThrownBy(() -> workflow.request(authentication, newSociety))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("approve and reject")
    class Review {

        @Test
        @DisplayName("approve leaves the athlete in exactly the new society and keeps the designated coach")
        void approve_replacesMemberships() {
            Account athlete = account(AccountRole.ATHLETE, oldSociety, UUID.randomUUID());
            UUID designated = UUID.randomUUID();
            athlete.setDesignatedCoachId(designated);
            Account coach = account(AccountRole.COACH, newSociety);
            signIn(coach);
            SocietyChangeRequest request = pendingRequest(athlete);
            when(requestRepository.findById(request.getId())).thenReturn(Optional.of(request));
            when(requestRepository.transitionStatus(request.getId(), ApprovalStatus.PENDING, ApprovalStatus.APPROVED,
                    NOW, coach.getId())).thenReturn(1);
            when(accountRepository.findById(athlete.getId())).thenReturn(Optional.of(athlete));

            workflow.approve(authentication, request.getId());

            ArgumentCaptor<Account> saved = ArgumentCaptor.forClass(Account.class);
            verify(accountRepository).save(saved.capture());
            assertThat(saved.getValue().getSocietyIds()).containsExactly(newSociety);
            assertThat(saved.getValue().getDesignatedCoachId()).isEqualTo(designated);
        }

        @Test
        @DisplayName("approving an already processed request is a conflict and changes no membership")
        void approve_alreadyProcessed_conflict() {
            Account athlete = account(AccountRole.ATHLETE, oldSociety);
            signIn(account(AccountRole.SUPER_ADMIN));
            SocietyChangeRequest request = pendingRequest(athlete);
            when(requestRepository.findById(request.getId())).thenReturn(Optional.of(request));
            when(requestRepository.transitionStatus(any(), any(), any(), any(), any())).thenReturn(0);

            assertThatThrownBy(() -> workflow.approve(authentication, request.getId()))
                    .isInstanceOf(ConflictException.class);
            verify(accountRepository, never()).save(any());
        }

        @Test
        @DisplayName("coach outside the requested society may not review")
        void reject_coachOutsideTarget_forbidden() {
            Account athlete = account(AccountRole.ATHLETE, oldSociety);
            signIn(account(AccountRole.COACH, oldSociety));
            SocietyChangeRequest request = pendingRequest(athlete);
            when(requestRepository.findById(request.getId())).thenReturn(Optional.of(request));

            assertThatThrownBy(() -> workflow.reject(authentication, request.getId()))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("reject only updates the request")
        void reject_leavesMembership() {
            Account athlete = account(AccountRole.ATHLETE, oldSociety);
            Account coach = account(AccountRole.COACH, newSociety);
            signIn(coach);
            SocietyChangeRequest request = pendingRequest(athlete);
            SocietyChangeRequest rejected = pendingRequest(athlete);
            rejected.setId(request.getId());
            rejected.setStatus(ApprovalStatus.REJECTED);
            when(requestRepository.findById(request.getId())).thenReturn(Optional.of(request), Optional.of(rejected));
            when(requestRepository.transitionStatus(request.getId(), ApprovalStatus.PENDING, ApprovalStatus.REJECTED,
                    NOW, coach.getId())).thenReturn(1);

            SocietyChangeRequestDto result = workflow.reject(authentication, request.getId());

            assertThat(result.status()).isEqualTo(ApprovalStatus.REJECTED);
            verify(accountRepository, never()).save(any());
            assertThat(athlete.getSocietyIds()).isEqualTo(List.of(oldSociety));
        }
    }
}
