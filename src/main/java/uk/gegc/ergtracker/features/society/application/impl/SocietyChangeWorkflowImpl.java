package uk.gegc.ergtracker.features.society.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.features.society.api.dto.SocietyChangeRequestDto;
import uk.gegc.ergtracker.features.society.application.SocietyChangeWorkflow;
import uk.gegc.ergtracker.features.society.domain.model.Society;
import uk.gegc.ergtracker.features.society.domain.model.SocietyChangeRequest;
import uk.gegc.ergtracker.features.society.domain.repository.SocietyChangeRequestRepository;
import uk.gegc.ergtracker.features.society.domain.repository.SocietyRepository;
import uk.gegc.ergtracker.features.society.infra.mapping.SocietyMapper;
import uk.gegc.ergtracker.shared.exception.ConflictException;
import uk.gegc.ergtracker.shared.exception.ResourceNotFoundException;
import uk.gegc.ergtracker.shared.exception.ValidationException;
import uk.gegc.ergtracker.shared.security.AccessControlEngine;
import uk.gegc.ergtracker.shared.security.CallerIdentity;
import uk.gegc.ergtracker.shared.security.CallerResolver;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class SocietyChangeWorkflowImpl implements SocietyChangeWorkflow {

    private final SocietyChangeRequestRepository requestRepository;
    private final SocietyRepository societyRepository;
    private final AccountRepository accountRepository;
    private final SocietyMapper societyMapper;
    private final AccessControlEngine accessControlEngine;
    private final CallerResolver callerResolver;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    public SocietyChangeRequestDto request(Authentication authentication, UUID newSocietyId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        accessControlEngine.requireAthlete(caller);

        Society target = societyRepository.findById(newSocietyId)
                .orElseThrow(() -> new ResourceNotFoundException("Society " + newSocietyId + " not found"));
        Account athlete = accountRepository.findById(caller.accountId())
                .orElseThrow(() -> new ResourceNotFoundException("Account " + caller.accountId() + " not found"));

        List<UUID> memberships = athlete.getSocietyIds();
        if (memberships.size() == 1 && memberships.get(0).equals(newSocietyId)) {
            throw new ValidationException("Athlete already belongs to this society");
        }
        if (requestRepository.existsByAthleteIdAndStatus(athlete.getId(), ApprovalStatus.PENDING)) {
            throw new ConflictException("A society change request is already pending");
        }

        SocietyChangeRequest request = new SocietyChangeRequest();
        request.setAthleteId(athlete.getId());
        request.setAthleteName(athlete.getName());
        request.setOldSocietyId(athlete.getPrimarySocietyId());
        request.setNewSocietyId(target.getId());
        request.setNewSocietyName(target.getName());
        request.setStatus(ApprovalStatus.PENDING);

        SocietyChangeRequest saved;
        try {
            saved = requestRepository.saveAndFlush(request);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Concurrent society change request for athlete {} refused", athlete.getId());
            throw new ConflictException("A society change request is already pending");
        }
        log.info("Society change {} filed by athlete {} towards society {}", saved.getId(), athlete.getId(), target.getId());
        return societyMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SocietyChangeRequestDto> list(Authentication authentication) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        return requestRepository.findAll(accessControlEngine.societyChangeListing(caller).filterOrThrow(),
                        Sort.by(Sort.Direction.DESC, "createdAt"))
                .stream()
                .map(societyMapper::toDto)
                .toList();
    }

    @Override
    public SocietyChangeRequestDto approve(Authentication authentication, UUID requestId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        SocietyChangeRequest request = authorizeReview(caller, requestId);

        complete(caller, request, ApprovalStatus.APPROVED);

        Account athlete = accountRepository.findById(request.getAthleteId())
                .orElseThrow(() -> new ResourceNotFoundException("Account " + request.getAthleteId() + " not found"));
        athlete.setSocietyIds(List.of(request.getNewSocietyId()));
        accountRepository.save(athlete);

        log.info("Society change {} approved by {}; athlete {} moved to society {}",
                requestId, caller.accountId(), athlete.getId(), request.getNewSocietyId());
        return reload(requestId);
    }

    @Override
    public SocietyChangeRequestDto reject(Authentication authentication, UUID requestId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        SocietyChangeRequest request = authorizeReview(caller, requestId);

        complete(caller, request, ApprovalStatus.REJECTED);

        log.info("Society change {} rejected by {}", requestId, caller.accountId());
        return reload(requestId);
    }

    private SocietyChangeRequest authorizeReview(CallerIdentity caller, UUID requestId) {
        SocietyChangeRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Society change request " + requestId + " not found"));
        accessControlEngine.requireReviewSocietyChange(caller, request);
        return request;
    }

    private void complete(CallerIdentity caller, SocietyChangeRequest request, ApprovalStatus target) {
        int updated = requestRepository.transitionStatus(
                request.getId(), ApprovalStatus.PENDING, target, Instant.now(utcClock), caller.accountId());
        if (updated == 0) {
            throw new ConflictException("Society change request has already been processed");
        }
    }

    private SocietyChangeRequestDto reload(UUID requestId) {
        return requestRepository.findById(requestId)
                .map(societyMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Society change request " + requestId + " not found"));
    }
}
