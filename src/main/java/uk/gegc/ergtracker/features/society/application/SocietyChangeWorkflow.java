package uk.gegc.ergtracker.features.society.application;

import org.springframework.security.core.Authentication;
import uk.gegc.ergtracker.features.society.api.dto.SocietyChangeRequestDto;

import java.util.List;
import java.util.UUID;

/**
 * Athlete transfers between societies. Approval replaces the athlete's memberships with the target society.
 */
public interface SocietyChangeWorkflow {

    SocietyChangeRequestDto request(Authentication authentication, UUID newSocietyId);

    List<SocietyChangeRequestDto> list(Authentication authentication);

    SocietyChangeRequestDto approve(Authentication authentication, UUID requestId);

    SocietyChangeRequestDto reject(Authentication authentication, UUID requestId);
}
