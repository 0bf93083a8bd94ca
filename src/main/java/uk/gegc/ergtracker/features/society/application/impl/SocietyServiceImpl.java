package uk.gegc.ergtracker.features.society.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.ergtracker.features.society.api.dto.CreateSocietyRequest;
import uk.gegc.ergtracker.features.society.api.dto.SocietyDto;
import uk.gegc.ergtracker.features.society.application.SocietyService;
import uk.gegc.ergtracker.features.society.domain.model.Society;
import uk.gegc.ergtracker.features.society.domain.repository.SocietyRepository;
import uk.gegc.ergtracker.features.society.infra.mapping.SocietyMapper;
import uk.gegc.ergtracker.shared.exception.ConflictException;
import uk.gegc.ergtracker.shared.exception.ValidationException;
import uk.gegc.ergtracker.shared.security.AccessControlEngine;
import uk.gegc.ergtracker.shared.security.CallerResolver;

import java.util.List;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class SocietyServiceImpl implements SocietyService {

    private static final int MAX_NAME_LENGTH = 120;

    private final SocietyRepository societyRepository;
    private final SocietyMapper societyMapper;
    private final AccessControlEngine accessControlEngine;
    private final CallerResolver callerResolver;

    @Override
    @Transactional(readOnly = true)
    public List<SocietyDto> listSocieties() {
        return societyRepository.findAllByOrderByNameAsc().stream()
                .map(societyMapper::toDto)
                .toList();
    }

    @Override
    public SocietyDto createSociety(Authentication authentication, CreateSocietyRequest request) {
        accessControlEngine.requireSuperAdmin(callerResolver.resolve(authentication));

        String name = request.name() == null ? "" : request.name().trim();
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Society name must be 1-" + MAX_NAME_LENGTH + " characters");
        }
        if (societyRepository.existsByNameIgnoreCase(name)) {
            throw new ConflictException("Society '" + name + "' already exists");
        }

        Society society = new Society();
        society.setName(name);
        Society saved = societyRepository.save(society);
        log.info("Society {} created", saved.getId());
        return societyMapper.toDto(saved);
    }
}
