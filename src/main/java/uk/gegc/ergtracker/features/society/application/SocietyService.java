package uk.gegc.ergtracker.features.society.application;

import org.springframework.security.core.Authentication;
import uk.gegc.ergtracker.features.society.api.dto.CreateSocietyRequest;
import uk.gegc.ergtracker.features.society.api.dto.SocietyDto;

import java.util.List;

public interface SocietyService {

    List<SocietyDto> listSocieties();

    SocietyDto createSociety(Authentication authentication, CreateSocietyRequest request);
}
