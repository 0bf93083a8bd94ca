package uk.gegc.ergtracker.features.society.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.society.api.dto.SocietyChangeRequestDto;
import uk.gegc.ergtracker.features.society.api.dto.SocietyDto;
import uk.gegc.ergtracker.features.society.domain.model.Society;
import uk.gegc.ergtracker.features.society.domain.model.SocietyChangeRequest;

@Component
public class SocietyMapper {

    public SocietyDto toDto(Society society) {
        return new SocietyDto(society.getId(), society.getName(), society.getCreatedAt());
    }

    public SocietyChangeRequestDto toDto(SocietyChangeRequest request) {
        return new SocietyChangeRequestDto(
                request.getId(),
                request.getAthleteId(),
                request.getAthleteName(),
                request.getOldSocietyId(),
                request.getNewSocietyId(),
                request.getNewSocietyName(),
                request.getStatus(),
                request.getCreatedAt(),
                request.getReviewedAt(),
                request.getReviewedBy()
        );
    }
}
