package uk.gegc.ergtracker.features.performance.application;

import org.springframework.security.core.Authentication;
import uk.gegc.ergtracker.features.performance.api.dto.CreatePerformanceTestRequest;
import uk.gegc.ergtracker.features.performance.api.dto.PerformanceTestDto;
import uk.gegc.ergtracker.features.performance.api.dto.SubjectStatsDto;

import java.util.List;
import java.util.UUID;

public interface PerformanceTestService {

    PerformanceTestDto createTest(Authentication authentication, CreatePerformanceTestRequest request);

    /**
     * @param subjectId optional filter applied on top of the caller's visibility
     */
    List<PerformanceTestDto> listTests(Authentication authentication, UUID subjectId);

    SubjectStatsDto getSubjectStats(Authentication authentication, UUID subjectId);
}
