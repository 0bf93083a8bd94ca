package uk.gegc.ergtracker.features.performance.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.performance.api.dto.DistanceStatsDto;
import uk.gegc.ergtracker.features.performance.api.dto.PerformanceTestDto;
import uk.gegc.ergtracker.features.performance.api.dto.SubjectStatsDto;
import uk.gegc.ergtracker.features.performance.api.dto.TestSummaryDto;
import uk.gegc.ergtracker.features.performance.domain.model.DistanceStats;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceTest;
import uk.gegc.ergtracker.features.performance.domain.model.TestSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class PerformanceTestMapper {

    public PerformanceTestDto toDto(PerformanceTest test) {
        return new PerformanceTestDto(
                test.getId(),
                test.getSubjectId(),
                test.getSubjectName(),
                test.getSocietyId(),
                test.getDate(),
                test.getDistance(),
                test.getTimeSeconds(),
                test.getSplit500(),
                test.getWatts(),
                test.getWattsPerKg(),
                test.getStrokes(),
                test.getWeight(),
                test.getHeight(),
                test.getNotes(),
                test.getCreatedAt()
        );
    }

    public SubjectStatsDto toStatsDto(UUID subjectId, List<DistanceStats> stats, List<PerformanceTest> newestFirst) {
        Map<String, DistanceStatsDto> byLabel = new LinkedHashMap<>();
        for (DistanceStats entry : stats) {
            byLabel.put(entry.label(), new DistanceStatsDto(toSummary(entry.best()), toSummary(entry.latest()), entry.count()));
        }
        return new SubjectStatsDto(
                subjectId,
                newestFirst.size(),
                byLabel,
                newestFirst.stream().map(this::toDto).toList()
        );
    }

    private TestSummaryDto toSummary(TestSnapshot snapshot) {
        return new TestSummaryDto(snapshot.timeSeconds(), snapshot.split500(), snapshot.watts(), snapshot.date());
    }
}
