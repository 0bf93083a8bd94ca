package uk.gegc.ergtracker.features.performance.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.features.performance.api.dto.CreatePerformanceTestRequest;
import uk.gegc.ergtracker.features.performance.api.dto.PerformanceTestDto;
import uk.gegc.ergtracker.features.performance.api.dto.SubjectStatsDto;
import uk.gegc.ergtracker.features.performance.application.PerformanceTestService;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceMetrics;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceTest;
import uk.gegc.ergtracker.features.performance.domain.repository.PerformanceTestRepository;
import uk.gegc.ergtracker.features.performance.domain.repository.PerformanceTestSpecifications;
import uk.gegc.ergtracker.features.performance.domain.service.MetricsEngine;
import uk.gegc.ergtracker.features.performance.domain.service.StatsAggregator;
import uk.gegc.ergtracker.features.performance.infra.mapping.PerformanceTestMapper;
import uk.gegc.ergtracker.shared.exception.ResourceNotFoundException;
import uk.gegc.ergtracker.shared.security.AccessControlEngine;
import uk.gegc.ergtracker.shared.security.CallerIdentity;
import uk.gegc.ergtracker.shared.security.CallerResolver;

import java.util.List;
import java.util.UUID;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class PerformanceTestServiceImpl implements PerformanceTestService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("date"), Sort.Order.desc("createdAt"));

    private final PerformanceTestRepository performanceTestRepository;
    private final AccountRepository accountRepository;
    private final PerformanceTestMapper performanceTestMapper;
    private final MetricsEngine metricsEngine;
    private final StatsAggregator statsAggregator;
    private final AccessControlEngine accessControlEngine;
    private final CallerResolver callerResolver;

    @Override
    public PerformanceTestDto createTest(Authentication authentication, CreatePerformanceTestRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        Account subject = findSubject(request.subjectId());
        accessControlEngine.requireCreateTestFor(caller, subject);

        Double weight = MetricsEngine.effective(request.weight(), subject.getWeight());
        Double height = MetricsEngine.effective(request.height(), subject.getHeight());
        PerformanceMetrics metrics = metricsEngine.compute(request.distance(), request.timeSeconds(), weight);

        PerformanceTest test = new PerformanceTest();
        test.setSubjectId(subject.getId());
        test.setSubjectName(subject.getName());
        test.setSocietyId(subject.getPrimarySocietyId());
        test.setDate(request.date());
        test.setDistance(request.distance());
        test.setTimeSeconds(request.timeSeconds());
        test.setSplit500(metrics.split500());
        test.setWatts(metrics.watts());
        test.setWattsPerKg(metrics.wattsPerKg());
        test.setStrokes(request.strokes());
        test.setWeight(weight);
        test.setHeight(height);
        test.setNotes(request.notes());

        PerformanceTest saved = performanceTestRepository.save(test);
        log.info("Test {} recorded for subject {} by {}", saved.getId(), subject.getId(), caller.accountId());
        return performanceTestMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PerformanceTestDto> listTests(Authentication authentication, UUID subjectId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        Specification<PerformanceTest> filter = accessControlEngine.testListing(caller).filterOrThrow();
        if (subjectId != null) {
            filter = filter.and(PerformanceTestSpecifications.forSubject(subjectId));
        }
        return performanceTestRepository.findAll(filter, NEWEST_FIRST).stream()
                .map(performanceTestMapper::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public SubjectStatsDto getSubjectStats(Authentication authentication, UUID subjectId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        Account subject = findSubject(subjectId);
        accessControlEngine.requireViewSubjectStats(caller, subject);

        List<PerformanceTest> history = performanceTestRepository.findAll(
                PerformanceTestSpecifications.forSubject(subjectId), NEWEST_FIRST);
        return performanceTestMapper.toStatsDto(subjectId, statsAggregator.aggregate(history), history);
    }

    private Account findSubject(UUID subjectId) {
        return accountRepository.findById(subjectId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + subjectId + " not found"));
    }
}
