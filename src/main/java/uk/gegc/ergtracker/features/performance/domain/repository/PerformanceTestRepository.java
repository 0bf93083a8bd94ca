package uk.gegc.ergtracker.features.performance.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceTest;

import java.util.UUID;

public interface PerformanceTestRepository extends JpaRepository<PerformanceTest, UUID>,
        JpaSpecificationExecutor<PerformanceTest> {
}
