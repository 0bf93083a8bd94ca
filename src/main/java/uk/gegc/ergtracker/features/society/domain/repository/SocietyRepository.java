package uk.gegc.ergtracker.features.society.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.ergtracker.features.society.domain.model.Society;

import java.util.List;
import java.util.UUID;

public interface SocietyRepository extends JpaRepository<Society, UUID> {

    boolean existsByNameIgnoreCase(String name);

    List<Society> findAllByOrderByNameAsc();
}
