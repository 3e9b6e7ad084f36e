package com.courtdata.scraper.repo;

import com.courtdata.scraper.domain.CourtCase;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CourtCaseRepository extends JpaRepository<CourtCase, String> {

    /**
     * Loads a case for update, holding a row lock until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CourtCase c where c.id = :id")
    Optional<CourtCase> findForUpdate(@Param("id") String id);

    @EntityGraph(attributePaths = "orders")
    @Query("select c from CourtCase c where c.id = :id")
    Optional<CourtCase> findWithOrders(@Param("id") String id);
}
