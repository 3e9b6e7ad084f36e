package com.courtdata.scraper.repo;

import com.courtdata.scraper.domain.CaseOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CaseOrderRepository extends JpaRepository<CaseOrder, Long> {

    long countByCourtCaseId(String caseId);
}
