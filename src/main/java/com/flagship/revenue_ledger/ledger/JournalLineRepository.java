package com.flagship.revenue_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JournalLineRepository extends JpaRepository<JournalLineEntity, UUID> {

    List<JournalLineEntity> findByJournalEntryIdOrderByLineNumberAsc(UUID journalEntryId);
}
