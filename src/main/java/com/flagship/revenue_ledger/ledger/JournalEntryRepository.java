package com.flagship.revenue_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID> {

    List<JournalEntryEntity> findByOrganizationIdOrderByEntryNumberAsc(UUID organizationId);

    List<JournalEntryEntity> findByOrganizationIdAndStatusOrderByEntryNumberAsc(UUID organizationId,
                                                                              JournalEntryStatus status);
}
