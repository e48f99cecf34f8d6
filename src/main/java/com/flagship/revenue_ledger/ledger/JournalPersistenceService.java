package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads and stores journal entry aggregates.
 */
@Service
@RequiredArgsConstructor
public class JournalPersistenceService {

    private final JournalEntryRepository entryRepository;
    private final JournalLineRepository lineRepository;

    @Transactional
    public JournalEntry create(JournalEntry entry) {
        JournalEntryEntity saved = entryRepository.save(JournalEntryEntity.fromDomain(entry));
        return saved.toDomain(saveLines(entry.getLines()));
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findById(UUID entryId) {
        return entryRepository.findById(entryId).map(entity -> entity.toDomain(loadLines(entryId)));
    }

    @Transactional(readOnly = true)
    public JournalEntry require(UUID entryId) {
        return findById(entryId)
            .orElseThrow(() -> new NotFoundException("Journal entry not found: " + entryId,
                Map.of("journalEntryId", entryId)));
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findByOrganization(UUID organizationId, JournalEntryStatus status) {
        List<JournalEntryEntity> entities = status == null
            ? entryRepository.findByOrganizationIdOrderByEntryNumberAsc(organizationId)
            : entryRepository.findByOrganizationIdAndStatusOrderByEntryNumberAsc(organizationId, status);
        return entities.stream().map(entity -> entity.toDomain(loadLines(entity.getId()))).toList();
    }

    /**
     * Writes the header. Lines are left alone.
     */
    @Transactional
    public JournalEntry updateHeader(JournalEntry entry) {
        JournalEntryEntity entity = requireEntity(entry.getId());
        entity.updateFromDomain(entry);
        entryRepository.save(entity);
        return require(entry.getId());
    }

    /**
     * Writes the header and swaps the full line set. Drafts only; callers check.
     */
    @Transactional
    public JournalEntry replaceDraft(JournalEntry entry) {
        JournalEntryEntity entity = requireEntity(entry.getId());
        entity.updateFromDomain(entry);
        entryRepository.save(entity);
        lineRepository.deleteAll(lineRepository.findByJournalEntryIdOrderByLineNumberAsc(entry.getId()));
        lineRepository.flush();
        saveLines(entry.getLines());
        return require(entry.getId());
    }

    /**
     * Deletes lines, then the header. Drafts only; callers check.
     */
    @Transactional
    public void delete(UUID entryId) {
        lineRepository.deleteAll(lineRepository.findByJournalEntryIdOrderByLineNumberAsc(entryId));
        lineRepository.flush();
        entryRepository.deleteById(entryId);
    }

    private JournalEntryEntity requireEntity(UUID entryId) {
        return entryRepository.findById(entryId)
            .orElseThrow(() -> new NotFoundException("Journal entry not found: " + entryId,
                Map.of("journalEntryId", entryId)));
    }

    private List<JournalLine> saveLines(List<JournalLine> lines) {
        return lines.stream()
            .map(line -> lineRepository.save(JournalLineEntity.fromDomain(line)).toDomain())
            .toList();
    }

    private List<JournalLine> loadLines(UUID entryId) {
        return lineRepository.findByJournalEntryIdOrderByLineNumberAsc(entryId).stream()
            .map(JournalLineEntity::toDomain)
            .toList();
    }
}
