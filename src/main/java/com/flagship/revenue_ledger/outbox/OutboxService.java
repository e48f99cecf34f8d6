package com.flagship.revenue_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox and tracks their publication.
 *
 * {@link #saveEvent} joins the caller's transaction and refuses to run
 * without one: an event must commit or roll back together with the journal
 * entry or contract change it reports. Publication to Kafka is done later by
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.pending(aggregateType, aggregateId, eventType, toJson(payload));
        repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Queued outbox event: eventType={}, aggregateType={}, aggregateId={}",
            eventType, aggregateType, aggregateId);
        return event;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimUnpublished(int limit, int maxRetries) {
        return repository.claimUnpublished(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String error) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.recordFailure(error);
            repository.save(entity);
            log.warn("Outbox event {} failed to publish (attempt {}): {}", eventId, entity.getRetryCount(), error);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsFor(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc(aggregateType, aggregateId).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countByPublishedAtIsNull();
    }

    @Transactional(readOnly = true)
    public long countDeadLettered(int maxRetries) {
        return repository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize outbox payload " + payload.getClass().getSimpleName(), e);
        }
    }
}
