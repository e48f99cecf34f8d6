package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.common.Amounts;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.recognition.RecognitionRunResult.LineOutcome;
import com.flagship.revenue_ledger.recognition.RecognitionRunResult.LineResult;
import com.flagship.revenue_ledger.schedule.DueScheduleLine;
import com.flagship.revenue_ledger.schedule.SchedulePersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Batch revenue recognition.
 *
 * Finds every planned schedule line dated on or before the as-of date whose
 * contract is active, and posts each one through
 * {@link RecognitionPostingService}. The run itself holds no transaction:
 * each line commits or rolls back on its own, so a line that fails (missing
 * account, concurrent change) is reported and left planned while the others
 * post. Re-running the same as-of date is safe; posted lines are no longer due.
 *
 * A dry run reports what would post and writes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecognitionRunService {

    private final SchedulePersistenceService schedulePersistenceService;
    private final RecognitionPostingService postingService;
    private final LedgerMetrics metrics;

    public RecognitionRunResult runRecognition(UUID organizationId, LocalDate asOfDate, String actor, boolean dryRun) {
        return runRecognition(organizationId, null, asOfDate, actor, dryRun);
    }

    /**
     * @param contractId restricts the run to one contract; null means the whole organization
     */
    public RecognitionRunResult runRecognition(UUID organizationId, UUID contractId, LocalDate asOfDate,
                                               String actor, boolean dryRun) {
        if (organizationId == null) {
            throw new ValidationException("Organization is required");
        }
        if (asOfDate == null) {
            throw new ValidationException("As-of date is required");
        }
        if (!dryRun && (actor == null || actor.isBlank())) {
            throw new ValidationException("Actor is required");
        }

        MDC.put("organizationId", organizationId.toString());
        long started = System.nanoTime();
        try {
            List<DueScheduleLine> due = findDueLines(organizationId, contractId, asOfDate);
            log.info("Recognition run started: asOf={}, dueLines={}, dryRun={}", asOfDate, due.size(), dryRun);

            List<LineResult> results = new ArrayList<>(due.size());
            List<UUID> journalEntryIds = new ArrayList<>();
            BigDecimal total = Amounts.ZERO;
            int posted = 0;
            int failed = 0;

            for (DueScheduleLine line : due) {
                LineResult result = dryRun ? wouldPost(line) : post(line, actor);
                results.add(result);
                metrics.recordRecognitionLine(result.getOutcome().name().toLowerCase());
                switch (result.getOutcome()) {
                    case WOULD_POST -> total = total.add(line.getAmount());
                    case POSTED -> {
                        posted++;
                        total = total.add(line.getAmount());
                        journalEntryIds.add(result.getJournalEntryId());
                    }
                    case FAILED -> failed++;
                    case ALREADY_POSTED -> { }
                }
            }

            log.info("Recognition run finished: asOf={}, processed={}, posted={}, failed={}, total={}, dryRun={}",
                asOfDate, due.size(), posted, failed, total, dryRun);
            return RecognitionRunResult.builder()
                .organizationId(organizationId)
                .contractId(contractId)
                .asOfDate(asOfDate)
                .dryRun(dryRun)
                .linesProcessed(due.size())
                .linesPosted(posted)
                .linesFailed(failed)
                .totalAmount(total)
                .journalEntryIds(List.copyOf(journalEntryIds))
                .lineResults(List.copyOf(results))
                .build();
        } finally {
            metrics.recordRecognitionRun(dryRun, Duration.ofNanos(System.nanoTime() - started));
            MDC.remove("organizationId");
        }
    }

    public List<DueScheduleLine> findDueLines(UUID organizationId, LocalDate asOfDate) {
        return findDueLines(organizationId, null, asOfDate);
    }

    public List<DueScheduleLine> findDueLines(UUID organizationId, UUID contractId, LocalDate asOfDate) {
        return contractId == null
            ? schedulePersistenceService.findDueLines(organizationId, asOfDate)
            : schedulePersistenceService.findDueLines(organizationId, contractId, asOfDate);
    }

    private LineResult wouldPost(DueScheduleLine line) {
        return resultFor(line).outcome(LineOutcome.WOULD_POST).build();
    }

    private LineResult post(DueScheduleLine line, String actor) {
        try {
            RecognitionPostingResult posting = postingService.postScheduleLine(line.getScheduleLineId(), null, actor);
            LineOutcome outcome = posting.getOutcome() == RecognitionPostingResult.Outcome.POSTED
                ? LineOutcome.POSTED
                : LineOutcome.ALREADY_POSTED;
            return resultFor(line).outcome(outcome).journalEntryId(posting.getJournalEntryId()).build();
        } catch (RevenueLedgerException e) {
            log.warn("Schedule line {} not posted: {} {}", line.getScheduleLineId(), e.getKind(), e.getMessage());
            return resultFor(line)
                .outcome(LineOutcome.FAILED)
                .errorKind(e.getKind())
                .message(e.getMessage())
                .build();
        } catch (RuntimeException e) {
            log.error("Schedule line {} failed unexpectedly", line.getScheduleLineId(), e);
            return resultFor(line)
                .outcome(LineOutcome.FAILED)
                .message("Posting failed: " + e.getClass().getSimpleName())
                .build();
        }
    }

    private static LineResult.LineResultBuilder resultFor(DueScheduleLine line) {
        return LineResult.builder()
            .scheduleLineId(line.getScheduleLineId())
            .contractId(line.getContractId())
            .contractLineId(line.getContractLineId())
            .scheduleDate(line.getScheduleDate())
            .amount(line.getAmount());
    }
}
