package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.common.Amounts;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.schedule.RevenueScheduleLine;
import com.flagship.revenue_ledger.schedule.SchedulePersistenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Buckets schedule lines by the month of their schedule date. Planned lines
 * count as planned and deferred, posted lines as posted. Cancelled lines are
 * left out; months without lines are not listed.
 */
@Service
@RequiredArgsConstructor
public class WaterfallReporter {

    private final SchedulePersistenceService schedulePersistenceService;

    @Transactional(readOnly = true)
    public WaterfallReport waterfall(UUID organizationId, LocalDate fromDate, LocalDate toDate) {
        if (organizationId == null || fromDate == null || toDate == null) {
            throw new ValidationException("Organization, from date and to date are required");
        }
        if (fromDate.isAfter(toDate)) {
            throw new ValidationException("From date " + fromDate + " is after to date " + toDate);
        }

        Map<YearMonth, Bucket> buckets = new TreeMap<>();
        for (RevenueScheduleLine line : schedulePersistenceService.findActiveLinesInRange(organizationId, fromDate, toDate)) {
            buckets.computeIfAbsent(YearMonth.from(line.getScheduleDate()), month -> new Bucket()).add(line);
        }

        List<WaterfallReport.Period> periods = new ArrayList<>(buckets.size());
        BigDecimal planned = Amounts.ZERO;
        BigDecimal posted = Amounts.ZERO;
        for (Map.Entry<YearMonth, Bucket> entry : buckets.entrySet()) {
            Bucket bucket = entry.getValue();
            periods.add(new WaterfallReport.Period(entry.getKey(), bucket.planned, bucket.posted,
                bucket.planned, bucket.lineCount));
            planned = planned.add(bucket.planned);
            posted = posted.add(bucket.posted);
        }
        return new WaterfallReport(organizationId, fromDate, toDate, List.copyOf(periods),
            planned, posted, planned);
    }

    private static final class Bucket {
        private BigDecimal planned = Amounts.ZERO;
        private BigDecimal posted = Amounts.ZERO;
        private int lineCount;

        void add(RevenueScheduleLine line) {
            switch (line.getStatus()) {
                case PLANNED -> planned = planned.add(line.getAmount());
                case POSTED -> posted = posted.add(line.getAmount());
                case CANCELLED -> {
                    return;
                }
            }
            lineCount++;
        }
    }
}
