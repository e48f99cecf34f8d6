package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.LedgerFixtures;
import com.flagship.revenue_ledger.account.AccountService;
import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractService;
import com.flagship.revenue_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class WaterfallReporterTest {

    @Autowired
    private WaterfallReporter reporter;

    @Autowired
    private RecognitionRunService runService;

    @Autowired
    private ContractService contractService;

    @Autowired
    private AccountService accountService;

    private LedgerFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(accountService, contractService);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void waterfall_SplitsPostedFromPlanned() {
        fixtures.activeAnnualSubscription("12000.00");
        runService.runRecognition(fixtures.organizationId, LocalDate.of(2024, 3, 31), "system", false);

        WaterfallReport report = reporter.waterfall(fixtures.organizationId,
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30));

        assertEquals(6, report.getPeriods().size());
        assertEquals(YearMonth.of(2024, 1), report.getPeriods().get(0).getMonth());
        assertEquals(YearMonth.of(2024, 6), report.getPeriods().get(5).getMonth());
        assertAmount("3000.00", report.getTotalPlanned());
        assertAmount("3000.00", report.getTotalPosted());
        assertAmount("3000.00", report.getTotalDeferred());

        WaterfallReport.Period march = report.getPeriods().get(2);
        assertAmount("0.00", march.getPlanned());
        assertAmount("1000.00", march.getPosted());
        assertAmount("0.00", march.getDeferred());
        assertEquals(1, march.getLineCount());
        WaterfallReport.Period april = report.getPeriods().get(3);
        assertAmount("1000.00", april.getPlanned());
        assertAmount("0.00", april.getPosted());
        assertAmount("1000.00", april.getDeferred());
        assertEquals(1, april.getLineCount());
    }

    @Test
    void waterfall_PostedMonthHasNothingPlanned() {
        fixtures.activeAnnualSubscription("12000.00");
        runService.runRecognition(fixtures.organizationId, LocalDate.of(2024, 1, 31), "system", false);

        WaterfallReport report = reporter.waterfall(fixtures.organizationId,
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertEquals(1, report.getPeriods().size());
        WaterfallReport.Period january = report.getPeriods().get(0);
        assertAmount("0.00", january.getPlanned());
        assertAmount("1000.00", january.getPosted());
        assertAmount("0.00", january.getDeferred());
        assertAmount("0.00", report.getTotalDeferred());
    }

    @Test
    void waterfall_SumsContractsPerMonth() {
        fixtures.activeAnnualSubscription("12000.00");
        fixtures.activeAnnualSubscription("2400.00");

        WaterfallReport report = reporter.waterfall(fixtures.organizationId,
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

        assertEquals(12, report.getPeriods().size());
        assertEquals(2, report.getPeriods().get(0).getLineCount());
        assertAmount("1200.00", report.getPeriods().get(0).getPlanned());
        assertAmount("14400.00", report.getTotalPlanned());
        assertAmount("14400.00", report.getTotalDeferred());
        assertAmount("0.00", report.getTotalPosted());
    }

    @Test
    void waterfall_LeavesOutCancelledLines() {
        Contract contract = fixtures.activeAnnualSubscription("12000.00");
        runService.runRecognition(fixtures.organizationId, LocalDate.of(2024, 2, 29), "system", false);
        contractService.cancel(contract.getId());

        WaterfallReport report = reporter.waterfall(fixtures.organizationId,
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

        assertEquals(2, report.getPeriods().size());
        assertAmount("0.00", report.getTotalPlanned());
        assertAmount("2000.00", report.getTotalPosted());
        assertAmount("0.00", report.getTotalDeferred());
    }

    @Test
    void waterfall_EmptyOrganization() {
        WaterfallReport report = reporter.waterfall(fixtures.organizationId,
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

        assertTrue(report.getPeriods().isEmpty());
        assertAmount("0", report.getTotalPlanned());
    }

    @Test
    void waterfall_RejectsInvertedRange() {
        assertThrows(ValidationException.class, () -> reporter.waterfall(fixtures.organizationId,
            LocalDate.of(2024, 6, 30), LocalDate.of(2024, 1, 1)));
        assertThrows(ValidationException.class, () -> reporter.waterfall(fixtures.organizationId,
            null, LocalDate.of(2024, 1, 1)));
    }
}
