package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.LedgerFixtures;
import com.flagship.revenue_ledger.account.AccountService;
import com.flagship.revenue_ledger.contract.event.ContractActivatedEvent;
import com.flagship.revenue_ledger.exception.AllocationException;
import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.outbox.LedgerAggregates;
import com.flagship.revenue_ledger.outbox.OutboxEvent;
import com.flagship.revenue_ledger.outbox.OutboxService;
import com.flagship.revenue_ledger.recognition.RecognitionRunService;
import com.flagship.revenue_ledger.schedule.RevenueSchedule;
import com.flagship.revenue_ledger.schedule.ScheduleLineStatus;
import com.flagship.revenue_ledger.schedule.ScheduleService;
import com.flagship.revenue_ledger.schedule.ScheduleStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract authoring, allocation, activation and cancellation.
 */
@SpringBootTest
@ActiveProfiles("test")
class ContractServiceTest {

    @Autowired
    private ContractService contractService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private RecognitionRunService runService;

    private LedgerFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(accountService, contractService);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private Contract bundle() {
        return fixtures.draftContract("50000.00",
            fixtures.straightLine("Software license", "28000.00", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)),
            fixtures.straightLine("Support", "15000.00", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)),
            fixtures.pointInTime("Implementation", "12000.00", LocalDate.of(2024, 2, 15)));
    }

    @Test
    @DisplayName("Allocation stores each line's share of the discounted price")
    void allocate_PersistsShares() {
        printTestHeader("Allocate discounted bundle");
        Contract contract = bundle();

        AllocationResult result = contractService.allocate(contract.getId());

        assertEquals(3, result.getAllocationCount());
        List<BigDecimal> shares = result.getAllocations().stream()
            .map(AllocationResult.LineAllocation::getAllocatedTransactionPrice)
            .toList();
        System.out.println("Allocated: " + shares);
        assertEquals(List.of(new BigDecimal("25454.55"), new BigDecimal("13636.36"), new BigDecimal("10909.09")), shares);

        Contract reloaded = contractService.getContract(contract.getId());
        assertEquals(ContractStatus.DRAFT, reloaded.getStatus());
        assertEquals(0, reloaded.allocatedTotal().compareTo(new BigDecimal("50000.00")));
    }

    @Test
    @DisplayName("Activation allocates, activates, generates schedules and writes ContractActivated")
    void activate_GeneratesSchedules() {
        printTestHeader("Activate contract with schedules");
        Contract contract = bundle();

        Contract active = contractService.activate(contract.getId(), true);

        assertEquals(ContractStatus.ACTIVE, active.getStatus());
        for (ContractLine line : active.getLines()) {
            assertEquals(ContractLineStatus.ACTIVE, line.getStatus());
            RevenueSchedule schedule = scheduleService.getScheduleForLine(line.getId());
            assertEquals(ScheduleStatus.PLANNED, schedule.getStatus());
            assertEquals(0, schedule.lineTotal().compareTo(line.getAllocatedTransactionPrice()));
        }
        RevenueSchedule implementation = scheduleService.getScheduleForLine(active.getLines().get(2).getId());
        assertEquals(1, implementation.getLines().size());

        List<OutboxEvent> events = outboxService.eventsFor(LedgerAggregates.CONTRACT, contract.getId());
        assertEquals(1, events.size());
        assertEquals(ContractActivatedEvent.EVENT_TYPE, events.get(0).getEventType());
    }

    @Test
    @DisplayName("Generating schedules twice does not duplicate them")
    void generateSchedules_Idempotent() {
        Contract contract = contractService.activate(bundle().getId(), false);

        assertEquals(3, scheduleService.generateSchedules(contract.getId()).size());
        assertTrue(scheduleService.generateSchedules(contract.getId()).isEmpty());
    }

    @Test
    @DisplayName("Lines can only be changed while the contract is a draft")
    void draftOnlyEdits() {
        Contract contract = bundle();
        ContractLine added = contractService.addLine(contract.getId(),
            fixtures.pointInTime("Training", "500.00", LocalDate.of(2024, 3, 1)));
        assertEquals(4, added.getSortOrder());

        contractService.removeLine(added.getId());
        Contract active = contractService.activate(contract.getId(), false);

        ContractLineDraft extra = fixtures.pointInTime("Extra", "1.00", LocalDate.of(2024, 3, 1));
        UUID firstLine = active.getLines().get(0).getId();
        assertThrows(InvalidStateTransitionException.class, () -> contractService.addLine(active.getId(), extra));
        assertThrows(InvalidStateTransitionException.class, () -> contractService.updateLine(firstLine, extra));
        assertThrows(InvalidStateTransitionException.class, () -> contractService.removeLine(firstLine));
        assertThrows(InvalidStateTransitionException.class, () -> contractService.deleteContract(active.getId()));
    }

    @Test
    @DisplayName("Cancelling an active contract cancels the planned schedule lines")
    void cancel_CancelsSchedules() {
        Contract active = fixtures.activeAnnualSubscription("12000.00");

        Contract cancelled = contractService.cancel(active.getId());

        assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
        RevenueSchedule schedule = scheduleService.getScheduleForLine(active.getLines().get(0).getId());
        assertEquals(ScheduleStatus.CANCELLED, schedule.getStatus());
        schedule.getLines().forEach(line -> assertEquals(ScheduleLineStatus.CANCELLED, line.getStatus()));
        assertThrows(InvalidStateTransitionException.class, () -> contractService.allocate(active.getId()));
    }

    @Test
    @DisplayName("A contract without lines cannot be allocated or activated")
    void allocate_NoLines() {
        Contract empty = fixtures.draftContract("1000.00");

        assertThrows(AllocationException.class, () -> contractService.allocate(empty.getId()));
        assertThrows(AllocationException.class, () -> contractService.activate(empty.getId(), true));
        assertEquals(ContractStatus.DRAFT, contractService.getContract(empty.getId()).getStatus());
    }

    @Test
    @DisplayName("Contract input is validated")
    void createContract_Validation() {
        UUID org = fixtures.organizationId;
        LocalDate start = LocalDate.of(2024, 1, 1);

        assertThrows(ValidationException.class, () -> contractService.createContract(org, "SO-1",
            new BigDecimal("0.00"), "USD", start, null, List.of()));
        assertThrows(ValidationException.class, () -> contractService.createContract(org, "SO-1",
            new BigDecimal("10.00"), "usd", start, null, List.of()));
        assertThrows(ValidationException.class, () -> contractService.createContract(org, "SO-1",
            new BigDecimal("10.00"), "USD", start, start.minusDays(1), List.of()));
        assertThrows(ValidationException.class, () -> contractService.createContract(org, "SO-1",
            new BigDecimal("10.005"), "USD", start, null, List.of()));
    }

    @Test
    @DisplayName("Revenue accounts must belong to the contract's organization")
    void createContract_ForeignAccount() {
        LedgerFixtures other = new LedgerFixtures(accountService, contractService);
        ContractLineDraft line = ContractLineDraft.builder()
            .description("Subscription")
            .recognitionPattern(RecognitionPattern.STRAIGHT_LINE)
            .sspAmount(new BigDecimal("100.00"))
            .revenueAccountId(other.revenue.getId())
            .deferredRevenueAccountId(fixtures.deferredRevenue.getId())
            .build();

        assertThrows(ValidationException.class, () -> contractService.createContract(fixtures.organizationId,
            "SO-2", new BigDecimal("100.00"), "USD", LocalDate.of(2024, 1, 1), null, List.of(line)));
    }

    @Test
    @DisplayName("A deleted draft contract is gone")
    void deleteContract_Draft() {
        Contract contract = bundle();

        contractService.deleteContract(contract.getId());

        assertThrows(NotFoundException.class, () -> contractService.getContract(contract.getId()));
        assertTrue(contractService.listContracts(fixtures.organizationId).isEmpty());
    }

    @Test
    @DisplayName("Only active contracts with planned lines due by the as-of date are listed")
    void contractsDueForRecognition() {
        Contract active = fixtures.activeAnnualSubscription("12000.00");
        Contract startsLater = contractService.activate(fixtures.draftContract("600.00",
            fixtures.straightLine("Add-on", "600.00", LocalDate.of(2024, 7, 1), LocalDate.of(2024, 12, 31))).getId(),
            true);
        fixtures.draftContract("1200.00",
            fixtures.straightLine("Unsigned", "1200.00", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
        Contract cancelled = fixtures.activeAnnualSubscription("2400.00");
        contractService.cancel(cancelled.getId());

        List<Contract> dueInMarch = contractService.listContractsDueForRecognition(fixtures.organizationId,
            LocalDate.of(2024, 3, 31));
        List<Contract> dueInJuly = contractService.listContractsDueForRecognition(fixtures.organizationId,
            LocalDate.of(2024, 7, 31));

        assertEquals(Set.of(active.getId()), dueInMarch.stream().map(Contract::getId).collect(Collectors.toSet()));
        assertEquals(Set.of(active.getId(), startsLater.getId()),
            dueInJuly.stream().map(Contract::getId).collect(Collectors.toSet()));
    }

    @Test
    @DisplayName("Cancelling keeps a fully posted schedule completed")
    void cancel_KeepsCompletedSchedule() {
        Contract contract = contractService.activate(fixtures.draftContract("13000.00",
            fixtures.straightLine("Subscription", "12000.00", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)),
            fixtures.pointInTime("Onboarding", "1000.00", LocalDate.of(2024, 1, 15))).getId(), true);
        runService.runRecognition(fixtures.organizationId, LocalDate.of(2024, 1, 31), "system", false);
        ContractLine subscription = contract.getLines().get(0);
        ContractLine onboarding = contract.getLines().get(1);
        assertEquals(ScheduleStatus.COMPLETED, scheduleService.getScheduleForLine(onboarding.getId()).getStatus());

        Contract cancelled = contractService.cancel(contract.getId());

        RevenueSchedule onboardingSchedule = scheduleService.getScheduleForLine(onboarding.getId());
        assertEquals(ScheduleStatus.COMPLETED, onboardingSchedule.getStatus());
        onboardingSchedule.getLines().forEach(line -> assertEquals(ScheduleLineStatus.POSTED, line.getStatus()));
        assertEquals(ContractLineStatus.COMPLETED, cancelled.getLines().get(1).getStatus());

        RevenueSchedule subscriptionSchedule = scheduleService.getScheduleForLine(subscription.getId());
        assertEquals(ScheduleStatus.CANCELLED, subscriptionSchedule.getStatus());
        assertEquals(ScheduleLineStatus.POSTED, subscriptionSchedule.getLines().get(0).getStatus());
        assertEquals(ScheduleLineStatus.CANCELLED, subscriptionSchedule.getLines().get(1).getStatus());
        assertEquals(ContractLineStatus.CANCELLED, cancelled.getLines().get(0).getStatus());
    }

    @Test
    @DisplayName("A draft header can change every field")
    void updateContract_Draft() {
        Contract contract = bundle();

        Contract updated = contractService.updateContract(contract.getId(), "SO-RENEWAL",
            new BigDecimal("45000.00"), "EUR", LocalDate.of(2024, 2, 1), LocalDate.of(2025, 1, 31));

        Contract reloaded = contractService.getContract(contract.getId());
        assertEquals("SO-RENEWAL", reloaded.getReference());
        assertEquals(0, new BigDecimal("45000.00").compareTo(reloaded.getTotalTransactionPrice()));
        assertEquals("EUR", reloaded.getCurrency());
        assertEquals(LocalDate.of(2024, 2, 1), reloaded.getStartDate());
        assertEquals(LocalDate.of(2025, 1, 31), reloaded.getEndDate());
        assertEquals(ContractStatus.DRAFT, updated.getStatus());
        assertEquals(3, reloaded.getLines().size());
    }

    @Test
    @DisplayName("An active contract keeps its price, currency and start date")
    void updateContract_ActiveIsRestricted() {
        Contract active = fixtures.activeAnnualSubscription("12000.00");
        UUID id = active.getId();

        Contract renamed = contractService.updateContract(id, "SO-RENAMED", new BigDecimal("12000.00"), null, null,
            LocalDate.of(2025, 6, 30));
        assertEquals("SO-RENAMED", renamed.getReference());
        assertEquals(LocalDate.of(2025, 6, 30), renamed.getEndDate());

        assertThrows(InvalidStateTransitionException.class, () -> contractService.updateContract(id, null,
            new BigDecimal("15000.00"), null, null, null));
        assertThrows(InvalidStateTransitionException.class, () -> contractService.updateContract(id, null,
            null, "EUR", null, null));
        assertThrows(InvalidStateTransitionException.class, () -> contractService.updateContract(id, null,
            null, null, LocalDate.of(2024, 3, 1), null));

        Contract reloaded = contractService.getContract(id);
        assertEquals(0, new BigDecimal("12000.00").compareTo(reloaded.getTotalTransactionPrice()));
        assertEquals("USD", reloaded.getCurrency());
        assertEquals(LocalDate.of(2024, 1, 1), reloaded.getStartDate());
    }

    @Test
    @DisplayName("Closed contracts and bad header values are rejected")
    void updateContract_Rejections() {
        Contract draft = bundle();
        UUID draftId = draft.getId();
        assertThrows(ValidationException.class, () -> contractService.updateContract(draftId, null,
            null, null, null, LocalDate.of(2023, 12, 31)));
        assertThrows(ValidationException.class, () -> contractService.updateContract(draftId, null,
            null, "usd", null, null));
        assertThrows(ValidationException.class, () -> contractService.updateContract(draftId, null,
            new BigDecimal("0.00"), null, null, null));

        Contract cancelled = fixtures.activeAnnualSubscription("1200.00");
        contractService.cancel(cancelled.getId());
        assertThrows(InvalidStateTransitionException.class, () -> contractService.updateContract(cancelled.getId(),
            "SO-LATE", null, null, null, null));
    }
}
