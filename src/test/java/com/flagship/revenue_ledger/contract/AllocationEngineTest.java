package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.exception.AllocationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Relative-SSP allocation of a contract's transaction price.
 */
class AllocationEngineTest {

    private final AllocationEngine engine = new AllocationEngine();

    private static Contract contract(String total, String... sspAmounts) {
        UUID contractId = UUID.randomUUID();
        List<ContractLine> lines = new ArrayList<>();
        for (int i = 0; i < sspAmounts.length; i++) {
            lines.add(ContractLine.builder()
                .id(UUID.randomUUID())
                .contractId(contractId)
                .sortOrder(i + 1)
                .description("Line " + (i + 1))
                .recognitionPattern(RecognitionPattern.STRAIGHT_LINE)
                .quantity(BigDecimal.ONE)
                .unitPrice(new BigDecimal(sspAmounts[i]))
                .sspAmount(new BigDecimal(sspAmounts[i]))
                .status(ContractLineStatus.DRAFT)
                .build());
        }
        return Contract.builder()
            .id(contractId)
            .organizationId(UUID.randomUUID())
            .totalTransactionPrice(new BigDecimal(total))
            .currency("USD")
            .startDate(LocalDate.of(2024, 1, 1))
            .status(ContractStatus.DRAFT)
            .lines(List.copyOf(lines))
            .build();
    }

    private static List<BigDecimal> allocated(Contract contract) {
        return contract.getLines().stream().map(ContractLine::getAllocatedTransactionPrice).toList();
    }

    @Test
    @DisplayName("Discounted bundle is allocated by relative SSP with the remainder on the last line")
    void allocate_DiscountedBundle() {
        Contract result = engine.allocate(contract("50000.00", "28000.00", "15000.00", "12000.00"));

        assertEquals(List.of(new BigDecimal("25454.55"), new BigDecimal("13636.36"), new BigDecimal("10909.09")),
            allocated(result));
        assertEquals(0, result.allocatedTotal().compareTo(new BigDecimal("50000.00")));
    }

    @Test
    @DisplayName("A single line receives the whole price")
    void allocate_SingleLine() {
        Contract result = engine.allocate(contract("1234.56", "999.99"));

        assertEquals(List.of(new BigDecimal("1234.56")), allocated(result));
    }

    @Test
    @DisplayName("Lines are allocated in sort order regardless of list order")
    void allocate_FollowsSortOrder() {
        Contract original = contract("100.00", "1", "1", "1");
        List<ContractLine> reversed = new ArrayList<>(original.getLines());
        Collections.reverse(reversed);

        Contract result = engine.allocate(original.withLines(reversed));

        assertEquals(1, result.getLines().get(0).getSortOrder());
        assertEquals(new BigDecimal("33.34"), result.getLines().get(2).getAllocatedTransactionPrice());
    }

    @Test
    @DisplayName("Zero SSP on every line splits the price evenly")
    void allocate_ZeroSsp() {
        Contract result = engine.allocate(contract("100.00", "0", "0", "0"));

        assertEquals(List.of(new BigDecimal("33.33"), new BigDecimal("33.33"), new BigDecimal("33.34")),
            allocated(result));
    }

    @Test
    @DisplayName("Allocations always sum to the total, for arbitrary prices")
    void allocate_ConservesTotal() {
        Random random = new Random(42);
        for (int run = 0; run < 200; run++) {
            int lineCount = 1 + random.nextInt(8);
            String[] ssp = new String[lineCount];
            for (int i = 0; i < lineCount; i++) {
                ssp[i] = BigDecimal.valueOf(random.nextInt(10_000_000), 2).toPlainString();
            }
            String total = BigDecimal.valueOf(1 + random.nextInt(10_000_000), 2).toPlainString();

            Contract result = engine.allocate(contract(total, ssp));

            assertEquals(0, result.allocatedTotal().compareTo(new BigDecimal(total)),
                "Allocation must sum to " + total);
            result.getLines().forEach(line -> assertEquals(2, line.getAllocatedTransactionPrice().scale()));
        }
    }

    @Test
    @DisplayName("A contract without lines cannot be allocated")
    void allocate_NoLines() {
        AllocationException e = assertThrows(AllocationException.class, () -> engine.allocate(contract("100.00")));

        assertTrue(e.getEntityIds().containsKey("contractId"));
    }

    @Test
    @DisplayName("A non-positive total cannot be allocated")
    void allocate_NonPositiveTotal() {
        assertThrows(AllocationException.class, () -> engine.allocate(contract("0.00", "10.00")));
    }
}
