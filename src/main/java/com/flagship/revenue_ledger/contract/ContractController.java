package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.contract.dto.AllocationResponse;
import com.flagship.revenue_ledger.contract.dto.ContractLineRequest;
import com.flagship.revenue_ledger.contract.dto.ContractResponse;
import com.flagship.revenue_ledger.contract.dto.CreateContractRequest;
import com.flagship.revenue_ledger.contract.dto.UpdateContractRequest;
import com.flagship.revenue_ledger.schedule.ScheduleService;
import com.flagship.revenue_ledger.schedule.dto.RevenueScheduleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Contracts and their lines: authoring while draft, allocation, activation
 * and cancellation.
 */
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
@Slf4j
public class ContractController {

    private final ContractService contractService;
    private final ScheduleService scheduleService;

    @PostMapping
    public ResponseEntity<ContractResponse> createContract(@Valid @RequestBody CreateContractRequest request) {
        List<ContractLineDraft> lines = request.getLines() == null
            ? List.of()
            : request.getLines().stream().map(ContractLineRequest::toDraft).toList();
        Contract contract = contractService.createContract(request.getOrganizationId(), request.getReference(),
            request.getTotalTransactionPrice(), request.getCurrency(), request.getStartDate(),
            request.getEndDate(), lines);
        log.info("Contract created: id={}, reference={}, lines={}",
            contract.getId(), contract.getReference(), contract.getLines().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContractResponse.from(contract));
    }

    @GetMapping("/{id}")
    public ContractResponse getContract(@PathVariable("id") UUID id) {
        return ContractResponse.from(contractService.getContract(id));
    }

    @GetMapping
    public List<ContractResponse> listContracts(@RequestParam("organization_id") UUID organizationId) {
        return contractService.listContracts(organizationId).stream().map(ContractResponse::from).toList();
    }

    @GetMapping("/due-for-recognition")
    public List<ContractResponse> listContractsDueForRecognition(
            @RequestParam("organization_id") UUID organizationId,
            @RequestParam("as_of_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOfDate) {
        return contractService.listContractsDueForRecognition(organizationId, asOfDate).stream()
            .map(ContractResponse::from)
            .toList();
    }

    @PatchMapping("/{id}")
    public ContractResponse updateContract(@PathVariable("id") UUID id,
                                           @Valid @RequestBody UpdateContractRequest request) {
        return ContractResponse.from(contractService.updateContract(id, request.getReference(),
            request.getTotalTransactionPrice(), request.getCurrency(), request.getStartDate(),
            request.getEndDate()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteContract(@PathVariable("id") UUID id) {
        contractService.deleteContract(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/lines")
    public ResponseEntity<ContractResponse.Line> addLine(@PathVariable("id") UUID id,
                                                         @Valid @RequestBody ContractLineRequest request) {
        ContractLine line = contractService.addLine(id, request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContractResponse.Line.from(line));
    }

    @PutMapping("/lines/{lineId}")
    public ContractResponse.Line updateLine(@PathVariable("lineId") UUID lineId,
                                            @Valid @RequestBody ContractLineRequest request) {
        return ContractResponse.Line.from(contractService.updateLine(lineId, request.toDraft()));
    }

    @DeleteMapping("/lines/{lineId}")
    public ResponseEntity<Void> removeLine(@PathVariable("lineId") UUID lineId) {
        contractService.removeLine(lineId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/allocate")
    public AllocationResponse allocate(@PathVariable("id") UUID id) {
        return AllocationResponse.from(contractService.allocate(id));
    }

    @PostMapping("/{id}/activate")
    public ContractResponse activate(@PathVariable("id") UUID id,
                                     @RequestParam(name = "generate_schedules", defaultValue = "true")
                                     boolean generateSchedules) {
        return ContractResponse.from(contractService.activate(id, generateSchedules));
    }

    @PostMapping("/{id}/cancel")
    public ContractResponse cancel(@PathVariable("id") UUID id) {
        return ContractResponse.from(contractService.cancel(id));
    }

    @PostMapping("/{id}/schedules")
    public ResponseEntity<List<RevenueScheduleResponse>> generateSchedules(@PathVariable("id") UUID id) {
        List<RevenueScheduleResponse> schedules = scheduleService.generateSchedules(id).stream()
            .map(RevenueScheduleResponse::from)
            .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(schedules);
    }
}
