package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.recognition.dto.DueLineResponse;
import com.flagship.revenue_ledger.recognition.dto.RecognitionPostingResponse;
import com.flagship.revenue_ledger.recognition.dto.RecognitionRunResponse;
import com.flagship.revenue_ledger.recognition.dto.RunRecognitionRequest;
import com.flagship.revenue_ledger.recognition.dto.WaterfallResponse;
import com.flagship.revenue_ledger.schedule.RevenueSchedule;
import com.flagship.revenue_ledger.schedule.ScheduleService;
import com.flagship.revenue_ledger.schedule.ScheduleStatus;
import com.flagship.revenue_ledger.schedule.dto.RevenueScheduleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Schedules, recognition runs and the revenue waterfall.
 */
@RestController
@RequestMapping("/api/revenue-recognition")
@RequiredArgsConstructor
public class RevenueRecognitionController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final ScheduleService scheduleService;
    private final RecognitionRunService runService;
    private final RecognitionPostingService postingService;
    private final WaterfallReporter waterfallReporter;

    /**
     * Returns 201 with the new schedule, or 200 with the existing one.
     */
    @PostMapping("/contract-lines/{lineId}/schedule")
    public ResponseEntity<RevenueScheduleResponse> generateSchedule(@PathVariable("lineId") UUID lineId) {
        Optional<RevenueSchedule> created = scheduleService.generateSchedule(lineId);
        if (created.isPresent()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(RevenueScheduleResponse.from(created.get()));
        }
        return ResponseEntity.ok(RevenueScheduleResponse.from(scheduleService.getScheduleForLine(lineId)));
    }

    @GetMapping("/contract-lines/{lineId}/schedule")
    public RevenueScheduleResponse getSchedule(@PathVariable("lineId") UUID lineId) {
        return RevenueScheduleResponse.from(scheduleService.getScheduleForLine(lineId));
    }

    @GetMapping("/schedules")
    public List<RevenueScheduleResponse> listSchedules(@RequestParam("organization_id") UUID organizationId,
                                                       @RequestParam(name = "contract_id", required = false)
                                                       UUID contractId,
                                                       @RequestParam(name = "status", required = false)
                                                       ScheduleStatus status) {
        return scheduleService.listSchedules(organizationId, contractId, status).stream()
            .map(RevenueScheduleResponse::from)
            .toList();
    }

    @GetMapping("/schedules/{scheduleId}")
    public RevenueScheduleResponse getScheduleById(@PathVariable("scheduleId") UUID scheduleId) {
        return RevenueScheduleResponse.from(scheduleService.getSchedule(scheduleId));
    }

    @DeleteMapping("/schedules/{scheduleId}")
    public ResponseEntity<Void> deleteSchedule(@PathVariable("scheduleId") UUID scheduleId) {
        scheduleService.deleteSchedule(scheduleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/runs")
    public RecognitionRunResponse run(@Valid @RequestBody RunRecognitionRequest request,
                                      @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return RecognitionRunResponse.from(runService.runRecognition(request.getOrganizationId(),
            request.getContractId(), request.getAsOfDate(), actor, request.isDryRun()));
    }

    @GetMapping("/due")
    public List<DueLineResponse> dueLines(@RequestParam("organization_id") UUID organizationId,
                                          @RequestParam(name = "contract_id", required = false) UUID contractId,
                                          @RequestParam("as_of_date")
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOfDate) {
        return runService.findDueLines(organizationId, contractId, asOfDate).stream()
            .map(DueLineResponse::from)
            .toList();
    }

    @PostMapping("/schedule-lines/{lineId}/post")
    public RecognitionPostingResponse postScheduleLine(@PathVariable("lineId") UUID lineId,
                                                       @RequestHeader(ACTOR_HEADER) String actor,
                                                       @RequestParam(name = "posting_date", required = false)
                                                       @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
                                                       LocalDate postingDate) {
        return RecognitionPostingResponse.from(postingService.postScheduleLine(lineId, postingDate, actor));
    }

    @GetMapping("/waterfall")
    public WaterfallResponse waterfall(@RequestParam("organization_id") UUID organizationId,
                                       @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
                                       LocalDate from,
                                       @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
                                       LocalDate to) {
        return WaterfallResponse.from(waterfallReporter.waterfall(organizationId, from, to));
    }
}
