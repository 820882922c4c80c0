package com.flagship.wage_ledger.compensation.bonus;

import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.compensation.bonus.dto.BonusDraftResponse;
import com.flagship.wage_ledger.compensation.bonus.dto.BonusSummaryResponse;
import com.flagship.wage_ledger.compensation.bonus.dto.ComputeBonusRequest;
import com.flagship.wage_ledger.compensation.bonus.dto.DraftAdjustmentRequest;
import com.flagship.wage_ledger.compensation.bonus.dto.MarkPaidRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST Controller for bonus drafts.
 *
 * {@code /preview} computes without storing; {@code POST /api/bonus/drafts} stores the
 * recomputed drafts, keeping operator adjustments made earlier.
 */
@RestController
@RequestMapping("/api/bonus/drafts")
@RequiredArgsConstructor
@Slf4j
public class BonusController {

    private final BonusService bonusService;

    @PostMapping("/preview")
    public List<BonusDraftResponse> preview(@Valid @RequestBody ComputeBonusRequest request) {
        Period period = request.getPeriod().toPeriod();
        return toResponses(bonusService.computeBonusDraft(
            period, request.getDeductionPerAbsentDay(), request.getThresholdRelative()));
    }

    @PostMapping
    public List<BonusDraftResponse> computeAndSave(@Valid @RequestBody ComputeBonusRequest request) {
        Period period = request.getPeriod().toPeriod();
        log.info("Recomputing bonus drafts for {}", period);
        return toResponses(bonusService.computeAndSaveBonusDrafts(
            period, request.getDeductionPerAbsentDay(), request.getThresholdRelative()));
    }

    @GetMapping
    public List<BonusDraftResponse> listDrafts(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return toResponses(bonusService.listBonusDrafts(Period.of(start, end)));
    }

    @GetMapping("/summary")
    public BonusSummaryResponse summary(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return BonusSummaryResponse.from(bonusService.bonusSummary(Period.of(start, end)));
    }

    @GetMapping("/{id}")
    public BonusDraftResponse getDraft(@PathVariable("id") UUID id) {
        return BonusDraftResponse.from(bonusService.getBonusDraft(id));
    }

    @PostMapping("/{id}/extra-bonus")
    public BonusDraftResponse addExtraBonus(@PathVariable("id") UUID id,
                                            @Valid @RequestBody DraftAdjustmentRequest request) {
        return BonusDraftResponse.from(bonusService.addExtraBonus(id, request.getAmount(), request.getNotes()));
    }

    @PostMapping("/{id}/employee-deposit")
    public BonusDraftResponse addEmployeeDeposit(@PathVariable("id") UUID id,
                                                 @Valid @RequestBody DraftAdjustmentRequest request) {
        return BonusDraftResponse.from(bonusService.addEmployeeDeposit(id, request.getAmount(), request.getNotes()));
    }

    @PostMapping("/{id}/new-advance")
    public BonusDraftResponse setNewAdvance(@PathVariable("id") UUID id,
                                            @Valid @RequestBody DraftAdjustmentRequest request) {
        return BonusDraftResponse.from(bonusService.setNewAdvance(id, request.getAmount(), request.getNotes()));
    }

    @PostMapping("/{id}/payment")
    public BonusDraftResponse markPaid(@PathVariable("id") UUID id,
                                       @RequestBody(required = false) MarkPaidRequest request) {
        return BonusDraftResponse.from(bonusService.markPaid(id, request != null ? request.getAmountPaid() : null));
    }

    private static List<BonusDraftResponse> toResponses(List<BonusDraft> drafts) {
        return drafts.stream().map(BonusDraftResponse::from).toList();
    }
}
