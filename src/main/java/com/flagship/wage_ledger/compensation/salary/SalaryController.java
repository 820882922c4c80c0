package com.flagship.wage_ledger.compensation.salary;

import com.flagship.wage_ledger.compensation.salary.dto.SalaryDraftRequest;
import com.flagship.wage_ledger.compensation.salary.dto.SalaryDraftResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/salary/drafts")
@RequiredArgsConstructor
public class SalaryController {

    private final SalaryService salaryService;

    @PostMapping("/preview")
    public List<SalaryDraftResponse> preview(@Valid @RequestBody SalaryDraftRequest request) {
        return salaryService.computeSalaryDraft(request.getPeriod().toPeriod(), request.adjustmentsByWorker())
            .stream()
            .map(SalaryDraftResponse::from)
            .toList();
    }
}
