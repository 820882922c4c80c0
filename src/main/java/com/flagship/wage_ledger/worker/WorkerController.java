package com.flagship.wage_ledger.worker;

import com.flagship.wage_ledger.worker.dto.CreateWorkerRequest;
import com.flagship.wage_ledger.worker.dto.UpdateWorkerRequest;
import com.flagship.wage_ledger.worker.dto.WorkerResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/workers")
@RequiredArgsConstructor
public class WorkerController {

    private final WorkerService workerService;

    @PostMapping
    public ResponseEntity<WorkerResponse> createWorker(@Valid @RequestBody CreateWorkerRequest request) {
        Worker worker = workerService.createWorker(
            request.getCode(),
            request.getName(),
            request.getHourlyRate(),
            request.getStandardDailyHours(),
            request.getActive()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkerResponse.from(worker));
    }

    @PutMapping("/{id}")
    public WorkerResponse updateWorker(@PathVariable("id") UUID id,
                                       @Valid @RequestBody UpdateWorkerRequest request) {
        return WorkerResponse.from(workerService.updateWorker(
            id,
            request.getName(),
            request.getHourlyRate(),
            request.getStandardDailyHours(),
            request.getActive()
        ));
    }

    @GetMapping("/{id}")
    public WorkerResponse getWorker(@PathVariable("id") UUID id) {
        return WorkerResponse.from(workerService.getWorker(id));
    }

    @GetMapping
    public List<WorkerResponse> listWorkers(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        return workerService.listWorkers(activeOnly).stream().map(WorkerResponse::from).toList();
    }
}
