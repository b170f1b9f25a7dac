package com.kmg.extract.api;

import com.kmg.extract.dto.RunView;
import com.kmg.extract.dto.StartRunRequest;
import com.kmg.extract.dto.StartRunResponse;
import com.kmg.extract.service.RunService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/runs")
public class RunController {
    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @PostMapping
    public ResponseEntity<StartRunResponse> start(@Valid @RequestBody StartRunRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new StartRunResponse(runService.startRun(request)));
    }

    @GetMapping
    public List<RunView> listRuns() {
        return runService.listRuns();
    }

    @GetMapping("/{id}")
    public RunView getRun(@PathVariable String id) {
        return runService.getRun(id);
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<Void> stop(@PathVariable String id) {
        runService.stopRun(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<StartRunResponse> resume(@PathVariable String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new StartRunResponse(runService.resumeRun(id)));
    }
}
