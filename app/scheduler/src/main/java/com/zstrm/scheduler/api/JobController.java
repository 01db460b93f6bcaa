package com.zstrm.scheduler.api;

import com.zstrm.scheduler.api.request.CreateJobRequest;
import com.zstrm.scheduler.api.response.JobResponse;
import com.zstrm.scheduler.service.JobService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/jobs")
@RequiredArgsConstructor
public class JobController {

  private final JobService jobService;

  @PostMapping
  public ResponseEntity<JobResponse> createJob(@Valid @RequestBody CreateJobRequest request) {
    return ResponseEntity.ok(jobService.createJob(request));
  }

  @GetMapping
  public ResponseEntity<List<JobResponse>> listJobs(
      @RequestParam(name = "status", required = false) String status) {
    return ResponseEntity.ok(jobService.listJobs(status));
  }

  @PostMapping("/{jobId}/evaluate")
  public ResponseEntity<JobResponse> evaluateJob(@PathVariable("jobId") long jobId) {
    return ResponseEntity.ok(jobService.evaluateJob(jobId));
  }
}
