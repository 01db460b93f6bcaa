/*
 * Where: scheduler API
 * What: plain-text liveness response at the root path
 * Why: shows which runner answered behind a load balancer
 */
package com.zstrm.scheduler.api;

import com.zstrm.scheduler.service.RunnerIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final RunnerIdentity runnerIdentity;

  @GetMapping("/")
  public String home() {
    return "zstrm-scheduler: ok runner=" + runnerIdentity.runnerId();
  }
}
