package com.zstrm.scheduler;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SchedulerApplicationTests extends AbstractPostgresContainerTest {

  @Test
  void contextLoads() {}
}
