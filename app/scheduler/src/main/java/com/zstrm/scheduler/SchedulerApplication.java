/*
 * Where: scheduler application entry point
 * What: boots Spring, binds configuration properties and enables scheduled workers
 * Why: the scheduler loop and the license renewal cycle both run on the Spring task scheduler
 */
package com.zstrm.scheduler;

import com.zstrm.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class SchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SchedulerApplication.class, args);
  }
}
