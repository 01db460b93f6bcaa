/*
 * Where: scheduler configuration binding
 * What: licensing authority endpoint, install identity and lease/grace/retry timings
 * Why: lease and grace windows bound the worst-case time before a forced downgrade
 */
package com.zstrm.scheduler.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "licensing")
public record LicensingProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    @NotBlank String renewPath,
    String installId,
    String installSecret,
    @NotNull Duration requestTimeout,
    @NotNull Duration leaseDuration,
    @NotNull Duration graceDuration,
    @NotNull Duration retryBackoff,
    @NotNull Duration retryWindow) {}
