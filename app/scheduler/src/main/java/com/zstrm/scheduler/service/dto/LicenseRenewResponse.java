/*
 * Where: licensing authority DTO
 * What: body of a successful renewal
 * Why: tier is optional; an absent tier keeps the stored one
 */
package com.zstrm.scheduler.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LicenseRenewResponse(String tier) {}
