/*
 * Where: scheduler API
 * What: standard error body
 * Why: every failure reaches clients in one shape
 */
package com.zstrm.scheduler.api;

public record ApiErrorResponse(String code, String message) {}
