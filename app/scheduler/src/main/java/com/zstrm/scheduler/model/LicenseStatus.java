package com.zstrm.scheduler.model;

/** Trust level of the stored license at a given instant. */
public enum LicenseStatus {
  TRUSTED,
  GRACE,
  DEGRADED
}
