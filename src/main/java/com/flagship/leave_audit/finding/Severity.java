package com.flagship.leave_audit.finding;

/**
 * Finding severity, declared in reporting order (most severe first).
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
