package com.fastrelay.model.enums;

/**
 * 告警级别
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
