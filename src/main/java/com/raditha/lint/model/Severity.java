package com.raditha.lint.model;

/**
 * Severity attached to a reported violation.
 */
public enum Severity {
    WARNING,
    ERROR
}
