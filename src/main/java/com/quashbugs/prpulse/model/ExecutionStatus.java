package com.quashbugs.prpulse.model;

public enum ExecutionStatus {
    SUCCESS,
    PARTIAL,
    ERROR
}
