package io.github.riemr.attendance.application.dto;

public record AllocationFailure(String employeeId, String employeeCode, String message) {}
