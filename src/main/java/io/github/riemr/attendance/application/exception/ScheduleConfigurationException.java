package io.github.riemr.attendance.application.exception;

/**
 * The employee's work schedule cannot drive classification (missing, or no working days).
 */
public class ScheduleConfigurationException extends RuntimeException {

    private final String employeeId;

    public ScheduleConfigurationException(String employeeId, String message) {
        super(message);
        this.employeeId = employeeId;
    }

    public String getEmployeeId() {
        return employeeId;
    }
}
