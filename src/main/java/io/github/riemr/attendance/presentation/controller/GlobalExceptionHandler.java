package io.github.riemr.attendance.presentation.controller;

import io.github.riemr.attendance.application.exception.LeaveValidationException;
import io.github.riemr.attendance.application.exception.ResourceNotFoundException;
import io.github.riemr.attendance.application.exception.ScheduleConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LeaveValidationException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleLeaveValidation(LeaveValidationException e) {
        log.info("Leave request rejected: {}", e.getReason());
        Map<String, Object> response = new HashMap<>();
        response.put("error", e.getReason());
        response.put("leaveType", e.getCategory() == null ? null : e.getCategory().displayName());
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ScheduleConfigurationException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleScheduleConfiguration(ScheduleConfigurationException e) {
        log.warn("Schedule configuration problem for employee {}: {}", e.getEmployeeId(), e.getMessage());
        return new ResponseEntity<>(Map.of("error", e.getMessage()), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", e.getMessage());
        response.put("resourceType", e.getResourceType().name());
        return new ResponseEntity<>(response, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return new ResponseEntity<>(Map.of("error", String.valueOf(e.getMessage())), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unhandled exception occurred", e);

        Map<String, Object> response = new HashMap<>();
        response.put("error", "Internal Server Error");
        response.put("message", e.getMessage());
        response.put("exceptionType", e.getClass().getSimpleName());

        Throwable rootCause = getRootCause(e);
        response.put("rootCause", rootCause.getClass().getSimpleName());
        response.put("rootCauseMessage", rootCause.getMessage());

        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private Throwable getRootCause(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }
}
