package io.github.riemr.attendance.application.exception;

public class ResourceNotFoundException extends RuntimeException {

    public enum ResourceType {
        EMPLOYEE, LEAVE_TYPE, LEAVE_REQUEST
    }

    private final ResourceType resourceType;

    public ResourceNotFoundException(String message, ResourceType resourceType) {
        super(message);
        this.resourceType = resourceType;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }
}
