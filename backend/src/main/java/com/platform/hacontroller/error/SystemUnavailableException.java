package com.platform.hacontroller.error;

/**
 * Exception for external system errors (topology collaborator, Kafka).
 */
public class SystemUnavailableException extends ControlPlaneException {

    private final String systemName;

    public SystemUnavailableException(ErrorCode errorCode, String systemName, String message) {
        super(errorCode, message);
        this.systemName = systemName;
    }

    public SystemUnavailableException(ErrorCode errorCode, String systemName, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.systemName = systemName;
    }

    public static SystemUnavailableException collaborator(String message, Throwable cause) {
        return new SystemUnavailableException(
            ErrorCode.COLLABORATOR_UNAVAILABLE,
            "collaborator",
            message,
            cause
        );
    }

    public static SystemUnavailableException kafka(String message) {
        return new SystemUnavailableException(
            ErrorCode.KAFKA_UNAVAILABLE,
            "kafka",
            message
        );
    }

    public String getSystemName() {
        return systemName;
    }
}
