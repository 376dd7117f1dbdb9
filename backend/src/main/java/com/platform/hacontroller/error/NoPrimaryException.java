package com.platform.hacontroller.error;

/**
 * The topology currently has no node with role PRIMARY, so no write endpoint exists.
 */
public class NoPrimaryException extends ControlPlaneException {

    public NoPrimaryException() {
        super(ErrorCode.NO_PRIMARY);
    }

    public NoPrimaryException(String message) {
        super(ErrorCode.NO_PRIMARY, message);
    }
}
