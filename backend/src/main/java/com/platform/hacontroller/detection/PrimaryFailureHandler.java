package com.platform.hacontroller.detection;

import com.platform.hacontroller.model.PrimaryDownEvent;

/**
 * Receives quorum-confirmed primary failures. Called once per confirmed-down transition.
 */
public interface PrimaryFailureHandler {

    void onPrimaryDown(PrimaryDownEvent event);
}
