package com.platform.hacontroller.detection;

/**
 * Per-node failure detector state.
 *
 * HEALTHY -> SUSPECT on the first Down observation,
 * SUSPECT -> CONFIRMED_DOWN once a strict majority of observers agree within the window,
 * CONFIRMED_DOWN -> HEALTHY once a strict majority report Up again.
 */
public enum DetectorState {
    HEALTHY,
    SUSPECT,
    CONFIRMED_DOWN
}
