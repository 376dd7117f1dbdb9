package com.platform.hacontroller.model;

/**
 * Binary verdict an observer reports about a node.
 */
public enum Verdict {
    UP,
    DOWN
}
