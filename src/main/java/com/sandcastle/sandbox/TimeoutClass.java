package com.sandcastle.sandbox;

/**
 * Timeout classes with independent defaults and ceilings.
 */
public enum TimeoutClass {
    AD_HOC,
    LONG_RUNNING,
    INSTALL
}
