package org.akkordio.fingering.model;

/**
 * Occupation state of one finger.
 */
public enum FingerStatus {
    FREE,
    PRESSING,
    LOCKED_HOLDING
}
