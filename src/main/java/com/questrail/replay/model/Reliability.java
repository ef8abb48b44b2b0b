package com.questrail.replay.model;

/**
 * Caller-visible confidence tier of a decode result.
 */
public enum Reliability
{
    HIGH,
    MEDIUM,
    LOW
}
