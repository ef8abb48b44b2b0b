package com.questrail.replay.catalog;

/**
 * Id space an entity lives in. Units and buildings share the unit id space;
 * tech and upgrades each have their own.
 */
public enum EntityKind
{
    UNIT,
    BUILDING,
    TECH,
    UPGRADE
}
