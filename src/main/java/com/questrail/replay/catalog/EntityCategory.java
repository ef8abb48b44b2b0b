package com.questrail.replay.catalog;

/**
 * Strategic role of an entity.
 */
public enum EntityCategory
{
    ECONOMY,
    MILITARY,
    TECH,
    SUPPLY,
    DEFENSE
}
