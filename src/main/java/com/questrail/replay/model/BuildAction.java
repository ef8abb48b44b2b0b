package com.questrail.replay.model;

/**
 * Kind of a build order step.
 */
public enum BuildAction
{
    BUILD,
    TRAIN,
    MORPH,
    RESEARCH,
    UPGRADE
}
