package io.clusterengine.enums;

/**
 * Ranking used by the deletion policy to choose victims.
 */
public enum DeletionCriteria {
    OLDEST_FIRST,
    OLDEST_PROFILE_FIRST,
    YOUNGEST_FIRST,
    RANDOM
}
