package com.raditha.mdr.observer;

/**
 * The three phases of a mining run, in execution order.
 */
public enum MiningPhase {
    COMPUTE_DISTANCES,
    FIND_DATA_REGIONS,
    IDENTIFY_DATA_RECORDS
}
