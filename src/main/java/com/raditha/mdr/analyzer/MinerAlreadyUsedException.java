package com.raditha.mdr.analyzer;

/**
 * Thrown when a {@link MiningSession} is run a second time.
 */
public class MinerAlreadyUsedException extends IllegalStateException {

    public MinerAlreadyUsedException() {
        super("This mining session has already been used. Please start another one.");
    }
}
