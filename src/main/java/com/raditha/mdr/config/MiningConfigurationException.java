package com.raditha.mdr.config;

/**
 * Thrown when mining settings cannot be read.
 */
public class MiningConfigurationException extends RuntimeException {

    public MiningConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
