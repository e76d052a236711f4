package com.tony.nflStats.service;

/**
 * Fichier source absent ou illisible pour une saison demandée.
 */
public class MissingSourceDataException extends RuntimeException {

    public MissingSourceDataException(String message) {
        super(message);
    }

    public MissingSourceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
