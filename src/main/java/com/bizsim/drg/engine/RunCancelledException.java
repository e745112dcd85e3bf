package com.bizsim.drg.engine;

import java.util.concurrent.CancellationException;

/**
 * Raised when a run is cancelled between levels or solver iterations.
 * Partial values are discarded and nothing is cached.
 */
public class RunCancelledException extends CancellationException {

    public RunCancelledException(String message) {
        super(message);
    }
}
