package com.maintenance.exception;

import com.maintenance.domain.PipelineWindows;

/**
 * Writing features to the training or serving store failed.
 */
public class LoadException extends PipelineException {

    public LoadException(String message, PipelineWindows windows, Throwable cause) {
        super(message, windows, null, cause);
    }
}
