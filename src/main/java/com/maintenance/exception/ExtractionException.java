package com.maintenance.exception;

import com.maintenance.domain.PipelineWindows;

/**
 * Reading events failed. The whole run can be retried with the same boundaries.
 */
public class ExtractionException extends PipelineException {

    public ExtractionException(String message, Throwable cause) {
        super(message, null, null, cause);
    }

    public ExtractionException(String message, PipelineWindows windows, Throwable cause) {
        super(message, windows, null, cause);
    }
}
