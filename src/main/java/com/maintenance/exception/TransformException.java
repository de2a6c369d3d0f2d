package com.maintenance.exception;

import com.maintenance.domain.PipelineWindows;

/**
 * Windowing or feature computation failed.
 */
public class TransformException extends PipelineException {

    public TransformException(String message, String machineId) {
        super(message, null, machineId, null);
    }

    public TransformException(String message, PipelineWindows windows, String machineId, Throwable cause) {
        super(message, windows, machineId, cause);
    }
}
