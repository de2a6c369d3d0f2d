package com.maintenance.exception;

import com.maintenance.domain.PipelineWindows;
import lombok.Getter;

/**
 * Base class of all pipeline failures.
 *
 * Carries the run's window boundaries and, where known, the machine involved,
 * so a failed run can be replayed exactly.
 */
@Getter
public abstract class PipelineException extends RuntimeException {

    private final PipelineWindows windows;
    private final String machineId;

    protected PipelineException(String message, PipelineWindows windows, String machineId, Throwable cause) {
        super(describe(message, windows, machineId), cause);
        this.windows = windows;
        this.machineId = machineId;
    }

    private static String describe(String message, PipelineWindows windows, String machineId) {
        StringBuilder sb = new StringBuilder(message);
        if (windows != null) {
            sb.append(" [").append(windows).append(']');
        }
        if (machineId != null) {
            sb.append(" [machineId=").append(machineId).append(']');
        }
        return sb.toString();
    }
}
