package com.maintenance.exception;

/**
 * Required configuration is missing or invalid. Raised before any state is touched.
 */
public class PipelineConfigurationException extends PipelineException {

    public PipelineConfigurationException(String message) {
        super(message, null, null, null);
    }
}
