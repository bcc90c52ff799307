package com.finsight.config;

/**
 * Fatal configuration problem: empty symbol set, missing as-of, invalid setting values.
 */
public class PipelineConfigurationException extends RuntimeException {
    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
