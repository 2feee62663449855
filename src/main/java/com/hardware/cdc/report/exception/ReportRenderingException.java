package com.hardware.cdc.report.exception;

/**
 * A report could not be rendered, typically because the template failed.
 */
public class ReportRenderingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
