package com.markethours.exception;

/** Transient failure fetching the upstream schedule: network error, timeout or non-2xx response. */
public class AcquisitionException extends BaseException {

    public AcquisitionException(String message) {
        super(ErrorCode.ACQUISITION_ERROR, message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(ErrorCode.ACQUISITION_ERROR, message, cause);
    }
}
