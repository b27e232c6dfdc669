package com.shareplan.domain.exception;

import lombok.Getter;

/**
 * Runtime exception tagged with an {@link Error} from the {@link Errors} catalogue
 */
@Getter
public class ServiceException extends RuntimeException {

    private final Error error;

    public ServiceException(Error error) {
        super(error.code());
        this.error = error;
    }

    public ServiceException(Error error, String message) {
        super(message);
        this.error = error;
    }

    public ServiceException(Error error, Throwable cause) {
        super(error.code(), cause);
        this.error = error;
    }

    public ServiceException(Error error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public String getErrorCode() {
        return error.code();
    }
}
