package com.shareplan.domain.exception;

/**
 * Error code carried by a {@link ServiceException}
 */
public record Error(String code) {
}
