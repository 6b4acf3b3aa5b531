package com.anthem.dataproc.auth.service;

/**
 * The request carries no credential source at all. API Gateway turns an authorizer error
 * with the exact message {@code Unauthorized} into a 401 response.
 */
public class UnauthorizedRequestException extends RuntimeException {

    public static final String MESSAGE = "Unauthorized";

    public UnauthorizedRequestException() {
        super(MESSAGE);
    }
}
