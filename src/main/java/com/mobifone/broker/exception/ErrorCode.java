package com.mobifone.broker.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

@Getter
public enum ErrorCode {
    UNCATEGORIZED_EXCEPTION(9999, "Uncategorized error", HttpStatus.INTERNAL_SERVER_ERROR),
    USER_NOT_EXISTED(1005, "User not existed", HttpStatus.NOT_FOUND),
    UNAUTHENTICATED(1006, "Unauthenticated", HttpStatus.UNAUTHORIZED),
    UNAUTHORIZED(1007, "You do not have permission", HttpStatus.FORBIDDEN),
    WRONG_PASSWORD(1015, "WRONG_PASSWORD", HttpStatus.BAD_REQUEST),

    // connection brokering
    ACCESS_DENIED(2001, "Access to this service is not allowed", HttpStatus.FORBIDDEN),
    SERVICE_NOT_FOUND(2002, "Service not found", HttpStatus.NOT_FOUND),
    TRANSPORT_NOT_FOUND(2003, "Transport not found for this service", HttpStatus.NOT_FOUND),
    SERVICE_NOT_READY(2004, "The service is being prepared, please retry in a few seconds", HttpStatus.OK),
    TICKET_NOT_FOUND(2005, "Ticket not found", HttpStatus.NOT_FOUND),
    UNSUPPORTED_OS(2006, "Your operating system is not supported by this transport", HttpStatus.BAD_REQUEST),
    DECRYPTION_ERROR(2007, "Invalid credential payload", HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(2008, "Invalid request", HttpStatus.BAD_REQUEST),
    NOT_IMPLEMENTED(2009, "Not implemented", HttpStatus.NOT_IMPLEMENTED),
    SERVICE_IN_ERROR(2010, "The service could not be prepared, please try again", HttpStatus.OK),
    SERVICE_POOL_FULL(2011, "No more instances are available for this service", HttpStatus.OK),
    PROVISIONING_FAILED(2012, "Provisioning backend request failed", HttpStatus.BAD_GATEWAY),
    INSTANCE_NOT_FOUND(2013, "Instance not found", HttpStatus.NOT_FOUND),

    // authenticators
    AUTHENTICATOR_NOT_FOUND(3001, "Authenticator not found", HttpStatus.NOT_FOUND),
    NOT_SUPPORTED(3002, "Operation not supported by this authenticator", HttpStatus.BAD_REQUEST),
    ;

    ErrorCode(int code, String message, HttpStatusCode statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    private final int code;
    private final String message;
    private final HttpStatusCode statusCode;
}
