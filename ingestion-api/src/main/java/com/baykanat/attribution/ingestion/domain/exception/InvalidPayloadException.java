package com.baykanat.attribution.ingestion.domain.exception;

import lombok.Getter;

/** Resolver'a ulaşmadan reddedilen payload; GlobalExceptionHandler 400 döner. */
@Getter
public class InvalidPayloadException extends RuntimeException {

    private final String field;

    public InvalidPayloadException(String field, String message) {
        super(message);
        this.field = field;
    }
}
