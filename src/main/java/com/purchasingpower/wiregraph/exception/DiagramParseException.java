package com.purchasingpower.wiregraph.exception;

import lombok.Getter;

/**
 * A diagram document could not be read or is not well-formed.
 */
@Getter
public class DiagramParseException extends RuntimeException {

    private final String source;

    public DiagramParseException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

}
