package com.purchasingpower.wiregraph.exception;

import lombok.Getter;

/**
 * An exclusion file could not be read or does not match the expected layout.
 */
@Getter
public class ExclusionConfigException extends RuntimeException {

    private final String location;

    public ExclusionConfigException(String message, String location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

}
