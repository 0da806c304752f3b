package io.github.jakubt4.skypointer.error;

import lombok.Getter;

@Getter
public class UnknownBodyException extends PositionException {

    private final String identifier;

    public UnknownBodyException(final String identifier) {
        super("Unknown celestial body: " + identifier);
        this.identifier = identifier;
    }
}
