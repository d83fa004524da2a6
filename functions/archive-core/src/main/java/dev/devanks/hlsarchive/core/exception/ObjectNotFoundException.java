package dev.devanks.hlsarchive.core.exception;

import lombok.Getter;

@Getter
public class ObjectNotFoundException extends ObjectStoreException {

    private final String location;

    public ObjectNotFoundException(String location) {
        super("Object not found: " + location);
        this.location = location;
    }

    public ObjectNotFoundException(String location, Throwable cause) {
        super("Object not found: " + location, cause);
        this.location = location;
    }
}
