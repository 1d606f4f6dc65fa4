package com.github.stormino.relay.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Where a transfer source finds an object: a channel or container plus an object reference inside it.
 */
@Value
public class ObjectLocator {

    @NonNull
    String container;

    @NonNull
    String objectRef;

    public static ObjectLocator of(String container, String objectRef) {
        return new ObjectLocator(container, objectRef);
    }

    @Override
    public String toString() {
        return container + "/" + objectRef;
    }
}
