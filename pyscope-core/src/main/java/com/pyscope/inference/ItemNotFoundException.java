package com.pyscope.inference;

/**
 * A literal container cannot be indexed by a key, either because the key is
 * absent or because it cannot be compared statically. Dict lookups report
 * this too, instead of a separate key error.
 */
public class ItemNotFoundException extends RuntimeException {

    private final Object key;

    public ItemNotFoundException(Object key) {
        super("No item for key: " + key);
        this.key = key;
    }

    public ItemNotFoundException(Object key, String message) {
        super(message);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
