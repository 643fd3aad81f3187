package com.pyscope.json;

/**
 * Thrown when a tree cannot be read from or written to JSON, or when the JSON
 * describes a tree the analyzer cannot use.
 */
public class TreeJsonException extends RuntimeException {

    private final String nodeType;  // Can be null

    public TreeJsonException(String message) {
        this(message, null, null);
    }

    public TreeJsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TreeJsonException(String message, String nodeType, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    /**
     * Kind name of the node being read or written when the failure happened,
     * or null when it is not known.
     */
    public String getNodeType() {
        return nodeType;
    }
}
