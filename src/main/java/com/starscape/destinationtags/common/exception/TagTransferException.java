package com.starscape.destinationtags.common.exception;

import java.nio.file.Path;

/**
 * File I/O failure while exporting or importing the tag registry.
 */
public class TagTransferException extends RuntimeException {
    
    private final String operation;
    private final Path path;
    
    public TagTransferException(String operation, Path path, Throwable cause) {
        super("Tag " + operation + " failed for " + path + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.path = path;
    }
    
    public String getOperation() {
        return operation;
    }
    
    public Path getPath() {
        return path;
    }
}
