package org.explorerscript.compiler;

/**
 * A user-facing error while compiling ExplorerScript or SSBScript source to SSB operations.
 * <p>
 * This is a checked exception: compile handlers report errors in the source this way, and
 * the caller presents the message to the user instead of crashing.
 */
public class SsbCompilerException extends Exception {

    public SsbCompilerException(String message) {
        super(message);
    }

    public SsbCompilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
