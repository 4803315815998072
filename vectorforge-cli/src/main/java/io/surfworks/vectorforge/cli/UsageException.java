package io.surfworks.vectorforge.cli;

/**
 * Bad command-line arguments.
 */
final class UsageException extends Exception {

    UsageException(String message) {
        super(message);
    }
}
