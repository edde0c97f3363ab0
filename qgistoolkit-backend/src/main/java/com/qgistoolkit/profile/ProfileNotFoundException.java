package com.qgistoolkit.profile;

/**
 * Thrown when an extraction profile cannot be resolved by name.
 */
public class ProfileNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ProfileNotFoundException(String message) {
        super(message);
    }
}
