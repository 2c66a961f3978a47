package com.aboutblank.exception;

/**
 * Exception thrown when a request refers to a resource that does not exist.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    /**
     * Constructs a ResourceNotFoundException for a community message id.
     *
     * @param messageId the id that was not found
     * @return a ResourceNotFoundException with a formatted message
     */
    public static ResourceNotFoundException communityMessage(Long messageId) {
        return new ResourceNotFoundException(
                String.format("Community message '%d' does not exist.", messageId)
        );
    }
}
