/* (C)2026 */
package com.ammann.fedstats.exception;

/**
 * Failure reading, writing or listing blobs in the artifact store.
 *
 * <p>Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class ArtifactStoreException extends ApiException
{
    public ArtifactStoreException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public ArtifactStoreException(String message)
    {
        super(message);
    }

    /**
     * Creates the exception raised when a write-once key is written a second time.
     */
    public static ArtifactStoreException alreadyPublished(Object key)
    {
        return new ArtifactStoreException(String.format("Artifact %s has already been published", key));
    }
}
