/* (C)2026 */
package com.ammann.fedstats.exception;

/**
 * Thrown when a run id or round reference does not resolve to a submitted run.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class RunNotFoundException extends ApiException
{
    public RunNotFoundException(String runId)
    {
        super(String.format("Run '%s' has not been submitted", runId));
    }

    public RunNotFoundException(String runId, int sequence)
    {
        super(String.format("Run '%s' has no task with sequence %d", runId, sequence));
    }
}
