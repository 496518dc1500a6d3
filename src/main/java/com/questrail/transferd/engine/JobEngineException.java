package com.questrail.transferd.engine;

/**
 * The engine refused or failed to carry out a command.
 */
public class JobEngineException extends Exception
{
    public JobEngineException(String message) {
        super(message);
    }

    public JobEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
