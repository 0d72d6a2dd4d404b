package com.questrail.labsim.template;

/**
 * Raised when an analyzer template cannot be found, read or validated.
 */
public final class TemplateException extends IllegalArgumentException
{
    public TemplateException(String message)
    {
        super(message);
    }

    public TemplateException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
