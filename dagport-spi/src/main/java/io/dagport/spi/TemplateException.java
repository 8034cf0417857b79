package io.dagport.spi;

/**
 * Raised when a task template can't be loaded or rendered.
 */
public class TemplateException
    extends Exception
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
