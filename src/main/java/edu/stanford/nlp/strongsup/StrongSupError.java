package edu.stanford.nlp.strongsup;

/**
 * Root of the errors raised by the training core. Locally recoverable conditions (illegal operations, search timeouts) are never thrown; they are
 * folded into rewards.
 */
public class StrongSupError extends RuntimeException
{
	private static final long serialVersionUID = -2171271967007041814L;

	public StrongSupError()
	{
		super();
	}

	public StrongSupError(final String message)
	{
		super(message);
	}

	public StrongSupError(final Throwable cause)
	{
		super(cause);
	}

	public StrongSupError(final String message, final Throwable cause)
	{
		super(message, cause);
	}
}
