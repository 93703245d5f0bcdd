package edu.stanford.nlp.strongsup;

/**
 * Malformed or inconsistent hyperparameters. Raised while the settings are built, before any training happens.
 */
public class ConfigurationError extends StrongSupError
{
	private static final long serialVersionUID = 4712690315874092451L;

	public ConfigurationError(final String message)
	{
		super(message);
	}

	public ConfigurationError(final String message, final Throwable cause)
	{
		super(message, cause);
	}

	public static void check(final boolean condition, final String format, final Object... args)
	{
		if (!condition)
			throw new ConfigurationError(String.format(format, args));
	}
}
