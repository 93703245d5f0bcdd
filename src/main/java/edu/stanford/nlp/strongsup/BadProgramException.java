package edu.stanford.nlp.strongsup;

public class BadProgramException extends StrongSupError
{
	public static final long serialVersionUID = 86586128316354597L;

	public BadProgramException(final String message)
	{
		super(message);
	}

	// Combine multiple exceptions
	public BadProgramException(final BadProgramException... exceptions)
	{
		super(join(exceptions));
	}

	private static String join(final BadProgramException... exceptions)
	{
		final StringBuilder builder = new StringBuilder();
		for (final BadProgramException exception : exceptions)
			builder.append(" | ").append(exception.getMessage());
		return builder.length() == 0 ? "" : builder.substring(3);
	}
}
