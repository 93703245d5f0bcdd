package edu.stanford.nlp.strongsup;

/**
 * A gradient or a parameter update produced a non-finite value. Nothing of the offending update has been applied when this is thrown.
 */
public class NumericInstabilityError extends StrongSupError
{
	private static final long serialVersionUID = -5539120985321007733L;

	public NumericInstabilityError(final String message)
	{
		super(message);
	}
}
