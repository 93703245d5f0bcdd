package edu.stanford.nlp.strongsup;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;

/**
 * The tokens of a natural-language instruction. Tokens are lowercased and split on anything that is not a letter, a digit or an apostrophe.
 */
public final class Utterance
{
	private static final Splitter TOKENIZER = Splitter.on(CharMatcher.javaLetterOrDigit().or(CharMatcher.is('\'')).negate()).omitEmptyStrings();

	private final ImmutableList<String> tokens;

	public Utterance(final List<String> tokens)
	{
		this.tokens = ImmutableList.copyOf(tokens);
	}

	public static Utterance tokenize(final String text)
	{
		return new Utterance(TOKENIZER.splitToList(text.toLowerCase(Locale.ROOT)));
	}

	public ImmutableList<String> tokens()
	{
		return tokens;
	}

	@Override
	public boolean equals(final Object obj)
	{
		return obj instanceof Utterance && tokens.equals(((Utterance) obj).tokens);
	}

	@Override
	public int hashCode()
	{
		return tokens.hashCode();
	}

	@Override
	public String toString()
	{
		return Joiner.on(' ').join(tokens);
	}
}
