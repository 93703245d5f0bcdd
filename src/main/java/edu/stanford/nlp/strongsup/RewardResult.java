package edu.stanford.nlp.strongsup;

import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;

/**
 * What executing a candidate program earned.
 */
public final class RewardResult
{
	public enum Outcome
	{
		FULL_MATCH, PARTIAL_MATCH, MISMATCH, ILLEGAL
	}

	public final double reward;
	public final Outcome outcome;
	public final TangramsWorld finalState;
	// index of the rejected step, -1 if every step was legal
	public final int failedStep;
	public final boolean truncated;
	// mean per-piece credit, 0 for illegal programs
	public final double credit;

	public RewardResult(final double reward, final Outcome outcome, final TangramsWorld finalState, final int failedStep, final boolean truncated, final double credit)
	{
		this.reward = reward;
		this.outcome = outcome;
		this.finalState = finalState;
		this.failedStep = failedStep;
		this.truncated = truncated;
		this.credit = credit;
	}

	public boolean isCorrect()
	{
		return outcome == Outcome.FULL_MATCH;
	}

	public boolean isLegal()
	{
		return outcome != Outcome.ILLEGAL;
	}

	@Override
	public String toString()
	{
		return String.format("%s reward=%.4f%s%s", outcome, reward, failedStep >= 0 ? " failedStep=" + failedStep : "", truncated ? " truncated" : "");
	}
}
