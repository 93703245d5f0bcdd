package edu.stanford.nlp.strongsup;

import edu.stanford.nlp.strongsup.tangrams.Program;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;

/**
 * Executes a program and scores the world it produces against the target.
 */
public interface RewardEvaluator
{
	// |truncated|: the program was stopped by the length bound rather than by the policy.
	RewardResult evaluate(Program program, TangramsWorld initialState, TangramsWorld targetState, boolean truncated);

	default RewardResult evaluate(final Program program, final TangramsWorld initialState, final TangramsWorld targetState)
	{
		return evaluate(program, initialState, targetState, false);
	}

	default RewardResult evaluate(final Candidate candidate, final Example ex)
	{
		if (!ex.hasTarget())
			throw new StrongSupError("Example " + ex.id + " has no target state");
		return evaluate(candidate.program, ex.initialState, ex.targetState, candidate.status == Candidate.Status.TRUNCATED);
	}
}
