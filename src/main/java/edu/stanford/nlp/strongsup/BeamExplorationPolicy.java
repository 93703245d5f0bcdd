package edu.stanford.nlp.strongsup;

import edu.stanford.nlp.strongsup.tangrams.TangramsSimulator;
import java.util.List;
import java.util.Random;

/**
 * Deterministic top-k beam search.
 */
public class BeamExplorationPolicy extends ExplorationPolicy
{
	public BeamExplorationPolicy(final Options opts, final Policy policy, final TangramsSimulator simulator)
	{
		super(opts, policy, simulator);
	}

	@Override
	protected List<Candidate> prune(final List<Candidate> sorted, final int beamWidth, final Random random)
	{
		return sorted.size() <= beamWidth ? sorted : sorted.subList(0, beamWidth);
	}
}
