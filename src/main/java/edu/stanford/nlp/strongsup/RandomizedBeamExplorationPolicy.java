package edu.stanford.nlp.strongsup;

import edu.stanford.nlp.strongsup.tangrams.TangramsSimulator;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Random;

/**
 * Epsilon-greedy beam search: each beam slot takes a uniformly random surviving candidate with probability epsilon, and the best remaining one
 * otherwise.
 */
public class RandomizedBeamExplorationPolicy extends ExplorationPolicy
{
	public RandomizedBeamExplorationPolicy(final Options opts, final Policy policy, final TangramsSimulator simulator)
	{
		super(opts, policy, simulator);
	}

	@Override
	protected List<Candidate> prune(final List<Candidate> sorted, final int beamWidth, final Random random)
	{
		if (sorted.size() <= beamWidth)
			return sorted;
		final LinkedList<Candidate> remaining = new LinkedList<>(sorted);
		final List<Candidate> kept = new ArrayList<>(beamWidth);
		while (kept.size() < beamWidth)
			if (random.nextDouble() < opts.epsilon)
				kept.add(remaining.remove(random.nextInt(remaining.size())));
			else
				kept.add(remaining.removeFirst());
		return kept;
	}
}
