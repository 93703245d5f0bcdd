package edu.stanford.nlp.strongsup;

import java.util.List;

/**
 * Splits the credit among the positively rewarded candidates in proportion to q_i^beta * r_i. With beta = 1 this is maximum marginal likelihood,
 * with beta = 0 every rewarded candidate counts the same regardless of what the policy thinks of it.
 */
public class MeritocraticCaseWeighter extends CaseWeighter
{
	private final double beta;

	public MeritocraticCaseWeighter(final double beta)
	{
		this.beta = beta;
	}

	@Override
	public double[] weights(final List<Candidate> candidates, final double[] rewards)
	{
		final double[] w = new double[candidates.size()];
		if (candidates.isEmpty())
			return w;
		final double[] q = beamProbs(candidates);
		double sum = 0;
		for (int i = 0; i < w.length; i++)
			if (rewards[i] > 0)
			{
				w[i] = Math.pow(q[i], beta) * rewards[i];
				sum += w[i];
			}
		if (sum == 0)
			return w;
		for (int i = 0; i < w.length; i++)
			w[i] /= sum;
		return w;
	}
}
