package edu.stanford.nlp.strongsup;

import java.util.List;

/**
 * REINFORCE over the beam: w_i = q_i * (r_i - b).
 */
public class ReinforceCaseWeighter extends CaseWeighter
{
	public enum Baseline
	{
		NONE, // b = 0
		MEAN, // q-weighted mean reward of the beam
		MOVING; // exponential moving average of batch rewards

		public static Baseline fromString(final String s)
		{
			for (final Baseline b : values())
				if (b.name().equalsIgnoreCase(s))
					return b;
			throw new ConfigurationError("Unknown baseline '" + s + "', expected none, mean or moving");
		}
	}

	private final Baseline baseline;
	private final double decay;
	// only written between batches
	private volatile double movingAverage;
	private volatile boolean initialized;

	public ReinforceCaseWeighter(final Baseline baseline, final double decay)
	{
		this.baseline = baseline;
		this.decay = decay;
	}

	@Override
	public double[] weights(final List<Candidate> candidates, final double[] rewards)
	{
		if (candidates.isEmpty())
			return new double[0];
		final double[] q = beamProbs(candidates);
		final double b = baseline(q, rewards);
		final double[] w = new double[q.length];
		for (int i = 0; i < q.length; i++)
			w[i] = q[i] * (rewards[i] - b);
		return w;
	}

	private double baseline(final double[] q, final double[] rewards)
	{
		switch (baseline)
		{
			case MEAN:
				double mean = 0;
				for (int i = 0; i < q.length; i++)
					mean += q[i] * rewards[i];
				return mean;
			case MOVING:
				return movingAverage;
			default:
				return 0;
		}
	}

	@Override
	public void observeBatch(final double[] rewards)
	{
		if (baseline != Baseline.MOVING || rewards.length == 0)
			return;
		double mean = 0;
		for (final double r : rewards)
			mean += r;
		mean /= rewards.length;
		movingAverage = initialized ? decay * movingAverage + (1 - decay) * mean : mean;
		initialized = true;
	}

	public double getMovingAverage()
	{
		return movingAverage;
	}

	void restoreMovingAverage(final double value)
	{
		movingAverage = value;
		initialized = baseline == Baseline.MOVING;
	}
}
