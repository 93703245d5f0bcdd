package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import java.util.List;

/**
 * Turns a rewarded beam into per-candidate gradient weights: the trainer follows sum_i w_i * grad log p(candidate_i).
 */
public abstract class CaseWeighter
{
	public static final ImmutableSet<String> NAMES = ImmutableSet.of("reinforce", "mml", "meritocratic");

	public static class Options
	{
		public final String caseWeighter;
		// reinforce baseline: none, mean or moving
		public final ReinforceCaseWeighter.Baseline baseline;
		public final double baselineDecay;
		// meritocratic exponent on the policy probability
		public final double beta;

		public Options(final Config config)
		{
			caseWeighter = config.getString("caseWeighter");
			final String baselineName = config.getString("baseline");
			baselineDecay = config.getDouble("baselineDecay");
			beta = config.getDouble("beta");
			ConfigurationError.check(NAMES.contains(caseWeighter), "Unknown trainer.caseWeighter '%s', expected one of %s", caseWeighter, NAMES);
			baseline = ReinforceCaseWeighter.Baseline.fromString(baselineName);
			ConfigurationError.check(baselineDecay >= 0 && baselineDecay < 1, "trainer.baselineDecay must be in [0, 1), got %s", baselineDecay);
			ConfigurationError.check(beta >= 0, "trainer.beta must be non-negative, got %s", beta);
		}
	}

	public static CaseWeighter create(final Options opts)
	{
		switch (opts.caseWeighter)
		{
			case "reinforce":
				return new ReinforceCaseWeighter(opts.baseline, opts.baselineDecay);
			case "mml":
				return new MeritocraticCaseWeighter(1.0);
			case "meritocratic":
				return new MeritocraticCaseWeighter(opts.beta);
			default:
				throw new ConfigurationError("Unknown case weighter: " + opts.caseWeighter);
		}
	}

	// One weight per candidate; |rewards| is aligned with |candidates|.
	public abstract double[] weights(List<Candidate> candidates, double[] rewards);

	// Called once per batch with the rewards of every candidate of the batch, before any weights of the next batch are asked for.
	public void observeBatch(final double[] rewards)
	{
	}

	// The policy distribution renormalized over the beam.
	protected static double[] beamProbs(final List<Candidate> candidates)
	{
		final double[] logProbs = new double[candidates.size()];
		for (int i = 0; i < logProbs.length; i++)
			logProbs[i] = candidates.get(i).logProb;
		return ReinforcementUtils.expNormalize(logProbs);
	}
}
