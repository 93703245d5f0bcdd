package edu.stanford.nlp.strongsup;

import com.typesafe.config.Config;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes policy gradients from rewarded beams and applies them to the parameters. The gradient of a candidate is the sum over its decisions of
 * phi(chosen) - E_p[phi], scaled by the weight the {@link CaseWeighter} gives it.
 */
public class PolicyTrainer
{
	private static final Logger LOG = LoggerFactory.getLogger(PolicyTrainer.class);

	public static class Options
	{
		public final double rewardClipMin;
		public final double rewardClipMax;
		// Standardize rewards within each beam before weighting
		public final boolean normalizeRewards;
		public final double maxGradientNorm;

		public Options(final Config config)
		{
			rewardClipMin = config.getDouble("rewardClipMin");
			rewardClipMax = config.getDouble("rewardClipMax");
			normalizeRewards = config.getBoolean("normalizeRewards");
			maxGradientNorm = config.getDouble("maxGradientNorm");
			ConfigurationError.check(rewardClipMin < rewardClipMax, "trainer.rewardClipMin (%s) must be below rewardClipMax (%s)", rewardClipMin, rewardClipMax);
			ConfigurationError.check(maxGradientNorm > 0, "trainer.maxGradientNorm must be positive, got %s", maxGradientNorm);
		}
	}

	private final Options opts;
	private final Params params;
	private final CaseWeighter caseWeighter;

	public PolicyTrainer(final Options opts, final Params params, final CaseWeighter caseWeighter)
	{
		this.opts = opts;
		this.params = params;
		this.caseWeighter = caseWeighter;
	}

	public CaseWeighter getCaseWeighter()
	{
		return caseWeighter;
	}

	private double[] clipRewards(final double[] rewards)
	{
		final double[] clipped = new double[rewards.length];
		for (int i = 0; i < rewards.length; i++)
			clipped[i] = Math.max(opts.rewardClipMin, Math.min(opts.rewardClipMax, rewards[i]));
		return clipped;
	}

	public double[] shapeRewards(final double[] rewards)
	{
		final double[] shaped = clipRewards(rewards);
		if (opts.normalizeRewards && shaped.length > 0)
		{
			double mean = 0;
			for (final double r : shaped)
				mean += r;
			mean /= shaped.length;
			double var = 0;
			for (final double r : shaped)
				var += (r - mean) * (r - mean);
			final double std = Math.sqrt(var / shaped.length);
			for (int i = 0; i < shaped.length; i++)
				shaped[i] = std > 0 ? (shaped[i] - mean) / std : 0;
		}
		return shaped;
	}

	// Hands the batch's rewards to the case weighter, clipped like the ones its weights see.
	public void observeBatch(final double[] rewards)
	{
		caseWeighter.observeBatch(clipRewards(rewards));
	}

	// Gradient of one example's beam. |rewards| is aligned with |beam|.
	public Map<String, Double> gradient(final List<Candidate> beam, final double[] rewards)
	{
		final Map<String, Double> gradient = new HashMap<>();
		if (beam.isEmpty())
			return gradient;
		final double[] weights = caseWeighter.weights(beam, shapeRewards(rewards));
		for (int i = 0; i < beam.size(); i++)
		{
			if (weights[i] == 0)
				continue;
			for (final ParseCase parseCase : beam.get(i).cases)
				parseCase.addGradient(weights[i], gradient);
		}
		return gradient;
	}

	/**
	 * Sums the per-example gradients in the given order, rescales the sum to {@code maxGradientNorm} when it is longer, and applies it. Returns the
	 * new parameter version.
	 *
	 * @throws NumericInstabilityError if any value is not finite; the parameters are left untouched.
	 */
	public long update(final List<Map<String, Double>> gradients)
	{
		final Map<String, Double> total = new HashMap<>();
		for (final Map<String, Double> g : gradients)
			ReinforcementUtils.addToDoubleMap(total, g);
		if (!ReinforcementUtils.allFinite(total))
			throw new NumericInstabilityError("Non-finite gradient; update of version " + params.version() + " skipped");
		final double norm = ReinforcementUtils.l2Norm(total);
		LOG.debug("Gradient L2 norm: {} over {} features", norm, total.size());
		final Map<String, Double> applied = norm > opts.maxGradientNorm ? ReinforcementUtils.multiplyDoubleMap(total, opts.maxGradientNorm / norm) : total;
		return params.update(applied);
	}
}
