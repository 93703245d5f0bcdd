package edu.stanford.nlp.strongsup.tangrams;

import com.typesafe.config.Config;
import edu.stanford.nlp.strongsup.ConfigurationError;
import edu.stanford.nlp.strongsup.RewardEvaluator;
import edu.stanford.nlp.strongsup.RewardResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewards a tangrams program by the world it produces. An exact match earns the full reward; a world where the target pieces are on or near their
 * cells earns partial credit; anything else earns the mismatch reward. A program the simulator rejects earns the illegal penalty, which the options
 * keep below every legal outcome.
 */
public class TangramsRewardEvaluator implements RewardEvaluator
{
	private static final Logger LOG = LoggerFactory.getLogger(TangramsRewardEvaluator.class);

	public static class Options
	{
		public final double fullReward;
		public final double mismatchReward;
		public final double illegalPenalty;
		public final double timeoutPenalty;
		// credit of a target piece that is within partialDistance of its cell
		public final double adjacentCredit;
		public final int partialDistance;
		public final double partialThreshold;
		public final double partialScale;

		public Options(final Config config)
		{
			fullReward = config.getDouble("fullReward");
			mismatchReward = config.getDouble("mismatchReward");
			illegalPenalty = config.getDouble("illegalPenalty");
			timeoutPenalty = config.getDouble("timeoutPenalty");
			adjacentCredit = config.getDouble("adjacentCredit");
			partialDistance = config.getInt("partialDistance");
			partialThreshold = config.getDouble("partialThreshold");
			partialScale = config.getDouble("partialScale");
			ConfigurationError.check(timeoutPenalty >= 0, "reward.timeoutPenalty must be non-negative, got %s", timeoutPenalty);
			ConfigurationError.check(illegalPenalty < mismatchReward - timeoutPenalty, "reward.illegalPenalty (%s) must be below mismatchReward - timeoutPenalty (%s)", illegalPenalty, mismatchReward - timeoutPenalty);
			ConfigurationError.check(mismatchReward < fullReward, "reward.mismatchReward (%s) must be below fullReward (%s)", mismatchReward, fullReward);
			ConfigurationError.check(adjacentCredit >= 0 && adjacentCredit <= 1, "reward.adjacentCredit must be in [0, 1], got %s", adjacentCredit);
			ConfigurationError.check(partialDistance >= 0, "reward.partialDistance must be non-negative, got %d", partialDistance);
			ConfigurationError.check(partialThreshold > 0 && partialThreshold <= 1, "reward.partialThreshold must be in (0, 1], got %s", partialThreshold);
			// the lowest partial reward is paid at the threshold
			ConfigurationError.check(partialScale >= 0, "reward.partialScale must be non-negative, got %s", partialScale);
			ConfigurationError.check(illegalPenalty < partialScale * partialThreshold - timeoutPenalty, "reward.illegalPenalty (%s) must be below partialScale * partialThreshold - timeoutPenalty (%s)", illegalPenalty, partialScale * partialThreshold - timeoutPenalty);
		}
	}

	private final Options opts;
	private final TangramsSimulator simulator;

	public TangramsRewardEvaluator(final Options opts, final TangramsSimulator simulator)
	{
		this.opts = opts;
		this.simulator = simulator;
	}

	@Override
	public RewardResult evaluate(final Program program, final TangramsWorld initialState, final TangramsWorld targetState, final boolean truncated)
	{
		program.validate();
		final TangramsSimulator.Execution execution = simulator.execute(initialState, program);
		if (!execution.legal())
			return new RewardResult(opts.illegalPenalty, RewardResult.Outcome.ILLEGAL, execution.finalState, execution.failedStep, truncated, 0);

		final TangramsWorld state = execution.finalState;
		final RewardResult.Outcome outcome;
		final double credit;
		double reward;
		if (state.equals(targetState))
		{
			outcome = RewardResult.Outcome.FULL_MATCH;
			credit = 1;
			reward = opts.fullReward;
		}
		else
		{
			credit = credit(state, targetState);
			if (credit >= opts.partialThreshold)
			{
				outcome = RewardResult.Outcome.PARTIAL_MATCH;
				reward = opts.partialScale * credit;
			}
			else
			{
				outcome = RewardResult.Outcome.MISMATCH;
				reward = opts.mismatchReward;
			}
		}
		if (truncated)
			reward -= opts.timeoutPenalty;
		if (LOG.isTraceEnabled())
			LOG.trace("{} -> {} credit={} reward={}", program, outcome, credit, reward);
		return new RewardResult(reward, outcome, state, -1, truncated, credit);
	}

	// Mean credit over the target pieces and the predicted pieces the target does not have.
	double credit(final TangramsWorld predicted, final TangramsWorld target)
	{
		double sum = 0;
		int count = 0;
		for (final Piece want : target.pieces())
		{
			count++;
			final Piece got = predicted.piece(want.id);
			if (got == null || !got.shape.equals(want.shape))
				continue;
			if (got.equals(want))
				sum += 1;
			else
				if (got.position.manhattanDistance(want.position) <= opts.partialDistance)
					sum += opts.adjacentCredit;
		}
		for (final Piece extra : predicted.pieces())
			if (!target.contains(extra.id))
				count++;
		return count == 0 ? 1 : sum / count;
	}
}
