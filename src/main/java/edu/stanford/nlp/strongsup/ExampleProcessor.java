package edu.stanford.nlp.strongsup;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The per-example work of a training step, run on the worker threads. Every method reads only its example and the snapshot it is given. A failure is
 * logged and reported as {@code null} so that the example is skipped and the rest of the batch goes on.
 */
public class ExampleProcessor
{
	private static final Logger LOG = LoggerFactory.getLogger(ExampleProcessor.class);

	// A searched and rewarded example.
	public static class Evaluated
	{
		public final Example example;
		public final List<Candidate> beam;
		public final List<RewardResult> results;
		public final double[] rewards;
		// null when no gradient was asked for
		public final Map<String, Double> gradient;

		Evaluated(final Example example, final List<Candidate> beam, final List<RewardResult> results, final double[] rewards, final Map<String, Double> gradient)
		{
			this.example = example;
			this.beam = beam;
			this.results = results;
			this.rewards = rewards;
			this.gradient = gradient;
		}

		public boolean topCorrect()
		{
			return !results.isEmpty() && results.get(0).isCorrect();
		}

		public boolean oracleCorrect()
		{
			for (final RewardResult r : results)
				if (r.isCorrect())
					return true;
			return false;
		}

		// NaN for an empty beam
		public double topReward()
		{
			return results.isEmpty() ? Double.NaN : results.get(0).reward;
		}
	}

	private final RewardEvaluator evaluator;
	private final PolicyTrainer trainer;
	private final BeamDumpWriter beamDump;

	public ExampleProcessor(final RewardEvaluator evaluator, final PolicyTrainer trainer, final BeamDumpWriter beamDump)
	{
		this.evaluator = evaluator;
		this.trainer = trainer;
		this.beamDump = beamDump;
	}

	public List<Candidate> search(final ExplorationPolicy exploration, final Example ex, final ParamsSnapshot params)
	{
		try
		{
			return exploration.search(ex, params).toList();
		}
		catch (final RuntimeException e)
		{
			LOG.warn("Skipping example {}: search failed", ex.id, e);
			return null;
		}
	}

	public Evaluated evaluate(final Example ex, final List<Candidate> beam, final boolean computeGradient)
	{
		try
		{
			final List<RewardResult> results = new ArrayList<>(beam.size());
			final double[] rewards = new double[beam.size()];
			for (int i = 0; i < beam.size(); i++)
			{
				final RewardResult result = evaluator.evaluate(beam.get(i), ex);
				results.add(result);
				rewards[i] = result.reward;
			}
			final Map<String, Double> gradient = computeGradient ? trainer.gradient(beam, rewards) : null;
			// training beams only
			if (beamDump != null && computeGradient)
				beamDump.write(ex, beam, results);
			if (LOG.isDebugEnabled())
				for (int i = 0; i < beam.size(); i++)
					LOG.debug("{} [{}] {} -> {}", ex.id, i, beam.get(i), results.get(i));
			return new Evaluated(ex, beam, results, rewards, gradient);
		}
		catch (final RuntimeException e)
		{
			LOG.warn("Skipping example {}: evaluation failed", ex.id, e);
			return null;
		}
	}
}
