package edu.stanford.nlp.strongsup;

import com.google.common.math.StatsAccumulator;

/**
 * Accuracy (top candidate correct), oracle accuracy (some candidate correct) and mean reward of the top candidate over a set of examples.
 * Thread-safe.
 */
public class EvaluationStats
{
	private final StatsAccumulator correct = new StatsAccumulator();
	private final StatsAccumulator oracle = new StatsAccumulator();
	private final StatsAccumulator reward = new StatsAccumulator();
	private int failed;

	public synchronized void add(final boolean topCorrect, final boolean oracleCorrect, final double topReward)
	{
		correct.add(topCorrect ? 1 : 0);
		oracle.add(oracleCorrect ? 1 : 0);
		reward.add(topReward);
	}

	// An example that could not be searched or evaluated counts as wrong.
	public synchronized void addFailure()
	{
		failed++;
		correct.add(0);
		oracle.add(0);
	}

	public synchronized long count()
	{
		return correct.count();
	}

	public synchronized int failed()
	{
		return failed;
	}

	public synchronized double accuracy()
	{
		return correct.count() == 0 ? 0 : correct.mean();
	}

	public synchronized double oracleAccuracy()
	{
		return oracle.count() == 0 ? 0 : oracle.mean();
	}

	public synchronized double meanReward()
	{
		return reward.count() == 0 ? 0 : reward.mean();
	}

	public synchronized String summary()
	{
		return String.format("n=%d accuracy=%.4f oracle=%.4f meanReward=%.4f failed=%d", count(), accuracy(), oracleAccuracy(), meanReward(), failed);
	}
}
