package edu.stanford.nlp.strongsup;

import java.util.HashMap;
import java.util.Map;

/**
 * Numeric helpers shared by the search and the trainer.
 */
public final class ReinforcementUtils
{
	private ReinforcementUtils()
	{
	}

	public static void addToDoubleMap(final Map<String, Double> mutatedMap, final Map<String, Double> addedMap)
	{
		for (final Map.Entry<String, Double> entry : addedMap.entrySet())
			mutatedMap.merge(entry.getKey(), entry.getValue(), Double::sum);
	}

	public static Map<String, Double> multiplyDoubleMap(final Map<String, Double> map, final double factor)
	{
		final Map<String, Double> res = new HashMap<>();
		for (final Map.Entry<String, Double> entry : map.entrySet())
			res.put(entry.getKey(), entry.getValue() * factor);
		return res;
	}

	public static double l2Norm(final Map<String, Double> map)
	{
		double sumSq = 0;
		for (final double v : map.values())
			sumSq += v * v;
		return Math.sqrt(sumSq);
	}

	public static boolean allFinite(final Map<String, Double> map)
	{
		for (final double v : map.values())
			if (!Double.isFinite(v))
				return false;
		return true;
	}

	public static double logAdd(final double a, final double b)
	{
		if (a == Double.NEGATIVE_INFINITY)
			return b;
		if (b == Double.NEGATIVE_INFINITY)
			return a;
		return a > b ? a + Math.log1p(Math.exp(b - a)) : b + Math.log1p(Math.exp(a - b));
	}

	public static double logSumExp(final double[] scores)
	{
		double sum = Double.NEGATIVE_INFINITY;
		for (final double score : scores)
			sum = logAdd(sum, score);
		return sum;
	}

	// Input: log probabilities (unnormalized too). Output: normalized probabilities.
	public static double[] expNormalize(final double[] scores)
	{
		// subtract the max to prevent overflow
		final double[] res = new double[scores.length];
		double max = Double.NEGATIVE_INFINITY;
		for (final double score : scores)
			max = Math.max(max, score);
		if (Double.isInfinite(max))
			throw new IllegalArgumentException("Scores are probably empty");
		double sum = 0;
		for (int i = 0; i < scores.length; i++)
		{
			res[i] = Math.exp(scores[i] - max);
			sum += res[i];
		}
		for (int i = 0; i < res.length; i++)
			res[i] /= sum;
		return res;
	}
}
