package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableList;
import edu.stanford.nlp.strongsup.tangrams.Operation;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One decision of the policy: the operations it could take at this point, their features and probabilities, and the one that was taken. The
 * {@link Choices} are shared by every candidate branching from the same point.
 */
public final class ParseCase
{
	public static final class Choices
	{
		public final int step;
		public final ImmutableList<Operation> operations;
		public final ImmutableList<FeatureVector> features;
		private final double[] logProbs;

		Choices(final int step, final List<Operation> operations, final List<FeatureVector> features, final double[] logProbs)
		{
			this.step = step;
			this.operations = ImmutableList.copyOf(operations);
			this.features = ImmutableList.copyOf(features);
			this.logProbs = logProbs.clone();
		}

		public int size()
		{
			return operations.size();
		}

		public double logProb(final int i)
		{
			return logProbs[i];
		}

		public double prob(final int i)
		{
			return Math.exp(logProbs[i]);
		}

		// E_p[phi]
		public Map<String, Double> expectedFeatures()
		{
			final Map<String, Double> expected = new HashMap<>();
			for (int i = 0; i < features.size(); i++)
				features.get(i).increment(prob(i), expected);
			return expected;
		}
	}

	public final Choices choices;
	public final int chosen;

	public ParseCase(final Choices choices, final int chosen)
	{
		if (chosen < 0 || chosen >= choices.size())
			throw new IndexOutOfBoundsException("choice " + chosen + " of " + choices.size());
		this.choices = choices;
		this.chosen = chosen;
	}

	public Operation decision()
	{
		return choices.operations.get(chosen);
	}

	public double logProb()
	{
		return choices.logProb(chosen);
	}

	// Add |weight| * (phi(chosen) - E_p[phi]), the gradient of log p(chosen), to |gradient|.
	public void addGradient(final double weight, final Map<String, Double> gradient)
	{
		choices.features.get(chosen).increment(weight, gradient);
		for (int i = 0; i < choices.size(); i++)
			choices.features.get(i).increment(-weight * choices.prob(i), gradient);
	}

	@Override
	public String toString()
	{
		return "ParseCase(step=" + choices.step + ", " + decision() + ", p=" + String.format("%.4f", Math.exp(logProb())) + ")";
	}
}
