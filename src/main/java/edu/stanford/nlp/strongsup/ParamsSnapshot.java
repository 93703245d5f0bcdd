package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableMap;

/**
 * A frozen view of {@link Params} at one version. Search and evaluation tasks of a batch all read the same snapshot, so they see the same weights
 * whatever the trainer does meanwhile.
 */
public final class ParamsSnapshot
{
	private final Params owner;
	private final long version;
	private final ImmutableMap<String, Double> weights;
	private final double defaultWeight;

	ParamsSnapshot(final Params owner, final long version, final ImmutableMap<String, Double> weights, final double defaultWeight)
	{
		this.owner = owner;
		this.version = version;
		this.weights = weights;
		this.defaultWeight = defaultWeight;
	}

	public double getWeight(final String f)
	{
		final Double w = weights.get(f);
		return w == null ? defaultWeight : w;
	}

	public long version()
	{
		return version;
	}

	// False once the owning parameters have been updated past this version.
	public boolean isCurrent()
	{
		return owner.version() == version;
	}

	@Override
	public String toString()
	{
		return "ParamsSnapshot(v" + version + ", " + weights.size() + " weights)";
	}
}
