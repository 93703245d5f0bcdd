package edu.stanford.nlp.strongsup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.typesafe.config.Config;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Params contains the parameters of the policy: a map from features to weights, plus the AdaGrad state. Every successful {@link #update} bumps the
 * version and publishes a new {@link ParamsSnapshot}; readers never see a half-applied update.
 */
public class Params
{
	private static final Logger LOG = LoggerFactory.getLogger(Params.class);

	public static class Options
	{
		// By default, all features have this weight
		public final double defaultWeight;
		public final double initStepSize;
		// How fast to reduce the step size
		public final double stepSizeReduction;
		// Use the AdaGrad algorithm (different step size for each coordinate)
		public final boolean adaptiveStepSize;

		public Options(final Config config)
		{
			defaultWeight = config.getDouble("defaultWeight");
			initStepSize = config.getDouble("initStepSize");
			stepSizeReduction = config.getDouble("stepSizeReduction");
			adaptiveStepSize = config.getBoolean("adaptiveStepSize");
			ConfigurationError.check(initStepSize > 0, "params.initStepSize must be positive, got %s", initStepSize);
			ConfigurationError.check(stepSizeReduction >= 0, "params.stepSizeReduction must be non-negative, got %s", stepSizeReduction);
		}
	}

	// Serialized form of the weights and the optimizer state.
	public static class State
	{
		@JsonProperty
		public final Map<String, Double> weights;
		@JsonProperty
		public final Map<String, Double> sumSquaredGradients;
		@JsonProperty
		public final int numUpdates;
		@JsonProperty
		public final long version;

		@JsonCreator
		public State(@JsonProperty("weights") final Map<String, Double> weights, @JsonProperty("sumSquaredGradients") final Map<String, Double> sumSquaredGradients, @JsonProperty("numUpdates") final int numUpdates, @JsonProperty("version") final long version)
		{
			this.weights = weights == null ? ImmutableMap.<String, Double> of() : weights;
			this.sumSquaredGradients = sumSquaredGradients == null ? ImmutableMap.<String, Double> of() : sumSquaredGradients;
			this.numUpdates = numUpdates;
			this.version = version;
		}
	}

	private final Options opts;

	// Discriminative weights
	private final Map<String, Double> weights = new HashMap<>();

	// For AdaGrad
	private final Map<String, Double> sumSquaredGradients = new HashMap<>();

	// Number of stochastic updates we've made so far (for determining step size).
	private int numUpdates;

	private volatile long version;
	private volatile ParamsSnapshot snapshot;

	public Params(final Options opts)
	{
		this.opts = opts;
		publish();
	}

	public long version()
	{
		return version;
	}

	public ParamsSnapshot snapshot()
	{
		return snapshot;
	}

	public synchronized int getNumUpdates()
	{
		return numUpdates;
	}

	public synchronized double getWeight(final String f)
	{
		final Double w = weights.get(f);
		return w == null ? opts.defaultWeight : w;
	}

	// Update weights by adding |gradient| (modified appropriately with step size). Returns the new version.
	public synchronized long update(final Map<String, Double> gradient)
	{
		final Map<String, Double> newWeights = new HashMap<>();
		final Map<String, Double> newSumSquared = new HashMap<>();
		for (final Map.Entry<String, Double> entry : gradient.entrySet())
		{
			final String f = entry.getKey();
			final double g = entry.getValue();
			if (!Double.isFinite(g))
				throw new NumericInstabilityError("Non-finite gradient for " + f + ": " + g);
			if (g * g == 0)
				continue; // In order to not divide by zero

			final double stepSize;
			if (opts.adaptiveStepSize)
			{
				final double sumSq = sumSquaredGradients.getOrDefault(f, 0.0) + g * g;
				newSumSquared.put(f, sumSq);
				stepSize = opts.initStepSize / Math.sqrt(sumSq);
			}
			else
				stepSize = opts.initStepSize / Math.pow(numUpdates + 1, opts.stepSizeReduction);

			final double w = getWeight(f) + stepSize * g;
			if (!Double.isFinite(w))
			{
				LOG.warn("Weird feature update: feature={}, currentWeight={}, stepSize={}, gradient={}", f, getWeight(f), stepSize, g);
				throw new NumericInstabilityError("Gradient absolute value is too large or too small for " + f);
			}
			newWeights.put(f, w);
		}
		weights.putAll(newWeights);
		sumSquaredGradients.putAll(newSumSquared);
		numUpdates++;
		version++;
		publish();
		return version;
	}

	private void publish()
	{
		snapshot = new ParamsSnapshot(this, version, ImmutableMap.copyOf(weights), opts.defaultWeight);
	}

	public synchronized State exportState()
	{
		return new State(ImmutableMap.copyOf(weights), ImmutableMap.copyOf(sumSquaredGradients), numUpdates, version);
	}

	// Replaces everything, including the version: the only way parameters go back.
	public synchronized void restore(final State state)
	{
		weights.clear();
		weights.putAll(state.weights);
		sumSquaredGradients.clear();
		sumSquaredGradients.putAll(state.sumSquaredGradients);
		numUpdates = state.numUpdates;
		version = state.version;
		publish();
		LOG.info("Restored {} weights at version {}", weights.size(), version);
	}

	// Read parameters from |file|, one "feature \t weight" pair per line.
	public synchronized void read(final File file)
	{
		LOG.info("Reading parameters from {}", file);
		try (BufferedReader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8))
		{
			String line;
			while ((line = in.readLine()) != null)
			{
				if (line.isEmpty())
					continue;
				final List<String> pair = Splitter.on('\t').splitToList(line);
				if (pair.size() != 2)
					throw new StrongSupError("Bad parameter line in " + file + ": " + line);
				weights.put(pair.get(0), Double.parseDouble(pair.get(1)));
			}
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
		version++;
		publish();
		LOG.info("Read {} weights", weights.size());
	}

	public void write(final PrintWriter out)
	{
		final List<Map.Entry<String, Double>> entries;
		synchronized (this)
		{
			entries = Lists.newArrayList(weights.entrySet());
		}
		entries.sort(Map.Entry.<String, Double> comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()));
		for (final Map.Entry<String, Double> entry : entries)
			out.println(entry.getKey() + "\t" + entry.getValue());
	}

	public void write(final File file)
	{
		LOG.debug("Params.write({})", file);
		try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)))
		{
			write(out);
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}
}
