package edu.stanford.nlp.strongsup;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import edu.stanford.nlp.strongsup.tangrams.TangramsRewardEvaluator;

/**
 * The typed, validated options of every component, read from the {@code strongsup} tree of a configuration. Building a Settings is the only place
 * configuration errors surface; the components never look at the raw configuration.
 */
public final class Settings
{
	public final String dataDir;
	public final String device;
	public final Dataset.Options dataset;
	public final OperationProposer.Options world;
	public final FeatureExtractor.Options features;
	public final Params.Options params;
	public final ExplorationPolicy.Options search;
	public final TangramsRewardEvaluator.Options reward;
	public final CaseWeighter.Options caseWeighter;
	public final PolicyTrainer.Options policyTrainer;
	public final Trainer.Options trainer;

	private Settings(final Config root)
	{
		dataDir = root.getString("dataDir");
		device = root.getString("device");
		dataset = new Dataset.Options(root.getConfig("dataset"));
		world = new OperationProposer.Options(root.getConfig("world"));
		features = new FeatureExtractor.Options(root.getConfig("features"));
		params = new Params.Options(root.getConfig("params"));
		search = new ExplorationPolicy.Options(root.getConfig("search"));
		reward = new TangramsRewardEvaluator.Options(root.getConfig("reward"));
		caseWeighter = new CaseWeighter.Options(root.getConfig("trainer"));
		policyTrainer = new PolicyTrainer.Options(root.getConfig("trainer"));
		trainer = new Trainer.Options(root.getConfig("trainer"));
	}

	public static Settings fromConfig(final Config config)
	{
		try
		{
			return new Settings(config.getConfig("strongsup"));
		}
		catch (final ConfigException e)
		{
			throw new ConfigurationError("Invalid configuration: " + e.getMessage(), e);
		}
	}

	// reference.conf with |hocon| on top
	public static Settings parse(final String hocon)
	{
		return fromConfig(ConfigLoader.parse(hocon));
	}
}
