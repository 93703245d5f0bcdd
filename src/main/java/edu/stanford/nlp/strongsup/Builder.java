package edu.stanford.nlp.strongsup;

import edu.stanford.nlp.strongsup.tangrams.TangramsRewardEvaluator;
import edu.stanford.nlp.strongsup.tangrams.TangramsSimulator;
import java.io.File;

/**
 * Builds the components of a run from its {@link Settings}.
 */
public class Builder
{
	public final Settings settings;
	public TangramsSimulator simulator;
	public Policy policy;
	public Params params;
	public ExplorationPolicy trainSearch;
	public ExplorationPolicy testSearch;
	public RewardEvaluator evaluator;
	public PolicyTrainer policyTrainer;
	public BeamDumpWriter beamDump;

	public Builder(final Settings settings)
	{
		this.settings = settings;
	}

	public void build()
	{
		simulator = null;
		policy = null;
		params = null;
		trainSearch = null;
		testSearch = null;
		evaluator = null;
		policyTrainer = null;
		buildUnspecified();
	}

	// Fills in whatever has not been set by hand.
	public void buildUnspecified()
	{
		if (simulator == null)
			simulator = new TangramsSimulator();
		if (policy == null)
			policy = new Policy(new FeatureExtractor(settings.features), new OperationProposer(settings.world));
		if (params == null)
			params = new Params(settings.params);
		if (trainSearch == null)
			trainSearch = ExplorationPolicy.create(settings.search.trainExploration, settings.search, policy, simulator);
		if (testSearch == null)
			testSearch = ExplorationPolicy.create(settings.search.testExploration, settings.search, policy, simulator);
		if (evaluator == null)
			evaluator = new TangramsRewardEvaluator(settings.reward, simulator);
		if (policyTrainer == null)
			policyTrainer = new PolicyTrainer(settings.policyTrainer, params, CaseWeighter.create(settings.caseWeighter));
		if (beamDump == null && !settings.trainer.beamDumpFile.isEmpty())
			beamDump = new BeamDumpWriter(new File(settings.trainer.beamDumpFile));
	}

	public Trainer newTrainer(final Dataset dataset)
	{
		buildUnspecified();
		final ExampleProcessor processor = new ExampleProcessor(evaluator, policyTrainer, beamDump);
		return new Trainer(settings.trainer, dataset, params, trainSearch, testSearch, policyTrainer, processor, new CheckpointManager(new File(settings.trainer.checkpointDir)));
	}
}
