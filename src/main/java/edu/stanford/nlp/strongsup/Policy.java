package edu.stanford.nlp.strongsup;

import edu.stanford.nlp.strongsup.tangrams.Operation;
import edu.stanford.nlp.strongsup.tangrams.Program;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locally normalized log-linear policy: p(op | utterance, prefix, state) is proportional to exp(theta . phi(op)) over the proposed operations.
 */
public class Policy
{
	private static final Logger LOG = LoggerFactory.getLogger(Policy.class);

	private final FeatureExtractor featureExtractor;
	private final OperationProposer proposer;

	public Policy(final FeatureExtractor featureExtractor, final OperationProposer proposer)
	{
		this.featureExtractor = featureExtractor;
		this.proposer = proposer;
	}

	// The choices at the end of |prefix|. With |forceStop| the only choice is stop, with probability 1.
	public ParseCase.Choices choices(final Example ex, final Program prefix, final TangramsWorld state, final ParamsSnapshot params, final boolean forceStop)
	{
		final List<Operation> ops;
		if (forceStop)
		{
			ops = new ArrayList<>();
			ops.add(Operation.STOP);
		}
		else
			ops = proposer.propose(state);

		final List<FeatureVector> features = new ArrayList<>(ops.size());
		final double[] scores = new double[ops.size()];
		for (int i = 0; i < ops.size(); i++)
		{
			final FeatureVector fv = featureExtractor.extract(ex, prefix, state, ops.get(i));
			features.add(fv);
			scores[i] = fv.dotProduct(params);
		}
		final double logZ = ReinforcementUtils.logSumExp(scores);
		final double[] logProbs = new double[scores.length];
		for (int i = 0; i < scores.length; i++)
			logProbs[i] = scores[i] - logZ;
		if (LOG.isTraceEnabled())
			for (int i = 0; i < ops.size(); i++)
				FeatureVector.logFeatureWeights(LOG, ex.id + " step " + prefix.size() + " " + ops.get(i), features.get(i).toMap(), params);
		return new ParseCase.Choices(prefix.size(), ops, features, logProbs);
	}
}
