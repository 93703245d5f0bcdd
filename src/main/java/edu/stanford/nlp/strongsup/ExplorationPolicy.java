package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import edu.stanford.nlp.strongsup.tangrams.TangramsSimulator;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches the space of programs for an example. Each round extends every in-progress candidate with every proposed operation, executes the new step
 * and prunes the joint beam of in-progress and complete candidates back to the beam width. Subclasses decide how the beam is pruned.
 */
public abstract class ExplorationPolicy
{
	private static final Logger LOG = LoggerFactory.getLogger(ExplorationPolicy.class);

	public static final String BEAM = "beam";
	public static final String RANDOMIZED_BEAM = "randomized-beam";
	public static final ImmutableSet<String> NAMES = ImmutableSet.of(BEAM, RANDOMIZED_BEAM);

	public static class Options
	{
		public final int beamWidth;
		// Operations per program, stop included
		public final int maxProgramLength;
		// Drop extensions the simulator rejects instead of keeping them as ILLEGAL candidates
		public final boolean pruneIllegal;
		public final String trainExploration;
		public final String testExploration;
		public final double epsilon;
		public final long seed;

		public Options(final Config config)
		{
			beamWidth = config.getInt("beamWidth");
			maxProgramLength = config.getInt("maxProgramLength");
			pruneIllegal = config.getBoolean("pruneIllegal");
			trainExploration = config.getString("trainExploration");
			testExploration = config.getString("testExploration");
			epsilon = config.getDouble("epsilon");
			seed = config.getLong("seed");
			ConfigurationError.check(beamWidth > 0, "search.beamWidth must be positive, got %d", beamWidth);
			ConfigurationError.check(maxProgramLength > 0, "search.maxProgramLength must be positive, got %d", maxProgramLength);
			ConfigurationError.check(NAMES.contains(trainExploration), "Unknown search.trainExploration '%s', expected one of %s", trainExploration, NAMES);
			ConfigurationError.check(NAMES.contains(testExploration), "Unknown search.testExploration '%s', expected one of %s", testExploration, NAMES);
			ConfigurationError.check(epsilon >= 0 && epsilon <= 1, "search.epsilon must be in [0, 1], got %s", epsilon);
		}
	}

	public static ExplorationPolicy create(final String name, final Options opts, final Policy policy, final TangramsSimulator simulator)
	{
		switch (name)
		{
			case BEAM:
				return new BeamExplorationPolicy(opts, policy, simulator);
			case RANDOMIZED_BEAM:
				return new RandomizedBeamExplorationPolicy(opts, policy, simulator);
			default:
				throw new ConfigurationError("Unknown exploration policy: " + name);
		}
	}

	protected final Options opts;
	private final Policy policy;
	private final TangramsSimulator simulator;

	protected ExplorationPolicy(final Options opts, final Policy policy, final TangramsSimulator simulator)
	{
		this.opts = opts;
		this.policy = policy;
		this.simulator = simulator;
	}

	public CandidateStream search(final Example ex, final ParamsSnapshot params)
	{
		return search(ex, params, opts.beamWidth);
	}

	public CandidateStream search(final Example ex, final ParamsSnapshot params, final int beamWidth)
	{
		if (beamWidth <= 0)
			throw new IllegalArgumentException("beamWidth must be positive, got " + beamWidth);
		return new CandidateStream(params, beamWidth, () -> run(ex, params, beamWidth));
	}

	// Keep at most |beamWidth| of |sorted| (best first). The result need not be sorted.
	protected abstract List<Candidate> prune(List<Candidate> sorted, int beamWidth, Random random);

	private List<Candidate> run(final Example ex, final ParamsSnapshot params, final int beamWidth)
	{
		final Random random = newRandom(ex, params);
		final List<Candidate> complete = new ArrayList<>();
		List<Candidate> inProgress = new ArrayList<>();
		inProgress.add(Candidate.initial(ex.initialState));

		while (!inProgress.isEmpty())
		{
			final List<Candidate> joint = new ArrayList<>(complete);
			for (final Candidate c : inProgress)
				extend(ex, params, c, joint);
			joint.sort(Candidate.BY_SCORE);
			final List<Candidate> kept = prune(joint, beamWidth, random);

			complete.clear();
			inProgress = new ArrayList<>();
			for (final Candidate c : kept)
				if (c.isComplete())
					complete.add(c);
				else
					inProgress.add(c);
		}
		complete.sort(Candidate.BY_SCORE);
		if (LOG.isDebugEnabled())
		{
			LOG.debug("{}: {} candidates (params v{})", ex.id, complete.size(), params.version());
			for (final Candidate c : complete)
				LOG.debug("  {}", c);
		}
		return complete;
	}

	private void extend(final Example ex, final ParamsSnapshot params, final Candidate c, final List<Candidate> out)
	{
		// one slot left: the only way forward is stop
		final boolean forceStop = c.program.size() >= opts.maxProgramLength - 1;
		final ParseCase.Choices choices = policy.choices(ex, c.program, c.state, params, forceStop);
		for (int i = 0; i < choices.size(); i++)
		{
			final ParseCase parseCase = new ParseCase(choices, i);
			if (parseCase.decision().isStop())
			{
				out.add(c.extend(parseCase, c.state, forceStop ? Candidate.Status.TRUNCATED : Candidate.Status.TERMINATED));
				continue;
			}
			final TangramsSimulator.Transition t = simulator.apply(c.state, parseCase.decision());
			if (t.legal)
				out.add(c.extend(parseCase, t.state, Candidate.Status.IN_PROGRESS));
			else
				if (!opts.pruneIllegal)
					out.add(c.extend(parseCase, c.state, Candidate.Status.ILLEGAL));
		}
	}

	// Depends on the example and the parameter version only, never on which thread runs the search.
	private Random newRandom(final Example ex, final ParamsSnapshot params)
	{
		long seed = opts.seed;
		seed = 31 * seed + ex.id.hashCode();
		seed = 31 * seed + params.version();
		return new Random(seed);
	}
}
