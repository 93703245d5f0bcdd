package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableList;
import edu.stanford.nlp.strongsup.tangrams.Program;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;
import java.util.Comparator;

/**
 * A path of the search: the program built so far, the world after its last legal step, the decisions that built it and their total log
 * probability.
 */
public final class Candidate
{
	public enum Status
	{
		IN_PROGRESS, // may still be extended
		TERMINATED, // the policy chose stop
		TRUNCATED, // stop forced by the length bound
		ILLEGAL; // the last step was rejected by the simulator

		public boolean isComplete()
		{
			return this != IN_PROGRESS;
		}
	}

	// Best score first, ties broken on the program text.
	public static final Comparator<Candidate> BY_SCORE = Comparator.comparingDouble(Candidate::getScore).reversed().thenComparing(c -> c.program.toString());

	public final Program program;
	public final TangramsWorld state;
	public final ImmutableList<ParseCase> cases;
	public final double logProb;
	public final Status status;

	Candidate(final Program program, final TangramsWorld state, final ImmutableList<ParseCase> cases, final double logProb, final Status status)
	{
		this.program = program;
		this.state = state;
		this.cases = cases;
		this.logProb = logProb;
		this.status = status;
	}

	static Candidate initial(final TangramsWorld state)
	{
		return new Candidate(Program.EMPTY, state, ImmutableList.<ParseCase> of(), 0, Status.IN_PROGRESS);
	}

	Candidate extend(final ParseCase parseCase, final TangramsWorld newState, final Status newStatus)
	{
		final ImmutableList<ParseCase> newCases = ImmutableList.<ParseCase> builder().addAll(cases).add(parseCase).build();
		return new Candidate(program.append(parseCase.decision()), newState, newCases, logProb + parseCase.logProb(), newStatus);
	}

	public double getScore()
	{
		return logProb;
	}

	public boolean isComplete()
	{
		return status.isComplete();
	}

	@Override
	public String toString()
	{
		return String.format("%s [%s] logProb=%.4f", program, status, logProb);
	}
}
