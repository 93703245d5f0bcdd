package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Complete candidates of one search, best first. The search only runs on first access; the stream cannot be rewound, and consuming it after the
 * parameters it was scored with have moved on is an error.
 */
public class CandidateStream implements Iterator<Candidate>
{
	private final ParamsSnapshot params;
	private final int estimatedSize;
	private Supplier<List<Candidate>> search;
	private Deque<Candidate> remaining;

	CandidateStream(final ParamsSnapshot params, final int estimatedSize, final Supplier<List<Candidate>> search)
	{
		this.params = params;
		this.estimatedSize = estimatedSize;
		this.search = search;
	}

	private Deque<Candidate> remaining()
	{
		if (!params.isCurrent())
			throw new IllegalStateException("Parameters moved past version " + params.version() + " since this search was started");
		if (remaining == null)
		{
			remaining = new ArrayDeque<>(search.get());
			search = null;
		}
		return remaining;
	}

	@Override
	public boolean hasNext()
	{
		return !remaining().isEmpty();
	}

	public Candidate peek()
	{
		final Candidate c = remaining().peekFirst();
		if (c == null)
			throw new NoSuchElementException();
		return c;
	}

	@Override
	public Candidate next()
	{
		final Candidate c = remaining().pollFirst();
		if (c == null)
			throw new NoSuchElementException();
		return c;
	}

	// Upper bound before the search ran, exact count of what is left afterwards.
	public int estimatedSize()
	{
		return remaining == null ? estimatedSize : remaining.size();
	}

	// Drains the stream.
	public List<Candidate> toList()
	{
		final ImmutableList<Candidate> list = ImmutableList.copyOf(remaining());
		remaining.clear();
		return list;
	}

	public ParamsSnapshot params()
	{
		return params;
	}
}
