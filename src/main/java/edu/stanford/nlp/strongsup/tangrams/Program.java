package edu.stanford.nlp.strongsup.tangrams;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import edu.stanford.nlp.strongsup.BadProgramException;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable sequence of operations. {@link #length()} counts the operations before the terminal {@code stop}; {@link #size()} counts all of them.
 */
public final class Program implements Iterable<Operation>
{
	public static final Program EMPTY = new Program(ImmutableList.<Operation> of());

	private static final Pattern OPERATION = Pattern.compile("[a-z]+(\\([^)]*\\))?");

	private final ImmutableList<Operation> operations;

	public Program(final List<Operation> operations)
	{
		this.operations = ImmutableList.copyOf(operations);
	}

	public static Program of(final Operation... operations)
	{
		return new Program(ImmutableList.copyOf(operations));
	}

	public Program append(final Operation operation)
	{
		if (isTerminated())
			throw new BadProgramException("Cannot extend a terminated program: " + this);
		return new Program(ImmutableList.<Operation> builder().addAll(operations).add(operation).build());
	}

	public Operation get(final int i)
	{
		return operations.get(i);
	}

	public ImmutableList<Operation> operations()
	{
		return operations;
	}

	public int size()
	{
		return operations.size();
	}

	public int length()
	{
		return isTerminated() ? operations.size() - 1 : operations.size();
	}

	public boolean isTerminated()
	{
		return !operations.isEmpty() && operations.get(operations.size() - 1).isStop();
	}

	// null for the empty program
	public Operation last()
	{
		return operations.isEmpty() ? null : operations.get(operations.size() - 1);
	}

	// A stop token is only allowed in last position.
	public void validate()
	{
		for (int i = 0; i < operations.size() - 1; i++)
			if (operations.get(i).isStop())
				throw new BadProgramException(String.format("stop at step %d of %d: %s", i, operations.size(), this));
	}

	@Override
	public Iterator<Operation> iterator()
	{
		return operations.iterator();
	}

	public static Program fromString(final String s)
	{
		final ImmutableList.Builder<Operation> ops = ImmutableList.builder();
		final String compact = Joiner.on("").join(Splitter.on(' ').omitEmptyStrings().split(s));
		final Matcher m = OPERATION.matcher(compact);
		int end = 0;
		while (m.find())
		{
			if (m.start() != end)
				throw new BadProgramException("Cannot parse program: " + s);
			ops.add(Operation.fromString(m.group()));
			end = m.end();
		}
		if (end != compact.length())
			throw new BadProgramException("Cannot parse program: " + s);
		return new Program(ops.build());
	}

	@Override
	public boolean equals(final Object obj)
	{
		return obj instanceof Program && operations.equals(((Program) obj).operations);
	}

	@Override
	public int hashCode()
	{
		return operations.hashCode();
	}

	@Override
	public String toString()
	{
		return Joiner.on(' ').join(operations);
	}
}
