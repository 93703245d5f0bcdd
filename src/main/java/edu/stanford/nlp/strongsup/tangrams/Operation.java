package edu.stanford.nlp.strongsup.tangrams;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import edu.stanford.nlp.strongsup.BadProgramException;
import java.util.List;
import java.util.Objects;

/**
 * An atomic step of a program. The set of kinds is closed: every subclass is nested here and the constructor is private. Operands are typed: piece
 * operands are ids of pieces of the world the operation is applied to, cell operands are board positions. The textual form is
 * {@code kind(operand,...)}, e.g. {@code move(1,3,0)} or {@code stop}.
 */
public abstract class Operation
{
	public enum Kind
	{
		MOVE("move"), // move(piece, x, y)
		ROTATE("rotate"), // rotate(piece, quarterTurns), clockwise
		SWAP("swap"), // swap(pieceA, pieceB)
		REMOVE("remove"), // remove(piece)
		ADD("add"), // add(shape, x, y)
		COMBINE("combine"), // combine(anchor, piece): attach piece in front of anchor
		STOP("stop");

		private final String value;

		Kind(final String value)
		{
			this.value = value;
		}

		@Override
		public String toString()
		{
			return value;
		}

		public static Kind fromString(final String s)
		{
			for (final Kind k : values())
				if (k.value.equals(s))
					return k;
			throw new BadProgramException("Unknown operation kind: " + s);
		}
	}

	public static final Stop STOP = new Stop();

	public final Kind kind;

	private Operation(final Kind kind)
	{
		this.kind = kind;
	}

	// Ids of the pieces this operation refers to; they must exist in the world it is applied to.
	public abstract List<Integer> pieceOperands();

	protected abstract List<Object> operands();

	public boolean isStop()
	{
		return kind == Kind.STOP;
	}

	@Override
	public String toString()
	{
		final List<Object> operands = operands();
		if (operands.isEmpty())
			return kind.toString();
		return kind + "(" + Joiner.on(',').join(operands) + ")";
	}

	@Override
	public boolean equals(final Object obj)
	{
		if (this == obj)
			return true;
		if (!(obj instanceof Operation))
			return false;
		final Operation that = (Operation) obj;
		return kind == that.kind && operands().equals(that.operands());
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, operands());
	}

	public static Operation fromString(final String s)
	{
		final String text = s.trim();
		final int open = text.indexOf('(');
		if (open < 0)
		{
			final Kind kind = Kind.fromString(text);
			if (kind != Kind.STOP)
				throw new BadProgramException("Missing operands: " + s);
			return STOP;
		}
		if (!text.endsWith(")"))
			throw new BadProgramException("Unbalanced operation: " + s);
		final Kind kind = Kind.fromString(text.substring(0, open));
		final List<String> args = Splitter.on(',').trimResults().splitToList(text.substring(open + 1, text.length() - 1));
		try
		{
			switch (kind)
			{
				case MOVE:
					expectArity(s, args, 3);
					return new Move(Integer.parseInt(args.get(0)), Position.of(Integer.parseInt(args.get(1)), Integer.parseInt(args.get(2))));
				case ROTATE:
					expectArity(s, args, 2);
					return new Rotate(Integer.parseInt(args.get(0)), Integer.parseInt(args.get(1)));
				case SWAP:
					expectArity(s, args, 2);
					return new Swap(Integer.parseInt(args.get(0)), Integer.parseInt(args.get(1)));
				case REMOVE:
					expectArity(s, args, 1);
					return new Remove(Integer.parseInt(args.get(0)));
				case ADD:
					expectArity(s, args, 3);
					return new Add(args.get(0), Position.of(Integer.parseInt(args.get(1)), Integer.parseInt(args.get(2))));
				case COMBINE:
					expectArity(s, args, 2);
					return new Combine(Integer.parseInt(args.get(0)), Integer.parseInt(args.get(1)));
				default:
					throw new BadProgramException("stop takes no operands: " + s);
			}
		}
		catch (final NumberFormatException e)
		{
			throw new BadProgramException("Bad operand in " + s + ": " + e.getMessage());
		}
	}

	private static void expectArity(final String s, final List<String> args, final int arity)
	{
		if (args.size() != arity)
			throw new BadProgramException(String.format("%s expects %d operands: %s", s, arity, args));
	}

	public static final class Move extends Operation
	{
		public final int piece;
		public final Position target;

		public Move(final int piece, final Position target)
		{
			super(Kind.MOVE);
			this.piece = piece;
			this.target = target;
		}

		@Override
		public List<Integer> pieceOperands()
		{
			return ImmutableList.of(piece);
		}

		@Override
		protected List<Object> operands()
		{
			return ImmutableList.of(piece, target.x, target.y);
		}
	}

	public static final class Rotate extends Operation
	{
		public final int piece;
		public final int quarterTurns;

		public Rotate(final int piece, final int quarterTurns)
		{
			super(Kind.ROTATE);
			this.piece = piece;
			this.quarterTurns = quarterTurns;
		}

		@Override
		public List<Integer> pieceOperands()
		{
			return ImmutableList.of(piece);
		}

		@Override
		protected List<Object> operands()
		{
			return ImmutableList.of(piece, quarterTurns);
		}
	}

	public static final class Swap extends Operation
	{
		public final int first;
		public final int second;

		public Swap(final int first, final int second)
		{
			super(Kind.SWAP);
			this.first = first;
			this.second = second;
		}

		@Override
		public List<Integer> pieceOperands()
		{
			return ImmutableList.of(first, second);
		}

		@Override
		protected List<Object> operands()
		{
			return ImmutableList.of(first, second);
		}
	}

	public static final class Remove extends Operation
	{
		public final int piece;

		public Remove(final int piece)
		{
			super(Kind.REMOVE);
			this.piece = piece;
		}

		@Override
		public List<Integer> pieceOperands()
		{
			return ImmutableList.of(piece);
		}

		@Override
		protected List<Object> operands()
		{
			return ImmutableList.of(piece);
		}
	}

	public static final class Add extends Operation
	{
		public final String shape;
		public final Position target;

		public Add(final String shape, final Position target)
		{
			super(Kind.ADD);
			this.shape = shape;
			this.target = target;
		}

		@Override
		public List<Integer> pieceOperands()
		{
			return ImmutableList.of();
		}

		@Override
		protected List<Object> operands()
		{
			return ImmutableList.of(shape, target.x, target.y);
		}
	}

	public static final class Combine extends Operation
	{
		public final int anchor;
		public final int piece;

		public Combine(final int anchor, final int piece)
		{
			super(Kind.COMBINE);
			this.anchor = anchor;
			this.piece = piece;
		}

		@Override
		public List<Integer> pieceOperands()
		{
			return ImmutableList.of(anchor, piece);
		}

		@Override
		protected List<Object> operands()
		{
			return ImmutableList.of(anchor, piece);
		}
	}

	public static final class Stop extends Operation
	{
		private Stop()
		{
			super(Kind.STOP);
		}

		@Override
		public List<Integer> pieceOperands()
		{
			return ImmutableList.of();
		}

		@Override
		protected List<Object> operands()
		{
			return ImmutableList.of();
		}
	}
}
