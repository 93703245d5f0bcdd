package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import edu.stanford.nlp.strongsup.tangrams.Operation;
import edu.stanford.nlp.strongsup.tangrams.Piece;
import edu.stanford.nlp.strongsup.tangrams.Position;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Enumerates the well-typed operations applicable to a world: every piece operand names a piece of the world and every cell operand an in-bounds
 * cell. Whether the operation is legal is left to the simulator. The order is deterministic: kinds in declaration order, pieces by id, cells
 * row-major, {@code stop} last.
 */
public class OperationProposer
{
	public static class Options
	{
		// Shapes ADD may place
		public final ImmutableList<String> shapes;
		// Operation kinds proposed besides stop
		public final ImmutableSet<Operation.Kind> kinds;

		public Options(final Config config)
		{
			shapes = ImmutableList.copyOf(config.getStringList("shapes"));
			final EnumSet<Operation.Kind> set = EnumSet.noneOf(Operation.Kind.class);
			for (final String name : config.getStringList("operations"))
			{
				final Operation.Kind kind = parseKind(name);
				ConfigurationError.check(kind != null && kind != Operation.Kind.STOP, "Unknown operation '%s' in world.operations", name);
				set.add(kind);
			}
			kinds = ImmutableSet.copyOf(set);
			ConfigurationError.check(!kinds.contains(Operation.Kind.ADD) || !shapes.isEmpty(), "world.shapes is empty but add is enabled");
		}

		private static Operation.Kind parseKind(final String name)
		{
			for (final Operation.Kind k : Operation.Kind.values())
				if (k.toString().equals(name))
					return k;
			return null;
		}
	}

	private final Options opts;

	public OperationProposer(final Options opts)
	{
		this.opts = opts;
	}

	public List<Operation> propose(final TangramsWorld state)
	{
		final List<Operation> ops = new ArrayList<>();
		final List<Piece> pieces = state.pieces();
		for (final Operation.Kind kind : opts.kinds)
			switch (kind)
			{
				case MOVE:
					for (final Piece piece : pieces)
						for (final Position cell : state.freeCells())
							ops.add(new Operation.Move(piece.id, cell));
					break;
				case ROTATE:
					for (final Piece piece : pieces)
						for (int turns = 1; turns <= 3; turns++)
							ops.add(new Operation.Rotate(piece.id, turns));
					break;
				case SWAP:
					// unordered: swap(a,b) and swap(b,a) have the same effect
					for (final Piece a : pieces)
						for (final Piece b : pieces)
							if (a.id < b.id)
								ops.add(new Operation.Swap(a.id, b.id));
					break;
				case REMOVE:
					for (final Piece piece : pieces)
						ops.add(new Operation.Remove(piece.id));
					break;
				case ADD:
					for (final String shape : opts.shapes)
						for (final Position cell : state.freeCells())
							ops.add(new Operation.Add(shape, cell));
					break;
				case COMBINE:
					for (final Piece anchor : pieces)
						for (final Piece piece : pieces)
							if (anchor.id != piece.id)
								ops.add(new Operation.Combine(anchor.id, piece.id));
					break;
				default:
					throw new IllegalStateException("Unhandled operation kind " + kind);
			}
		ops.add(Operation.STOP);
		return ops;
	}
}
