package edu.stanford.nlp.strongsup.tangrams;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes operations against a {@link TangramsWorld}. The simulator holds no state: the same (state, operation) pair always gives the same result,
 * and a rejected operation returns the input state itself.
 */
public class TangramsSimulator
{
	private static final Logger LOG = LoggerFactory.getLogger(TangramsSimulator.class);

	public enum Failure
	{
		MISSING_PIECE, OUT_OF_BOUNDS, OVERLAP, INVALID_OPERAND
	}

	public static final class Transition
	{
		public final TangramsWorld state;
		public final boolean legal;
		public final Failure failure; // null when legal

		private Transition(final TangramsWorld state, final boolean legal, final Failure failure)
		{
			this.state = state;
			this.legal = legal;
			this.failure = failure;
		}

		static Transition legal(final TangramsWorld state)
		{
			return new Transition(state, true, null);
		}

		static Transition illegal(final TangramsWorld unchanged, final Failure failure)
		{
			return new Transition(unchanged, false, failure);
		}

		@Override
		public String toString()
		{
			return legal ? "legal " + state : "illegal(" + failure + ")";
		}
	}

	// Result of running a whole program.
	public static final class Execution
	{
		public final TangramsWorld finalState; // state before the failing step, if any
		public final int failedStep; // -1 if every step was legal
		public final Failure failure;

		Execution(final TangramsWorld finalState, final int failedStep, final Failure failure)
		{
			this.finalState = finalState;
			this.failedStep = failedStep;
			this.failure = failure;
		}

		public boolean legal()
		{
			return failedStep < 0;
		}
	}

	public Transition apply(final TangramsWorld state, final Operation operation)
	{
		for (final int id : operation.pieceOperands())
			if (!state.contains(id))
				return Transition.illegal(state, Failure.MISSING_PIECE);

		switch (operation.kind)
		{
			case MOVE:
				return move(state, (Operation.Move) operation);
			case ROTATE:
				return rotate(state, (Operation.Rotate) operation);
			case SWAP:
				return swap(state, (Operation.Swap) operation);
			case REMOVE:
				return Transition.legal(state.without(((Operation.Remove) operation).piece));
			case ADD:
				return add(state, (Operation.Add) operation);
			case COMBINE:
				return combine(state, (Operation.Combine) operation);
			case STOP:
				return Transition.legal(state);
			default:
				throw new IllegalStateException("Unhandled operation kind " + operation.kind);
		}
	}

	// Runs |program| until its end or its first illegal step.
	public Execution execute(final TangramsWorld initial, final Program program)
	{
		TangramsWorld state = initial;
		for (int i = 0; i < program.size(); i++)
		{
			final Transition t = apply(state, program.get(i));
			if (!t.legal)
			{
				if (LOG.isTraceEnabled())
					LOG.trace("execute: step {} ({}) rejected: {}", i, program.get(i), t.failure);
				return new Execution(state, i, t.failure);
			}
			state = t.state;
		}
		return new Execution(state, -1, null);
	}

	private Transition move(final TangramsWorld state, final Operation.Move op)
	{
		final Piece piece = state.piece(op.piece);
		final Transition blocked = checkTarget(state, op.target, piece);
		if (blocked != null)
			return blocked;
		return Transition.legal(state.with(piece.moveTo(op.target)));
	}

	private Transition rotate(final TangramsWorld state, final Operation.Rotate op)
	{
		if (op.quarterTurns < 1 || op.quarterTurns > 3)
			return Transition.illegal(state, Failure.INVALID_OPERAND);
		return Transition.legal(state.with(state.piece(op.piece).rotate(op.quarterTurns)));
	}

	private Transition swap(final TangramsWorld state, final Operation.Swap op)
	{
		if (op.first == op.second)
			return Transition.illegal(state, Failure.INVALID_OPERAND);
		final Piece a = state.piece(op.first);
		final Piece b = state.piece(op.second);
		return Transition.legal(state.with(a.moveTo(b.position), b.moveTo(a.position)));
	}

	private Transition add(final TangramsWorld state, final Operation.Add op)
	{
		if (op.shape == null || op.shape.isEmpty())
			return Transition.illegal(state, Failure.INVALID_OPERAND);
		final Transition blocked = checkTarget(state, op.target, null);
		if (blocked != null)
			return blocked;
		return Transition.legal(state.with(new Piece(state.nextPieceId(), op.shape, op.target, Orientation.NORTH)));
	}

	// |piece| goes to the cell |anchor| faces and takes the anchor's orientation.
	private Transition combine(final TangramsWorld state, final Operation.Combine op)
	{
		if (op.anchor == op.piece)
			return Transition.illegal(state, Failure.INVALID_OPERAND);
		final Piece anchor = state.piece(op.anchor);
		final Piece piece = state.piece(op.piece);
		final Position target = anchor.position.neighbor(anchor.orientation);
		final Transition blocked = checkTarget(state, target, piece);
		if (blocked != null)
			return blocked;
		return Transition.legal(state.with(piece.moveTo(target).withOrientation(anchor.orientation)));
	}

	// null if |self| may occupy |target|
	private static Transition checkTarget(final TangramsWorld state, final Position target, final Piece self)
	{
		if (!state.inBounds(target))
			return Transition.illegal(state, Failure.OUT_OF_BOUNDS);
		final Piece occupant = state.occupant(target);
		if (occupant != null && (self == null || occupant.id != self.id))
			return Transition.illegal(state, Failure.OVERLAP);
		return null;
	}
}
