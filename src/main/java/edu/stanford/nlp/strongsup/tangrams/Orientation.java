package edu.stanford.nlp.strongsup.tangrams;

// the direction a piece faces; y grows towards NORTH
public enum Orientation
{
	NORTH(0, 1), EAST(1, 0), SOUTH(0, -1), WEST(-1, 0);

	public final int dx;
	public final int dy;

	Orientation(final int dx, final int dy)
	{
		this.dx = dx;
		this.dy = dy;
	}

	// clockwise
	public Orientation rotate(final int quarterTurns)
	{
		final Orientation[] values = values();
		return values[Math.floorMod(ordinal() + quarterTurns, values.length)];
	}
}
