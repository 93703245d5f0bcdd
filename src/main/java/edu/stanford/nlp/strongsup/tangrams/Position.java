package edu.stanford.nlp.strongsup.tangrams;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A cell of the board. Immutable.
 */
public final class Position
{
	@JsonProperty
	public final int x;
	@JsonProperty
	public final int y;

	@JsonCreator
	public Position(@JsonProperty("x") final int x, @JsonProperty("y") final int y)
	{
		this.x = x;
		this.y = y;
	}

	public static Position of(final int x, final int y)
	{
		return new Position(x, y);
	}

	public Position neighbor(final Orientation direction)
	{
		return new Position(x + direction.dx, y + direction.dy);
	}

	public int manhattanDistance(final Position that)
	{
		return Math.abs(x - that.x) + Math.abs(y - that.y);
	}

	@Override
	public boolean equals(final Object obj)
	{
		if (this == obj)
			return true;
		if (!(obj instanceof Position))
			return false;
		final Position other = (Position) obj;
		return x == other.x && y == other.y;
	}

	@Override
	public int hashCode()
	{
		final int prime = 19;
		int result = 1;
		result = prime * result + x;
		result = prime * result + y;
		return result;
	}

	@Override
	public String toString()
	{
		return x + "," + y;
	}
}
