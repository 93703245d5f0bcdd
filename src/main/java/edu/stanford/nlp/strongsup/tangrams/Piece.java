package edu.stanford.nlp.strongsup.tangrams;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * A tangrams piece: an id that operations refer to, a shape, the cell it covers and the direction it faces. Immutable; the mutators return copies.
 */
public final class Piece
{
	@JsonProperty
	public final int id;
	@JsonProperty
	public final String shape;
	@JsonProperty
	public final Position position;
	@JsonProperty
	public final Orientation orientation;

	@JsonCreator
	public Piece(@JsonProperty("id") final int id, @JsonProperty("shape") final String shape, @JsonProperty("position") final Position position, @JsonProperty("orientation") final Orientation orientation)
	{
		Preconditions.checkArgument(shape != null && !shape.isEmpty(), "piece %s has no shape", id);
		Preconditions.checkNotNull(position, "piece %s has no position", id);
		this.id = id;
		this.shape = shape;
		this.position = position;
		this.orientation = orientation == null ? Orientation.NORTH : orientation;
	}

	public Piece moveTo(final Position target)
	{
		return new Piece(id, shape, target, orientation);
	}

	public Piece rotate(final int quarterTurns)
	{
		return new Piece(id, shape, position, orientation.rotate(quarterTurns));
	}

	public Piece withOrientation(final Orientation o)
	{
		return new Piece(id, shape, position, o);
	}

	@Override
	public boolean equals(final Object obj)
	{
		if (this == obj)
			return true;
		if (!(obj instanceof Piece))
			return false;
		final Piece other = (Piece) obj;
		return id == other.id && shape.equals(other.shape) && position.equals(other.position) && orientation == other.orientation;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, shape, position, orientation);
	}

	@Override
	public String toString()
	{
		return id + ":" + shape + "@" + position + "/" + orientation.name().charAt(0);
	}
}
