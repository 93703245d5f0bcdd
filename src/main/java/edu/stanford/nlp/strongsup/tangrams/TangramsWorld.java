package edu.stanford.nlp.strongsup.tangrams;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import edu.stanford.nlp.strongsup.Json;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The board of a tangrams puzzle: a {@code width x height} grid and the pieces lying on it. Every piece is inside the board and no two pieces share a
 * cell; the constructor refuses anything else. Instances are immutable, so a state can be shared between search threads.
 */
public final class TangramsWorld
{
	private final int width;
	private final int height;
	private final ImmutableSortedMap<Integer, Piece> pieces;
	private final ImmutableMap<Position, Piece> occupancy;

	@JsonCreator
	public TangramsWorld(@JsonProperty("width") final int width, @JsonProperty("height") final int height, @JsonProperty("pieces") final List<Piece> pieces)
	{
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException(String.format("Board must be non-empty, got %dx%d", width, height));
		this.width = width;
		this.height = height;
		final Map<Integer, Piece> byId = new HashMap<>();
		final Map<Position, Piece> byPosition = new HashMap<>();
		if (pieces != null)
			for (final Piece piece : pieces)
			{
				if (!inBounds(piece.position))
					throw new IllegalArgumentException("Piece out of bounds: " + piece);
				if (byId.put(piece.id, piece) != null)
					throw new IllegalArgumentException("Duplicate piece id: " + piece.id);
				final Piece other = byPosition.put(piece.position, piece);
				if (other != null)
					throw new IllegalArgumentException("Pieces overlap: " + other + " and " + piece);
			}
		this.pieces = ImmutableSortedMap.copyOf(byId);
		occupancy = ImmutableMap.copyOf(byPosition);
	}

	public static TangramsWorld empty(final int width, final int height)
	{
		return new TangramsWorld(width, height, ImmutableList.<Piece> of());
	}

	@JsonProperty("width")
	public int width()
	{
		return width;
	}

	@JsonProperty("height")
	public int height()
	{
		return height;
	}

	// sorted by id
	@JsonProperty("pieces")
	public ImmutableList<Piece> pieces()
	{
		return pieces.values().asList();
	}

	public int size()
	{
		return pieces.size();
	}

	public boolean contains(final int pieceId)
	{
		return pieces.containsKey(pieceId);
	}

	// null if there is no such piece
	public Piece piece(final int pieceId)
	{
		return pieces.get(pieceId);
	}

	// null if the cell is empty
	public Piece occupant(final Position position)
	{
		return occupancy.get(position);
	}

	public boolean inBounds(final Position p)
	{
		return p.x >= 0 && p.x < width && p.y >= 0 && p.y < height;
	}

	public boolean isFree(final Position p)
	{
		return inBounds(p) && !occupancy.containsKey(p);
	}

	public int nextPieceId()
	{
		return pieces.isEmpty() ? 1 : pieces.lastKey() + 1;
	}

	// All in-bounds cells without a piece, in row-major order.
	public List<Position> freeCells()
	{
		final List<Position> cells = new ArrayList<>();
		for (int y = 0; y < height; y++)
			for (int x = 0; x < width; x++)
			{
				final Position p = Position.of(x, y);
				if (!occupancy.containsKey(p))
					cells.add(p);
			}
		return cells;
	}

	// Returns a world where the given pieces replace (or join) the ones with the same id.
	public TangramsWorld with(final Piece... updated)
	{
		final Map<Integer, Piece> copy = new HashMap<>(pieces);
		for (final Piece piece : updated)
			copy.put(piece.id, piece);
		return new TangramsWorld(width, height, new ArrayList<>(copy.values()));
	}

	public TangramsWorld without(final int pieceId)
	{
		final Map<Integer, Piece> copy = new HashMap<>(pieces);
		copy.remove(pieceId);
		return new TangramsWorld(width, height, new ArrayList<>(copy.values()));
	}

	public String toJSON()
	{
		return Json.writeValueAsStringHard(this);
	}

	public static TangramsWorld fromJSON(final String json)
	{
		return Json.readValueHard(json, TangramsWorld.class);
	}

	/**
	 * Reads the one-row world notation of the rlong tangrams data, e.g. {@code "1:A 2:B 3:C"}: position (1-based) and shape. The piece at position
	 * {@code k} gets id {@code k} and lies on cell {@code (k-1, 0)}. A shape of {@code _} marks an empty position.
	 */
	public static TangramsWorld fromRlongString(final String s, final int width, final int height)
	{
		final List<Piece> parsed = new ArrayList<>();
		for (final String token : Splitter.on(' ').omitEmptyStrings().trimResults().split(s))
		{
			final List<String> parts = Splitter.on(':').splitToList(token);
			if (parts.size() != 2)
				throw new IllegalArgumentException("Bad tangrams token '" + token + "' in: " + s);
			final int position = Integer.parseInt(parts.get(0));
			if ("_".equals(parts.get(1)))
				continue;
			parsed.add(new Piece(position, parts.get(1), Position.of(position - 1, 0), Orientation.NORTH));
		}
		return new TangramsWorld(width, height, parsed);
	}

	@Override
	public boolean equals(final Object obj)
	{
		if (this == obj)
			return true;
		if (!(obj instanceof TangramsWorld))
			return false;
		final TangramsWorld other = (TangramsWorld) obj;
		return width == other.width && height == other.height && pieces.equals(other.pieces);
	}

	@Override
	public int hashCode()
	{
		int hash = 0x7ed55d16;
		hash = hash * 0xd3a2646c + width;
		hash = hash * 0xd3a2646c + height;
		hash = hash * 0xd3a2646c + pieces.hashCode();
		return hash;
	}

	@Override
	public String toString()
	{
		return width + "x" + height + "[" + Joiner.on(' ').join(pieces.values()) + "]";
	}
}
