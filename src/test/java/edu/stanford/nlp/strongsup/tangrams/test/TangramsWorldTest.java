package edu.stanford.nlp.strongsup.tangrams.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertNull;
import static org.testng.AssertJUnit.assertTrue;

import edu.stanford.nlp.strongsup.tangrams.Orientation;
import edu.stanford.nlp.strongsup.tangrams.Piece;
import edu.stanford.nlp.strongsup.tangrams.Position;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;
import java.util.Arrays;
import org.testng.annotations.Test;

/**
 * Test the board invariants and its serialized forms.
 */
public class TangramsWorldTest
{
	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectsOverlap()
	{
		new TangramsWorld(3, 1, Arrays.asList(new Piece(1, "A", Position.of(0, 0), null), new Piece(2, "B", Position.of(0, 0), null)));
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectsDuplicateIds()
	{
		new TangramsWorld(3, 1, Arrays.asList(new Piece(1, "A", Position.of(0, 0), null), new Piece(1, "B", Position.of(1, 0), null)));
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectsOutOfBounds()
	{
		new TangramsWorld(3, 1, Arrays.asList(new Piece(1, "A", Position.of(0, 1), null)));
	}

	@Test
	public void rlongNotation()
	{
		final TangramsWorld w = TangramsWorld.fromRlongString("1:A 2:_ 3:C", 5, 1);
		assertEquals(2, w.size());
		assertEquals("A", w.piece(1).shape);
		assertEquals(Position.of(2, 0), w.piece(3).position);
		assertNull(w.occupant(Position.of(1, 0)));
		assertEquals(4, w.nextPieceId());
		assertEquals(3, w.freeCells().size());
		assertTrue(w.isFree(Position.of(4, 0)));
		assertFalse(w.isFree(Position.of(5, 0)));
	}

	@Test
	public void jsonRoundTrip()
	{
		final TangramsWorld w = new TangramsWorld(4, 2, Arrays.asList(new Piece(2, "B", Position.of(3, 1), Orientation.WEST), new Piece(1, "A", Position.of(0, 0), Orientation.NORTH)));
		final String json = w.toJSON();
		final TangramsWorld back = TangramsWorld.fromJSON(json);
		assertEquals(w, back);
		assertEquals(json, back.toJSON());
		assertEquals(Orientation.WEST, back.piece(2).orientation);
	}
}
