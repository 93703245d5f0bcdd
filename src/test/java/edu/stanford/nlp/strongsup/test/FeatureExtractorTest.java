package edu.stanford.nlp.strongsup.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertTrue;

import edu.stanford.nlp.strongsup.ConfigurationError;
import edu.stanford.nlp.strongsup.Example;
import edu.stanford.nlp.strongsup.FeatureExtractor;
import edu.stanford.nlp.strongsup.FeatureVector;
import edu.stanford.nlp.strongsup.OperationProposer;
import edu.stanford.nlp.strongsup.Settings;
import edu.stanford.nlp.strongsup.tangrams.Operation;
import edu.stanford.nlp.strongsup.tangrams.Position;
import edu.stanford.nlp.strongsup.tangrams.Program;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.testng.annotations.Test;

/**
 * Test features and operation proposals.
 */
public class FeatureExtractorTest
{
	private static Map<String, Double> features(final String domains, final Example ex, final Program prefix, final Operation op)
	{
		final Settings settings = TestUtils.settings("strongsup.features.domains = " + domains);
		return new FeatureExtractor(settings.features).extract(ex, prefix, ex.initialState, op).toMap();
	}

	@Test
	public void ordinalsMatchPieceAndTarget()
	{
		final Example ex = TestUtils.moveExample("m");
		final Map<String, Double> right = features("[ordinal]", ex, Program.EMPTY, new Operation.Move(1, Position.of(3, 0)));
		assertTrue(right.toString(), right.containsKey("ordinal :: piece-match,move,0"));
		assertTrue(right.toString(), right.containsKey("ordinal :: target-match,move"));

		// the second piece to the third cell: nothing the utterance mentions
		final Map<String, Double> wrong = features("[ordinal]", ex, Program.EMPTY, new Operation.Move(2, Position.of(2, 0)));
		assertTrue(wrong.toString(), wrong.isEmpty());
	}

	@Test
	public void onlyConfiguredDomainsFire()
	{
		final Example ex = TestUtils.removeExample("r");
		final Map<String, Double> bias = features("[bias]", ex, Program.EMPTY, new Operation.Remove(2));
		assertEquals(1, bias.size());
		assertEquals(1.0, bias.get("bias :: remove"), 0.0);

		final Map<String, Double> all = features("[bias, lexical, shape, ordinal, direction, history]", ex, Program.of(new Operation.Remove(1)), new Operation.Remove(2));
		assertTrue(all.containsKey("lexical :: remove,remove"));
		assertTrue(all.containsKey("history :: prev=remove,remove"));
		assertTrue(all.containsKey("history :: step=1,remove"));
		assertFalse(all.containsKey("history :: same-piece,remove"));
		assertTrue(all.containsKey("ordinal :: piece-match,remove,0"));
	}

	@Test
	public void rotationAmountIsMatched()
	{
		final Example ex = new Example.Builder().setId("t").setUtterance("turn the first figure 180 degrees").setInitialState(TestUtils.row(3, TestUtils.piece(1, "A", 0))).createExample();
		assertTrue(features("[ordinal]", ex, Program.EMPTY, new Operation.Rotate(1, 2)).containsKey("ordinal :: turns-match"));
		assertFalse(features("[ordinal]", ex, Program.EMPTY, new Operation.Rotate(1, 1)).containsKey("ordinal :: turns-match"));
	}

	@Test(expectedExceptions = ConfigurationError.class)
	public void unknownDomainIsRejected()
	{
		TestUtils.settings("strongsup.features.domains = [bias, syntax]");
	}

	@Test
	public void proposalsEndWithStop()
	{
		final Settings settings = TestUtils.settings("strongsup.world.operations = [move, swap]");
		final List<Operation> ops = new OperationProposer(settings.world).propose(TestUtils.row(3, TestUtils.piece(1, "A", 0), TestUtils.piece(2, "B", 1)));
		// two pieces times one free cell, one swap, stop
		assertEquals(4, ops.size());
		assertEquals(Operation.fromString("move(1,2,0)"), ops.get(0));
		assertEquals(Operation.fromString("move(2,2,0)"), ops.get(1));
		assertEquals(Operation.fromString("swap(1,2)"), ops.get(2));
		assertEquals(Operation.STOP, ops.get(ops.size() - 1));
	}

	@Test
	public void repeatedFeaturesAddUp()
	{
		final FeatureVector v = new FeatureVector();
		v.add("a", "x");
		v.add("a", "x");
		v.add("b", "y");
		final Map<String, Double> counts = v.toMap();
		assertEquals(2, counts.size());
		assertEquals(2.0, counts.get("a :: x"), 1e-9);
		assertEquals(1.0, counts.get("b :: y"), 1e-9);

		final Map<String, Double> map = new HashMap<>();
		map.put("a :: x", 1.0);
		v.increment(-0.5, map);
		assertEquals(0.0, map.get("a :: x"), 1e-9);
		assertEquals(-0.5, map.get("b :: y"), 1e-9);
	}
}
