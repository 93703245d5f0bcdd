package edu.stanford.nlp.strongsup.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertNull;

import com.google.common.collect.ImmutableMap;
import edu.stanford.nlp.strongsup.Checkpoint;
import edu.stanford.nlp.strongsup.Example;
import edu.stanford.nlp.strongsup.Json;
import edu.stanford.nlp.strongsup.Params;
import edu.stanford.nlp.strongsup.tangrams.Orientation;
import org.testng.annotations.Test;

/**
 * Test the persisted forms of examples and checkpoints.
 */
public class JsonTest
{
	@Test
	public void exampleKeepsItsWorlds()
	{
		final Example ex = TestUtils.moveExample("m");
		final String json = ex.toJSON();
		// derived state is not written
		assertFalse(json, json.contains("tokens"));
		final Example back = Example.fromJSON(json);
		assertEquals("m", back.id);
		assertEquals(ex.utterance, back.utterance);
		assertEquals(ex.initialState, back.initialState);
		assertEquals(ex.targetState, back.targetState);
		assertEquals(ex.getTokens().tokens(), back.getTokens().tokens());
	}

	@Test
	public void exampleWithoutTargetIsReadable()
	{
		final Example ex = Example.fromJSON("{\"id\":\"x\",\"utterance\":\"Rotate it\",\"initialState\":{\"width\":2,\"height\":2,\"pieces\":[{\"id\":1,\"shape\":\"A\",\"position\":{\"x\":1,\"y\":1},\"orientation\":\"WEST\"}]},\"comment\":\"ignored\"}");
		assertNull(ex.targetState);
		assertFalse(ex.hasTarget());
		assertEquals(Orientation.WEST, ex.initialState.piece(1).orientation);
		assertEquals("rotate", ex.getTokens().tokens().get(0));
	}

	@Test
	public void checkpointKeepsOptimizerState()
	{
		final Params.State params = new Params.State(ImmutableMap.of("bias :: move", 0.5), ImmutableMap.of("bias :: move", 4.0), 3, 7);
		final Checkpoint back = Json.readValueHard(Json.prettyWriteValueAsStringHard(new Checkpoint(12, 1, 5, 0.25, params)), Checkpoint.class);
		assertEquals(12, back.step);
		assertEquals(1, back.epoch);
		assertEquals(5, back.cursor);
		assertEquals(0.25, back.baseline, 0.0);
		assertEquals(0.5, back.params.weights.get("bias :: move"), 0.0);
		assertEquals(4.0, back.params.sumSquaredGradients.get("bias :: move"), 0.0);
		assertEquals(3, back.params.numUpdates);
		assertEquals(7, back.params.version);
	}
}
