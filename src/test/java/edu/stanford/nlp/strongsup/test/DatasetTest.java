package edu.stanford.nlp.strongsup.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertNull;
import static org.testng.AssertJUnit.assertTrue;

import edu.stanford.nlp.strongsup.ConfigurationError;
import edu.stanford.nlp.strongsup.Dataset;
import edu.stanford.nlp.strongsup.Example;
import edu.stanford.nlp.strongsup.RewardResult;
import edu.stanford.nlp.strongsup.Settings;
import edu.stanford.nlp.strongsup.StrongSupError;
import edu.stanford.nlp.strongsup.tangrams.Program;
import edu.stanford.nlp.strongsup.tangrams.TangramsRewardEvaluator;
import edu.stanford.nlp.strongsup.tangrams.TangramsSimulator;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import org.testng.annotations.Test;

/**
 * Test reading examples in both dataset formats.
 */
public class DatasetTest
{
	private static File resource(final String name)
	{
		try
		{
			return new File(DatasetTest.class.getResource("/data/" + name).toURI());
		}
		catch (final URISyntaxException e)
		{
			throw new IllegalStateException(e);
		}
	}

	private static Dataset.Options options(final String train, final int maxExamples)
	{
		return TestUtils.settings("strongsup.dataset.train = \"" + train + "\"", "strongsup.dataset.maxExamples = " + maxExamples).dataset;
	}

	@Test
	public void readsJsonLines()
	{
		final File file = resource("tangrams-small.jsonl");
		final List<Example> examples = Dataset.read(file, options(file.getPath(), -1));
		assertEquals(3, examples.size());
		assertEquals("move-1", examples.get(0).id);
		assertEquals("rotate-1", examples.get(2).id);
		assertEquals(2, examples.get(0).initialState.size());
		assertTrue(examples.get(1).hasTarget());
		assertEquals(1, examples.get(1).targetState.size());
	}

	@Test
	public void maxExamplesLimitsTheRead()
	{
		final File file = resource("tangrams-small.jsonl");
		assertEquals(2, Dataset.read(file, options(file.getPath(), 2)).size());
		assertEquals(0, Dataset.read(file, options(file.getPath(), 0)).size());
	}

	@Test
	public void readsRlongInteractions()
	{
		final File file = resource("tangrams-small.tsv");
		final Settings settings = TestUtils.settings("strongsup.dataset.train = \"" + file.getPath() + "\"");
		final List<Example> examples = Dataset.read(file, settings.dataset);
		assertEquals(2, examples.size());
		assertEquals("train-1-0", examples.get(0).id);
		assertEquals("train-1-1", examples.get(1).id);
		assertEquals("swap the first and the third figure", examples.get(0).utterance);
		// each turn starts where the previous one ended
		assertEquals(examples.get(0).targetState, examples.get(1).initialState);
		assertEquals(5, examples.get(0).initialState.width());

		// pieces keep their ids across turns, so one operation explains each turn
		final TangramsRewardEvaluator evaluator = new TangramsRewardEvaluator(settings.reward, new TangramsSimulator());
		final Example swap = examples.get(0);
		final Example remove = examples.get(1);
		assertEquals(RewardResult.Outcome.FULL_MATCH, evaluator.evaluate(Program.fromString("swap(1,3) stop"), swap.initialState, swap.targetState).outcome);
		assertEquals(RewardResult.Outcome.FULL_MATCH, evaluator.evaluate(Program.fromString("remove(2) stop"), remove.initialState, remove.targetState).outcome);
	}

	@Test
	public void relabelingKeepsShapeIds()
	{
		final Example ex = Dataset.read(resource("tangrams-small.tsv"), options("unused", -1)).get(0);
		// "1:C 2:B 3:A": C is still piece 3, now on the first cell
		assertEquals("C", ex.targetState.piece(3).shape);
		assertEquals(0, ex.targetState.piece(3).position.x);
		assertEquals(2, ex.targetState.piece(1).position.x);
		assertNull(ex.targetState.piece(4));
	}

	@Test(expectedExceptions = ConfigurationError.class)
	public void missingFileIsAConfigurationError()
	{
		Dataset.read(new File("no/such/file.jsonl"), options("no/such/file.jsonl", -1));
	}

	@Test
	public void malformedLineReportsItsPosition() throws IOException
	{
		final File file = File.createTempFile("strongsup-bad", ".jsonl");
		file.deleteOnExit();
		Files.write(file.toPath(), (TestUtils.moveExample("ok").toJSON() + "\n{\"id\": \"broken\"\n").getBytes(StandardCharsets.UTF_8));
		try
		{
			Dataset.read(file, options(file.getPath(), -1));
			assertFalse("expected a failure", true);
		}
		catch (final StrongSupError e)
		{
			assertTrue(e.getMessage(), e.getMessage().contains(file.getName() + ":2"));
		}
	}

	@Test(expectedExceptions = ConfigurationError.class)
	public void emptyTrainPathIsRejected()
	{
		options("", -1);
	}
}
