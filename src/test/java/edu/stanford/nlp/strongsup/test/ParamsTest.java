package edu.stanford.nlp.strongsup.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertTrue;

import com.google.common.collect.ImmutableMap;
import edu.stanford.nlp.strongsup.Checkpoint;
import edu.stanford.nlp.strongsup.CheckpointManager;
import edu.stanford.nlp.strongsup.Params;
import edu.stanford.nlp.strongsup.ParamsSnapshot;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import org.testng.annotations.Test;

/**
 * Test parameter updates, snapshots and persistence.
 */
public class ParamsTest
{
	private static final double EPS = 1e-9;

	private static Params params(final String... lines)
	{
		return new Params(TestUtils.settings(lines).params);
	}

	@Test
	public void adaGrad()
	{
		final Params params = params();
		params.update(ImmutableMap.of("f :: a", 2.0));
		// step 0.1 / sqrt(4)
		assertEquals(0.1, params.getWeight("f :: a"), EPS);
		params.update(ImmutableMap.of("f :: a", 2.0, "f :: b", -1.0));
		assertEquals(0.1 + 0.2 / Math.sqrt(8), params.getWeight("f :: a"), EPS);
		assertEquals(-0.1, params.getWeight("f :: b"), EPS);
		assertEquals(2, params.getNumUpdates());
	}

	@Test
	public void decayingStepSize()
	{
		final Params params = params("strongsup.params { adaptiveStepSize = false, initStepSize = 1.0, stepSizeReduction = 1.0 }");
		params.update(ImmutableMap.of("f :: a", 1.0));
		params.update(ImmutableMap.of("f :: a", 1.0));
		assertEquals(1.5, params.getWeight("f :: a"), EPS);
	}

	@Test
	public void snapshotsAreFrozenAndVersioned()
	{
		final Params params = params("strongsup.params.defaultWeight = 0.25");
		final ParamsSnapshot before = params.snapshot();
		assertEquals(0, before.version());
		assertTrue(before.isCurrent());
		assertEquals(0.25, before.getWeight("f :: unseen"), EPS);

		assertEquals(1, params.update(ImmutableMap.of("f :: a", 1.0)));
		assertFalse(before.isCurrent());
		assertEquals(0.25, before.getWeight("f :: a"), EPS);
		assertEquals(0.35, params.snapshot().getWeight("f :: a"), EPS);
		assertTrue(params.snapshot().isCurrent());
	}

	@Test
	public void tsvRoundTrip() throws IOException
	{
		final Params params = params();
		params.update(ImmutableMap.of("f :: a", 1.0, "f :: b", -3.0));
		final File file = Files.createTempFile("params", ".tsv").toFile();
		file.deleteOnExit();
		params.write(file);
		assertEquals("f :: a\t0.1", Files.readAllLines(file.toPath()).get(0));

		final Params back = params();
		back.read(file);
		assertEquals(params.getWeight("f :: a"), back.getWeight("f :: a"), EPS);
		assertEquals(params.getWeight("f :: b"), back.getWeight("f :: b"), EPS);
	}

	@Test
	public void checkpointRoundTripKeepsOptimizerState() throws IOException
	{
		final Params params = params();
		params.update(ImmutableMap.of("f :: a", 2.0));
		params.update(ImmutableMap.of("f :: a", 1.0));
		final File dir = Files.createTempDirectory("checkpoints").toFile();
		final File file = new CheckpointManager(dir).save(new Checkpoint(7, 1, 3, 0.0, params.exportState()), params);
		assertEquals("checkpoint-7.json", file.getName());
		assertTrue(new File(dir, "params-7.tsv").isFile());

		final Checkpoint loaded = CheckpointManager.load(file);
		assertEquals(7, loaded.step);
		assertEquals(3, loaded.cursor);
		final Params restored = params();
		restored.restore(loaded.params);
		assertEquals(params.version(), restored.version());
		assertEquals(params.getNumUpdates(), restored.getNumUpdates());

		// same AdaGrad history: the next update moves both the same way
		params.update(ImmutableMap.of("f :: a", 1.0));
		restored.update(ImmutableMap.of("f :: a", 1.0));
		assertEquals(params.getWeight("f :: a"), restored.getWeight("f :: a"), EPS);
	}
}
