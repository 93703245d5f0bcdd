package edu.stanford.nlp.strongsup.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertNotNull;
import static org.testng.AssertJUnit.assertTrue;
import static org.testng.AssertJUnit.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.stanford.nlp.strongsup.Builder;
import edu.stanford.nlp.strongsup.Candidate;
import edu.stanford.nlp.strongsup.Example;
import edu.stanford.nlp.strongsup.NumericInstabilityError;
import edu.stanford.nlp.strongsup.ReinforceCaseWeighter;
import edu.stanford.nlp.strongsup.RewardResult;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.testng.annotations.Test;

/**
 * Test gradient computation and parameter updates.
 */
public class PolicyTrainerTest
{
	private static final double EPS = 1e-9;

	private static Builder build(final String... lines)
	{
		final Builder builder = new Builder(TestUtils.settings(lines));
		builder.build();
		return builder;
	}

	private static double probOf(final Builder b, final Example ex, final String program)
	{
		final Candidate c = TestUtils.find(b.testSearch.search(ex, b.params.snapshot()).toList(), program);
		assertNotNull(program + " not in beam", c);
		return Math.exp(c.logProb);
	}

	// One training step on |ex| with the train-time search.
	private static void step(final Builder b, final Example ex)
	{
		final List<Candidate> beam = b.trainSearch.search(ex, b.params.snapshot()).toList();
		final double[] rewards = new double[beam.size()];
		for (int i = 0; i < beam.size(); i++)
			rewards[i] = b.evaluator.evaluate(beam.get(i), ex).reward;
		b.policyTrainer.update(ImmutableList.of(b.policyTrainer.gradient(beam, rewards)));
	}

	@Test
	public void trainingRaisesTheProbabilityOfTheRewardedProgram()
	{
		for (final String weighter : new String[] { "reinforce", "mml", "meritocratic" })
		{
			final Builder b = build("strongsup.features.domains = [ordinal]", "strongsup.world.operations = [move]", "strongsup.search { beamWidth = 8, maxProgramLength = 2, trainExploration = beam }", "strongsup.trainer.caseWeighter = " + weighter);
			final Example ex = TestUtils.moveExample("m");
			final String correct = "move(1,3,0) stop";
			assertEquals(RewardResult.Outcome.FULL_MATCH, b.evaluator.evaluate(TestUtils.find(b.testSearch.search(ex, b.params.snapshot()).toList(), correct), ex).outcome);

			final double before = probOf(b, ex, correct);
			assertEquals(0.2, before, EPS);
			double last = before;
			for (int i = 0; i < 5; i++)
			{
				step(b, ex);
				final double now = probOf(b, ex, correct);
				assertTrue(weighter + " step " + i + ": " + now + " <= " + last, now > last);
				last = now;
			}
			assertEquals(5, b.params.version());
		}
	}

	@Test
	public void nonFiniteGradientIsRejected()
	{
		final Builder b = build();
		b.params.update(ImmutableMap.of("bias :: move", 1.0));
		final long version = b.params.version();
		final Map<String, Double> bad = new HashMap<>();
		bad.put("bias :: move", 1.0);
		bad.put("bias :: stop", Double.NaN);
		try
		{
			b.policyTrainer.update(ImmutableList.of(bad));
			fail("expected NumericInstabilityError");
		}
		catch (final NumericInstabilityError e)
		{
			assertEquals(version, b.params.version());
			assertEquals(0.1, b.params.getWeight("bias :: move"), EPS);
			assertEquals(0.0, b.params.getWeight("bias :: stop"), EPS);
		}
	}

	@Test
	public void gradientNormIsClipped()
	{
		final Builder b = build("strongsup.params { adaptiveStepSize = false, initStepSize = 1.0 }", "strongsup.trainer.maxGradientNorm = 1.0");
		b.policyTrainer.update(ImmutableList.of(ImmutableMap.of("a :: x", 1.0, "a :: y", 4.0), ImmutableMap.of("a :: x", 2.0)));
		// sum (3, 4) has norm 5
		assertEquals(0.6, b.params.getWeight("a :: x"), EPS);
		assertEquals(0.8, b.params.getWeight("a :: y"), EPS);
	}

	@Test
	public void rewardsAreClippedAndStandardized()
	{
		final double[] clipped = build().policyTrainer.shapeRewards(new double[] { -5, 0.5, 3 });
		assertEquals(-1.0, clipped[0], EPS);
		assertEquals(0.5, clipped[1], EPS);
		assertEquals(1.0, clipped[2], EPS);

		final double[] standardized = build("strongsup.trainer.normalizeRewards = true").policyTrainer.shapeRewards(new double[] { 0, 1 });
		assertEquals(-1.0, standardized[0], EPS);
		assertEquals(1.0, standardized[1], EPS);

		final double[] flat = build("strongsup.trainer.normalizeRewards = true").policyTrainer.shapeRewards(new double[] { 0.5, 0.5 });
		assertEquals(0.0, flat[0], EPS);
	}

	@Test
	public void movingBaselineTracksClippedRewards()
	{
		final Builder b = build("strongsup.trainer { caseWeighter = reinforce, baseline = moving, baselineDecay = 0.5 }");
		final ReinforceCaseWeighter weighter = (ReinforceCaseWeighter) b.policyTrainer.getCaseWeighter();
		b.policyTrainer.observeBatch(new double[] { 5.0, 3.0 });
		assertEquals(1.0, weighter.getMovingAverage(), EPS);
		b.policyTrainer.observeBatch(new double[] { -4.0, 0.0 });
		assertEquals(0.5 * 1.0 + 0.5 * -0.5, weighter.getMovingAverage(), EPS);
	}

	@Test
	public void emptyBeamHasNoGradient()
	{
		assertTrue(build().policyTrainer.gradient(ImmutableList.<Candidate> of(), new double[0]).isEmpty());
	}
}
