package edu.stanford.nlp.strongsup.test;

import static org.testng.AssertJUnit.assertEquals;

import edu.stanford.nlp.strongsup.Builder;
import edu.stanford.nlp.strongsup.Candidate;
import edu.stanford.nlp.strongsup.MeritocraticCaseWeighter;
import edu.stanford.nlp.strongsup.ReinforceCaseWeighter;
import java.util.List;
import org.testng.annotations.Test;

/**
 * Test how beams are turned into gradient weights. The beam is the five programs of a one-step move search under zero weights, so every candidate
 * has probability 1/5.
 */
public class CaseWeighterTest
{
	private static final double EPS = 1e-9;

	private static List<Candidate> uniformBeam()
	{
		final Builder b = new Builder(TestUtils.settings("strongsup.world.operations = [move]", "strongsup.search { beamWidth = 8, maxProgramLength = 2 }"));
		b.build();
		final List<Candidate> beam = b.testSearch.search(TestUtils.moveExample("m"), b.params.snapshot()).toList();
		assertEquals(5, beam.size());
		return beam;
	}

	private static double sum(final double[] xs)
	{
		double s = 0;
		for (final double x : xs)
			s += x;
		return s;
	}

	@Test
	public void reinforceWithMeanBaselineIsCentered()
	{
		final double[] rewards = { 1.0, 0.0, 0.0, 0.5, -1.0 };
		final double[] w = new ReinforceCaseWeighter(ReinforceCaseWeighter.Baseline.MEAN, 0.9).weights(uniformBeam(), rewards);
		// baseline 0.1
		assertEquals(0.2 * 0.9, w[0], EPS);
		assertEquals(0.2 * -0.1, w[1], EPS);
		assertEquals(0.2 * -1.1, w[4], EPS);
		assertEquals(0.0, sum(w), EPS);
	}

	@Test
	public void reinforceWithoutBaseline()
	{
		final double[] w = new ReinforceCaseWeighter(ReinforceCaseWeighter.Baseline.NONE, 0.9).weights(uniformBeam(), new double[] { 1.0, 0.0, 0.0, 0.5, -1.0 });
		assertEquals(0.2, w[0], EPS);
		assertEquals(0.1, w[3], EPS);
	}

	@Test
	public void movingBaselineFollowsBatches()
	{
		final ReinforceCaseWeighter weighter = new ReinforceCaseWeighter(ReinforceCaseWeighter.Baseline.MOVING, 0.5);
		weighter.observeBatch(new double[] { 1.0, 0.0 });
		assertEquals(0.5, weighter.getMovingAverage(), EPS);
		weighter.observeBatch(new double[] { 0.0 });
		assertEquals(0.25, weighter.getMovingAverage(), EPS);
		final double[] w = weighter.weights(uniformBeam(), new double[] { 1.0, 0.0, 0.0, 0.0, 0.0 });
		assertEquals(0.2 * 0.75, w[0], EPS);
		assertEquals(0.2 * -0.25, w[1], EPS);
	}

	@Test
	public void mmlSplitsCreditAmongRewardedCandidates()
	{
		final double[] w = new MeritocraticCaseWeighter(1.0).weights(uniformBeam(), new double[] { 1.0, 0.0, 0.0, 0.5, -1.0 });
		assertEquals(2.0 / 3, w[0], EPS);
		assertEquals(1.0 / 3, w[3], EPS);
		assertEquals(0.0, w[4], EPS);
		assertEquals(1.0, sum(w), EPS);
	}

	@Test
	public void nothingRewardedMeansNoWeight()
	{
		final double[] w = new MeritocraticCaseWeighter(0.0).weights(uniformBeam(), new double[] { 0.0, 0.0, -1.0, 0.0, -0.5 });
		assertEquals(0.0, sum(w), EPS);
	}
}
