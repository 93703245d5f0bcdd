package edu.stanford.nlp.strongsup;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The training loop, as an explicit state machine:
 *
 * <pre>
 * INIT -> SAMPLE_BATCH -> SEARCH -> EVALUATE -> UPDATE -> (CHECKPOINT) -> SAMPLE_BATCH ... -> TERMINATE
 * </pre>
 *
 * The examples of a batch are searched and evaluated in parallel against one parameter snapshot; their gradients are summed in batch order and
 * applied once. A stop request is honored at the next step boundary.
 */
public class Trainer implements AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger(Trainer.class);

	public enum State
	{
		INIT, SAMPLE_BATCH, SEARCH, EVALUATE, UPDATE, CHECKPOINT, TERMINATE
	}

	public static class Options
	{
		public final int batchSize;
		public final int maxSteps;
		public final int maxEpochs;
		public final int numThreads;
		public final boolean shuffle;
		public final long seed;
		public final String checkpointDir;
		// 0 disables periodic checkpoints
		public final int checkpointEvery;
		// 0 disables periodic evaluation
		public final int evalEvery;
		// empty for none
		public final String beamDumpFile;

		public Options(final Config config)
		{
			batchSize = config.getInt("batchSize");
			maxSteps = config.getInt("maxSteps");
			maxEpochs = config.getInt("maxEpochs");
			numThreads = config.getInt("numThreads");
			shuffle = config.getBoolean("shuffle");
			seed = config.getLong("seed");
			checkpointDir = config.getString("checkpointDir");
			checkpointEvery = config.getInt("checkpointEvery");
			evalEvery = config.getInt("evalEvery");
			beamDumpFile = config.getString("beamDumpFile");
			ConfigurationError.check(batchSize > 0, "trainer.batchSize must be positive, got %d", batchSize);
			ConfigurationError.check(maxSteps >= 0, "trainer.maxSteps must be non-negative, got %d", maxSteps);
			ConfigurationError.check(maxEpochs > 0, "trainer.maxEpochs must be positive, got %d", maxEpochs);
			ConfigurationError.check(numThreads > 0, "trainer.numThreads must be positive, got %d", numThreads);
			ConfigurationError.check(checkpointEvery >= 0, "trainer.checkpointEvery must be non-negative, got %d", checkpointEvery);
			ConfigurationError.check(evalEvery >= 0, "trainer.evalEvery must be non-negative, got %d", evalEvery);
		}
	}

	public static class Summary
	{
		public final int steps;
		public final int epochs;
		public final long version;
		public final int skippedExamples;
		public final int skippedUpdates;
		public final boolean stopped;
		// null without a dev set
		public final EvaluationStats dev;

		Summary(final int steps, final int epochs, final long version, final int skippedExamples, final int skippedUpdates, final boolean stopped, final EvaluationStats dev)
		{
			this.steps = steps;
			this.epochs = epochs;
			this.version = version;
			this.skippedExamples = skippedExamples;
			this.skippedUpdates = skippedUpdates;
			this.stopped = stopped;
			this.dev = dev;
		}

		@Override
		public String toString()
		{
			return String.format("steps=%d epochs=%d version=%d skippedExamples=%d skippedUpdates=%d%s%s", steps, epochs, version, skippedExamples, skippedUpdates, stopped ? " (stopped)" : "", dev == null ? "" : " dev: " + dev.summary());
		}
	}

	private final Options opts;
	private final Dataset dataset;
	private final Params params;
	private final ExplorationPolicy trainSearch;
	private final ExplorationPolicy testSearch;
	private final PolicyTrainer policyTrainer;
	private final ExampleProcessor processor;
	private final CheckpointManager checkpoints;
	private final ExecutorService executor;
	private final AtomicBoolean stopRequested = new AtomicBoolean();

	private volatile State state = State.INIT;
	private int step;
	private int epoch;
	private int cursor;
	private List<Example> order;
	private int skippedExamples;
	private int skippedUpdates;
	private int lastCheckpointStep = -1;

	// Current batch
	private List<Example> batch;
	private ParamsSnapshot snapshot;
	private List<List<Candidate>> beams;
	private List<ExampleProcessor.Evaluated> evaluated;

	public Trainer(final Options opts, final Dataset dataset, final Params params, final ExplorationPolicy trainSearch, final ExplorationPolicy testSearch, final PolicyTrainer policyTrainer, final ExampleProcessor processor, final CheckpointManager checkpoints)
	{
		this.opts = opts;
		this.dataset = dataset;
		this.params = params;
		this.trainSearch = trainSearch;
		this.testSearch = testSearch;
		this.policyTrainer = policyTrainer;
		this.processor = processor;
		this.checkpoints = checkpoints;
		executor = Executors.newFixedThreadPool(opts.numThreads, new ThreadFactoryBuilder().setNameFormat("strongsup-worker-%d").setDaemon(true).build());
	}

	public State getState()
	{
		return state;
	}

	public int getStep()
	{
		return step;
	}

	// Honored at the next step boundary.
	public void requestStop()
	{
		if (!stopRequested.getAndSet(true))
			LOG.info("Stop requested");
	}

	public void restore(final Checkpoint checkpoint)
	{
		if (state != State.INIT)
			throw new IllegalStateException("Cannot restore a checkpoint in state " + state);
		params.restore(checkpoint.params);
		step = checkpoint.step;
		epoch = checkpoint.epoch;
		cursor = checkpoint.cursor;
		lastCheckpointStep = checkpoint.step;
		if (policyTrainer.getCaseWeighter() instanceof ReinforceCaseWeighter)
			((ReinforceCaseWeighter) policyTrainer.getCaseWeighter()).restoreMovingAverage(checkpoint.baseline);
		LOG.info("Resuming at step {} (epoch {}, example {})", step, epoch, cursor);
	}

	public Checkpoint checkpoint()
	{
		final double baseline = policyTrainer.getCaseWeighter() instanceof ReinforceCaseWeighter ? ((ReinforceCaseWeighter) policyTrainer.getCaseWeighter()).getMovingAverage() : 0;
		return new Checkpoint(step, epoch, cursor, baseline, params.exportState());
	}

	public Summary run()
	{
		EvaluationStats dev = null;
		while (state != State.TERMINATE)
			switch (state)
			{
				case INIT:
					LOG.info("Training on {} examples: batchSize={} maxSteps={} maxEpochs={} threads={}", dataset.train().size(), opts.batchSize, opts.maxSteps, opts.maxEpochs, opts.numThreads);
					if (dataset.train().isEmpty())
					{
						LOG.warn("No training examples");
						state = State.TERMINATE;
						break;
					}
					order = epochOrder(epoch);
					state = State.SAMPLE_BATCH;
					break;
				case SAMPLE_BATCH:
					state = sampleBatch();
					break;
				case SEARCH:
					search();
					state = State.EVALUATE;
					break;
				case EVALUATE:
					evaluate();
					state = State.UPDATE;
					break;
				case UPDATE:
					update();
					step++;
					if (opts.evalEvery > 0 && step % opts.evalEvery == 0 && !dataset.dev().isEmpty())
						evaluate(dataset.dev(), "dev");
					state = opts.checkpointEvery > 0 && step % opts.checkpointEvery == 0 ? State.CHECKPOINT : State.SAMPLE_BATCH;
					break;
				case CHECKPOINT:
					saveCheckpoint();
					state = State.SAMPLE_BATCH;
					break;
				default:
					throw new IllegalStateException("Unexpected state " + state);
			}

		if (step > 0 && lastCheckpointStep != step)
			saveCheckpoint();
		if (!dataset.dev().isEmpty())
			dev = evaluate(dataset.dev(), "dev");
		final Summary summary = new Summary(step, epoch, params.version(), skippedExamples, skippedUpdates, stopRequested.get(), dev);
		LOG.info("Training done: {}", summary);
		return summary;
	}

	private State sampleBatch()
	{
		if (stopRequested.get())
			return State.TERMINATE;
		if (step >= opts.maxSteps)
		{
			LOG.info("Reached maxSteps={}", opts.maxSteps);
			return State.TERMINATE;
		}
		if (cursor >= order.size())
		{
			epoch++;
			cursor = 0;
			if (epoch < opts.maxEpochs)
				order = epochOrder(epoch);
		}
		if (epoch >= opts.maxEpochs)
		{
			LOG.info("Reached maxEpochs={}", opts.maxEpochs);
			return State.TERMINATE;
		}
		final int end = Math.min(cursor + opts.batchSize, order.size());
		batch = order.subList(cursor, end);
		cursor = end;
		return State.SEARCH;
	}

	private void search()
	{
		snapshot = params.snapshot();
		final List<Callable<List<Candidate>>> tasks = new ArrayList<>();
		for (final Example ex : batch)
			tasks.add(() -> processor.search(trainSearch, ex, snapshot));
		beams = invokeAll(tasks);
	}

	private void evaluate()
	{
		final List<Callable<ExampleProcessor.Evaluated>> tasks = new ArrayList<>();
		for (int i = 0; i < batch.size(); i++)
		{
			final Example ex = batch.get(i);
			final List<Candidate> beam = beams.get(i);
			tasks.add(() -> beam == null ? null : processor.evaluate(ex, beam, true));
		}
		evaluated = invokeAll(tasks);
	}

	private void update()
	{
		final List<Map<String, Double>> gradients = new ArrayList<>();
		final List<Double> rewards = new ArrayList<>();
		final EvaluationStats stats = new EvaluationStats();
		for (final ExampleProcessor.Evaluated e : evaluated)
		{
			if (e == null)
			{
				skippedExamples++;
				stats.addFailure();
				continue;
			}
			gradients.add(e.gradient);
			for (final double r : e.rewards)
				rewards.add(r);
			if (e.beam.isEmpty())
				stats.addFailure();
			else
				stats.add(e.topCorrect(), e.oracleCorrect(), e.topReward());
		}
		try
		{
			if (!gradients.isEmpty())
				policyTrainer.update(gradients);
			final double[] batchRewards = new double[rewards.size()];
			for (int i = 0; i < batchRewards.length; i++)
				batchRewards[i] = rewards.get(i);
			policyTrainer.observeBatch(batchRewards);
		}
		catch (final NumericInstabilityError e)
		{
			skippedUpdates++;
			LOG.warn("Step {}: update skipped", step, e);
		}
		LOG.info("Step {} (epoch {}): {} params=v{}", step, epoch, stats.summary(), params.version());
		batch = null;
		beams = null;
		evaluated = null;
	}

	private void saveCheckpoint()
	{
		checkpoints.save(checkpoint(), params);
		lastCheckpointStep = step;
	}

	/**
	 * Decodes |examples| with the test-time search and the current parameters.
	 */
	public EvaluationStats evaluate(final List<Example> examples, final String prefix)
	{
		final ParamsSnapshot current = params.snapshot();
		final List<Callable<ExampleProcessor.Evaluated>> tasks = new ArrayList<>();
		for (final Example ex : examples)
			tasks.add(() -> {
				final List<Candidate> beam = processor.search(testSearch, ex, current);
				return beam == null ? null : processor.evaluate(ex, beam, false);
			});
		final EvaluationStats stats = new EvaluationStats();
		for (final ExampleProcessor.Evaluated e : invokeAll(tasks))
			if (e == null || e.beam.isEmpty())
				stats.addFailure();
			else
				stats.add(e.topCorrect(), e.oracleCorrect(), e.topReward());
		LOG.info("Evaluation ({}) at step {}: {}", prefix, step, stats.summary());
		return stats;
	}

	private List<Example> epochOrder(final int e)
	{
		final List<Example> examples = new ArrayList<>(dataset.train());
		if (opts.shuffle)
			Collections.shuffle(examples, new Random(opts.seed + e));
		return examples;
	}

	// Runs |tasks| on the pool and waits for all of them; results keep the order of the tasks.
	private <T> List<T> invokeAll(final List<Callable<T>> tasks)
	{
		final List<T> results = new ArrayList<>(tasks.size());
		try
		{
			for (final Future<T> future : executor.invokeAll(tasks))
				results.add(future.get());
		}
		catch (final InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new StrongSupError("Interrupted while waiting for workers", e);
		}
		catch (final ExecutionException e)
		{
			throw new StrongSupError("Worker failed", e.getCause());
		}
		return results;
	}

	@Override
	public void close()
	{
		executor.shutdown();
		try
		{
			if (!executor.awaitTermination(30, TimeUnit.SECONDS))
				executor.shutdownNow();
		}
		catch (final InterruptedException e)
		{
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
