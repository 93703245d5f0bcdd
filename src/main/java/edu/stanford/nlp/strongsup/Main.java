package edu.stanford.nlp.strongsup;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Entry point: trains a policy on the configured dataset, or only evaluates it with {@code --eval-only}.
 */
@Command(name = "strongsup", mixinStandardHelpOptions = true, version = "strongsup 1.0", description = "Trains a tangrams instruction-following policy by reinforcement over program search.")
public class Main implements Callable<Integer>
{
	private static final Logger LOG = LoggerFactory.getLogger(Main.class);

	public static final int EXIT_CONFIGURATION_ERROR = 2;
	private static final long SHUTDOWN_GRACE_SECONDS = 60;

	@Parameters(index = "0", description = "HOCON configuration file, layered over the defaults")
	private File configFile;

	@Option(names = "--resume", description = "Checkpoint to resume from")
	private File resume;

	@Option(names = "--eval-only", description = "Decode the dev set (the train set without one) and exit")
	private boolean evalOnly;

	@Override
	public Integer call() throws IOException
	{
		final Builder builder;
		final Dataset dataset;
		final Checkpoint checkpoint;
		try
		{
			final Settings settings = Settings.fromConfig(ConfigLoader.load(configFile));
			LOG.info("Data directory: {}, device: {}", settings.dataDir, settings.device);
			builder = new Builder(settings);
			builder.build();
			dataset = Dataset.load(settings.dataset);
			checkpoint = resume == null ? null : CheckpointManager.load(resume);
		}
		catch (final ConfigurationError e)
		{
			LOG.error("Configuration error: {}", e.getMessage());
			return EXIT_CONFIGURATION_ERROR;
		}

		try (Trainer trainer = builder.newTrainer(dataset))
		{
			if (checkpoint != null)
				trainer.restore(checkpoint);
			if (evalOnly)
			{
				final List<Example> examples = dataset.dev().isEmpty() ? dataset.train() : dataset.dev();
				trainer.evaluate(examples, dataset.dev().isEmpty() ? "train" : "dev");
				return 0;
			}
			// on SIGTERM, finish the current step and write the final checkpoint before the JVM goes away
			final CountDownLatch finished = new CountDownLatch(1);
			final Thread hook = new Thread(() -> {
				trainer.requestStop();
				awaitQuietly(finished);
			}, "strongsup-shutdown");
			Runtime.getRuntime().addShutdownHook(hook);
			try
			{
				trainer.run();
			}
			finally
			{
				finished.countDown();
			}
			removeHook(hook);
			return 0;
		}
		finally
		{
			if (builder.beamDump != null)
				builder.beamDump.close();
		}
	}

	private static void removeHook(final Thread hook)
	{
		try
		{
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch (final IllegalStateException e)
		{
			LOG.debug("JVM already shutting down", e);
		}
	}

	private static void awaitQuietly(final CountDownLatch latch)
	{
		try
		{
			if (!latch.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS))
				LOG.warn("Training did not stop within {}s", SHUTDOWN_GRACE_SECONDS);
		}
		catch (final InterruptedException e)
		{
			Thread.currentThread().interrupt();
		}
	}

	public static void main(final String[] args)
	{
		System.exit(new CommandLine(new Main()).execute(args));
	}
}
