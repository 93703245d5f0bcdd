package edu.stanford.nlp.strongsup;

import java.io.File;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@code checkpoint-<step>.json} and a readable {@code params-<step>.tsv} next to it.
 */
public class CheckpointManager
{
	private static final Logger LOG = LoggerFactory.getLogger(CheckpointManager.class);

	private final File dir;

	public CheckpointManager(final File dir)
	{
		this.dir = dir;
	}

	public File save(final Checkpoint checkpoint, final Params params)
	{
		if (!dir.isDirectory() && !dir.mkdirs())
			throw new StrongSupError("Cannot create checkpoint directory " + dir.getAbsolutePath());
		final File file = new File(dir, "checkpoint-" + checkpoint.step + ".json");
		Json.prettyWriteValueHard(file, checkpoint);
		params.write(new File(dir, "params-" + checkpoint.step + ".tsv"));
		LOG.info("Wrote {} to {}", checkpoint, file);
		return file;
	}

	public static Checkpoint load(final File file)
	{
		if (!file.isFile())
			throw new ConfigurationError("Checkpoint not found: " + file.getAbsolutePath());
		final Checkpoint checkpoint = Json.readValueHard(file, Checkpoint.class);
		LOG.info("Loaded {} from {}", checkpoint, file);
		return checkpoint;
	}
}
