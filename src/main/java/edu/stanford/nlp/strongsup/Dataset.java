package edu.stanford.nlp.strongsup;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import edu.stanford.nlp.strongsup.tangrams.Piece;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The train and dev examples. Two formats are read, chosen by file extension:
 * <ul>
 * <li>{@code .jsonl}: one {@link Example} per line, {@code {"id", "utterance", "initialState", "targetState"}};</li>
 * <li>{@code .tsv}: the rlong interaction format {@code id \t world0 \t utterance1 \t world1 \t utterance2 \t world2 ...}, where each
 * (utterance, world) pair becomes an example starting from the world before it.</li>
 * </ul>
 */
public class Dataset
{
	private static final Logger LOG = LoggerFactory.getLogger(Dataset.class);

	public static class Options
	{
		public final String train;
		// empty for none
		public final String dev;
		// -1 reads everything
		public final int maxExamples;
		public final int rlongWidth;
		public final int rlongHeight;

		public Options(final Config config)
		{
			train = config.getString("train");
			dev = config.getString("dev");
			maxExamples = config.getInt("maxExamples");
			rlongWidth = config.getInt("rlongWidth");
			rlongHeight = config.getInt("rlongHeight");
			ConfigurationError.check(!train.isEmpty(), "dataset.train is not set");
			ConfigurationError.check(rlongWidth > 0 && rlongHeight > 0, "dataset.rlongWidth and rlongHeight must be positive");
		}
	}

	private final List<Example> train;
	private final List<Example> dev;

	public Dataset(final List<Example> train, final List<Example> dev)
	{
		this.train = ImmutableList.copyOf(train);
		this.dev = ImmutableList.copyOf(dev);
	}

	public static Dataset load(final Options opts)
	{
		final List<Example> train = read(new File(opts.train), opts);
		final List<Example> dev = opts.dev.isEmpty() ? ImmutableList.<Example> of() : read(new File(opts.dev), opts);
		LOG.info("Dataset: {} train, {} dev examples", train.size(), dev.size());
		return new Dataset(train, dev);
	}

	public List<Example> train()
	{
		return train;
	}

	public List<Example> dev()
	{
		return dev;
	}

	public static List<Example> read(final File file, final Options opts)
	{
		if (!file.isFile())
			throw new ConfigurationError("Dataset file not found: " + file.getAbsolutePath());
		LOG.info("Reading examples from {}", file);
		final List<Example> examples = new ArrayList<>();
		final boolean rlong = file.getName().endsWith(".tsv");
		try (BufferedReader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8))
		{
			String line;
			int lineNumber = 0;
			while ((line = in.readLine()) != null)
			{
				lineNumber++;
				if (line.trim().isEmpty())
					continue;
				try
				{
					if (rlong)
						examples.addAll(parseRlong(line, opts.rlongWidth, opts.rlongHeight));
					else
						examples.add(Json.readValueHard(line, Example.class));
				}
				catch (final RuntimeException e)
				{
					throw new StrongSupError(String.format("%s:%d: %s", file, lineNumber, e.getMessage()), e);
				}
				if (opts.maxExamples >= 0 && examples.size() >= opts.maxExamples)
					break;
			}
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
		final List<Example> result = opts.maxExamples >= 0 && examples.size() > opts.maxExamples ? examples.subList(0, opts.maxExamples) : examples;
		LOG.info("Read {} examples from {}", result.size(), file.getName());
		return result;
	}

	// One interaction line: id, initial world, then (utterance, world) pairs.
	static List<Example> parseRlong(final String line, final int width, final int height)
	{
		final List<String> fields = Splitter.on('\t').trimResults().splitToList(line);
		if (fields.size() < 4 || fields.size() % 2 != 0)
			throw new IllegalArgumentException("Expected id, world and (utterance, world) pairs, got " + fields.size() + " fields");
		final String id = fields.get(0);
		final List<Example> examples = new ArrayList<>();
		TangramsWorld previous = TangramsWorld.fromRlongString(fields.get(1), width, height);
		for (int i = 2; i < fields.size(); i += 2)
		{
			final TangramsWorld next = relabel(previous, TangramsWorld.fromRlongString(fields.get(i + 1), width, height));
			examples.add(new Example.Builder().setId(id + "-" + (i / 2 - 1)).setUtterance(fields.get(i)).setInitialState(previous).setTargetState(next).createExample());
			previous = next;
		}
		return examples;
	}

	/**
	 * The rlong notation numbers pieces by position. Shapes are unique within a tangrams world, so a piece keeps the id its shape had in the previous
	 * world; a shape that is new gets the next free id, the way {@code add} numbers pieces.
	 */
	static TangramsWorld relabel(final TangramsWorld previous, final TangramsWorld next)
	{
		final Map<String, Integer> idByShape = new HashMap<>();
		for (final Piece piece : previous.pieces())
			idByShape.put(piece.shape, piece.id);
		int nextId = previous.nextPieceId();
		final List<Piece> pieces = new ArrayList<>();
		for (final Piece piece : next.pieces())
		{
			Integer id = idByShape.get(piece.shape);
			if (id == null)
				id = nextId++;
			pieces.add(new Piece(id, piece.shape, piece.position, piece.orientation));
		}
		return new TangramsWorld(next.width(), next.height(), pieces);
	}
}
