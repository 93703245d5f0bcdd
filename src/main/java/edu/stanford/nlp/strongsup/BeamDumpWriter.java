package edu.stanford.nlp.strongsup;

import com.opencsv.CSVWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * CSV dump of every searched candidate: {@code utterance,program,correct}. Rows of one beam are written together.
 */
public class BeamDumpWriter implements Closeable
{
	private final CSVWriter writer;

	public BeamDumpWriter(final File file)
	{
		try
		{
			final File parent = file.getAbsoluteFile().getParentFile();
			if (parent != null && !parent.isDirectory() && !parent.mkdirs())
				throw new StrongSupError("Cannot create directory " + parent);
			writer = new CSVWriter(Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8));
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
		writer.writeNext(new String[] { "utterance", "program", "correct" });
	}

	public synchronized void write(final Example ex, final List<Candidate> beam, final List<RewardResult> results)
	{
		for (int i = 0; i < beam.size(); i++)
			writer.writeNext(new String[] { ex.utterance, beam.get(i).program.toString(), Boolean.toString(results.get(i).isCorrect()) });
		try
		{
			writer.flush();
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	@Override
	public synchronized void close() throws IOException
	{
		writer.close();
	}
}
