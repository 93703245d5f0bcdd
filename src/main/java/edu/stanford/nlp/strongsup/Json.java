package edu.stanford.nlp.strongsup;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Simple wrappers and sane defaults for Jackson. Only explicitly annotated members are (de)serialized.
 */
public final class Json
{
	private Json()
	{
	}

	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
	static
	{
		OBJECT_MAPPER.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
	}

	public static ObjectMapper getMapper()
	{
		return OBJECT_MAPPER;
	}

	private static ObjectReader getReader()
	{
		return getMapper().reader();
	}

	public static <T> T readValueHard(final String json, final Class<T> klass)
	{
		try
		{
			return getReader().forType(klass).readValue(json);
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	public static <T> T readValueHard(final File f, final Class<T> klass)
	{
		try
		{
			return getReader().forType(klass).readValue(f);
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	public static String writeValueAsStringHard(final Object o)
	{
		try
		{
			return getMapper().writer().writeValueAsString(o);
		}
		catch (final JsonProcessingException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	public static String prettyWriteValueAsStringHard(final Object o)
	{
		try
		{
			return getMapper().writerWithDefaultPrettyPrinter().writeValueAsString(o);
		}
		catch (final JsonProcessingException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	public static void prettyWriteValueHard(final File f, final Object o)
	{
		try
		{
			getMapper().writerWithDefaultPrettyPrinter().writeValue(f, o);
		}
		catch (final IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}
}
