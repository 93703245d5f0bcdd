package edu.stanford.nlp.strongsup;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the run configuration. Precedence, highest first:
 * <ol>
 * <li>environment variables with the {@code CONFIG_FORCE_} prefix ({@code CONFIG_FORCE_strongsup_search_beamWidth=16})</li>
 * <li>JVM system properties ({@code -Dstrongsup.search.beamWidth=16})</li>
 * <li>the configuration file of the run</li>
 * <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Other environment variables are only visible through substitutions such as {@code ${?STRONGSUP_DIR}}.
 */
public final class ConfigLoader
{
	private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

	private ConfigLoader()
	{
	}

	public static Config load(final File configFile)
	{
		if (configFile == null)
			return resolve(ConfigFactory.empty());
		if (!configFile.isFile())
			throw new ConfigurationError("Configuration file not found: " + configFile.getAbsolutePath());
		LOG.info("Loading configuration from {}", configFile.getAbsolutePath());
		try
		{
			return resolve(ConfigFactory.parseFile(configFile));
		}
		catch (final ConfigException e)
		{
			throw new ConfigurationError("Malformed configuration " + configFile + ": " + e.getMessage(), e);
		}
	}

	// For tests and embedding: |hocon| layered over the defaults.
	public static Config parse(final String hocon)
	{
		try
		{
			return resolve(ConfigFactory.parseString(hocon));
		}
		catch (final ConfigException e)
		{
			throw new ConfigurationError("Malformed configuration: " + e.getMessage(), e);
		}
	}

	private static Config resolve(final Config fileConfig)
	{
		return layer(ConfigFactory.systemEnvironmentOverrides(), ConfigFactory.systemProperties(), fileConfig);
	}

	// |environment| over |system| over |fileConfig| over reference.conf, resolved.
	public static Config layer(final Config environment, final Config system, final Config fileConfig)
	{
		try
		{
			return environment.withFallback(system).withFallback(fileConfig).withFallback(ConfigFactory.parseResources("reference.conf")).resolve();
		}
		catch (final ConfigException e)
		{
			throw new ConfigurationError("Cannot resolve configuration: " + e.getMessage(), e);
		}
	}
}
