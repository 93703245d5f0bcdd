package edu.stanford.nlp.strongsup;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;

/**
 * The indicator features of one policy decision, each named {@code domain :: name} so that domains cannot collide. Duplicates are allowed and add
 * up.
 */
public class FeatureVector
{
	private final List<String> features = new ArrayList<>();

	static String toFeature(final String domain, final String name)
	{
		return domain + " :: " + name;
	}

	public void add(final String domain, final String name)
	{
		features.add(toFeature(domain, name));
	}

	public double dotProduct(final ParamsSnapshot params)
	{
		double sum = 0;
		for (final String f : features)
			sum += params.getWeight(f);
		return sum;
	}

	// map += factor * this
	public void increment(final double factor, final Map<String, Double> map)
	{
		for (final String f : features)
			map.merge(f, factor, Double::sum);
	}

	@JsonValue
	public Map<String, Double> toMap()
	{
		final Map<String, Double> map = new TreeMap<>();
		increment(1, map);
		return map;
	}

	// Logs |features| with their contribution under |params|, largest first.
	public static void logFeatureWeights(final Logger log, final String prefix, final Map<String, Double> features, final ParamsSnapshot params)
	{
		if (!log.isTraceEnabled())
			return;
		final List<Map.Entry<String, Double>> entries = new ArrayList<>();
		double sumValue = 0;
		for (final Map.Entry<String, Double> entry : features.entrySet())
		{
			if (entry.getValue() == 0)
				continue;
			final double value = entry.getValue() * params.getWeight(entry.getKey());
			sumValue += value;
			entries.add(Maps.immutableEntry(entry.getKey(), value));
		}
		entries.sort(Comparator.comparing(Map.Entry<String, Double>::getValue).reversed());
		log.trace("{} features [sum = {}] (format is feature value * weight)", prefix, String.format("%.4f", sumValue));
		for (final Map.Entry<String, Double> entry : entries)
			log.trace(String.format("%-50s %8.4f = %s * %.4f", "[ " + entry.getKey() + " ]", entry.getValue(), features.get(entry.getKey()), params.getWeight(entry.getKey())));
	}

	@Override
	public String toString()
	{
		return toMap().toString();
	}
}
