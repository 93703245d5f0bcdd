package edu.stanford.nlp.strongsup;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import edu.stanford.nlp.strongsup.tangrams.Operation;
import edu.stanford.nlp.strongsup.tangrams.Piece;
import edu.stanford.nlp.strongsup.tangrams.Position;
import edu.stanford.nlp.strongsup.tangrams.Program;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A FeatureExtractor maps one decision of the policy, i.e. (utterance, program so far, current world, proposed operation), to a sparse feature vector.
 * [Using features] List the feature domains in the {@code features.domains} option. [Implementing new features] Add a domain name to
 * {@link #DOMAINS} and a method here, guarded by {@link #containsDomain}.
 */
public class FeatureExtractor
{
	public static final ImmutableSet<String> DOMAINS = ImmutableSet.of("bias", "lexical", "shape", "ordinal", "direction", "history");

	public static class Options
	{
		// Set of feature domains to include
		public final ImmutableSet<String> featureDomains;

		public Options(final Config config)
		{
			featureDomains = ImmutableSet.copyOf(config.getStringList("domains"));
			for (final String domain : featureDomains)
				ConfigurationError.check(DOMAINS.contains(domain), "Unknown feature domain '%s', expected one of %s", domain, DOMAINS);
		}
	}

	// Ordinal words of the rlong instructions, and the position (1-based) they point at.
	private static final ImmutableMap<String, Integer> ORDINALS = ImmutableMap.<String, Integer> builder()//
			.put("first", 1).put("1st", 1).put("one", 1).put("1", 1)//
			.put("second", 2).put("2nd", 2).put("two", 2).put("2", 2)//
			.put("third", 3).put("3rd", 3).put("three", 3).put("3", 3)//
			.put("fourth", 4).put("4th", 4).put("four", 4).put("4", 4)//
			.put("fifth", 5).put("5th", 5).put("five", 5).put("5", 5)//
			.put("sixth", 6).put("6th", 6).put("six", 6).put("6", 6)//
			.put("seventh", 7).put("7th", 7).put("seven", 7).put("7", 7)//
			.put("eighth", 8).put("8th", 8).put("eight", 8).put("8", 8)//
			.put("ninth", 9).put("9th", 9).put("nine", 9).put("9", 9)//
			.put("tenth", 10).put("10th", 10).put("ten", 10).put("10", 10)//
			.build();

	private static final ImmutableMap<String, Integer> TURNS = ImmutableMap.of("90", 1, "quarter", 1, "180", 2, "half", 2, "270", 3);

	private final Options opts;

	public FeatureExtractor(final Options opts)
	{
		this.opts = opts;
	}

	public boolean containsDomain(final String domain)
	{
		return opts.featureDomains.contains(domain);
	}

	public FeatureVector extract(final Example ex, final Program prefix, final TangramsWorld state, final Operation op)
	{
		final FeatureVector features = new FeatureVector();
		final String kind = op.kind.toString();
		final Set<String> tokens = new LinkedHashSet<>(ex.getTokens().tokens());
		if (containsDomain("bias"))
			features.add("bias", kind);
		if (containsDomain("lexical"))
			for (final String token : tokens)
				features.add("lexical", token + "," + kind);
		if (containsDomain("shape"))
			extractShapeFeatures(tokens, state, op, features);
		if (containsDomain("ordinal"))
			extractOrdinalFeatures(tokens, state, op, features);
		if (containsDomain("direction"))
			extractDirectionFeatures(tokens, state, op, features);
		if (containsDomain("history"))
			extractHistoryFeatures(prefix, op, features);
		return features;
	}

	// Shapes the operation touches: those of its piece operands, or the one it adds.
	private static List<String> shapesOf(final TangramsWorld state, final Operation op)
	{
		final List<String> shapes = new ArrayList<>();
		if (op instanceof Operation.Add)
			shapes.add(((Operation.Add) op).shape);
		for (final int id : op.pieceOperands())
		{
			final Piece piece = state.piece(id);
			if (piece != null)
				shapes.add(piece.shape);
		}
		return shapes;
	}

	private void extractShapeFeatures(final Set<String> tokens, final TangramsWorld state, final Operation op, final FeatureVector features)
	{
		final String kind = op.kind.toString();
		final List<String> shapes = shapesOf(state, op);
		for (int i = 0; i < shapes.size(); i++)
		{
			final String shape = shapes.get(i).toLowerCase(Locale.ROOT);
			if (tokens.contains(shape))
				features.add("shape", "mentioned," + kind + "," + i);
			for (final String token : tokens)
				features.add("shape", token + "," + shapes.get(i));
		}
	}

	private void extractOrdinalFeatures(final Set<String> tokens, final TangramsWorld state, final Operation op, final FeatureVector features)
	{
		final String kind = op.kind.toString();
		final Set<Integer> ordinals = new LinkedHashSet<>();
		for (final String token : tokens)
			if (ORDINALS.containsKey(token))
				ordinals.add(ORDINALS.get(token));
		final boolean last = tokens.contains("last");

		final List<Integer> operands = op.pieceOperands();
		for (int i = 0; i < operands.size(); i++)
		{
			final Piece piece = state.piece(operands.get(i));
			if (piece == null)
				continue;
			if (ordinals.contains(piece.position.x + 1))
				features.add("ordinal", "piece-match," + kind + "," + i);
			if (last && piece.position.x == state.width() - 1)
				features.add("ordinal", "last-match," + kind + "," + i);
		}
		final Position target = targetOf(op);
		if (target != null)
		{
			if (ordinals.contains(target.x + 1))
				features.add("ordinal", "target-match," + kind);
			if (last && target.x == state.width() - 1)
				features.add("ordinal", "target-last," + kind);
		}
		if (op instanceof Operation.Rotate)
			for (final String token : tokens)
				if (TURNS.containsKey(token) && TURNS.get(token) == ((Operation.Rotate) op).quarterTurns)
					features.add("ordinal", "turns-match");
	}

	private void extractDirectionFeatures(final Set<String> tokens, final TangramsWorld state, final Operation op, final FeatureVector features)
	{
		if (op instanceof Operation.Move)
		{
			final Operation.Move move = (Operation.Move) op;
			final Piece piece = state.piece(move.piece);
			if (piece == null)
				return;
			final String dx = "dx" + sign(move.target.x - piece.position.x);
			final String dy = "dy" + sign(move.target.y - piece.position.y);
			for (final String token : tokens)
			{
				features.add("direction", token + "," + dx);
				features.add("direction", token + "," + dy);
			}
		}
		else
			if (op instanceof Operation.Rotate)
				for (final String token : tokens)
					features.add("direction", token + ",turns=" + ((Operation.Rotate) op).quarterTurns);
	}

	private void extractHistoryFeatures(final Program prefix, final Operation op, final FeatureVector features)
	{
		final String kind = op.kind.toString();
		final Operation previous = prefix.last();
		features.add("history", "prev=" + (previous == null ? "START" : previous.kind.toString()) + "," + kind);
		features.add("history", "step=" + prefix.size() + "," + kind);
		if (previous != null)
			for (final int id : op.pieceOperands())
				if (previous.pieceOperands().contains(id))
				{
					features.add("history", "same-piece," + kind);
					break;
				}
	}

	private static Position targetOf(final Operation op)
	{
		if (op instanceof Operation.Move)
			return ((Operation.Move) op).target;
		if (op instanceof Operation.Add)
			return ((Operation.Add) op).target;
		return null;
	}

	private static String sign(final int d)
	{
		return d > 0 ? "+" : d < 0 ? "-" : "0";
	}
}
