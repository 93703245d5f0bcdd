package edu.stanford.nlp.strongsup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.stanford.nlp.strongsup.tangrams.TangramsWorld;
import java.util.Objects;

/**
 * An example is the unit we train and predict on: an instruction, the world it applies to, and the world it should produce. Immutable once loaded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Example
{
	// Unique identifier for this example.
	@JsonProperty
	public final String id;

	// Input utterance, as written
	@JsonProperty
	public final String utterance;

	@JsonProperty
	public final TangramsWorld initialState;

	// What executing a correct program should produce.
	@JsonProperty
	public final TangramsWorld targetState;

	private final Utterance tokens;

	public static class Builder
	{
		private String id;
		private String utterance;
		private TangramsWorld initialState;
		private TangramsWorld targetState;

		public Builder setId(final String id_)
		{
			id = id_;
			return this;
		}

		public Builder setUtterance(final String utterance_)
		{
			utterance = utterance_;
			return this;
		}

		public Builder setInitialState(final TangramsWorld initialState_)
		{
			initialState = initialState_;
			return this;
		}

		public Builder setTargetState(final TangramsWorld targetState_)
		{
			targetState = targetState_;
			return this;
		}

		public Example createExample()
		{
			return new Example(id, utterance, initialState, targetState);
		}
	}

	@JsonCreator
	public Example(@JsonProperty("id") final String id_, @JsonProperty("utterance") final String utterance_, @JsonProperty("initialState") final TangramsWorld initialState_, @JsonProperty("targetState") final TangramsWorld targetState_)
	{
		id = Objects.requireNonNull(id_, "example id");
		utterance = utterance_ == null ? "" : utterance_;
		initialState = Objects.requireNonNull(initialState_, "initial state of " + id_);
		targetState = targetState_;
		tokens = Utterance.tokenize(utterance);
	}

	// Accessors
	public Utterance getTokens()
	{
		return tokens;
	}

	public boolean hasTarget()
	{
		return targetState != null;
	}

	public String toJSON()
	{
		return Json.writeValueAsStringHard(this);
	}

	public static Example fromJSON(final String json)
	{
		return Json.readValueHard(json, Example.class);
	}

	@Override
	public String toString()
	{
		return id + ": " + utterance;
	}
}
