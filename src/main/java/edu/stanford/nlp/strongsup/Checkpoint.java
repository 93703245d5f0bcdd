package edu.stanford.nlp.strongsup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything needed to resume training at a step boundary: the parameters with their optimizer state and the position in the training data.
 */
public class Checkpoint
{
	@JsonProperty
	public final int step;
	@JsonProperty
	public final int epoch;
	// index of the next training example within the epoch
	@JsonProperty
	public final int cursor;
	// moving reward baseline, 0 when unused
	@JsonProperty
	public final double baseline;
	@JsonProperty
	public final Params.State params;

	@JsonCreator
	public Checkpoint(@JsonProperty("step") final int step, @JsonProperty("epoch") final int epoch, @JsonProperty("cursor") final int cursor, @JsonProperty("baseline") final double baseline, @JsonProperty("params") final Params.State params)
	{
		this.step = step;
		this.epoch = epoch;
		this.cursor = cursor;
		this.baseline = baseline;
		if (params == null)
			throw new StrongSupError("Checkpoint without parameters");
		this.params = params;
	}

	@Override
	public String toString()
	{
		return "Checkpoint(step=" + step + ", epoch=" + epoch + ", cursor=" + cursor + ", version=" + params.version + ")";
	}
}
