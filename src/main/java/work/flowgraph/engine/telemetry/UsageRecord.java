package work.flowgraph.engine.telemetry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated usage of one resource under one API key, in the shape the usage endpoint accepts.
 * Timestamps are epoch nanoseconds; {@code sourceDuration} is in seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsageRecord(
    @JsonProperty("api_key") String apiKey,
    @JsonProperty("category") String category,
    @JsonProperty("resource_id") String resourceId,
    @JsonProperty("resource_details") String resourceDetails,
    @JsonProperty("exec_session_id") String execSessionId,
    @JsonProperty("timestamp_start") long timestampStart,
    @JsonProperty("timestamp_stop") long timestampStop,
    @JsonProperty("processed_frames") long processedFrames,
    @JsonProperty("fps") double fps,
    @JsonProperty("source_duration") double sourceDuration,
    @JsonProperty("hosted") boolean hosted,
    @JsonProperty("enterprise") boolean enterprise
) {
    /**
     * Key under which records are aggregated for one API key.
     */
    @JsonIgnore
    public String aggregationKey() {
        return category + ":" + resourceId;
    }
}
