package com.gentoro.govdir.fetch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Point-in-time view of a {@link FetchGovernor}, reported at the end of a run. */
@JsonPropertyOrder({
  "state",
  "consecutive_anomalies",
  "cautious_requests_remaining",
  "backoff_pause_ms",
  "total_requests",
  "total_attempts",
  "succeeded_requests",
  "total_anomalies"
})
public record GovernorSnapshot(
    @JsonProperty("state") GovernorState state,
    @JsonProperty("consecutive_anomalies") int consecutiveAnomalies,
    @JsonProperty("cautious_requests_remaining") int cautiousRequestsRemaining,
    @JsonProperty("backoff_pause_ms") long backoffPauseMs,
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("total_attempts") long totalAttempts,
    @JsonProperty("succeeded_requests") long succeededRequests,
    @JsonProperty("total_anomalies") long totalAnomalies) {

  public static GovernorSnapshot idle() {
    return new GovernorSnapshot(GovernorState.NORMAL, 0, 0, 0, 0, 0, 0, 0);
  }
}
