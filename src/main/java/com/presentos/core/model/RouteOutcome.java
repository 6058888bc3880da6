package com.presentos.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON response describing the resolved intent and the side effects performed for one message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteOutcome(
    @JsonProperty("request_id") String requestId,
    Intent intent,
    OutcomeStatus status,
    IntentRecord record,
    @JsonProperty("task_id") String taskId,
    String link,
    DownstreamResponse downstream,
    @JsonProperty("error_kind") ErrorKind errorKind,
    String detail,
    String raw,
    List<RouteWarning> warnings
) {

    public static Builder builder(String requestId, Intent intent) {
        return new Builder(requestId, intent);
    }

    public static final class Builder {
        private final String requestId;
        private final Intent intent;
        private OutcomeStatus status = OutcomeStatus.ROUTED;
        private IntentRecord record;
        private String taskId;
        private String link;
        private DownstreamResponse downstream;
        private ErrorKind errorKind;
        private String detail;
        private String raw;
        private final List<RouteWarning> warnings = new ArrayList<>();

        private Builder(String requestId, Intent intent) {
            this.requestId = requestId;
            this.intent = intent;
        }

        public Builder status(OutcomeStatus status) { this.status = status; return this; }
        public Builder record(IntentRecord record) { this.record = record; return this; }
        public Builder taskId(String taskId) { this.taskId = taskId; return this; }
        public Builder link(String link) { this.link = link; return this; }
        public Builder downstream(DownstreamResponse downstream) { this.downstream = downstream; return this; }
        public Builder raw(String raw) { this.raw = raw; return this; }

        public Builder error(ErrorKind kind, String detail) {
            this.errorKind = kind;
            this.detail = detail;
            return this;
        }

        public Builder warn(String stage, String detail) {
            warnings.add(new RouteWarning(stage, detail));
            return this;
        }

        public RouteOutcome build() {
            return new RouteOutcome(requestId, intent, status, record, taskId, link, downstream,
                    errorKind, detail, raw, warnings.isEmpty() ? null : List.copyOf(warnings));
        }
    }
}
