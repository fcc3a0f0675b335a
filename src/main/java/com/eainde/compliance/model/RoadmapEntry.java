package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the merged roadmap. Technical entries carry the issue kind they fix.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoadmapEntry(
        @JsonProperty("action")     String action,
        @JsonProperty("reason")     String reason,
        @JsonProperty("effort")     String effort,
        @JsonProperty("validation") String validation,
        @JsonProperty("issue_kind") String issueKind,
        @JsonProperty("source")     RecordSource source
) {

    public static RoadmapEntry fromFix(RemediationFix fix, String reason) {
        return new RoadmapEntry(fix.title(), reason, fix.estimatedEffort(), fix.validation(),
                fix.issueKind(), RecordSource.TECHNICAL);
    }

    public static RoadmapEntry fromAction(RoadmapAction action, RecordSource source) {
        return new RoadmapEntry(action.action(), action.reason(), action.effort(), action.validation(), null, source);
    }
}
