package com.ulbaudit.audit.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw rule row as exported from the validation-rules workbook. Keys are unresolved strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDocument(
        @JsonProperty("checkpoint_id") String checkpointId,
        @JsonProperty("part") String part,
        @JsonProperty("description") String description,
        @JsonProperty("validation_type") String validationType,
        @JsonProperty("calculation_type") String calculationType,
        @JsonProperty("primary_table") String primaryTable,
        @JsonProperty("reference_table") String referenceTable,
        @JsonProperty("multi_part") String multiPart,
        @JsonProperty("column_1") String column1,
        @JsonProperty("column_2") String column2,
        @JsonProperty("column_3") String column3,
        @JsonProperty("column_4") String column4,
        @JsonProperty("peer_group_by") String peerGroupBy,
        @JsonProperty("peer_population_min") Double peerPopulationMin,
        @JsonProperty("peer_population_max") Double peerPopulationMax,
        @JsonProperty("iqr_multiplier") Double iqrMultiplier,
        @JsonProperty("stddev_limit") Double stddevLimit,
        @JsonProperty("operator") String operator,
        @JsonProperty("threshold") String threshold,
        @JsonProperty("severity") String severity,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("narrative") String narrative,
        @JsonProperty("statistical_context") String statisticalContext,
        @JsonProperty("time_period") String timePeriod
) {

    public boolean enabledFlag() {
        return enabled == null || enabled;
    }

    public boolean multiPartFlag() {
        return multiPart != null && multiPart.trim().equalsIgnoreCase("yes");
    }
}
