package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Scheduling data for recurring or one-off events (shows, classes, activities).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduledEventPayload implements NodePayload {

    public static final String SCHEMA_TYPE = "scheduled_event";

    /** daily, weekly, biweekly, monthly or specific_date. */
    @JsonProperty("recurrenceType")
    String recurrenceType;

    @JsonProperty("validFrom")
    String validFrom;

    @JsonProperty("validUntil")
    String validUntil;

    @JsonProperty("startTime")
    String startTime;

    @JsonProperty("endTime")
    String endTime;

    @JsonProperty("days")
    @Singular
    List<String> days;

    /** active, cancelled, postponed or full. */
    @JsonProperty("eventStatus")
    String eventStatus;

    @JsonProperty("location")
    String location;

    @JsonProperty("targetAudience")
    String targetAudience;

    @JsonProperty("minAge")
    Integer minAge;

    @JsonProperty("maxAge")
    Integer maxAge;

    @JsonProperty("isExternalAllowed")
    Boolean externalAllowed;

    @JsonProperty("requiresReservation")
    Boolean requiresReservation;

    @Override
    public String schemaType() {
        return SCHEMA_TYPE;
    }
}
