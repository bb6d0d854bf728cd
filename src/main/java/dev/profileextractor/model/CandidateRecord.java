package dev.profileextractor.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A work-experience or education entry.
 * For education, title holds the degree and organization the school.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CandidateRecord {

    private RecordKind kind;

    @JsonAlias({"degree", "position_title"})
    private String title;

    @JsonProperty("organization")
    @JsonAlias({"company", "school", "institution_name"})
    private String organization;

    @JsonProperty("date_range")
    @JsonAlias({"duration", "dates", "year"})
    private String dateRange;

    private String location;
    private String description;

    public CandidateRecord copy() {
        return toBuilder().build();
    }
}
