package com.tradescheduler.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Wire shape of a job, used for both requests and responses. Bookkeeping
 * fields are ignored on input. Field checks belong to the store, so request
 * errors carry its messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobDefinitionDTO {

    private String name;

    private String action;

    private String ticker;

    private Integer quantity;

    private ScheduleDTO schedule;

    private Boolean enabled;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private Long version;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private Instant createdAt;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private Instant updatedAt;
}
