package com.flightops.diversion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrewReplacementPlan {

    boolean required;

    /** Minutes until a replacement crew is available. */
    int estimatedTime;

    BigDecimal cost;

    @Builder.Default
    List<String> logistics = new ArrayList<>();
}
