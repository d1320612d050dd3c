package com.flightops.diversion.dto;

import com.flightops.diversion.enums.FeasibilityLimitation;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeasibilityResult {

    boolean feasible;

    @Builder.Default
    List<FeasibilityLimitation> limitations = new ArrayList<>();

    public boolean hasAdvisories() {
        return limitations.stream().anyMatch(limitation -> !limitation.isBlocking());
    }
}
