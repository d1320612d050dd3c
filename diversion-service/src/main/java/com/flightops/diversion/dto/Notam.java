package com.flightops.diversion.dto;

import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.enums.NotamStatus;
import com.flightops.diversion.enums.NotamType;
import com.flightops.diversion.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Notam {

    String id;
    String airport;
    NotamType type;
    String description;
    LocalDateTime effective;
    LocalDateTime expires;
    NotamStatus status;
    RiskLevel impact;
    DataProvenance provenance;
}
