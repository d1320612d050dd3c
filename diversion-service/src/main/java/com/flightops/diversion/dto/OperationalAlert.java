package com.flightops.diversion.dto;

import com.flightops.diversion.enums.AlertSeverity;
import com.flightops.diversion.enums.AlertType;
import com.flightops.diversion.enums.DataProvenance;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationalAlert {

    AlertType type;
    AlertSeverity severity;
    String message;
    DataProvenance provenance;
}
