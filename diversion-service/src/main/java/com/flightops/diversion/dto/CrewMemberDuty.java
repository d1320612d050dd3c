package com.flightops.diversion.dto;

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
public class CrewMemberDuty {

    String name;
    String position;
    LocalDateTime dutyStart;

    /** Minutes on duty so far. */
    int currentDuty;

    /** Extension minutes already used. */
    int extensionsUsed;
}
