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
public class OperationalAnalysis {

    String summary;
    FinancialDetail financialDetail;
    RiskAnalysis riskAnalysis;

    @Builder.Default
    List<String> recommendations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FinancialDetail {

        CostEstimate directCosts;
        BigDecimal brandImpact;
        BigDecimal operationalRecovery;
        BigDecimal regulatoryCompliance;
        BigDecimal totalEstimatedImpact;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RiskAnalysis {

        @Builder.Default
        List<String> primaryRisks = new ArrayList<>();

        @Builder.Default
        List<String> mitigationStrategies = new ArrayList<>();

        @Builder.Default
        List<String> preventionMeasures = new ArrayList<>();
    }
}
