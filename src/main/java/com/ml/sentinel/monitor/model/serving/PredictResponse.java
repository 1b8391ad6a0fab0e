package com.ml.sentinel.monitor.model.serving;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictResponse {
    @JsonAlias("label")
    private Integer prediction;
    private Double confidence;
    private String modelVersion;
}
