package com.ml.sentinel.monitor.model.serving;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainResponse {
    private String status;
    @JsonAlias({"version", "new_version"})
    private String modelVersion;
    private Double accuracy;
    private Integer trainingSamples;
}
