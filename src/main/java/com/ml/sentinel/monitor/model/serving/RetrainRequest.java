package com.ml.sentinel.monitor.model.serving;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetrainRequest {
    private String datasetRef;
}
