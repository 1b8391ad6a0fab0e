package com.ml.sentinel.monitor.model.serving;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictRequest {
    private List<Double> features;
}
