package com.ml.sentinel.monitor.model.generator;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateResponse {
    private Long generationId;
    private Integer samplesCreated;
    private String timestamp;

    /**
     * Reference passed on to the serving API's retrain call.
     */
    public String datasetRef() {
        return generationId == null ? null : String.valueOf(generationId);
    }
}
