package com.ml.sentinel.monitor.service.tracker;

import com.ml.sentinel.monitor.common.Result;
import com.ml.sentinel.monitor.dto.RunRecord;

/**
 * Sink for retraining run records. Implementations must not throw: a failed
 * write comes back as {@link Result#fail} and never aborts a tick.
 */
public interface ExperimentTracker {

    /**
     * @return the tracker's own id for the logged run
     */
    Result<String> logRun(RunRecord record);
}
