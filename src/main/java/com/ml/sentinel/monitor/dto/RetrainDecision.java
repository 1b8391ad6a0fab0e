package com.ml.sentinel.monitor.dto;

import com.ml.sentinel.monitor.enums.RetrainReason;

public record RetrainDecision(boolean shouldRetrain, RetrainReason reason) {

    public static final RetrainDecision NO_ACTION = new RetrainDecision(false, RetrainReason.NONE);

    public static RetrainDecision retrain(RetrainReason reason) {
        return new RetrainDecision(true, reason);
    }

    public static RetrainDecision suppressed(RetrainReason reason) {
        return new RetrainDecision(false, reason);
    }
}
