package com.ml.sentinel.monitor.common.constants;

public interface SentinelConsts {

    // Fast-state keys
    String RETRAIN_LOCK_KEY = "retrain:lock";
    String RETRAIN_COOLDOWN_PREFIX = "retrain:";
    String ALERT_COOLDOWN_PREFIX = "alert:";

    // Result error codes for collaborator calls
    String ERR_TIMEOUT = "TIMEOUT";
    String ERR_UNREACHABLE = "UNREACHABLE";
    String ERR_HTTP_CLIENT = "HTTP_4XX";
    String ERR_HTTP_SERVER = "HTTP_5XX";
    String ERR_BAD_RESPONSE = "BAD_RESPONSE";
    String ERR_REJECTED = "REJECTED";

    // Alert presentation (webhook embed colours)
    int COLOR_INFO = 3447003;
    int COLOR_WARNING = 16776960;
    int COLOR_CRITICAL = 15158332;
    int COLOR_DRIFT = 16753920;

    String SERVICE_NAME = "Model Sentinel";

    // MDC key carrying the tick sequence number
    String MDC_TICK = "tick";
}
