package com.ml.sentinel.monitor.service.alert;

import com.ml.sentinel.monitor.dto.AlertEvent;

/**
 * External notification channel. Rate limits and presentation belong to the
 * channel; the caller only needs to know whether delivery was acknowledged.
 */
public interface AlertSink {

    /**
     * @return true only when the channel acknowledged the message
     */
    boolean notify(AlertEvent event);
}
