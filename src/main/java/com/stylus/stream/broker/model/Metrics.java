package com.stylus.stream.broker.model;

public interface Metrics {

    String BASE_METRIC_PREFIX = "stylus.streamBroker";

    interface Counters {
        String CHANNEL_REQUEST = m("channel.request");
        String CHANNEL_REQUEST_ERROR = m("channel.request.error");

        String SESSION_ENDED = m("session.ended");
        String QUEUE_PROMOTED = m("queue.promoted");
        String QUEUE_EXPIRED = m("queue.expired");

        String STREAM_RESOLUTION_ERROR = m("stream.resolution.error");
        String TUNER_FAILED = m("tuner.failed");

        String LIVENESS_SWEEP_OK = m("liveness.sweep.ok");
        String LIVENESS_SWEEP_FAIL = m("liveness.sweep.fail");

        String UNDER_LOCK_ERRORS = m("lock.error");
    }

    interface Timers {
        String BROKER_OUTSIDE_TIME = m("broker.outside.time");
        String BROKER_INSIDE_TIME = m("broker.inside.time");
        String STREAM_RESOLUTION_TIME = m("stream.resolution.time");
    }

    interface Gauges {
        String ACTIVE_SESSIONS = m("sessions.active");
        String QUEUE_LENGTH = m("queue.length");
        String BUSY_TUNERS = m("tuners.busy");
    }

    interface Tags {
        String OPERATION = "operation";
        String RESOURCE_KIND = "resource_kind";
        String OUTCOME = "outcome";
        String REASON = "reason";
        String ERROR_TYPE = "error_type";
    }

    static String m(String metric) {
        return String.join(".", BASE_METRIC_PREFIX, metric);
    }
}
