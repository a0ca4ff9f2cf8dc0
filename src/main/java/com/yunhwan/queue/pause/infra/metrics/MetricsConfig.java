package com.yunhwan.queue.pause.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    public static final String METRIC_COMMAND = "queue_pause.command";
    public static final String METRIC_HELD_CONSUMERS = "queue_pause.held_consumers";

    // 고카디널리티 금지 (큐 이름은 태그로 쓰지 않는다)
    public static final String TAG_ACTION = "action";
    public static final String TAG_RESULT = "result";
    public static final String TAG_BROKER = "broker";

    public static final String ACTION_PAUSE = "pause";
    public static final String ACTION_RESUME = "resume";
    public static final String ACTION_CONNECT = "connect";
    public static final String ACTION_DISCONNECT = "disconnect";

    // 고정 결과값(집계 안정성)
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_NOOP = "noop";
    public static final String RESULT_ERROR = "error";
    public static final String RESULT_TIMEOUT = "timeout";
}
