package io.poolermanager.metrics;

/**
 * Constants for metrics names and tags used by the pooler manager.
 */
public class MetricsConstants {
    public final static String LOG_RECORDS_METRIC_NAME = "pooler_log_records_total";
    public final static String POOLER_RUNNING_METRIC_NAME = "pooler_process_running";
    public final static String RECONCILE_CYCLES_METRIC_NAME = "pooler_reconcile_cycles_total";
    public final static String RECONCILE_RELOADS_METRIC_NAME = "pooler_reconcile_reloads_total";
    public final static String PIPE_TAG = "pipe";
    public final static String MATCHED_TAG = "matched";
    public final static String RESULT_TAG = "result";

    private MetricsConstants() {}
}
