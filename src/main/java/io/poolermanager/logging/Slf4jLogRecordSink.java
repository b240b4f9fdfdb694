package io.poolermanager.logging;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolermanager.metrics.MetricsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

import static io.poolermanager.config.Constants.PGBOUNCER_LOGGER_NAME;
import static io.poolermanager.metrics.MetricsConstants.LOG_RECORDS_METRIC_NAME;
import static io.poolermanager.metrics.MetricsConstants.MATCHED_TAG;
import static io.poolermanager.metrics.MetricsConstants.PIPE_TAG;

/**
 * Writes every record as a single JSON object on the {@code pgbouncer} logger.
 */
public class Slf4jLogRecordSink implements LogRecordSink {

    private static final Logger POOLER_LOG = LoggerFactory.getLogger(PGBOUNCER_LOGGER_NAME);

    private final ObjectMapper objectMapper;
    private final MetricsProvider metricsProvider;

    public Slf4jLogRecordSink(ObjectMapper objectMapper, MetricsProvider metricsProvider) {
        this.objectMapper = objectMapper;
        this.metricsProvider = metricsProvider;
    }

    @Override
    public void accept(LogRecord record) throws IOException {
        POOLER_LOG.info(objectMapper.writeValueAsString(record));
        if (metricsProvider != null) {
            metricsProvider.counter(LOG_RECORDS_METRIC_NAME, Map.of(
                    PIPE_TAG, String.valueOf(record.getPipe()),
                    MATCHED_TAG, String.valueOf(record.isMatched()))).increment();
        }
    }
}
