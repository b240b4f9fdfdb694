package io.poolermanager.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State of the pooler instance managed by this process.
 *
 * Example response:
 * <pre>
 * {
 *   "pooler_name": "pooler-rw",
 *   "namespace": "default",
 *   "running": true,
 *   "pid": 4242,
 *   "configuration_file": "/controller/configs/pgbouncer.ini"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PoolerStatusResponse {
    private String poolerName;
    private String namespace;
    private boolean running;
    private Long pid;
    private String configurationFile;
}
