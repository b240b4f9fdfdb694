package io.poolermanager.logging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of pooling process output.
 * <p>
 * Records that matched the pooler's own log format carry all four structured fields;
 * unmatched records only carry the raw line in {@code message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"msg", "pipe", "matched", "timestamp", "pid", "level", "message"})
public class LogRecord {

    /**
     * Discriminator shared by every record produced from child process output.
     */
    public static final String DISCRIMINATOR = "record";

    @JsonProperty("pipe")
    private String pipe;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("pid")
    private String pid;

    @JsonProperty("level")
    private String level;

    @JsonProperty("message")
    private String message;

    @JsonProperty("matched")
    private boolean matched;

    @JsonProperty("msg")
    public String getMsg() {
        return DISCRIMINATOR;
    }

    public static LogRecord unmatched(String pipe, String line) {
        return LogRecord.builder()
                .pipe(pipe)
                .timestamp("")
                .pid("")
                .level("")
                .message(line)
                .matched(false)
                .build();
    }
}
