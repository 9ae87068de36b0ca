package com.catalogmcp.mcpserver.mcp.error;

import com.catalogmcp.shared.mcp.errors.ErrorType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the client-facing error payloads.
 */
@Component
public class ToolResponseFormatter {

    private final Clock clock;

    public ToolResponseFormatter() {
        this(Clock.systemUTC());
    }

    public ToolResponseFormatter(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param error        failure being reported; non-throwables are rendered with {@code String.valueOf}
     * @param errorType    classification of {@code error}
     * @param toolName     tool that failed
     * @param operation    operation being performed
     * @param extraDetails merged into the error metadata, may be null
     */
    public StandardErrorResponse format(Object error, ErrorType errorType, String toolName, String operation,
                                        Map<String, Object> extraDetails) {
        String message = messageOf(error);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("tool", toolName);
        meta.put("operation", operation);
        meta.put("timestamp", Instant.now(clock).toString());
        if (extraDetails != null) {
            meta.putAll(extraDetails);
        }

        Map<String, String> source = new LinkedHashMap<>();
        source.put("tool", toolName);
        source.put("operation", operation);

        return StandardErrorResponse.builder()
            .data(StandardErrorResponse.ErrorData.builder()
                .message(message)
                .code(errorType.getCode())
                .source(source)
                .build())
            .errors(List.of(StandardErrorResponse.ErrorObject.builder()
                .status(errorType.getHttpStatus())
                .code(errorType.getCode())
                .title(errorType.getTitle())
                .detail(message)
                .source(Map.of("parameter", operation))
                .meta(meta)
                .build()))
            .build();
    }

    public SimpleErrorResponse formatSimple(String message) {
        return SimpleErrorResponse.of(message);
    }

    public static String messageOf(Object error) {
        if (error instanceof Throwable) {
            Throwable unwrapped = ToolErrorClassifier.unwrap((Throwable) error);
            return unwrapped.getMessage() != null ? unwrapped.getMessage() : unwrapped.getClass().getSimpleName();
        }
        return String.valueOf(error);
    }
}
