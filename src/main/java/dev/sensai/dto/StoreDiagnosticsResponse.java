package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Human-oriented report of backend and document store state. Connection strings are never
 * echoed, only whether they are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StoreDiagnosticsResponse {

    private String backend;
    private String database;
    private String databaseUrl;
    private String databaseName;
    private String connectionStatus;
    @Builder.Default
    private List<String> collections = List.of();
}
