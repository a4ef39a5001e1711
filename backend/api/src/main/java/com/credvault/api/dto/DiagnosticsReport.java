package com.credvault.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Fixed-shape payload of the diagnostic endpoint. Each probe fills in its own fields.
 */
@Data
@JsonInclude(JsonInclude.Include.ALWAYS)
public class DiagnosticsReport {

    private String backend = "✅ Running";
    private String database = "❌ Not Available";

    @JsonProperty("database_url")
    private String databaseUrl;

    @JsonProperty("database_name")
    private String databaseName;

    @JsonProperty("connection_status")
    private String connectionStatus = "Not Connected";

    private List<String> collections = new ArrayList<>();
}
