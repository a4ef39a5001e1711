package com.credvault.api.dto;

import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Credential {

    @NotNull(message = "title is required")
    private String title;

    @NotNull(message = "username is required")
    private String username;

    @NotNull(message = "password is required")
    private String password;

    private String url;

    private String note;

    /**
     * Storage shape of this credential; optional fields are kept as explicit nulls.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("title", title);
        record.put("username", username);
        record.put("password", password);
        record.put("url", url);
        record.put("note", note);
        return record;
    }
}
