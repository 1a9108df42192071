package com.bulwark.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat message model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    @JsonProperty("role")
    private String role; // system, user, assistant

    @JsonProperty("content")
    private String content;

    @JsonProperty("name")
    private String name;

    public static Message of(String role, String content) {
        return Message.builder().role(role).content(content).build();
    }

    public boolean isSystem() {
        return "system".equals(role);
    }
}
