package com.foreman.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProjectRequest(
    @JsonProperty("project_path") String projectPath
) {}
