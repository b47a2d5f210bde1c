package com.di.buildtrace.api.dto;

import lombok.Value;

import java.util.List;

/**
 * Body of the {@code 202 Accepted} answer to {@code POST /process}.
 */
@Value
public class IngestionResponse {

    String     status;
    List<Long> accepted;
}
