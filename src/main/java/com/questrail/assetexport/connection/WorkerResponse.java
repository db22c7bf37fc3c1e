package com.questrail.assetexport.connection;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * One decoded worker response.
 *
 * @param id     identifier of the request being answered
 * @param result result payload; a {@code NullNode} when absent or on error
 * @param error  error message reported by the worker, if the call failed
 */
public record WorkerResponse(long id, JsonNode result, Optional<String> error)
{
    public WorkerResponse {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(error, "error");
    }

    public boolean isError() {
        return error.isPresent();
    }
}
