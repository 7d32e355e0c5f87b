package me.golemcore.map.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Outcome of a single map tool invocation.
 *
 * <p>
 * Successful results carry a human-readable {@code output}; failures carry an
 * {@code error} and a {@link ToolFailureKind}. Both kinds get the map state as
 * it stands after the call attached by the dispatcher.
 *
 * @since 1.0
 */
@Data
@Builder(toBuilder = true)
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Map<String, Object> data;
    private String error;
    private ToolFailureKind failureKind;
    private MapSnapshot mapState;

    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult success(String output, Map<String, Object> data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    /**
     * Text reported back to the LLM and the client for this result.
     */
    public String getMessage() {
        return success ? output : error;
    }

    public ToolResult withMapState(MapSnapshot snapshot) {
        return toBuilder().mapState(snapshot).build();
    }
}
