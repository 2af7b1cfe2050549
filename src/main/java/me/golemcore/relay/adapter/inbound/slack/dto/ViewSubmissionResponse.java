package me.golemcore.relay.adapter.inbound.slack.dto;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Reply to a {@code view_submission}: close the modal or show errors next to
 * its inputs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ViewSubmissionResponse {

    @JsonProperty("response_action")
    private String responseAction;

    private Map<String, String> errors;

    public static ViewSubmissionResponse clear() {
        return ViewSubmissionResponse.builder().responseAction("clear").build();
    }

    public static ViewSubmissionResponse errors(String blockId, String message) {
        return ViewSubmissionResponse.builder()
                .responseAction("errors")
                .errors(Map.of(blockId, message))
                .build();
    }
}
