package me.golemcore.relay.adapter.inbound.web.dto;

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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of starting a confirmation flow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfirmationResponse {

    public static final String STATUS_PROMPTED = "prompted";
    public static final String STATUS_ALREADY_EXISTS = "already_exists";

    private boolean success;
    private String status;
    private String requestId;

    public static ConfirmationResponse prompted(String requestId) {
        return ConfirmationResponse.builder()
                .success(true)
                .status(STATUS_PROMPTED)
                .requestId(requestId)
                .build();
    }

    public static ConfirmationResponse alreadyExists() {
        return ConfirmationResponse.builder()
                .success(true)
                .status(STATUS_ALREADY_EXISTS)
                .build();
    }
}
