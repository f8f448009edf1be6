package me.remotepilot.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.remotepilot.domain.model.ScheduleRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Registered schedules of a session. {@code time} is the cron expression of a
 * recurring schedule or the ISO-8601 instant of a one-time one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleListResponse {

    private List<ScheduleView> schedules;

    public static ScheduleListResponse of(List<ScheduleRecord> records) {
        return new ScheduleListResponse(records.stream().map(ScheduleView::from).toList());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScheduleView {
        private String id;
        private String time;
        private Payload payload;
        private ScheduleRecord.ScheduleType type;
        private Instant createdAt;

        static ScheduleView from(ScheduleRecord record) {
            return ScheduleView.builder()
                    .id(record.getId())
                    .time(record.getWhen().describe())
                    .payload(new Payload(record.getTool(), record.getArgs(), record.getDescription()))
                    .type(record.getType())
                    .createdAt(record.getCreatedAt())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Payload {
        private String tool;
        private Map<String, Object> args;
        private String description;
    }
}
