package com.marketbot.pk.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobLogInsertParam {
    private Long id;
    private String jobName;
    private String status;
    private OffsetDateTime startedAt;
}
