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
public class CompanyUpdateParam {
    private Long id;
    private String name;
    private String description;
    private String sector;
    private String logoUrl;
    private OffsetDateTime updatedAt;
}
