package com.marketbot.pk.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyInsertParam {
    private Long id;
    private String symbol;
    private String name;
    private String sector;
    private String sectorCode;
    private String logoUrl;
}
