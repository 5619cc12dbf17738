package com.marketbot.pk.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompanyRow {
    private Long id;
    private String symbol;
    private String name;
    private String logoUrl;
}
