package com.marketbot.pk.model;

import lombok.Value;

@Value
public class CommodityRate {
    String name;
    double price;
    String source;
}
