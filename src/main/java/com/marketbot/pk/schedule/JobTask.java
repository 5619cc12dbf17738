package com.marketbot.pk.schedule;

import com.marketbot.pk.model.ScrapeResult;

@FunctionalInterface
public interface JobTask {
    ScrapeResult run() throws Exception;
}
