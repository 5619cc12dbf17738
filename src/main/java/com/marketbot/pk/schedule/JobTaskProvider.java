package com.marketbot.pk.schedule;

import com.marketbot.pk.config.Config;

/**
 * Supplies a job that is not built into this application, such as downstream processing of the
 * scraped data. Implementations are found through {@link java.util.ServiceLoader} and run on the
 * trigger configured under {@code schedule.<jobName>}.
 */
public interface JobTaskProvider {

    String jobName();

    JobTask create(Config config) throws Exception;
}
