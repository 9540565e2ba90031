package com.nemweb.region;

import com.nemweb.fetcher.NemwebReportFetcher;
import com.nemweb.fetcher.ReportFetcher;
import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.parser.ReportParser;
import com.nemweb.scheduler.PollScheduler;
import com.nemweb.scheduler.PollerSettings;
import com.nemweb.scheduler.ProductPoller;
import com.nemweb.store.ForecastStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires a pipeline against the live NEMWEB site. Each pipeline gets its own fetcher and parser
 * instances; only the store and the thread pools are shared.
 */
@Component
public class NemwebPipelineFactory implements RegionPipelineFactory {

    private final RestTemplate restTemplate;
    private final RetryTemplate retryTemplate;
    private final ForecastStore store;
    private final TaskScheduler taskScheduler;
    private final AsyncTaskExecutor pollExecutor;
    private final PollerSettings settings;
    private final String baseUrl;
    private final long maxEntryBytes;

    public NemwebPipelineFactory(
            RestTemplate nemwebRestTemplate,
            RetryTemplate nemwebRetryTemplate,
            ForecastStore store,
            TaskScheduler taskScheduler,
            @Qualifier("pollExecutor") AsyncTaskExecutor pollExecutor,
            PollerSettings settings,
            @Value("${nemweb.base-url:https://nemweb.com.au}") String baseUrl,
            @Value("${nemweb.parser.max-entry-bytes:268435456}") long maxEntryBytes) {
        this.restTemplate = nemwebRestTemplate;
        this.retryTemplate = nemwebRetryTemplate;
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.pollExecutor = pollExecutor;
        this.settings = settings;
        this.baseUrl = baseUrl;
        this.maxEntryBytes = maxEntryBytes;
    }

    @Override
    public RegionPipeline create(Region region) {
        ReportFetcher fetcher = new NemwebReportFetcher(restTemplate, retryTemplate, baseUrl);
        ReportParser parser = new ReportParser(maxEntryBytes);

        List<ProductPoller> pollers = new ArrayList<>();
        for (ProductKind kind : ProductKind.values()) {
            pollers.add(new ProductPoller(region, kind, fetcher, parser, store, pollExecutor,
                    settings.failureThreshold()));
        }
        return new RegionPipeline(region, new PollScheduler(taskScheduler, settings, pollers));
    }
}
