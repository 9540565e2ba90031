package com.nemweb.fetcher;

import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.ReportBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ReportFetcher} backed by the public NEMWEB HTTPS directories.
 *
 * <p>Each fetch first reads the directory listing; the bundle itself is only downloaded when
 * the newest file differs from the caller's previous identifier. Transient failures are
 * retried by the supplied {@link RetryTemplate}, which is expected to retry on
 * {@link ResourceAccessException} and {@link HttpServerErrorException} only.
 */
public class NemwebReportFetcher implements ReportFetcher {

    private static final Logger log = LoggerFactory.getLogger(NemwebReportFetcher.class);

    private final RestTemplate restTemplate;
    private final RetryTemplate retryTemplate;
    private final String baseUrl;

    public NemwebReportFetcher(RestTemplate restTemplate, RetryTemplate retryTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.retryTemplate = retryTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public Optional<ReportBundle> fetch(Region region, ProductKind kind, String previousIdentifier) {
        String directoryUrl = ReportListing.directoryUrl(baseUrl, kind);

        String listing = call(kind, "listing " + directoryUrl,
                () -> restTemplate.getForObject(directoryUrl, String.class));

        ReportListing.ListedFile latest = ReportListing.latest(listing, kind)
                .orElseThrow(() -> FetchException.notFound(kind, "No " + kind.getLabel() + " bundle in " + directoryUrl));

        if (latest.name().equals(previousIdentifier)) {
            log.debug("[{}/{}] Latest bundle unchanged: {}", region, kind.getLabel(), latest.name());
            return Optional.empty();
        }

        log.info("[{}/{}] Downloading new bundle: {} (was: {})",
                region, kind.getLabel(), latest.name(), previousIdentifier == null ? "none" : previousIdentifier);
        String fileUrl = directoryUrl + latest.name();
        byte[] payload = call(kind, "bundle " + latest.name(),
                () -> restTemplate.getForObject(fileUrl, byte[].class));
        if (payload == null || payload.length == 0) {
            throw FetchException.notFound(kind, "Empty bundle body for " + latest.name());
        }

        return Optional.of(new ReportBundle(latest.name(), latest.publishedAt(), payload));
    }

    private <T> T call(ProductKind kind, String what, Supplier<T> request) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying {} (attempt {}) after: {}", what, context.getRetryCount() + 1,
                            context.getLastThrowable() == null ? "unknown" : context.getLastThrowable().getMessage());
                }
                return request.get();
            });
        } catch (HttpClientErrorException e) {
            throw FetchException.notFound(kind, what + " returned " + e.getStatusCode());
        } catch (ResourceAccessException | HttpServerErrorException e) {
            throw FetchException.network(kind, "Retries exhausted for " + what + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw FetchException.network(kind, "Unexpected response for " + what + ": " + e.getMessage(), e);
        }
    }
}
