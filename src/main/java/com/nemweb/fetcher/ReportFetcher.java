package com.nemweb.fetcher;

import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.ReportBundle;

import java.util.Optional;

/**
 * Retrieves the latest published report bundle for a product.
 * Implementations hold no state shared between callers; change detection relies on the
 * identifier supplied by the caller.
 */
public interface ReportFetcher {

    /**
     * Fetch the newest bundle for {@code kind}.
     *
     * @param region             Region the caller polls for (bundles themselves cover every region)
     * @param kind               Product to fetch
     * @param previousIdentifier File name of the last bundle the caller processed, or null
     * @return the new bundle, or empty when the latest published file is {@code previousIdentifier}
     * @throws FetchException when the listing or bundle cannot be retrieved
     */
    Optional<ReportBundle> fetch(Region region, ProductKind kind, String previousIdentifier);
}
