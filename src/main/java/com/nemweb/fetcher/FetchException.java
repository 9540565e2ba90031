package com.nemweb.fetcher;

import com.nemweb.model.ProductKind;

/**
 * Raised when a report bundle cannot be obtained from NEMWEB.
 *
 * <p>{@link Kind#NETWORK} is transient and has already been retried when it reaches the caller.
 * {@link Kind#NOT_FOUND} means there is nothing new to process this cycle.
 */
public class FetchException extends RuntimeException {

    public enum Kind {
        NETWORK,
        NOT_FOUND
    }

    private final Kind kind;
    private final ProductKind product;

    public FetchException(Kind kind, ProductKind product, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.product = product;
    }

    public static FetchException network(ProductKind product, String message, Throwable cause) {
        return new FetchException(Kind.NETWORK, product, message, cause);
    }

    public static FetchException notFound(ProductKind product, String message) {
        return new FetchException(Kind.NOT_FOUND, product, message, null);
    }

    public Kind getKind() {
        return kind;
    }

    public ProductKind getProduct() {
        return product;
    }
}
