package com.nemweb.controller;

import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.publisher.CurrentPrice;
import com.nemweb.publisher.ForecastPublisher;
import com.nemweb.publisher.ForecastView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * REST controller exposing the price and forecast attributes of a region.
 *
 * <pre>
 * GET /regions/NSW1/current
 * GET /regions/NSW1/forecast/five_minute
 * GET /regions/NSW1/peak/predispatch
 * GET /regions/NSW1/merged
 * </pre>
 */
@RestController
@RequestMapping("/regions/{code}")
@CrossOrigin(origins = "*")
public class ForecastController {

    private static final Logger log = LoggerFactory.getLogger(ForecastController.class);

    private final ForecastPublisher publisher;

    public ForecastController(ForecastPublisher publisher) {
        this.publisher = publisher;
    }

    /**
     * Latest spot price of a region, falling back to the first 5-minute interval.
     */
    @GetMapping("/current")
    public ResponseEntity<?> current(@PathVariable String code) {
        Optional<Region> region = Region.fromCode(code);
        if (region.isEmpty()) {
            return unknownRegion(code);
        }

        Optional<CurrentPrice> current = publisher.current(region.get());
        if (current.isEmpty()) {
            log.debug("No current price yet for region={}", region.get());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.noData("No price data yet for " + region.get()));
        }
        return ResponseEntity.ok(current.get());
    }

    /**
     * Raw series of one product. Returns empty arrays until the first update.
     *
     * @param code Region code (e.g., "NSW1")
     * @param kind Product label (e.g., "five_minute")
     */
    @GetMapping("/forecast/{kind}")
    public ResponseEntity<?> forecast(@PathVariable String code, @PathVariable String kind) {
        Optional<Region> region = Region.fromCode(code);
        if (region.isEmpty()) {
            return unknownRegion(code);
        }
        Optional<ProductKind> product = ProductKind.fromLabel(kind);
        if (product.isEmpty()) {
            return unknownKind(kind);
        }

        ForecastView view = publisher.forecast(region.get(), product.get());
        log.debug("Returning {} points for region={} kind={}", view.forecastLength(), region.get(), kind);
        return ResponseEntity.ok(view);
    }

    @GetMapping("/peak/{kind}")
    public ResponseEntity<?> peak(@PathVariable String code, @PathVariable String kind) {
        Optional<Region> region = Region.fromCode(code);
        if (region.isEmpty()) {
            return unknownRegion(code);
        }
        Optional<ProductKind> product = ProductKind.fromLabel(kind);
        if (product.isEmpty()) {
            return unknownKind(kind);
        }

        OptionalDouble peak = publisher.peak(region.get(), product.get());
        if (peak.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.noData("No future " + kind + " prices for " + region.get()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("region", region.get().getCode());
        body.put("kind", product.get().getLabel());
        body.put("peak", peak.getAsDouble());
        return ResponseEntity.ok(body);
    }

    /**
     * 5-minute forecast extended with the predispatch periods beyond its horizon.
     */
    @GetMapping("/merged")
    public ResponseEntity<?> merged(@PathVariable String code) {
        Optional<Region> region = Region.fromCode(code);
        if (region.isEmpty()) {
            return unknownRegion(code);
        }
        return ResponseEntity.ok(publisher.merged(region.get()));
    }

    private static ResponseEntity<ErrorResponse> unknownRegion(String code) {
        log.warn("Invalid region requested: {}", code);
        return ResponseEntity.badRequest()
                .body(ErrorResponse.error("Unsupported region: " + code
                        + ". Supported: " + String.join(", ", Region.supportedCodes())));
    }

    private static ResponseEntity<ErrorResponse> unknownKind(String kind) {
        log.warn("Invalid product requested: {}", kind);
        return ResponseEntity.badRequest()
                .body(ErrorResponse.error("Unsupported product: " + kind
                        + ". Supported: " + String.join(", ", ProductKind.supportedLabels())));
    }
}
