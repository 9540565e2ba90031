package com.nemweb.publisher;

import com.nemweb.model.ForecastSeries;
import com.nemweb.model.PricePoint;
import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.store.ForecastStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

@DisplayName("StoreForecastPublisher")
class StoreForecastPublisherTest {

    /** 15:20 market time. */
    private static final Instant NOW = Instant.parse("2025-12-25T05:20:00Z");

    private ForecastStore store;
    private StoreForecastPublisher publisher;

    private static ForecastSeries series(ProductKind kind, Instant start, long stepMinutes, double... prices) {
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < prices.length; i++) {
            points.add(new PricePoint(start.plusSeconds(stepMinutes * 60 * i), prices[i]));
        }
        return new ForecastSeries(Region.NSW1, kind, points, start, "source.zip");
    }

    @BeforeEach
    void setUp() {
        store = new ForecastStore(Clock.fixed(NOW, ZoneOffset.UTC));
        publisher = new StoreForecastPublisher(store);
    }

    @Nested
    @DisplayName("current")
    class Current {

        @Test
        @DisplayName("reports the latest dispatch price with its market-time timestamp")
        void fromDispatch() {
            store.update(series(ProductKind.REALTIME, NOW, 5, 85.12));

            assertThat(publisher.current(Region.NSW1)).hasValueSatisfying(current -> {
                assertThat(current.price()).isEqualTo(85.12);
                assertThat(current.timestamp()).isEqualTo("2025-12-25T15:20:00+10:00");
                assertThat(current.source()).isEqualTo("DISPATCH");
                assertThat(current.stale()).isFalse();
                assertThat(current.lastUpdate()).isEqualTo(NOW.toString());
                assertThat(current.priceCents()).isCloseTo(8.512, within(1e-9));
            });
        }

        @Test
        @DisplayName("falls back to the first 5-minute interval without dispatch data")
        void fallbackToFiveMinute() {
            store.update(series(ProductKind.FIVE_MINUTE, NOW.plusSeconds(300), 5, 90.0, 95.0));

            assertThat(publisher.current(Region.NSW1)).hasValueSatisfying(current -> {
                assertThat(current.price()).isEqualTo(90.0);
                assertThat(current.source()).isEqualTo("P5MIN");
                assertThat(current.spike()).isNull();
            });
        }

        @Test
        @DisplayName("is empty before any data arrives")
        void noData() {
            assertThat(publisher.current(Region.NSW1)).isEmpty();
        }

        @Test
        @DisplayName("carries the stale flag of the dispatch series")
        void stale() {
            store.update(series(ProductKind.REALTIME, NOW, 5, 85.12));
            store.markStale(Region.NSW1, ProductKind.REALTIME);

            assertThat(publisher.current(Region.NSW1)).hasValueSatisfying(current -> {
                assertThat(current.stale()).isTrue();
                assertThat(current.price()).isEqualTo(85.12);
            });
        }
    }

    @Nested
    @DisplayName("forecast")
    class Forecast {

        @Test
        @DisplayName("publishes parallel arrays in ascending order")
        void parallelArrays() {
            store.update(series(ProductKind.FIVE_MINUTE, NOW.plusSeconds(300), 5, 85.25, 90.5, -12.0));

            ForecastView view = publisher.forecast(Region.NSW1, ProductKind.FIVE_MINUTE);

            assertThat(view.forecast()).containsExactly(85.25, 90.5, -12.0);
            assertThat(view.timestamps()).containsExactly(
                    "2025-12-25T15:25:00+10:00", "2025-12-25T15:30:00+10:00", "2025-12-25T15:35:00+10:00");
            assertThat(view.forecastDict()).containsExactly(
                    entry("2025-12-25T15:25:00+10:00", 85.25),
                    entry("2025-12-25T15:30:00+10:00", 90.5),
                    entry("2025-12-25T15:35:00+10:00", -12.0));
            assertThat(view.forecastCents()).containsExactly(8.525, 9.05, -1.2);
            assertThat(view.forecastKwh()).hasSize(3);
            assertThat(view.forecastKwh().get(0)).isCloseTo(0.08525, within(1e-12));
            assertThat(view.forecastKwh().get(2)).isCloseTo(-0.012, within(1e-12));
            assertThat(view.forecastLength()).isEqualTo(3);
            assertThat(view.kind()).isEqualTo("five_minute");
            assertThat(view.stale()).isFalse();
        }

        @Test
        @DisplayName("is empty for a product never updated")
        void empty() {
            ForecastView view = publisher.forecast(Region.NSW1, ProductKind.PREDISPATCH);

            assertThat(view.forecast()).isEmpty();
            assertThat(view.timestamps()).isEmpty();
            assertThat(view.forecastLength()).isZero();
            assertThat(view.generatedAt()).isNull();
        }
    }

    @Nested
    @DisplayName("merged")
    class Merged {

        @Test
        @DisplayName("appends predispatch periods beyond the 5-minute horizon")
        void mergesBeyondHorizon() {
            // 5-minute: 15:25 .. 15:35
            store.update(series(ProductKind.FIVE_MINUTE, NOW.plusSeconds(300), 5, 80, 81, 82));
            // predispatch: 15:30, 16:00, 16:30
            store.update(series(ProductKind.PREDISPATCH, NOW.plusSeconds(600), 30, 70, 71, 72));

            ForecastView view = publisher.merged(Region.NSW1);

            assertThat(view.forecast()).containsExactly(80.0, 81.0, 82.0, 71.0, 72.0);
            assertThat(view.timestamps()).last().isEqualTo("2025-12-25T16:30:00+10:00");
            assertThat(view.kind()).isEqualTo("merged");
        }

        @Test
        @DisplayName("uses predispatch alone when there is no 5-minute series")
        void predispatchOnly() {
            store.update(series(ProductKind.PREDISPATCH, NOW.plusSeconds(600), 30, 70, 71));

            assertThat(publisher.merged(Region.NSW1).forecast()).containsExactly(70.0, 71.0);
        }

        @Test
        @DisplayName("is stale when either source is stale")
        void staleIfEitherStale() {
            store.update(series(ProductKind.FIVE_MINUTE, NOW.plusSeconds(300), 5, 80));
            store.update(series(ProductKind.PREDISPATCH, NOW.plusSeconds(600), 30, 70));
            store.markStale(Region.NSW1, ProductKind.PREDISPATCH);

            assertThat(publisher.merged(Region.NSW1).stale()).isTrue();
        }
    }

    @Test
    @DisplayName("peak delegates to the store's future-only maximum")
    void peak() {
        store.update(series(ProductKind.PREDISPATCH, NOW.minusSeconds(1800), 30, 500, 60, 75));

        assertThat(publisher.peak(Region.NSW1, ProductKind.PREDISPATCH)).hasValue(75.0);
    }
}
