package com.transferengine.providers;

import com.github.benmanes.caffeine.cache.Ticker;
import com.transferengine.common.Currency;
import com.transferengine.common.Money;
import com.transferengine.common.exception.RateUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CachingFXProvider.
 *
 * Covers the primary -> fallback -> fail sequence, cache expiry and the
 * single-flight behaviour under a burst of concurrent lookups.
 */
@ExtendWith(MockitoExtension.class)
class CachingFXProviderTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    @Mock
    private RateSource primary;

    @Mock
    private RateSource fallback;

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private CachingFXProvider provider;

    @BeforeEach
    void setUp() {
        lenient().when(primary.getName()).thenReturn("primary");
        lenient().when(fallback.getName()).thenReturn("fallback");
        provider = new CachingFXProvider(primary, fallback, TTL, 100, ticker, clock);
    }

    @Test
    void testSameCurrencyIsExactlyOneWithoutUpstreamCall() {
        ExchangeRate rate = provider.getRate(Currency.EUR, Currency.EUR);

        assertEquals(0, BigDecimal.ONE.compareTo(rate.getRate()));
        assertEquals(RateSourceType.IDENTITY, rate.getSource());
        verify(primary, never()).fetchRate(any(), any());
        verify(fallback, never()).fetchRate(any(), any());
    }

    @Test
    void testPrimarySuccess() {
        when(primary.fetchRate(Currency.USD, Currency.EUR)).thenReturn(quote(Currency.USD, Currency.EUR, "0.85"));

        ExchangeRate rate = provider.getRate(Currency.USD, Currency.EUR);

        assertEquals(0, new BigDecimal("0.85").compareTo(rate.getRate()));
        assertEquals(RateSourceType.PRIMARY, rate.getSource());
        assertEquals(clock.instant().plus(TTL), rate.getExpiresAt());
        verify(fallback, never()).fetchRate(any(), any());
    }

    @Test
    void testPrimaryFailsFallbackSucceeds() {
        when(primary.fetchRate(Currency.USD, Currency.EUR)).thenThrow(new RateSourceException("primary", "HTTP 429"));
        when(fallback.fetchRate(Currency.USD, Currency.EUR)).thenReturn(quote(Currency.USD, Currency.EUR, "0.88"));

        ExchangeRate rate = provider.getRate(Currency.USD, Currency.EUR);

        assertEquals(0, new BigDecimal("0.88").compareTo(rate.getRate()));
        assertEquals(RateSourceType.FALLBACK, rate.getSource());
        verify(primary).fetchRate(Currency.USD, Currency.EUR);
        verify(fallback).fetchRate(Currency.USD, Currency.EUR);
    }

    @Test
    void testActiveSourceFollowsTheSourceThatAnswered() {
        when(primary.fetchRate(Currency.USD, Currency.EUR)).thenThrow(new RateSourceException("primary", "HTTP 429"));
        when(fallback.fetchRate(Currency.USD, Currency.EUR)).thenReturn(quote(Currency.USD, Currency.EUR, "0.88"));
        when(primary.fetchRate(Currency.USD, Currency.GBP)).thenReturn(quote(Currency.USD, Currency.GBP, "0.79"));

        assertEquals("primary", provider.getActiveSourceName());

        provider.getRate(Currency.USD, Currency.EUR);
        assertEquals("fallback", provider.getActiveSourceName());

        // served from cache, no upstream lookup
        provider.getRate(Currency.USD, Currency.EUR);
        assertEquals("fallback", provider.getActiveSourceName());

        provider.getRate(Currency.USD, Currency.GBP);
        assertEquals("primary", provider.getActiveSourceName());
    }

    @Test
    void testBothSourcesFail() {
        when(primary.fetchRate(Currency.USD, Currency.EUR)).thenThrow(new RateSourceException("primary", "timeout"));
        when(fallback.fetchRate(Currency.USD, Currency.EUR)).thenThrow(new RateSourceException("fallback", "HTTP 500"));

        RateUnavailableException e = assertThrows(RateUnavailableException.class,
            () -> provider.getRate(Currency.USD, Currency.EUR));

        assertTrue(e.getMessage().contains("USD to EUR"));
        assertEquals(Currency.USD, e.getFrom());
        verify(primary, times(1)).fetchRate(Currency.USD, Currency.EUR);
        verify(fallback, times(1)).fetchRate(Currency.USD, Currency.EUR);
    }

    @Test
    void testFailuresAreNotCached() {
        when(primary.fetchRate(Currency.USD, Currency.EUR))
            .thenThrow(new RateSourceException("primary", "down"))
            .thenReturn(quote(Currency.USD, Currency.EUR, "0.90"));
        when(fallback.fetchRate(Currency.USD, Currency.EUR)).thenThrow(new RateSourceException("fallback", "down"));

        assertThrows(RateUnavailableException.class, () -> provider.getRate(Currency.USD, Currency.EUR));
        ExchangeRate rate = provider.getRate(Currency.USD, Currency.EUR);

        assertEquals(0, new BigDecimal("0.90").compareTo(rate.getRate()));
    }

    @Test
    void testRateIsCachedUntilTtlElapses() {
        when(primary.fetchRate(Currency.GBP, Currency.USD))
            .thenReturn(quote(Currency.GBP, Currency.USD, "1.27"))
            .thenReturn(quote(Currency.GBP, Currency.USD, "1.30"));

        provider.getRate(Currency.GBP, Currency.USD);
        nanos.addAndGet(TTL.minusSeconds(1).toNanos());
        ExchangeRate cached = provider.getRate(Currency.GBP, Currency.USD);
        assertEquals(0, new BigDecimal("1.27").compareTo(cached.getRate()));
        verify(primary, times(1)).fetchRate(Currency.GBP, Currency.USD);

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        ExchangeRate refreshed = provider.getRate(Currency.GBP, Currency.USD);
        assertEquals(0, new BigDecimal("1.30").compareTo(refreshed.getRate()));
        verify(primary, times(2)).fetchRate(Currency.GBP, Currency.USD);
    }

    @Test
    void testExpiredRateIsNotServedDuringOutage() {
        when(primary.fetchRate(Currency.GBP, Currency.USD))
            .thenReturn(quote(Currency.GBP, Currency.USD, "1.27"))
            .thenThrow(new RateSourceException("primary", "down"));
        when(fallback.fetchRate(Currency.GBP, Currency.USD)).thenThrow(new RateSourceException("fallback", "down"));

        provider.getRate(Currency.GBP, Currency.USD);
        nanos.addAndGet(TTL.plusSeconds(1).toNanos());

        assertThrows(RateUnavailableException.class, () -> provider.getRate(Currency.GBP, Currency.USD));
    }

    @Test
    void testBurstOfLookupsTriggersSingleUpstreamCall() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(primary.fetchRate(Currency.USD, Currency.PEN)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return quote(Currency.USD, Currency.PEN, "3.70");
        });

        int callers = 50;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<ExchangeRate>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> provider.getRate(Currency.USD, Currency.PEN)));
            }
            Thread.sleep(200);
            release.countDown();

            for (Future<ExchangeRate> result : results) {
                assertEquals(0, new BigDecimal("3.70").compareTo(result.get(10, TimeUnit.SECONDS).getRate()));
            }
        } finally {
            pool.shutdownNow();
        }

        verify(primary, times(1)).fetchRate(Currency.USD, Currency.PEN);
    }

    @Test
    void testConvertRoundsToTargetScale() {
        when(primary.fetchRate(Currency.USD, Currency.PEN)).thenReturn(quote(Currency.USD, Currency.PEN, "3.7049"));

        Money converted = provider.convert(Money.of("10.00", Currency.USD), Currency.PEN);

        assertEquals(Money.of("37.05", Currency.PEN), converted);
    }

    private static RateQuote quote(Currency from, Currency to, String rate) {
        return new RateQuote(from, to, new BigDecimal(rate), Instant.parse("2024-05-01T09:59:59Z"));
    }
}
