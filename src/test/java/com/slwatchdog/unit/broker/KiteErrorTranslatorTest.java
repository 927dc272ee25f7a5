package com.slwatchdog.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;

import com.slwatchdog.broker.KiteErrorTranslator;
import com.slwatchdog.exception.BrokerAuthException;
import com.slwatchdog.exception.BrokerException;
import com.slwatchdog.exception.DuplicateOrderException;
import com.slwatchdog.exception.RateLimitedException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link KiteErrorTranslator}: Kite's code/message pairs become typed
 * broker exceptions, keeping the original as the cause.
 */
class KiteErrorTranslatorTest {

    @Test
    @DisplayName("HTTP 429 becomes RateLimitedException")
    void rateLimitedByCode() {
        BrokerException translated = KiteErrorTranslator.translate("placeOrder", new KiteException("Slow down", 429));

        assertThat(translated).isInstanceOf(RateLimitedException.class);
        assertThat(translated.getMessage()).isEqualTo("placeOrder failed: Slow down");
        assertThat(translated.getCause()).isInstanceOf(KiteException.class);
    }

    @Test
    @DisplayName("A 'Too many requests' message is a rate limit regardless of code")
    void rateLimitedByMessage() {
        assertThat(KiteErrorTranslator.translate("getQuote", new KiteException("Too many requests", 400)))
                .isInstanceOf(RateLimitedException.class);
    }

    @Test
    @DisplayName("Token errors and 403 become BrokerAuthException")
    void authFailures() {
        assertThat(KiteErrorTranslator.translate("getProfile", new TokenException("Incorrect api_key or access_token", 403)))
                .isInstanceOf(BrokerAuthException.class);
        assertThat(KiteErrorTranslator.translate("getPositions", new KiteException("Token expired", 403)))
                .isInstanceOf(BrokerAuthException.class);
    }

    @Test
    @DisplayName("Duplicate-order messages become DuplicateOrderException")
    void duplicates() {
        assertThat(KiteErrorTranslator.translate("placeOrder", new KiteException("Duplicate order detected", 400)))
                .isInstanceOf(DuplicateOrderException.class);
        assertThat(KiteErrorTranslator.translate("placeOrder", new KiteException("Order already completed", 400)))
                .isInstanceOf(DuplicateOrderException.class);
    }

    @Test
    @DisplayName("Anything else is a plain recoverable BrokerException")
    void generic() {
        BrokerException translated = KiteErrorTranslator.translate("placeOrder", new KiteException("Insufficient margin", 400));

        assertThat(translated.getClass()).isEqualTo(BrokerException.class);
        assertThat(translated.isRecoverable()).isTrue();
    }
}
