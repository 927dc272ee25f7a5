package com.slwatchdog.broker;

import com.slwatchdog.exception.BrokerAuthException;
import com.slwatchdog.exception.BrokerException;
import com.slwatchdog.exception.DuplicateOrderException;
import com.slwatchdog.exception.RateLimitedException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import java.util.Locale;

/**
 * Translates Kite SDK failures into the watchdog's typed broker exceptions.
 *
 * <p>{@link KiteException} extends {@link Throwable} and only carries an HTTP-like
 * {@code code} and a free-text {@code message}, so classification happens here once
 * and every caller downstream works with exception types instead of strings.
 */
public final class KiteErrorTranslator {

    private KiteErrorTranslator() {}

    public static BrokerException translate(String operation, KiteException e) {
        String detail = e.message != null ? e.message : e.getClass().getSimpleName();
        String message = operation + " failed: " + detail;
        String lower = detail.toLowerCase(Locale.ROOT);

        if (e.code == 429 || lower.contains("too many requests") || lower.contains("rate limit")) {
            return new RateLimitedException(message, e);
        }
        if (e instanceof TokenException || e.code == 403) {
            return new BrokerAuthException(message, e);
        }
        if (isDuplicateMessage(lower)) {
            return new DuplicateOrderException(message, e);
        }
        return new BrokerException(message, e);
    }

    static boolean isDuplicateMessage(String lowerCaseMessage) {
        return lowerCaseMessage.contains("duplicate order")
                || lowerCaseMessage.contains("order already completed")
                || lowerCaseMessage.contains("already executed");
    }
}
