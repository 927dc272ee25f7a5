package com.slwatchdog.broker;

import com.slwatchdog.exception.BrokerAuthException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Profile;
import java.io.IOException;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Verifies the configured Kite session at startup. Internal to {@link KiteBrokerGateway}.
 *
 * <p>Any failure here is an authentication failure: without a working session the
 * watchdog cannot protect anything, so the caller aborts startup.
 */
@Service
public class KiteSessionService {

    private static final Logger log = LoggerFactory.getLogger(KiteSessionService.class);

    private final KiteConnect kiteConnect;

    public KiteSessionService(KiteConnect kiteConnect) {
        this.kiteConnect = kiteConnect;
    }

    public String verifySession() {
        try {
            Profile profile = kiteConnect.getProfile();
            String userName = profile != null ? profile.userName : null;
            log.info("Kite session verified: user={}", userName);
            return userName;
        } catch (KiteException e) {
            log.error("Kite session verification failed: code={}, message={}", e.code, e.message);
            throw new BrokerAuthException("Kite session verification failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Kite session verification error", e);
            throw new BrokerAuthException("Kite session verification error: " + e.getMessage(), e);
        }
    }
}
