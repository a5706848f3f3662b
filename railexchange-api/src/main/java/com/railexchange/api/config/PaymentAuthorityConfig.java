package com.railexchange.api.config;

import com.railexchange.api.subscription.PaymentAuthority;
import com.railexchange.api.subscription.StripePaymentAuthority;
import com.railexchange.api.subscription.UnconfiguredPaymentAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the payment authority adapter. Without a secret key the platform still starts,
 * but subscription checks deny.
 */
@Configuration
public class PaymentAuthorityConfig {

    private static final Logger log = LoggerFactory.getLogger(PaymentAuthorityConfig.class);

    @Bean
    public PaymentAuthority paymentAuthority(PaymentAuthorityProperties properties) {
        if (!properties.isConfigured()) {
            log.warn("railexchange.payment-authority.secret-key is not set; subscription verification will deny all checks");
            return new UnconfiguredPaymentAuthority();
        }
        return new StripePaymentAuthority(properties);
    }
}
