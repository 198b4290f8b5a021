package me.golemcore.costmodel.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.costmodel.domain.model.Discounts;
import me.golemcore.costmodel.domain.model.ProviderConfig;
import me.golemcore.costmodel.port.outbound.CloudProviderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves the discount fractions to apply to raw costs.
 *
 * <p>
 * Discounts are a best-effort adjustment: if the provider configuration cannot
 * be loaded, or a percentage is malformed, that discount is 0 and the
 * computation goes on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscountResolver {

    private final CloudProviderPort cloudProvider;

    public Discounts resolve() {
        ProviderConfig config;
        try {
            config = cloudProvider.getConfig();
        } catch (RuntimeException e) { // NOSONAR - missing pricing config must not fail cost queries
            log.warn("[Pricing] Unable to load provider config, using no discount: {}", e.getMessage());
            return Discounts.none();
        }
        if (config == null) {
            return Discounts.none();
        }
        return new Discounts(
                parseOrZero(config.getDiscount(), "discount"),
                parseOrZero(config.getNegotiatedDiscount(), "negotiated discount"));
    }

    /**
     * Parse {@code "NN%"} or {@code "NN"} into a fraction, e.g. {@code "10%"}
     * becomes {@code 0.10}.
     *
     * @throws NumberFormatException
     *             if the text is not a percentage
     */
    public static double parsePercent(String text) {
        if (text == null) {
            throw new NumberFormatException("Percentage is null");
        }
        String trimmed = text.trim();
        if (trimmed.endsWith("%")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        double percent = Double.parseDouble(trimmed);
        if (Double.isNaN(percent) || Double.isInfinite(percent)) {
            throw new NumberFormatException("Percentage is not finite: " + text);
        }
        return percent / 100.0;
    }

    private double parseOrZero(String text, String what) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        try {
            return parsePercent(text);
        } catch (NumberFormatException e) {
            log.warn("[Pricing] Malformed {} '{}', using 0", what, text);
            return 0.0;
        }
    }
}
