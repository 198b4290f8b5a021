package me.golemcore.costmodel.adapter.outbound.provider;

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

import me.golemcore.costmodel.domain.model.ProviderConfig;
import me.golemcore.costmodel.infrastructure.config.CostModelProperties;
import me.golemcore.costmodel.port.outbound.CloudProviderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cloud provider backed by static configuration.
 *
 * <p>
 * Discounts come from {@code costmodel.pricing.discount} and
 * {@code costmodel.pricing.negotiated-discount}. The optional
 * {@code costmodel.pricing.local-storage-query} is a PromQL template in which
 * {@code {window}} and {@code {offset}} are substituted; {@code {offset}}
 * becomes {@code offset <duration>} or nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredCloudProviderAdapter implements CloudProviderPort {

    private final CostModelProperties properties;

    @Override
    public ProviderConfig getConfig() {
        CostModelProperties.PricingProperties pricing = properties.getPricing();
        return ProviderConfig.builder()
                .discount(pricing.getDiscount())
                .negotiatedDiscount(pricing.getNegotiatedDiscount())
                .build();
    }

    @Override
    public String getLocalStorageQuery(String window, String offset, boolean rate) {
        String template = properties.getPricing().getLocalStorageQuery();
        if (template == null || template.isBlank()) {
            return "";
        }
        String fmtOffset = offset == null || offset.isBlank() ? "" : "offset " + offset;
        String query = template.replace("{window}", window).replace("{offset}", fmtOffset);
        log.debug("[Provider] Local storage query (rate={}): {}", rate, query);
        return query;
    }
}
