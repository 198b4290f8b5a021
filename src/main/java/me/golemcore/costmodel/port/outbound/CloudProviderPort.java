package me.golemcore.costmodel.port.outbound;

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

/**
 * Port for cloud-provider specific pricing inputs.
 */
public interface CloudProviderPort {

    /**
     * Current pricing configuration, including discount percentages.
     *
     * @throws IllegalStateException
     *             if the configuration cannot be loaded
     */
    ProviderConfig getConfig();

    /**
     * PromQL expression for provider-local storage costs, added to the storage
     * queries. Empty when the provider has no local storage pricing.
     *
     * @param rate
     *            whether the expression should yield a monthly rate rather than
     *            a cumulative cost
     */
    String getLocalStorageQuery(String window, String offset, boolean rate);
}
