package me.golemcore.costmodel.domain.model;

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

import lombok.Value;

/**
 * Fractional attribution of a resource's usage to idle, system, user and other
 * categories. Fields are accumulated independently and are not normalized, so
 * they need not sum to 1.
 *
 * <p>
 * Instances are immutable; the {@code plus} methods return a new breakdown.
 */
@Value
public class ClusterCostsBreakdown {

    private static final ClusterCostsBreakdown EMPTY = new ClusterCostsBreakdown(0.0, 0.0, 0.0, 0.0);

    double idle;
    double other;
    double system;
    double user;

    public static ClusterCostsBreakdown empty() {
        return EMPTY;
    }

    /**
     * Adds a CPU mode fraction to the matching field. Unknown or missing modes
     * count as {@code other}.
     */
    public ClusterCostsBreakdown plusMode(String mode, double fraction) {
        if (mode == null) {
            return new ClusterCostsBreakdown(idle, other + fraction, system, user);
        }
        return switch (mode) {
        case "idle" -> new ClusterCostsBreakdown(idle + fraction, other, system, user);
        case "system" -> new ClusterCostsBreakdown(idle, other, system + fraction, user);
        case "user" -> new ClusterCostsBreakdown(idle, other, system, user + fraction);
        default -> new ClusterCostsBreakdown(idle, other + fraction, system, user);
        };
    }

    public ClusterCostsBreakdown plusSystem(double fraction) {
        return new ClusterCostsBreakdown(idle, other, system + fraction, user);
    }
}
