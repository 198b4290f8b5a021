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

/**
 * Billable resource categories and the discounts each one is subject to.
 *
 * <p>
 * The policy table is a pricing rule: compute and memory get both the list
 * discount and the negotiated discount, GPUs only the negotiated one, storage
 * neither.
 */
public enum CostCategory {

    CPU(DiscountPolicy.BOTH),
    GPU(DiscountPolicy.CUSTOM_ONLY),
    RAM(DiscountPolicy.BOTH),
    STORAGE(DiscountPolicy.NONE);

    private final DiscountPolicy discountPolicy;

    CostCategory(DiscountPolicy discountPolicy) {
        this.discountPolicy = discountPolicy;
    }

    /**
     * Multiplier applied to raw cost values of this category.
     */
    public double discountFactor(Discounts discounts) {
        return switch (discountPolicy) {
        case BOTH -> (1.0 - discounts.standard()) * (1.0 - discounts.custom());
        case CUSTOM_ONLY -> 1.0 - discounts.custom();
        case NONE -> 1.0;
        };
    }

    public enum DiscountPolicy {
        BOTH, CUSTOM_ONLY, NONE
    }
}
