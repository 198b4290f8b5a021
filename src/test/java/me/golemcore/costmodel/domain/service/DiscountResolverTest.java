package me.golemcore.costmodel.domain.service;

import me.golemcore.costmodel.domain.model.Discounts;
import me.golemcore.costmodel.domain.model.ProviderConfig;
import me.golemcore.costmodel.port.outbound.CloudProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DiscountResolverTest {

    private CloudProviderPort cloudProvider;
    private DiscountResolver resolver;

    @BeforeEach
    void setUp() {
        cloudProvider = mock(CloudProviderPort.class);
        resolver = new DiscountResolver(cloudProvider);
    }

    @Test
    void parsesPercentagesWithAndWithoutSign() {
        assertEquals(0.10, DiscountResolver.parsePercent("10%"), 1e-12);
        assertEquals(0.25, DiscountResolver.parsePercent("25"), 1e-12);
        assertEquals(0.055, DiscountResolver.parsePercent(" 5.5 % "), 1e-12);
        assertEquals(0.0, DiscountResolver.parsePercent("0%"));
    }

    @Test
    void parsePercentRejectsGarbage() {
        assertThrows(NumberFormatException.class, () -> DiscountResolver.parsePercent("ten"));
        assertThrows(NumberFormatException.class, () -> DiscountResolver.parsePercent(null));
        assertThrows(NumberFormatException.class, () -> DiscountResolver.parsePercent("NaN%"));
    }

    @Test
    void resolvesBothDiscounts() {
        when(cloudProvider.getConfig()).thenReturn(ProviderConfig.builder()
                .discount("30%")
                .negotiatedDiscount("10%")
                .build());

        Discounts discounts = resolver.resolve();

        assertEquals(0.30, discounts.standard(), 1e-12);
        assertEquals(0.10, discounts.custom(), 1e-12);
    }

    @Test
    void malformedDiscountFallsBackToZeroIndependently() {
        when(cloudProvider.getConfig()).thenReturn(ProviderConfig.builder()
                .discount("lots")
                .negotiatedDiscount("20%")
                .build());

        Discounts discounts = resolver.resolve();

        assertEquals(0.0, discounts.standard());
        assertEquals(0.20, discounts.custom(), 1e-12);
    }

    @Test
    void missingValuesMeanNoDiscount() {
        when(cloudProvider.getConfig()).thenReturn(new ProviderConfig());

        assertEquals(Discounts.none(), resolver.resolve());
    }

    @Test
    void unavailableConfigMeansNoDiscount() {
        when(cloudProvider.getConfig()).thenThrow(new IllegalStateException("pricing file missing"));

        assertEquals(Discounts.none(), resolver.resolve());
    }

    @Test
    void nullConfigMeansNoDiscount() {
        when(cloudProvider.getConfig()).thenReturn(null);

        assertEquals(Discounts.none(), resolver.resolve());
    }
}
