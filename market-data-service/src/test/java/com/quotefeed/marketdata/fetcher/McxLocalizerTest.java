package com.quotefeed.marketdata.fetcher;

import com.quotefeed.common.model.LocalizedPrice;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class McxLocalizerTest {

    @Test
    void silverPerKilogram() {
        // 25 × 83.50 × 35.274 = 73634.475
        LocalizedPrice silver = McxLocalizer.localize("SILVER", 25.0).orElseThrow();

        assertEquals(new BigDecimal("73634.48"), silver.price());
        assertEquals("per kg", silver.unit());
        assertEquals("Mumbai Spot Silver", silver.displayName());
        assertEquals("₹73,634.48", silver.formatted());
    }

    @Test
    void goldUsesUnroundedUsdPrice() {
        // 2000.004 × 83.50 × 0.321507 = 53691.777...; from 2000.00 it would be 53691.67
        LocalizedPrice gold = McxLocalizer.localize("GOLD", 2000.004).orElseThrow();

        assertEquals(new BigDecimal("53691.78"), gold.price());
        assertEquals("per 10g", gold.unit());
    }

    @Test
    void unknownCommodityOrUnusablePriceIsSkipped() {
        assertEquals(Optional.empty(), McxLocalizer.localize("COPPER", 4.10));
        assertEquals(Optional.empty(), McxLocalizer.localize("GOLD", Double.NaN));
        assertEquals(Optional.empty(), McxLocalizer.localize("GOLD", 0.0));
        assertEquals(Optional.empty(), McxLocalizer.localize("GOLD", -5.0));
    }
}
