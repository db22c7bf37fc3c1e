package com.questrail.assetexport.api;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExportScaleTest {

    @Test
    void definedOrderIsAscending() {
        assertEquals(List.of(ExportScale.HALF, ExportScale.ONE, ExportScale.ONE_AND_HALF,
                ExportScale.TWO, ExportScale.THREE, ExportScale.FOUR), ExportScale.definedOrder());
        assertEquals(ExportScale.HALF, ExportScale.smallest());
    }

    @Test
    void derivedSuffixIsEmptyOnlyForOneX() {
        assertEquals("", ExportScale.ONE.defaultSuffix());
        assertEquals("@2x", ExportScale.TWO.defaultSuffix());
        assertEquals("@0.5x", ExportScale.HALF.defaultSuffix());
        assertEquals("@1.5x", ExportScale.ONE_AND_HALF.defaultSuffix());
    }

    @Test
    void resolvesNumericValuesRegardlessOfPrecision() {
        assertEquals(Optional.of(ExportScale.TWO), ExportScale.of(new BigDecimal("2.00")));
        assertEquals(Optional.of(ExportScale.ONE_AND_HALF), ExportScale.of(1.5));
        assertEquals(Optional.empty(), ExportScale.of(2.5));
        assertEquals(Optional.empty(), ExportScale.of((BigDecimal) null));
    }
}
