package com.scoutharvest.core.normalize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NumberParsingTest {

    @Test
    void thousandsSeparatorsInAnyLocale() {
        assertEquals(31980L, NumberParsing.parseAmount("€ 31,980"));
        assertEquals(31980L, NumberParsing.parseAmount("31.980 €"));
        assertEquals(45500L, NumberParsing.parseAmount("CHF 45'500.–"));
        assertEquals(1250000L, NumberParsing.parseAmount("1 250 000 km"));
        assertEquals(161415L, NumberParsing.parseAmount("161 415 km"));
    }

    @Test
    void decimalPartIsRoundedHalfUp() {
        assertEquals(1235L, NumberParsing.parseAmount("1.234,56 €"));
        assertEquals(12500L, NumberParsing.parseAmount("£12,499.50"));
        assertEquals(12499L, NumberParsing.parseAmount("£12,499.49"));
        assertEquals(10L, NumberParsing.parseAmount("9,5"));
    }

    @Test
    void unparseableIsNullNotZero() {
        assertNull(NumberParsing.parseAmount("Price on request"));
        assertNull(NumberParsing.parseAmount(null));
        assertNull(NumberParsing.firstInteger("- seats"));
    }

    @Test
    void firstIntegerHandlesGrouping() {
        assertEquals(1598, NumberParsing.firstInteger("1,598 cc"));
        assertEquals(1204, NumberParsing.firstInteger("(1,204 reviews)"));
        assertEquals(5, NumberParsing.firstInteger("5 seats"));
        assertEquals(8, NumberParsing.firstInteger("8"));
    }

    @Test
    void engineSizeNeedsCcUnitOrThreeDigits() {
        assertEquals(2993, NumberParsing.engineSizeCc("2,993 cc"));
        assertEquals(1598, NumberParsing.engineSizeCc("1.598 cm³"));
        assertEquals(999, NumberParsing.engineSizeCc("999"));
        assertEquals(50, NumberParsing.engineSizeCc("50 ccm"));
        assertNull(NumberParsing.engineSizeCc("1.6 l"));
        assertNull(NumberParsing.engineSizeCc("2.0 TDI"));
        assertNull(NumberParsing.engineSizeCc(null));
    }
}
