package com.chambua.inventory.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class NumberGrammarTest {

    @Test
    void acceptsPlainGroupedAndSignedNumbers() {
        assertThat(NumberGrammar.parse("1000")).contains(new BigDecimal("1000"));
        assertThat(NumberGrammar.parse("1000.50")).contains(new BigDecimal("1000.50"));
        assertThat(NumberGrammar.parse("1,000")).contains(new BigDecimal("1000"));
        assertThat(NumberGrammar.parse("1,000.50")).contains(new BigDecimal("1000.50"));
        assertThat(NumberGrammar.parse("-500")).contains(new BigDecimal("-500"));
        assertThat(NumberGrammar.parse(" 42 ")).contains(new BigDecimal("42"));
    }

    @Test
    void commaIsAlwaysGroupingNeverDecimal() {
        assertThat(NumberGrammar.parse("100,50")).contains(new BigDecimal("10050"));
    }

    @Test
    void rejectsSymbolsLettersAndMalformedNumbers() {
        assertThat(NumberGrammar.parse("abc")).isEmpty();
        assertThat(NumberGrammar.parse("$1000")).isEmpty();
        assertThat(NumberGrammar.parse("1.2.3")).isEmpty();
        assertThat(NumberGrammar.parse("1e5")).isEmpty();
        assertThat(NumberGrammar.parse(",100")).isEmpty();
        assertThat(NumberGrammar.parse("")).isEmpty();
        assertThat(NumberGrammar.parse(null)).isEmpty();
    }

    @Test
    void formatsWithoutGroupingOrTrailingZeros() {
        assertThat(NumberGrammar.format(new BigDecimal("1000.500"))).isEqualTo("1000.5");
        assertThat(NumberGrammar.format(new BigDecimal("1200.00"))).isEqualTo("1200");
        assertThat(NumberGrammar.format(new BigDecimal("0.000"))).isEqualTo("0");
        assertThat(NumberGrammar.format(new BigDecimal("-3"))).isEqualTo("-3");
        assertThat(NumberGrammar.format(null)).isEmpty();
    }

    @Test
    void formattedValuesParseBackToTheSameNumber() {
        for (String s : new String[]{"1000000.25", "0.001", "-12.5", "7"}) {
            BigDecimal v = new BigDecimal(s);
            assertThat(NumberGrammar.parse(NumberGrammar.format(v)).orElseThrow()).isEqualByComparingTo(v);
        }
    }
}
