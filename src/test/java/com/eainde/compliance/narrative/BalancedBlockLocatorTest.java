package com.eainde.compliance.narrative;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class BalancedBlockLocatorTest {

    @Test
    @DisplayName("finds the first balanced object in surrounding prose")
    void prose() {
        assertThat(BalancedBlockLocator.firstObject("Result: {\"a\": {\"b\": 1}} and {\"c\": 2}"))
                .hasValue("{\"a\": {\"b\": 1}}");
    }

    @Test
    @DisplayName("braces inside strings and escaped quotes do not count")
    void stringsIgnored() {
        assertThat(BalancedBlockLocator.firstObject("Here you go: {\"a\": \"}\\\"{\"} trailing"))
                .hasValue("{\"a\": \"}\\\"{\"}");
    }

    @Test
    @DisplayName("an unclosed brace is skipped and the search resumes at the next one")
    void unclosed() {
        assertThat(BalancedBlockLocator.firstObject("{ unclosed { \"b\": 1 }"))
                .hasValue("{ \"b\": 1 }");
    }

    @Test
    @DisplayName("many unclosed braces are scanned once, not once per brace")
    void manyUnclosed() {
        String text = "{ ".repeat(200_000) + "{\"b\": 1}";

        String found = assertTimeoutPreemptively(Duration.ofSeconds(2), () -> BalancedBlockLocator.firstObject(text))
                .orElseThrow();

        assertThat(found).isEqualTo("{\"b\": 1}");
    }

    @Test
    @DisplayName("of several inner objects under an unclosed brace the earliest closed one wins")
    void earliestInner() {
        assertThat(BalancedBlockLocator.firstObject("{ {\"a\": {\"x\": 1}} {\"b\": 2}"))
                .hasValue("{\"a\": {\"x\": 1}}");
    }

    @Test
    @DisplayName("no object gives empty")
    void none() {
        assertThat(BalancedBlockLocator.firstObject(null)).isEmpty();
        assertThat(BalancedBlockLocator.firstObject("")).isEmpty();
        assertThat(BalancedBlockLocator.firstObject("no braces [1, 2]")).isEmpty();
        assertThat(BalancedBlockLocator.firstObject("{{{")).isEmpty();
    }
}
