package com.naturaltime.plugin;

import com.naturaltime.plugin.arithmetic.ArithmeticTimePlugin;
import com.naturaltime.token.RelativeTimeUnit;
import com.naturaltime.token.TimeToken;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeResolverTest {

    private final TimeResolver resolver = new TimeResolver(new ArithmeticTimePlugin());

    @Test
    void testTokensAreAppliedInInputOrder() {
        LocalDateTime base = LocalDateTime.of(2001, 1, 30, 0, 0);

        assertEquals(Optional.of(LocalDateTime.of(2001, 3, 1, 0, 0)), resolver.resolve("1 month 1 day", base));
        assertEquals(Optional.of(LocalDateTime.of(2001, 2, 28, 0, 0)), resolver.resolve("1 day 1 month", base));
    }

    @Test
    void testMixedChainFromMillennium() {
        LocalDateTime base = LocalDateTime.of(2000, 1, 1, 0, 0);

        Optional<LocalDateTime> result = resolver.resolve("1 year 2 months ago 3 hours -30 min", base);

        assertEquals(Optional.of(LocalDateTime.of(2000, 11, 1, 2, 30)), result);
    }

    @Test
    void testUnrecognizedExpressionResolvesToEmpty() {
        LocalDateTime base = LocalDateTime.of(2000, 1, 1, 0, 0);

        assertTrue(resolver.resolve("four eggs ago 15 days ago", base).isEmpty());
        assertTrue(resolver.resolve("", base).isEmpty());
    }

    @Test
    void testNullArguments() {
        assertThrows(NullPointerException.class, () -> resolver.resolve("1 day", null));
        assertThrows(NullPointerException.class, () -> resolver.resolve(null, LocalDateTime.now()));
        assertThrows(NullPointerException.class, () -> new TimeResolver(null));
    }

    @Test
    void testUnknownUnitStopsTheChain() {
        List<TimeToken> tokens = List.of(
            TimeToken.of(ArithmeticTimePlugin.KEY, 1, RelativeTimeUnit.DAYS),
            TimeToken.of(ArithmeticTimePlugin.KEY, 1, RelativeTimeUnit.UNKNOWN));

        TimeFormatException exception = assertThrows(TimeFormatException.class,
            () -> resolver.applyAll(tokens, LocalDateTime.of(2000, 1, 1, 0, 0)));
        assertEquals(RelativeTimeUnit.UNKNOWN, exception.getToken().unit());
        assertTrue(exception.getMessage().contains("[Unknown:1]"));
    }
}
