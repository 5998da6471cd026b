package com.restschema.validation;

import com.restschema.common.status.Status;
import com.restschema.errors.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorsTest {

    @Test
    void testMin() {
        Validator<Integer> min = Validators.min(7);
        assertTrue(min.validate(7).isOk());
        assertTrue(min.validate(8).isOk());

        Status status = min.validate(5);
        assertTrue(status.isError());
        assertEquals("5 is not >= 7", status.getMessage());
    }

    @Test
    void testMax() {
        Validator<Integer> max = Validators.max(3);
        assertTrue(max.validate(3).isOk());
        assertEquals("4 is not <= 3", max.validate(4).getMessage());
    }

    @Test
    void testRange() {
        Validator<Integer> range = Validators.range(0, 30);
        assertTrue(range.validate(0).isOk());
        assertTrue(range.validate(30).isOk());
        assertEquals("-1 is not >= 0", range.validate(-1).getMessage());
        assertEquals("31 is not <= 30", range.validate(31).getMessage());
    }

    @Test
    void testRange_MinAboveMax() {
        assertThrows(ConfigurationException.class, () -> Validators.range(5, 1));
    }

    @Test
    void testChoices() {
        Validator<String> choices = Validators.choices(List.of("a", "b"));
        assertTrue(choices.validate("a").isOk());
        assertEquals("x is not in [a, b]", choices.validate("x").getMessage());
    }

    @Test
    void testMatch() {
        Validator<String> match = Validators.match("\\w+");
        assertTrue(match.validate("cat").isOk());
        assertTrue(match.validate("cat food").isOk(), "pattern is anchored at the start only");
        assertEquals("!cat does not match pattern: \\w+", match.validate("!cat").getMessage());
    }

    @Test
    void testMatch_InvalidPattern() {
        assertThrows(ConfigurationException.class, () -> Validators.match("(unclosed"));
    }

    @Test
    void testNotBlank() {
        Validator<String> notBlank = Validators.notBlank();
        assertTrue(notBlank.validate("x").isOk());
        assertTrue(notBlank.validate("  ").isError());
        assertTrue(notBlank.validate("").isError());
    }

    @Test
    void testRunChain_StopsAtFirstFailure() {
        int[] calls = {0};
        Validator<Integer> counting = value -> {
            calls[0]++;
            return Status.ok();
        };
        List<Validator<Integer>> chain = List.of(Validators.min(10), counting);

        Status status = Validators.runChain(chain, 5);
        assertEquals("5 is not >= 10", status.getMessage());
        assertEquals(0, calls[0], "validators after a failure must not run");

        assertTrue(Validators.runChain(chain, 15).isOk());
        assertEquals(1, calls[0]);
    }
}
