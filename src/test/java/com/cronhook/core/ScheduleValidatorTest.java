package com.cronhook.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScheduleValidatorTest {

    @Test
    public void testValidExpressions() {
        String[] valid = {
            "* * * * *",
            "*/5 * * * *",
            "0 0 * * *",
            "0 9-17 * * 1-5",
            "15,45 */2 1 1,6,12 *",
            "0 0 1 jan-jun sun",
            "0 12 * * 7",
            "59 23 31 12 6",
            "10/5 * * * *",
            "* * * * * *",
            "*/30 * * * * *",
            "  0   0  *  *  *  ",
        };
        for (String expr : valid) {
            assertTrue(ScheduleValidator.validate(expr), expr);
        }
    }

    @Test
    public void testInvalidExpressions() {
        String[] invalid = {
            null,
            "",
            "   ",
            "* * * *",
            "* * * * * * *",
            "99 * * * *",
            "60 * * * *",
            "* 24 * * *",
            "* * 0 * *",
            "* * 32 * *",
            "* * * 13 *",
            "* * * 0 *",
            "* * * * 8",
            "*/0 * * * *",
            "5-1 * * * *",
            "1,,2 * * * *",
            "1, * * * *",
            "a * * * *",
            "-1 * * * *",
            "? * * * *",
            "* * L * *",
            "* * 15W * *",
            "* * * * 5#2",
            "* * * * * 60",
            "1-2-3 * * * *",
            "*/ * * * *",
            "0 0 * FOO *",
        };
        for (String expr : invalid) {
            assertFalse(ScheduleValidator.validate(expr), String.valueOf(expr));
        }
    }
}
