package com.finsight.runner;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RetryPolicyTest {

    @Test
    void delayShouldDoubleUntilCapped() {
        RetryPolicy policy = new RetryPolicy(5, 100L, 250L, millis -> { });

        assertEquals(100L, policy.delayAfter(1));
        assertEquals(200L, policy.delayAfter(2));
        assertEquals(250L, policy.delayAfter(3));
        assertEquals(250L, policy.delayAfter(40));
    }

    @Test
    void pauseShouldUseSleeperAndSkipZeroDelays() throws Exception {
        List<Long> slept = new ArrayList<>();
        new RetryPolicy(3, 50L, 1000L, slept::add).pause(2);
        new RetryPolicy(3, 0L, 1000L, slept::add).pause(1);

        assertEquals(List.of(100L), slept);
    }

    @Test
    void attemptsShouldBeAtLeastOne() {
        assertEquals(1, new RetryPolicy(0, 10L, 10L, null).maxAttempts());
    }
}
