package com.osservatorio.client.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AdaptiveLimitControllerTest {

    private RateLimitProperties.Adaptive settings;
    private AdaptiveLimitController controller;

    @BeforeEach
    void setUp() {
        settings = new RateLimitProperties.Adaptive();
        settings.setWindowSize(10);
        controller = new AdaptiveLimitController(settings);
    }

    @Test
    void unknownIdentifierRunsAtNominal() {
        assertThat(controller.factor("nobody")).isEqualTo(1.0);
    }

    @Test
    void slowResponsesShrinkTheFactorMonotonically() {
        double previous = 1.0;
        for (int i = 0; i < 20; i++) {
            controller.recordResponseTime("c", "/data", Duration.ofMillis(4_000));
            double factor = controller.factor("c");
            assertThat(factor).isLessThanOrEqualTo(previous);
            previous = factor;
        }

        assertThat(previous).isEqualTo(settings.getMinAdjustmentRatio(), within(1e-9));
        assertThat(controller.throttledIdentifiers()).isEqualTo(1);
    }

    @Test
    void recoveryRaisesTheFactorButNeverAboveNominal() {
        for (int i = 0; i < 5; i++) {
            controller.recordResponseTime("c", "/data", Duration.ofMillis(4_000));
        }
        double throttled = controller.factor("c");
        assertThat(throttled).isLessThan(1.0);

        double previous = throttled;
        boolean recovering = false;
        for (int i = 0; i < 40; i++) {
            controller.recordResponseTime("c", "/data", Duration.ofMillis(100));
            double factor = controller.factor("c");
            if (recovering) {
                assertThat(factor).isGreaterThanOrEqualTo(previous);
            }
            recovering = recovering || factor > previous;
            assertThat(factor).isLessThanOrEqualTo(1.0);
            previous = factor;
        }

        assertThat(controller.factor("c")).isEqualTo(1.0, within(1e-9));
        assertThat(controller.purgeRecovered()).isEqualTo(1);
        assertThat(controller.throttledIdentifiers()).isZero();
    }

    @Test
    void fastCallsOnAnotherEndpointDoNotLiftTheThrottle() {
        for (int i = 0; i < 5; i++) {
            controller.recordResponseTime("c", "/slow", Duration.ofMillis(5_000));
        }
        double throttled = controller.factor("c");
        assertThat(throttled).isLessThan(1.0);

        double previous = throttled;
        for (int i = 0; i < 5; i++) {
            controller.recordResponseTime("c", "/fast", Duration.ofMillis(10));
            controller.recordResponseTime("c", "/slow", Duration.ofMillis(5_000));
            controller.recordResponseTime("c", "/fast", Duration.ofMillis(10));
            assertThat(controller.factor("c")).isLessThanOrEqualTo(previous);
            previous = controller.factor("c");
        }

        assertThat(controller.factor("c")).isLessThan(throttled);
        assertThat(controller.averageResponseTime("c", "/slow")).hasValue(5_000.0);
    }

    @Test
    void purgeRecoveredDropsTheResponseWindows() {
        controller.recordResponseTime("a", "/data", Duration.ofMillis(100));
        controller.recordResponseTime("b", "/data", Duration.ofMillis(5_000));
        assertThat(controller.trackedIdentifiers()).isEqualTo(2);

        assertThat(controller.purgeRecovered()).isEqualTo(1);

        assertThat(controller.trackedIdentifiers()).isEqualTo(1);
        assertThat(controller.averageResponseTime("a", "/data")).isEmpty();
        assertThat(controller.averageResponseTime("b", "/data")).hasValue(5_000.0);
    }

    @Test
    void averagesArePerEndpoint() {
        controller.recordResponseTime("c", "/a", Duration.ofMillis(100));
        controller.recordResponseTime("c", "/a", Duration.ofMillis(300));
        controller.recordResponseTime("c", "/b", Duration.ofMillis(1_000));

        assertThat(controller.averageResponseTime("c", "/a")).hasValue(200.0);
        assertThat(controller.averageResponseTime("c", "/b")).hasValue(1_000.0);
        assertThat(controller.overallAverageMs()).isEqualTo(600.0);
    }

    @Test
    void disabledControllerNeverThrottles() {
        settings.setEnabled(false);
        controller.recordResponseTime("c", "/data", Duration.ofMillis(10_000));

        assertThat(controller.factor("c")).isEqualTo(1.0);
    }

    @Test
    void resetForgetsTheIdentifier() {
        controller.recordResponseTime("c", "/data", Duration.ofMillis(10_000));
        controller.reset("c");

        assertThat(controller.factor("c")).isEqualTo(1.0);
        assertThat(controller.averageResponseTime("c", "/data")).isEmpty();
    }
}
