package com.phillippitts.voicerelay.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void voiceRelayExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        VoiceRelayException ex = new VoiceRelayException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void externalServiceExceptionShouldCarryTarget() {
        ExternalServiceException ex = new ServiceUnavailableException("overloaded", "claude-sonnet-4@us-east-1");

        assertThat(ex.getMessage()).isEqualTo("overloaded (target: claude-sonnet-4@us-east-1)");
        assertThat(ex.getTarget()).isEqualTo("claude-sonnet-4@us-east-1");
        assertThat(ex).isInstanceOf(VoiceRelayException.class);
    }

    @Test
    void circuitOpenExceptionShouldNameTarget() {
        CircuitOpenException ex = new CircuitOpenException("synthesis:aura-asteria-en");

        assertThat(ex.getTarget()).isEqualTo("synthesis:aura-asteria-en");
        assertThat(ex.getMessage()).startsWith("Circuit open");
    }

    @Test
    void noRouteAvailableShouldKeepAttemptsAndLastFailure() {
        RateLimitedException last = new RateLimitedException("slow down", "claude-3-haiku@us-west-2");
        NoRouteAvailableException ex = new NoRouteAvailableException("No candidate succeeded",
                List.of("claude-sonnet-4@us-east-1", "claude-3-haiku@us-west-2"), last);

        assertThat(ex.getAttemptedTargets()).containsExactly("claude-sonnet-4@us-east-1", "claude-3-haiku@us-west-2");
        assertThat(ex.getCause()).isSameAs(last);
        assertThat(ex.getMessage()).contains("claude-3-haiku@us-west-2");
    }

    @Test
    void callCancelledExceptionShouldNameCall() {
        assertThat(new CallCancelledException("call-7").getMessage()).isEqualTo("Call cancelled: call-7");
    }

    @Test
    void allExceptionsShouldBeUnchecked() {
        assertThat(new SegmentationException("bad")).isInstanceOf(RuntimeException.class);
        assertThat(new ServiceTimeoutException("slow", "t")).isInstanceOf(RuntimeException.class);
        assertThat(new RequestInvalidException("bad", "t")).isInstanceOf(RuntimeException.class);
    }
}
