package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.service.helper.ProcessHelper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class JobCancellationRegistryTest {

    private final ProcessHelper processHelper = mock(ProcessHelper.class);
    private final JobCancellationRegistry registry = new JobCancellationRegistry(processHelper);

    @Test
    void cancelFlagsTokenAndStopsProcesses() {
        CancellationToken token = registry.register("j1");

        assertThat(registry.cancel("j1")).isTrue();
        assertThat(token.isCancelled()).isTrue();
        verify(processHelper).stopProcesses("j1");

        // a second cancel is acknowledged but kills nothing more
        assertThat(registry.cancel("j1")).isTrue();
        verify(processHelper, times(1)).stopProcesses("j1");
    }

    @Test
    void unknownJobIsNotCancelled() {
        assertThat(registry.cancel("nope")).isFalse();
        verify(processHelper, never()).stopProcesses(anyString());
    }

    @Test
    void unregisterForgetsTheJob() {
        registry.register("j1");
        assertThat(registry.isActive("j1")).isTrue();

        registry.unregister("j1");

        assertThat(registry.isActive("j1")).isFalse();
        assertThat(registry.cancel("j1")).isFalse();
    }
}
