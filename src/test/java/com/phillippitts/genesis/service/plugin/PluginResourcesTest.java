package com.phillippitts.genesis.service.plugin;

import com.phillippitts.genesis.testutil.FakeDailyTaskScheduler;
import com.phillippitts.genesis.testutil.FakeRobotOutput;
import com.phillippitts.genesis.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PluginResourcesTest {

    @Test
    void shouldReturnGrantedResources() {
        FakeDailyTaskScheduler scheduler = new FakeDailyTaskScheduler();
        FakeRobotOutput output = new FakeRobotOutput();
        SyncExecutor executor = new SyncExecutor();
        PluginResources resources = new PluginResources("p",
                Set.of(SharedResource.SCHEDULER, SharedResource.HARDWARE_LINK, SharedResource.MAIN_LOOP),
                Map.of(SharedResource.SCHEDULER, scheduler,
                        SharedResource.HARDWARE_LINK, output,
                        SharedResource.MAIN_LOOP, executor));

        assertThat(resources.scheduler()).isSameAs(scheduler);
        assertThat(resources.robotOutput()).isSameAs(output);
        assertThat(resources.mainLoop()).isSameAs(executor);
        assertThat(resources.isGranted(SharedResource.STORAGE)).isFalse();
    }

    @Test
    void shouldRejectUndeclaredResource() {
        PluginResources resources = new PluginResources("p", Set.of(), Map.of());

        assertThatThrownBy(resources::storage)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'p' did not declare resource STORAGE");
    }

    @Test
    void shouldRejectDeclaredButMissingResource() {
        PluginResources resources = new PluginResources("p", Set.of(SharedResource.SETTINGS), Map.of());

        assertThatThrownBy(resources::settings)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not available");
    }
}
