package com.quasar.relayservice.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.quasar.relayservice.config.QuasarProperties;
import com.quasar.relayservice.support.FakeProcess;
import com.quasar.relayservice.support.FakeProcessLauncher;
import com.quasar.relayservice.support.RecordingSocket;
import com.quasar.relayservice.support.RelayHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BridgeFactoryTest {

    @TempDir
    Path tmp;

    private RelayHarness h;
    private RecordingSocket viewer;
    private Path binary;

    @BeforeEach
    void setUp() throws IOException {
        binary = tmp.resolve("bin/game_bridge");
        Files.createDirectories(binary.getParent());
        Files.writeString(binary, "#!/bin/sh\n");
        binary.toFile().setExecutable(true);

        QuasarProperties properties = RelayHarness.defaultProperties();
        properties.setTetraSrc(tmp.resolve("src").toString());
        properties.setTetraDir(tmp.resolve("tetra").toString());
        properties.getBridge().setBinary(binary.toString());

        h = new RelayHarness(properties, null, null, null);
        viewer = h.connectViewer();
        viewer.clear();
    }

    private void writeBridgeConfig(String game) throws IOException {
        Path config = tmp.resolve("tetra/orgs/tetra/games/" + game + "/bridge.json");
        Files.createDirectories(config.getParent());
        Files.writeString(config, "{}");
    }

    private void spawn(String json) {
        h.protocol.handleMessage(viewer, json);
    }

    @Test
    void builtinGameIsReadyWithoutSpawning() {
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"pong\",\"channel\":2}");

        JsonNode ready = viewer.last();
        assertThat(ready.path("t").asText()).isEqualTo("bridge.ready");
        assertThat(ready.path("status").asText()).isEqualTo("builtin");
        assertThat(ready.path("slot").asInt()).isEqualTo(2);
        assertThat(h.launcher.launches()).isEmpty();
        assertThat(h.slotManager.getActiveSlots()).isEmpty();
    }

    @Test
    void engineGameInitialisesSlotWithDemoSprites() {
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"magnetar\"}");

        assertThat(viewer.last().path("status").asText()).isEqualTo("ok");
        assertThat(h.slotManager.getSlot(0)).isPresent();
        assertThat(h.engine.commandsFor(0)).contains(
                "0 INIT 60 24 15",
                "0 SPAWN pulsar 30 12 4.0 0.1 1",
                "0 SPAWN pulsar 50 12 4.0 -0.1 2");
        assertThat(h.stats.getBridgesSpawned()).isEqualTo(1);
    }

    @Test
    void engineGameOnBadSlotReportsInitFailure() {
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"magnetar\",\"channel\":400}");

        JsonNode error = viewer.last();
        assertThat(error.path("t").asText()).isEqualTo("bridge.error");
        assertThat(error.path("error").asText()).isEqualTo("Failed to initialize slot");
        assertThat(h.slotManager.getActiveSlots()).isEmpty();
    }

    @Test
    void missingConfigFailsFast() {
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");

        JsonNode error = viewer.last();
        assertThat(error.path("t").asText()).isEqualTo("bridge.error");
        assertThat(error.path("error").asText()).startsWith("Bridge config not found");
        assertThat(h.launcher.launches()).isEmpty();
        assertThat(h.bridgeFactory.list()).isEmpty();
    }

    @Test
    void missingBinaryFailsFast() throws IOException {
        writeBridgeConfig("cymatica");
        Files.delete(binary);

        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");

        assertThat(viewer.last().path("error").asText()).startsWith("Bridge binary not found");
        assertThat(h.launcher.launches()).isEmpty();
    }

    @Test
    void gameBridgeIsSpawnedWithGameArgumentAndTwoDirectoryVariables() throws IOException {
        writeBridgeConfig("cymatica");

        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");

        FakeProcessLauncher.Launch launch = h.launcher.last();
        assertThat(launch.command()).containsExactly(binary.toString(), "cymatica");
        assertThat(launch.env()).containsOnlyKeys("TETRA_SRC", "TETRA_DIR");
        assertThat(launch.env()).containsEntry("TETRA_DIR", tmp.resolve("tetra").toString());

        JsonNode ready = viewer.last();
        assertThat(ready.path("t").asText()).isEqualTo("bridge.ready");
        assertThat(ready.path("status").asText()).isEqualTo("spawned");
        assertThat(ready.path("pid").asLong()).isEqualTo(launch.process().pid());

        assertThat(h.bridgeFactory.list()).singleElement()
                .satisfies(b -> {
                    assertThat(b.key()).isEqualTo("cymatica:1");
                    assertThat(b.state()).isEqualTo(BridgeState.RUNNING);
                });
    }

    @Test
    void duplicateSpawnOnLiveKeyIsRejected() throws IOException {
        writeBridgeConfig("cymatica");
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");

        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");

        assertThat(viewer.last().path("error").asText()).isEqualTo("Bridge already running");
        assertThat(h.launcher.launches()).hasSize(1);
        assertThat(h.launcher.last().process().isDestroyed()).isFalse();
    }

    @Test
    void exitRemovesEntryAndPublishesClosedEvent() throws IOException {
        writeBridgeConfig("cymatica");
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");
        FakeProcess process = h.launcher.last().process();

        process.exit(2);

        assertThat(h.bridgeFactory.list()).isEmpty();
        assertThat(h.events).containsExactly(new BridgeClosedEvent("cymatica", 1, 2));

        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");
        assertThat(h.launcher.launches()).hasSize(2);
    }

    @Test
    void launchFailureLeavesNoEntry() throws IOException {
        writeBridgeConfig("cymatica");
        h.launcher.failWith(new IOException("permission denied"));

        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");

        assertThat(viewer.last().path("error").asText()).contains("permission denied");
        assertThat(h.bridgeFactory.list()).isEmpty();
    }

    @Test
    void killAndKillAll() throws IOException {
        writeBridgeConfig("cymatica");
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":1}");
        spawn("{\"t\":\"bridge.spawn\",\"game\":\"cymatica\",\"channel\":2}");

        assertThat(h.bridgeFactory.kill("cymatica", 1)).isTrue();
        assertThat(h.bridgeFactory.kill("cymatica", 1)).isFalse();
        assertThat(h.launcher.launches().get(0).process().isDestroyed()).isTrue();

        assertThat(h.bridgeFactory.killAll()).isEqualTo(1);
        assertThat(h.bridgeFactory.list()).isEmpty();
    }
}
