package com.quasar.relayservice.tick;

import com.fasterxml.jackson.databind.JsonNode;
import com.quasar.relayservice.support.RecordingSocket;
import com.quasar.relayservice.support.RelayHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MasterTickTest {

    private RelayHarness h;
    private MasterTick tick;

    @BeforeEach
    void setUp() {
        h = new RelayHarness();
        tick = new MasterTick(h.registry, h.frameBus, h.codec, h.loop, 15, false);
    }

    @Test
    void intervalIsFlooredFromFps() {
        assertThat(tick.getInterval()).isEqualTo(66);
        tick.setFps(30);
        assertThat(tick.getInterval()).isEqualTo(33);
    }

    @Test
    void startAndStopAreIdempotent() {
        tick.start();
        tick.start();
        assertThat(h.loop.activeTimerCount()).isEqualTo(1);

        tick.stop();
        tick.stop();
        assertThat(h.loop.activeTimerCount()).isZero();
        assertThat(tick.isRunning()).isFalse();
    }

    @Test
    void setFpsWhileRunningKeepsExactlyOneTimer() {
        tick.start();

        tick.setFps(60);
        tick.setFps(10);

        assertThat(h.loop.activeTimerCount()).isEqualTo(1);
        h.loop.advance(1000);
        assertThat(tick.getStats().getTickCount()).isEqualTo(10);
    }

    @Test
    void setFpsWhileStoppedDoesNotStart() {
        tick.setFps(30);

        assertThat(tick.isRunning()).isFalse();
        assertThat(h.loop.activeTimerCount()).isZero();
    }

    @Test
    void nonPositiveFpsIsRejected() {
        assertThatThrownBy(() -> tick.setFps(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(tick.getFps()).isEqualTo(15);
    }

    @Test
    void tickPollsOpenSourcesAndRebroadcastsLastFrame() {
        RecordingSocket viewer = h.connectViewer();
        RecordingSocket source = h.connectSource();
        RecordingSocket closedSource = h.connectSource();
        closedSource.close();
        h.protocol.handleMessage(source, "{\"t\":\"register\",\"gameType\":\"trax\"}");
        h.protocol.handleMessage(source, "{\"t\":\"frame\",\"seq\":4}");
        viewer.clear();
        h.loop.advance(500);

        tick.tick();

        assertThat(source.messages("poll")).hasSize(1);
        assertThat(closedSource.sent()).isEmpty();
        List<JsonNode> frames = viewer.messages("frame");
        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).path("seq").asLong()).isEqualTo(4);
        assertThat(frames.get(0).path("tick").asLong()).isEqualTo(1);
        assertThat(frames.get(0).path("serverTs").asLong()).isEqualTo(h.loop.now());
        assertThat(viewer.messages("tick")).isEmpty();

        JsonNode bundle = tick.getLastBundle();
        assertThat(bundle.path("tick").asLong()).isEqualTo(1);
        assertThat(bundle.path("sources").path("trax").path("seq").asLong()).isEqualTo(4);
        assertThat(tick.getStats().getPollsTotal()).isEqualTo(1);
        assertThat(tick.getStats().getFramesCollected()).isEqualTo(1);
    }

    @Test
    void rebroadcastDoesNotMutateCachedFrame() {
        RecordingSocket source = h.connectSource();
        h.protocol.handleMessage(source, "{\"t\":\"frame\",\"seq\":1}");

        tick.tick();

        assertThat(h.frameBus.lastFrame().orElseThrow().has("tick")).isFalse();
    }

    @Test
    void tickWithoutFramesSendsNothingToViewers() {
        RecordingSocket viewer = h.connectViewer();
        viewer.clear();

        tick.tick();

        assertThat(viewer.sent()).isEmpty();
        assertThat(tick.getStats().getTickCount()).isEqualTo(1);
    }

    @Test
    void bundleIsBroadcastWhenEnabled() {
        MasterTick bundling = new MasterTick(h.registry, h.frameBus, h.codec, h.loop, 15, true);
        RecordingSocket viewer = h.connectViewer();
        viewer.clear();

        bundling.tick();

        assertThat(viewer.messages("tick")).hasSize(1);
    }

    @Test
    void statusReflectsRunningState() {
        tick.start();

        assertThat(tick.status())
                .containsEntry("enabled", true)
                .containsEntry("fps", 15)
                .containsEntry("interval", 66L);
    }
}
