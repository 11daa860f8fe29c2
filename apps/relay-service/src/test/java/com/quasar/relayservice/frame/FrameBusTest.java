package com.quasar.relayservice.frame;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.registry.ViewerConnection;
import com.quasar.relayservice.support.RecordingSocket;
import com.quasar.relayservice.support.RelayHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrameBusTest {

    private RelayHarness h;
    private RecordingSocket viewer;

    @BeforeEach
    void setUp() {
        h = new RelayHarness();
        viewer = h.connectViewer();
        viewer.clear();
    }

    private ObjectNode frame(long seq) {
        return h.codec.message("frame").put("seq", seq);
    }

    @Test
    void lastWriteWinsAcrossProducers() {
        h.frameBus.publish(frame(1), FrameProducer.source());
        h.loop.advance(10);
        ObjectNode slotFrame = h.codec.message("frame").put("slot", 3).put("display", "|##|");
        h.frameBus.publish(slotFrame, FrameProducer.slot(3));

        assertThat(h.frameBus.lastFrame()).containsSame(slotFrame);
        assertThat(h.frameBus.lastProducer()).contains(FrameProducer.slot(3));
        assertThat(h.frameBus.lastFrameTs()).isEqualTo(h.loop.now());
        assertThat(h.frameBus.currentScreen()).isEqualTo("|##|");
        assertThat(h.frameBus.publishedCount(FrameProducer.Kind.SOURCE)).isEqualTo(1);
        assertThat(h.frameBus.publishedCount(FrameProducer.Kind.SLOT)).isEqualTo(1);
        assertThat(h.frameBus.publishedTotal()).isEqualTo(2);
    }

    @Test
    void slotFramesDoNotTouchLossAccounting() {
        h.frameBus.publish(frame(1), FrameProducer.source());
        h.frameBus.publish(h.codec.message("frame").put("slot", 0).put("display", "x"), FrameProducer.slot(0));
        h.frameBus.publish(frame(2), FrameProducer.source());

        ViewerConnection meta = h.registry.viewer(viewer).orElseThrow();
        assertThat(meta.getStats().getFramesReceived()).isEqualTo(2);
        assertThat(meta.getStats().getFramesDropped()).isZero();
        assertThat(meta.getLastFrameSeq()).isEqualTo(2);
        assertThat(viewer.messages("frame")).hasSize(3);
    }

    @Test
    void sourceFramesDoNotOverwriteScreen() {
        h.frameBus.setCurrentScreen("reported");

        h.frameBus.publish(frame(1).put("display", "from source"), FrameProducer.source());

        assertThat(h.frameBus.currentScreen()).isEqualTo("reported");
    }

    @Test
    void rebroadcastLeavesCacheUntouched() {
        h.frameBus.publish(frame(5), FrameProducer.source());
        long ts = h.frameBus.lastFrameTs();
        h.loop.advance(50);

        int sent = h.frameBus.rebroadcast(frame(99));

        assertThat(sent).isEqualTo(1);
        assertThat(h.frameBus.lastSeq()).isEqualTo(5);
        assertThat(h.frameBus.lastFrameTs()).isEqualTo(ts);
        assertThat(h.registry.viewer(viewer).orElseThrow().getStats().getFramesReceived()).isEqualTo(1);
    }

    @Test
    void soundDeltaIsFoldedIntoSharedState() {
        ObjectNode f = frame(1);
        f.putObject("snd").put("mode", "pwm");

        h.frameBus.publish(f, FrameProducer.source());

        assertThat(h.soundState.getMode()).isEqualTo("pwm");
    }
}
