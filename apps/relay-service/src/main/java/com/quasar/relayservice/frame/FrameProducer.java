package com.quasar.relayservice.frame;

/**
 * 帧生产者标签：FrameBus 的每次 publish 都显式带上是谁写的。
 *
 * @param kind 生产者类别
 * @param slot 仅 SLOT 类别有效，其余为 -1
 */
public record FrameProducer(Kind kind, int slot) {

    public enum Kind {
        /** 外部 source 连接推来的帧（带单调 seq） */
        SOURCE,
        /** 进程内引擎某个 slot 渲染出的帧（无 seq） */
        SLOT
    }

    private static final FrameProducer SOURCE_PRODUCER = new FrameProducer(Kind.SOURCE, -1);

    public static FrameProducer source() {
        return SOURCE_PRODUCER;
    }

    public static FrameProducer slot(int index) {
        return new FrameProducer(Kind.SLOT, index);
    }

    /** 只有 source 帧参与 viewer 丢帧统计 */
    public boolean sequenced() {
        return kind == Kind.SOURCE;
    }

    @Override
    public String toString() {
        return kind == Kind.SLOT ? "slot:" + slot : "source";
    }
}
