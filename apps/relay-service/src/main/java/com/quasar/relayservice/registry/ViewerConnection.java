package com.quasar.relayservice.registry;

import com.quasar.relayservice.transport.ClientSocket;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 浏览器 viewer 连接的元数据。
 *
 * 包含：
 *  - 连接标识与建立时间；
 *  - 丢帧统计（基于 source 帧的 seq 间隙，无需任何 ack 流量）；
 *  - 延迟样本；
 *  - 可选的玩家 / 对局身份（lobby.* / match.* 时分配）；
 *  - 每连接音量。
 */
@Getter
public class ViewerConnection {

    /** 延迟样本窗口大小 */
    private static final int MAX_LATENCY_SAMPLES = 20;

    private final String id;
    private final ClientSocket socket;
    private final long connectedAt;

    /** 最近一次收到的带 seq 帧的序号，0 表示还没有 */
    private long lastFrameSeq;

    @Setter
    private long lastPingTs;

    private final Latency latency = new Latency();

    private final Stats stats = new Stats();

    /** 玩家身份（lobby.join 等分配），断开时用于 match 清理 */
    @Setter
    private String playerId;

    /** 分配给该玩家的 monogram 令牌，断开时释放 */
    @Setter
    private String monogram;

    /** 0.0 ~ 1.0 */
    @Setter
    private double volume = 1.0;

    public ViewerConnection(String id, ClientSocket socket, long connectedAt) {
        this.id = id;
        this.socket = socket;
        this.connectedAt = connectedAt;
    }

    /**
     * 记录一帧 source 帧：seq 出现间隙时把缺失数累加到丢帧计数。
     * @param seq    帧序号，帧不带 seq 时传 0
     */
    public void recordFrame(long seq) {
        if (seq > 0 && lastFrameSeq > 0) {
            stats.framesDropped += Math.max(0, seq - lastFrameSeq - 1);
        }
        lastFrameSeq = seq;
        stats.framesReceived++;
    }

    /**
     * 每连接帧统计
     */
    @Data
    public static class Stats {
        private long framesReceived;
        private long framesDropped;
    }

    /**
     * 往返延迟统计：滑动窗口平均 + 抖动（相邻样本差的平均）
     */
    @Getter
    public static class Latency {
        private long rtt;
        private double avg;
        private double jitter;
        private final Deque<Long> samples = new ArrayDeque<>();

        public void addSample(long rttMs) {
            rtt = rttMs;
            samples.addLast(rttMs);
            while (samples.size() > MAX_LATENCY_SAMPLES) {
                samples.removeFirst();
            }
            long sum = 0;
            long diffSum = 0;
            Long prev = null;
            for (Long s : samples) {
                sum += s;
                if (prev != null) {
                    diffSum += Math.abs(s - prev);
                }
                prev = s;
            }
            avg = (double) sum / samples.size();
            jitter = samples.size() > 1 ? (double) diffSum / (samples.size() - 1) : 0;
        }
    }
}
