package com.quasar.relayservice.slot;

import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.platform.process.ProcessLauncher;
import com.quasar.relayservice.platform.process.ProcessOutputPump;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * PulsarProcessEngine
 * ---------------------------------------
 * 以子进程方式运行 PULSAR slots 引擎，所有槽位共用一个进程。
 *
 * 指令（写 stdin，每行一条）：
 *   {@code <slot> INIT cols rows fps} / {@code <slot> TICK ms} / {@code <slot> RENDER} /
 *   {@code <slot> SPAWN type x y len0 dtheta valence} / {@code <slot> DESTROY} / {@code QUIT}
 *
 * 输出（读 stdout）：以 '|' 或 '=' 开头的行开始一帧，END_FRAME 结束；其余行只记 DEBUG 日志。
 * 输出里不带槽位号，按 RENDER 的发送顺序（FIFO）归属到槽位。
 * 每个槽位同时最多一个未应答的 RENDER；收到 ERR 应答或最早的 RENDER 超时未应答时清空队列重新对齐。
 */
@Slf4j
public class PulsarProcessEngine implements SlotEngine {

    static final String END_FRAME = "END_FRAME";

    /** 引擎的错误应答前缀 */
    static final String ERROR_PREFIX = "ERR";

    /** RENDER 超过这个时间没有帧返回，视为引擎丢了应答 */
    static final long RENDER_TIMEOUT_MS = 1000;

    /** close 时等待进程自行退出的时间 */
    private static final long QUIT_GRACE_MS = 1000;

    private final ProcessLauncher launcher;
    private final Path binary;
    private final RelayLoop loop;

    private Process process;
    private BufferedWriter stdin;

    private FrameListener frameListener = (slot, lines) -> { };
    private ExitListener exitListener = code -> { };

    /** 已发出 RENDER、尚未收到帧的请求，按发送顺序 */
    private final Deque<PendingRender> pendingRenders = new ArrayDeque<>();

    /** pendingRenders 中的槽位，保证每槽最多一个 */
    private final Set<Integer> outstanding = new HashSet<>();

    /** 正在收集的帧，null 表示不在帧内 */
    private List<String> currentFrame;

    public PulsarProcessEngine(ProcessLauncher launcher, Path binary, RelayLoop loop) {
        this.launcher = launcher;
        this.binary = binary;
        this.loop = loop;
    }

    @Override
    public void setFrameListener(FrameListener listener) {
        this.frameListener = listener;
    }

    @Override
    public void setExitListener(ExitListener listener) {
        this.exitListener = listener;
    }

    @Override
    public boolean open() {
        if (isOpen()) {
            return true;
        }
        Process started;
        try {
            started = launcher.launch(List.of(binary.toString()), null, null);
        } catch (IOException e) {
            log.error("PULSAR 启动失败: binary={}, error={}", binary, e.getMessage());
            return false;
        }
        process = started;
        stdin = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));
        resyncRenders();
        currentFrame = null;

        ProcessOutputPump.start("pulsar-stdout", started.getInputStream(),
                line -> loop.execute(() -> onOutputLine(line)));
        ProcessOutputPump.start("pulsar-stderr", started.getErrorStream(),
                line -> log.warn("PULSAR 错误输出: {}", line));
        started.onExit().thenAccept(p -> loop.execute(() -> onProcessExit(p)));

        log.info("PULSAR 已启动: {}（PID: {}）", binary, started.pid());
        return true;
    }

    @Override
    public boolean isOpen() {
        return process != null && process.isAlive();
    }

    @Override
    public void init(int slot, int cols, int rows, int fps) {
        send(slot + " INIT " + cols + " " + rows + " " + fps);
    }

    @Override
    public void tick(int slot, long elapsedMs) {
        send(slot + " TICK " + elapsedMs);
    }

    @Override
    public void render(int slot) {
        expireStaleRenders();
        if (outstanding.contains(slot)) {
            log.debug("槽位 {} 上一帧尚未返回，跳过本次 RENDER", slot);
            return;
        }
        if (send(slot + " RENDER")) {
            pendingRenders.addLast(new PendingRender(slot, loop.now()));
            outstanding.add(slot);
        }
    }

    @Override
    public void spawn(int slot, String type, int x, int y, SpriteParams params) {
        send(slot + " SPAWN " + type + " " + x + " " + y + " "
                + number(params.len0OrDefault()) + " "
                + number(params.dthetaOrDefault()) + " "
                + params.valenceOrDefault());
    }

    @Override
    public void destroy(int slot) {
        send(slot + " DESTROY");
    }

    /**
     * 发送 QUIT 并关闭 stdin；宽限期内未退出则强制结束
     */
    @Override
    public void close() {
        Process p = process;
        if (p == null) {
            return;
        }
        send("QUIT");
        process = null;
        try {
            stdin.close();
        } catch (IOException e) {
            log.debug("关闭 PULSAR stdin 失败: {}", e.getMessage());
        }
        stdin = null;
        p.onExit()
                .orTimeout(QUIT_GRACE_MS, TimeUnit.MILLISECONDS)
                .whenComplete((exited, ex) -> {
                    if (ex != null) {
                        log.warn("PULSAR 未在 {}ms 内退出，强制结束: pid={}", QUIT_GRACE_MS, p.pid());
                        p.destroyForcibly();
                    }
                });
        log.info("PULSAR 已关闭: pid={}", p.pid());
    }

    /**
     * 解析一行引擎输出（循环线程上调用）
     */
    void onOutputLine(String line) {
        if (currentFrame != null) {
            if (END_FRAME.equals(line)) {
                List<String> frame = currentFrame;
                currentFrame = null;
                PendingRender pending = pendingRenders.pollFirst();
                if (pending == null) {
                    log.debug("收到无法归属的帧，丢弃: lines={}", frame.size());
                    return;
                }
                outstanding.remove(pending.slot());
                frameListener.onFrame(pending.slot(), frame);
            } else {
                currentFrame.add(line);
            }
            return;
        }
        if (line.startsWith("|") || line.startsWith("=")) {
            currentFrame = new ArrayList<>();
            currentFrame.add(line);
            return;
        }
        if (line.startsWith(ERROR_PREFIX)) {
            log.warn("PULSAR 错误应答: {}（丢弃 {} 个未应答的 RENDER）", line, pendingRenders.size());
            resyncRenders();
            return;
        }
        log.debug("PULSAR 输出: {}", line);
    }

    /** 未应答的 RENDER 数（每槽最多一个） */
    int pendingRenderCount() {
        return pendingRenders.size();
    }

    private void expireStaleRenders() {
        PendingRender oldest = pendingRenders.peekFirst();
        if (oldest != null && loop.now() - oldest.sentAt() > RENDER_TIMEOUT_MS) {
            log.warn("PULSAR 超过 {}ms 未返回帧，重新对齐 RENDER 队列: slot={}, pending={}",
                    RENDER_TIMEOUT_MS, oldest.slot(), pendingRenders.size());
            resyncRenders();
        }
    }

    private void resyncRenders() {
        pendingRenders.clear();
        outstanding.clear();
    }

    private void onProcessExit(Process exited) {
        if (exited != process) {
            // 主动 close 的进程
            return;
        }
        int code = exited.exitValue();
        log.warn("PULSAR 已退出: code={}", code);
        process = null;
        stdin = null;
        resyncRenders();
        currentFrame = null;
        exitListener.onExit(code);
    }

    private boolean send(String command) {
        if (stdin == null) {
            log.debug("PULSAR 未运行，丢弃指令: {}", command);
            return false;
        }
        try {
            stdin.write(command);
            stdin.write('\n');
            stdin.flush();
            return true;
        } catch (IOException e) {
            log.warn("PULSAR 写入失败: command={}, error={}", command, e.getMessage());
            return false;
        }
    }

    /** 整数值不带小数点（4 而不是 4.0） */
    private static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private record PendingRender(int slot, long sentAt) {
    }
}
