package com.quasar.relayservice.slot;

import java.util.List;

/**
 * 槽位渲染引擎抽象。
 *
 * 一个引擎实例承载全部 256 个槽位，按行接收指令，异步回调渲染好的帧。
 * 所有方法和回调都在 relay 循环线程上执行。
 */
public interface SlotEngine {

    void setFrameListener(FrameListener listener);

    void setExitListener(ExitListener listener);

    /**
     * 确保引擎可用（必要时启动）
     * @return false 表示无法分配新的上下文
     */
    boolean open();

    boolean isOpen();

    void init(int slot, int cols, int rows, int fps);

    /**
     * 推进模拟
     * @param elapsedMs 距上次 tick 的毫秒数
     */
    void tick(int slot, long elapsedMs);

    /** 请求渲染一帧，结果经 FrameListener 回调 */
    void render(int slot);

    void spawn(int slot, String type, int x, int y, SpriteParams params);

    void destroy(int slot);

    /** 关闭引擎并释放底层资源 */
    void close();

    /**
     * 帧回调
     */
    interface FrameListener {
        void onFrame(int slot, List<String> lines);
    }

    /**
     * 引擎意外退出回调
     */
    interface ExitListener {
        void onExit(int exitCode);
    }
}
