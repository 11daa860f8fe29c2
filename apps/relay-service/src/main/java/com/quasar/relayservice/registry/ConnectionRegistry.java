package com.quasar.relayservice.registry;

import com.quasar.relayservice.transport.ClientSocket;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 连接注册表：当前打开的 viewer / source 连接及其元数据。
 *
 * 说明：
 *  - 只在 relay 循环线程上访问，不加锁；
 *  - 生命周期与进程一致，但可以显式 dispose()，测试中直接 new 一个新的实例即可。
 */
@Slf4j
public class ConnectionRegistry {

    /** socketId -> viewer */
    private final Map<String, ViewerConnection> viewers = new LinkedHashMap<>();

    /** socketId -> source */
    private final Map<String, SourceConnection> sources = new LinkedHashMap<>();

    public ViewerConnection addViewer(ViewerConnection viewer) {
        viewers.put(viewer.getSocket().id(), viewer);
        return viewer;
    }

    public SourceConnection addSource(SourceConnection source) {
        sources.put(source.getSocket().id(), source);
        return source;
    }

    public Optional<ViewerConnection> viewer(ClientSocket socket) {
        return Optional.ofNullable(viewers.get(socket.id()));
    }

    public Optional<SourceConnection> source(ClientSocket socket) {
        return Optional.ofNullable(sources.get(socket.id()));
    }

    public Optional<ViewerConnection> removeViewer(ClientSocket socket) {
        return Optional.ofNullable(viewers.remove(socket.id()));
    }

    public Optional<SourceConnection> removeSource(ClientSocket socket) {
        return Optional.ofNullable(sources.remove(socket.id()));
    }

    /**
     * 遍历用快照：广播过程中即使有连接关闭也不会影响本轮迭代。
     */
    public List<ViewerConnection> viewers() {
        return new ArrayList<>(viewers.values());
    }

    public List<SourceConnection> sources() {
        return new ArrayList<>(sources.values());
    }

    public int viewerCount() {
        return viewers.size();
    }

    public int sourceCount() {
        return sources.size();
    }

    /**
     * 向所有打开的 viewer 发送同一份已序列化的文本，未打开的静默跳过。
     * @return 实际发送的连接数
     */
    public int broadcastToViewers(String payload) {
        int sent = 0;
        for (ViewerConnection viewer : viewers.values()) {
            if (viewer.getSocket().isOpen() && viewer.getSocket().send(payload)) {
                sent++;
            }
        }
        return sent;
    }

    /**
     * 向所有打开的 source 发送同一份文本。
     */
    public int broadcastToSources(String payload) {
        int sent = 0;
        for (SourceConnection source : sources.values()) {
            if (source.getSocket().isOpen() && source.getSocket().send(payload)) {
                sent++;
            }
        }
        return sent;
    }

    /**
     * 关闭并清空所有连接（停机 / 重置）。
     */
    public void dispose() {
        int total = viewers.size() + sources.size();
        List<ClientSocket> sockets = new ArrayList<>();
        viewers.values().forEach(v -> sockets.add(v.getSocket()));
        sources.values().forEach(s -> sockets.add(s.getSocket()));
        viewers.clear();
        sources.clear();
        sockets.forEach(ClientSocket::close);
        log.info("连接注册表已释放: closed={}", total);
    }
}
