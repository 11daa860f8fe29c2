package com.quasar.relayservice.platform.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 子进程启动原语（引擎进程、game_bridge 进程共用），测试中替换为假实现。
 */
public interface ProcessLauncher {

    /**
     * 启动子进程，stdio 均为管道
     * @param command 可执行文件 + 参数
     * @param env     为 null 时继承当前环境；否则清空后只设置这些变量
     * @param workDir 为 null 时使用当前目录
     */
    Process launch(List<String> command, Map<String, String> env, Path workDir) throws IOException;
}
