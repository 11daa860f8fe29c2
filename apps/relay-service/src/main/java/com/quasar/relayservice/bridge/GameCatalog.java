package com.quasar.relayservice.bridge;

import com.quasar.relayservice.config.QuasarProperties;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 游戏目录：游戏名 -> 运行方式。来自 quasar.games 配置，启动后只读。
 */
public class GameCatalog {

    private final Map<String, GameDefinition> games = new LinkedHashMap<>();

    public GameCatalog(QuasarProperties properties) {
        properties.getGames().forEach((name, game) -> games.put(name,
                new GameDefinition(name, game.getKind(), StringUtils.defaultIfBlank(game.getTitle(), name))));
    }

    public Optional<GameDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(games.get(name));
    }

    public List<GameDefinition> all() {
        return Collections.unmodifiableList(new ArrayList<>(games.values()));
    }
}
