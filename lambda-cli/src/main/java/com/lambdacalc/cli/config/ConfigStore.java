package com.lambdacalc.cli.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 配置文件的读写（JSON）
 *
 * <p>文件不存在时使用默认值；文件损坏或无法读取时记录警告并使用默认值。</p>
 */
public class ConfigStore {
    private static final Logger LOG = Logger.getLogger(ConfigStore.class.getName());

    private final Path file;
    private final Gson gson;

    public ConfigStore(Path file) {
        this.file = file;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    /**
     * ~/.lambdacalc/config.json
     */
    public static ConfigStore defaultStore() {
        return new ConfigStore(Paths.get(System.getProperty("user.home"), ".lambdacalc", "config.json"));
    }

    public Path getFile() {
        return file;
    }

    public LambdaConfig load() {
        if (!Files.exists(file)) {
            LOG.fine("配置文件不存在，使用默认配置: " + file);
            return new LambdaConfig();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            LambdaConfig config = gson.fromJson(reader, LambdaConfig.class);
            if (config == null) {
                LOG.warning("配置文件为空，使用默认配置: " + file);
                return new LambdaConfig();
            }
            return config;
        } catch (IOException | JsonParseException e) {
            LOG.warning("无法读取配置文件 " + file + "，使用默认配置: " + e.getMessage());
            return new LambdaConfig();
        }
    }

    public void save(LambdaConfig config) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(config, writer);
        }
        LOG.fine("配置已写入: " + file);
    }
}
