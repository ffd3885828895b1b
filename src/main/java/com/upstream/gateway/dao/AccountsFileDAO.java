package com.upstream.gateway.dao;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.upstream.gateway.config.AppProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 账号配置文件读写（整文件 read-modify-write，单进程单写者）
 * <p>
 * accounts.json 为 v2 多账号格式，auth.json 为旧版单账号格式
 */
@Component
public class AccountsFileDAO {

    static final String ACCOUNTS_FILE = "accounts.json";
    static final String LEGACY_FILE = "auth.json";

    private final Path configDir;

    public AccountsFileDAO(AppProperties properties) {
        this(Path.of(properties.getConfigDir()));
    }

    public AccountsFileDAO(Path configDir) {
        this.configDir = configDir;
    }

    public Path accountsPath() {
        return configDir.resolve(ACCOUNTS_FILE);
    }

    public Path legacyPath() {
        return configDir.resolve(LEGACY_FILE);
    }

    public boolean accountsFileExists() {
        return Files.exists(accountsPath());
    }

    public boolean legacyFileExists() {
        return Files.exists(legacyPath());
    }

    /**
     * 读取 accounts.json，文件不存在返回 empty
     *
     * @throws IOException   读取失败
     * @throws JSONException 内容不是 JSON 对象
     */
    public Optional<JSONObject> readAccounts() throws IOException {
        return readObject(accountsPath());
    }

    public Optional<JSONObject> readLegacy() throws IOException {
        return readObject(legacyPath());
    }

    /**
     * 写入 accounts.json（先写临时文件再替换）
     */
    public void writeAccounts(JSONObject config) throws IOException {
        Files.createDirectories(configDir);
        Path target = accountsPath();
        Path tmp = configDir.resolve(ACCOUNTS_FILE + ".tmp");
        Files.writeString(tmp, config.toJSONString(JSONWriter.Feature.PrettyFormat), StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private Optional<JSONObject> readObject(Path path) throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        Object parsed = JSON.parse(content);
        if (parsed instanceof JSONObject object) {
            return Optional.of(object);
        }
        throw new JSONException("配置文件不是 JSON 对象: " + path);
    }
}
