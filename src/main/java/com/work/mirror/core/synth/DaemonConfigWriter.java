package com.work.mirror.core.synth;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.mirror.core.model.ApplyResult;
import com.work.mirror.core.model.RecommendedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static com.work.mirror.core.support.ValidationUtils.requireNonNull;

/**
 * 把推荐镜像合并写入外部 daemon 配置（JSON 对象）。
 *
 * 流程：
 * 1. 推荐列表为空时不做任何写入
 * 2. 目录不存在则创建
 * 3. 原文件存在时先逐字节备份；备份失败则放弃本次写入
 * 4. 读取原配置，解析失败或不是对象时按空对象处理
 * 5. 只替换 registry-mirrors，保留其他字段及其顺序
 * 6. 写临时文件后原子替换，格式固定（4 空格缩进、UTF-8），相同输入得到相同字节
 * 7. 成功后发布 {@link DaemonConfigUpdatedEvent}，不直接重启下游服务
 *
 * <p>所有 I/O 失败都以 {@link ApplyResult} 返回，不抛异常。</p>
 */
public class DaemonConfigWriter {

    public static final String MIRRORS_FIELD = "registry-mirrors";

    private static final Logger log = LoggerFactory.getLogger(DaemonConfigWriter.class);

    private final Path configPath;
    private final Path backupPath;
    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;
    private final ApplicationEventPublisher eventPublisher;

    public DaemonConfigWriter(Path configPath, Path backupPath, ObjectMapper objectMapper,
                              ApplicationEventPublisher eventPublisher) {
        this.configPath = requireNonNull(configPath, "configPath");
        this.backupPath = requireNonNull(backupPath, "backupPath");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        this.eventPublisher = requireNonNull(eventPublisher, "eventPublisher");
        this.prettyWriter = objectMapper.writer(new DaemonJsonPrettyPrinter());
    }

    public ApplyResult apply(RecommendedConfig config) {
        requireNonNull(config, "config");
        if (config.isEmpty()) {
            log.info("[mirror] 没有可用的镜像源，跳过配置更新 path={}", configPath);
            return ApplyResult.noAvailableMirrors(configPath);
        }

        Path dir = configPath.toAbsolutePath().getParent();
        if (dir != null && !Files.isDirectory(dir)) {
            try {
                Files.createDirectories(dir);
                log.info("[mirror] 配置目录不存在，已创建 dir={}", dir);
            } catch (IOException e) {
                log.warn("[mirror] 创建配置目录失败 dir={} err={}", dir, e.toString());
                return ApplyResult.failed(configPath, "创建配置目录失败: " + describe(e));
            }
        }

        byte[] existing = null;
        Path backup = null;
        if (Files.exists(configPath)) {
            try {
                existing = Files.readAllBytes(configPath);
                Files.copy(configPath, backupPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                backup = backupPath;
            } catch (IOException e) {
                log.warn("[mirror] 备份配置失败，放弃写入 path={} backup={} err={}", configPath, backupPath, e.toString());
                return ApplyResult.failed(configPath, "备份配置失败: " + describe(e));
            }
        }

        ObjectNode merged = parseExisting(existing);
        ArrayNode mirrors = merged.putArray(MIRRORS_FIELD);
        for (String m : config.getMirrors()) {
            mirrors.add(m);
        }

        byte[] content;
        try {
            content = prettyWriter.writeValueAsString(merged).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            return ApplyResult.failed(configPath, "序列化配置失败: " + e.getOriginalMessage());
        }

        try {
            writeAtomically(content);
        } catch (AccessDeniedException e) {
            log.warn("[mirror] 权限不足，无法写入 path={}", configPath);
            return ApplyResult.failed(configPath, "权限不足，无法写入 " + configPath);
        } catch (IOException e) {
            log.warn("[mirror] 写入配置失败 path={} err={}", configPath, e.toString());
            return ApplyResult.failed(configPath, "写入配置失败: " + describe(e));
        }

        log.info("[mirror] 配置已更新 path={} count={} mirrors={}", configPath, config.getCount(), config.getMirrors());
        eventPublisher.publishEvent(new DaemonConfigUpdatedEvent(configPath, config.getMirrors()));
        return ApplyResult.applied(configPath, backup, config.getMirrors());
    }

    public Path getConfigPath() {
        return configPath;
    }

    private ObjectNode parseExisting(byte[] existing) {
        if (existing == null || existing.length == 0) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(existing);
            if (node != null && node.isObject()) {
                return (ObjectNode) node;
            }
            log.warn("[mirror] 现有配置不是 JSON 对象，将创建新配置 path={}", configPath);
        } catch (IOException e) {
            log.warn("[mirror] 读取现有配置失败，将创建新配置 path={} err={}", configPath, e.toString());
        }
        return objectMapper.createObjectNode();
    }

    private void writeAtomically(byte[] content) throws IOException {
        Path dir = configPath.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, "." + configPath.getFileName(), ".tmp");
        try {
            Files.write(tmp, content);
            copyPermissions(tmp);
            try {
                Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * 替换前把原文件的 POSIX 权限复制到临时文件上，替换后权限不变。
     */
    private void copyPermissions(Path tmp) {
        if (!Files.exists(configPath)) {
            return;
        }
        try {
            Files.setPosixFilePermissions(tmp, Files.getPosixFilePermissions(configPath));
        } catch (UnsupportedOperationException e) {
            // 非 POSIX 文件系统
            log.debug("[mirror] 文件系统不支持 POSIX 权限 path={}", configPath);
        } catch (IOException e) {
            log.warn("[mirror] 复制配置文件权限失败 path={} err={}", configPath, e.toString());
        }
    }

    /**
     * 4 空格缩进，字段与值之间为 ": "。
     */
    static final class DaemonJsonPrettyPrinter extends DefaultPrettyPrinter {

        private static final long serialVersionUID = 1L;

        DaemonJsonPrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        DaemonJsonPrettyPrinter(DaemonJsonPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new DaemonJsonPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        // 空数组输出 []
        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }

        // 空对象输出 {}
        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
