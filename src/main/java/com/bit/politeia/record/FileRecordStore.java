package com.bit.politeia.record;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.util.TokenUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 文件记录存储：记录即目录 vetted/{token}，全部元数据流保存在同一个 metadata.json 中。
 * 更新先写临时文件再原子替换，因此多条流的一次更新是原子的。
 */
@Slf4j
@Component
public class FileRecordStore implements RecordStore {

    public static final String METADATA_FILE = "metadata.json";

    private static final TypeReference<TreeMap<Integer, String>> STREAMS_TYPE = new TypeReference<TreeMap<Integer, String>>() {
    };

    private final Path vettedDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileRecordStore(PoliteiaProperties properties, ObjectMapper objectMapper) {
        this(properties.vettedDir(), objectMapper);
    }

    public FileRecordStore(Path vettedDir, ObjectMapper objectMapper) {
        this.vettedDir = vettedDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<Integer, String> getVettedMetadata(String token) {
        return load(recordDir(token));
    }

    @Override
    public void updateVettedMetadata(String token, List<Integer> removals, List<MetadataStream> additions) {
        Path dir = recordDir(token);
        TreeMap<Integer, String> streams = load(dir);
        if (removals != null) {
            removals.forEach(streams::remove);
        }
        if (additions != null) {
            for (MetadataStream stream : additions) {
                streams.put(stream.getId(), stream.getPayload());
            }
        }

        Path file = dir.resolve(METADATA_FILE);
        Path tmp = dir.resolve(METADATA_FILE + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), streams);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PoliteiaException(ErrorType.LEDGER_IO, "写入元数据失败: " + file, e);
        }
        log.debug("元数据已更新 token={} 流={}", token, streams.keySet());
    }

    private Path recordDir(String token) {
        if (!TokenUtils.isHexKey(token)) {
            throw new PoliteiaException(ErrorType.MALFORMED_TOKEN, "非法令牌: " + token);
        }
        Path dir = vettedDir.resolve(token);
        if (!Files.isDirectory(dir)) {
            throw new PoliteiaException(ErrorType.RECORD_NOT_FOUND, "提案记录不存在: " + token);
        }
        return dir;
    }

    private TreeMap<Integer, String> load(Path dir) {
        Path file = dir.resolve(METADATA_FILE);
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(file.toFile(), STREAMS_TYPE);
        } catch (IOException e) {
            throw new PoliteiaException(ErrorType.LEDGER_IO, "读取元数据失败: " + file, e);
        }
    }
}
