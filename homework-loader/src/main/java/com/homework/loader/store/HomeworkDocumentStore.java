package com.homework.loader.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.common.exception.DocumentIOException;
import com.homework.loader.config.LoaderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 数据文件读写，唯一的写入方是保存任务。
 * <p>
 * 写入先落到同目录的临时文件，再整体替换，避免写到一半的文件被下次加载读到。
 */
@Slf4j
@Component
public class HomeworkDocumentStore {

    private final ObjectMapper objectMapper;
    private final Path dataFile;

    @Autowired
    public HomeworkDocumentStore(ObjectMapper objectMapper, LoaderProperties properties) {
        this(objectMapper, Path.of(properties.getDataFile()));
    }

    public HomeworkDocumentStore(ObjectMapper objectMapper, Path dataFile) {
        this.objectMapper = objectMapper;
        this.dataFile = dataFile.toAbsolutePath();
    }

    public Path getDataFile() {
        return dataFile;
    }

    public boolean exists() {
        return Files.isRegularFile(dataFile);
    }

    /**
     * 读取整个文件为 JSON 树，格式判断交给调用方。
     */
    public JsonNode readTree() {
        try (InputStream in = Files.newInputStream(dataFile)) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new DocumentIOException("读取数据文件失败: " + e.getMessage(), e);
        }
    }

    /**
     * 以当前格式写入数据文件（UTF-8，带缩进）。
     */
    public void write(HomeworkDocument document) {
        Path parent = dataFile.getParent();
        Path temp = null;
        try {
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, dataFile.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, document);
            }
            moveIntoPlace(temp);
            log.info("数据已保存: {}, 作业数: {}", dataFile,
                    document.getHomeworks() != null ? document.getHomeworks().size() : 0);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new DocumentIOException("保存数据时出错：" + e.getMessage(), e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("文件系统不支持原子替换，改用普通替换");
            Files.move(temp, dataFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("临时文件清理失败: {}", temp, e);
        }
    }
}
