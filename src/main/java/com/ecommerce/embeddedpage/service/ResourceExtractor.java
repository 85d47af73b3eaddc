package com.ecommerce.embeddedpage.service;

import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.exception.ErrorKind;
import com.ecommerce.embeddedpage.loader.ResourcePackage;
import com.ecommerce.embeddedpage.model.ResourceResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 资源提取器：把资源包中的单个资源写到目标文件
 *
 * - 目标父目录不存在时自动创建
 * - 目标文件已存在则失败（CREATE_NEW），不会覆盖
 * - 失败时半写入的文件保留原样，由调用方整体放弃本次缓存
 */
@Slf4j
public class ResourceExtractor {

    private final int bufferSize;

    public ResourceExtractor() {
        this(EmbeddedPageConstants.COPY_BUFFER_SIZE);
    }

    ResourceExtractor(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /**
     * 提取资源
     * @return 成功时为写出的字节数
     */
    public ResourceResult<Long> extract(ResourcePackage resourcePackage, String resourceName, Path destinationPath) {
        if (resourcePackage == null) {
            return ResourceResult.invalidArgument("Resource package containing embedded resource may not be null.");
        }
        if (resourceName == null || resourceName.isEmpty()) {
            return ResourceResult.invalidArgument("Path to embedded resource may not be null or empty.");
        }
        if (destinationPath == null || destinationPath.toString().isEmpty()) {
            return ResourceResult.invalidArgument("Destination path of embedded resource may not be null or empty.");
        }

        Path parent = destinationPath.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException | RuntimeException e) {
            return ResourceResult.failure(ErrorKind.EXTRACTION_FAILURE,
                "Unable to create destination directory for path [" + destinationPath + "].", e);
        }

        try (InputStream in = openResource(resourcePackage, resourceName);
             OutputStream out = Files.newOutputStream(destinationPath,
                 StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            long written = copy(in, out);
            out.flush();
            log.debug("Extracted {} ({} bytes) from {} to {}", resourceName, written, resourcePackage.name(),
                destinationPath);
            return ResourceResult.success(written);
        } catch (IOException | RuntimeException e) {
            return ResourceResult.failure(ErrorKind.EXTRACTION_FAILURE,
                "Unable to write resource [" + resourceName + "] from package [" + resourcePackage.name()
                    + "] to destination [" + destinationPath + "].", e);
        }
    }

    private static InputStream openResource(ResourcePackage resourcePackage, String resourceName) throws IOException {
        InputStream in = resourcePackage.open(resourceName);
        if (in == null) {
            throw new NoSuchFileException(resourceName, null, "resource not found in " + resourcePackage.name());
        }
        return in;
    }

    private long copy(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            total += read;
        }
        return total;
    }
}
