package com.ecommerce.embeddedpage.config;

import com.ecommerce.embeddedpage.model.PackageBinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 配置属性测试
 */
class EmbeddedPagePropertiesTest {

    private static EmbeddedPageProperties.PackageConfig packageConfig(String name, String namespaceRoot) {
        EmbeddedPageProperties.PackageConfig config = new EmbeddedPageProperties.PackageConfig();
        config.setName(name);
        config.setNamespaceRoot(namespaceRoot);
        return config;
    }

    @Test
    @DisplayName("保持配置顺序")
    void testPackageBindingsOrder() {
        EmbeddedPageProperties properties = new EmbeddedPageProperties();
        properties.setPackages(List.of(
            packageConfig("b-pages", "com.b"),
            packageConfig("a-pages", "com.a")));

        assertEquals(List.of(
            new PackageBinding("b-pages", "com.b"),
            new PackageBinding("a-pages", "com.a")), properties.packageBindings());
    }

    @Test
    @DisplayName("重复资源包只保留第一个命名空间根")
    void testDuplicatePackage() {
        EmbeddedPageProperties properties = new EmbeddedPageProperties();
        properties.setPackages(List.of(
            packageConfig("pages", "com.first"),
            packageConfig("pages", "com.second")));

        assertEquals(List.of(new PackageBinding("pages", "com.first")), properties.packageBindings());
    }

    @Test
    @DisplayName("未配置时为空")
    void testNoPackages() {
        assertTrue(new EmbeddedPageProperties().packageBindings().isEmpty());
        assertFalse(new EmbeddedPageProperties().allowFilesystemPages());
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", " True "})
    @DisplayName("true 忽略大小写与空白")
    void testParseTrue(String value) {
        assertTrue(EmbeddedPageProperties.parseFlag(value));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"false", "FALSE", "yes", "1", "maybe"})
    @DisplayName("其余取值一律为 false")
    void testParseFalse(String value) {
        assertFalse(EmbeddedPageProperties.parseFlag(value));
    }

    @Test
    @DisplayName("路径配置")
    void testPaths() {
        EmbeddedPageProperties properties = new EmbeddedPageProperties();

        assertEquals(Path.of("").toAbsolutePath(), properties.documentRootPath());
        assertNull(properties.tempDirPath());

        properties.setDocumentRoot("/srv/app/../www");
        properties.setTempDir("/var/cache/pages");

        assertEquals(Path.of("/srv/www"), properties.documentRootPath());
        assertEquals(Path.of("/var/cache/pages"), properties.tempDirPath());
    }
}
