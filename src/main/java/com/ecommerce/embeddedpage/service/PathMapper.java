package com.ecommerce.embeddedpage.service;

import com.ecommerce.embeddedpage.exception.ErrorKind;
import com.ecommerce.embeddedpage.model.ResourceResult;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 资源标识 -> 文件系统路径映射
 *
 * 算法：
 * 1. 去掉 "命名空间根." 前缀
 * 2. 最后一个点之后（含点）为扩展名
 * 3. 其余部分的点全部替换为路径分隔符
 * 4. 拼接到目标根目录并规范化为绝对路径
 *
 * 例：("MyNamespace.Sub", "MyNamespace.Sub.Folder1.Folder2.File.txt", "/temp") -> /temp/Folder1/Folder2/File.txt
 *
 * 多段扩展名（如 Page.zh-CN.jspx）会被当作目录处理，属于已知限制
 * 纯函数，无状态，线程安全
 */
public class PathMapper {

    private static final char SEPARATOR = '.';
    private static final String DOUBLE_SEPARATOR = "..";

    /**
     * 映射到指定目标根目录；destinationRoot 为 null 时使用当前工作目录
     */
    public ResourceResult<Path> map(String namespaceRoot, String resourceName, Path destinationRoot) {
        String problem = checkDottedName(namespaceRoot, "Base resource namespace");
        if (problem != null) {
            return ResourceResult.invalidArgument(problem);
        }
        problem = checkDottedName(resourceName, "Embedded resource path");
        if (problem != null) {
            return ResourceResult.invalidArgument(problem);
        }
        if (!resourceName.startsWith(namespaceRoot + SEPARATOR)) {
            return ResourceResult.failure(ErrorKind.PREFIX_MISMATCH,
                "Base resource namespace [" + namespaceRoot
                    + "] must appear at the start of the embedded resource path [" + resourceName + "].");
        }

        Path targetFolder = (destinationRoot == null || destinationRoot.toString().isEmpty())
            ? Paths.get("").toAbsolutePath()
            : destinationRoot.toAbsolutePath();

        String remainder = resourceName.substring(namespaceRoot.length() + 1);
        String relativePath = toRelativePath(remainder, targetFolder.getFileSystem().getSeparator());

        return ResourceResult.success(targetFolder.resolve(relativePath).normalize());
    }

    /**
     * 字符串目标根目录重载；null 或空串使用当前工作目录
     */
    public ResourceResult<Path> map(String namespaceRoot, String resourceName, String destinationRoot) {
        Path root = (destinationRoot == null || destinationRoot.isEmpty()) ? null : Paths.get(destinationRoot);
        return map(namespaceRoot, resourceName, root);
    }

    static String toRelativePath(String remainder, String separator) {
        int extSeparator = remainder.lastIndexOf(SEPARATOR);
        if (extSeparator < 0) {
            // 无扩展名
            return remainder;
        }
        return remainder.substring(0, extSeparator).replace(String.valueOf(SEPARATOR), separator)
            + remainder.substring(extSeparator);
    }

    /**
     * 校验点分名称
     * @return 违反的第一条规则描述，合法返回 null
     */
    public static String checkDottedName(String value, String label) {
        if (value == null) {
            return label + " may not be null.";
        }
        if (value.isEmpty()) {
            return label + " may not be empty.";
        }
        if (value.charAt(0) == SEPARATOR || value.charAt(value.length() - 1) == SEPARATOR) {
            return label + " [" + value + "] may not start or end with a period.";
        }
        if (value.contains(DOUBLE_SEPARATOR)) {
            return label + " [" + value + "] may not contain two or more periods together.";
        }
        return null;
    }
}
