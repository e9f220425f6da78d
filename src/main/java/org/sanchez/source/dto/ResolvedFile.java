package org.sanchez.source.dto;

/**
 * 解析得到的一个待处理文件。
 *
 * @param sourceAbsolutePath 源文件绝对路径
 * @param outputPath         对应的输出文件路径
 */
public record ResolvedFile(String sourceAbsolutePath, String outputPath) {
}
