package org.sanchez.source.dto;

/**
 * 一次源文件解析请求（由命令行/工具参数映射而来）。
 *
 * @param sourcePath 源路径：单个文件、目录或 glob 模式（例如 {@code source/**&#47;*IR.jpg}），可为相对路径
 * @param outputPath 输出路径：单文件模式下为输出文件，批量模式下为输出目录
 * @param batch      是否批量模式
 */
public record ResolutionRequest(String sourcePath, String outputPath, boolean batch) {

    public ResolutionRequest {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("参数错误：sourcePath 不能为空");
        }
        if (batch && (outputPath == null || outputPath.isBlank())) {
            throw new IllegalArgumentException("参数错误：批量模式下 outputPath 不能为空");
        }
    }
}
