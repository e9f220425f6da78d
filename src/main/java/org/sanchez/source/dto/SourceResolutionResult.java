package org.sanchez.source.dto;

import org.sanchez.render.RenderOptions;

import java.util.List;

/**
 * {@code fc_resolve_sources} 的返回结果。
 *
 * @param sourcePath      调用方传入的源路径（原样）
 * @param outputPath      调用方传入的输出路径（原样）
 * @param batch           是否批量模式
 * @param outputPrepared  本次是否执行了输出目录准备
 * @param fileCount       解析得到的文件数
 * @param files           按完整路径排序的文件列表
 * @param renderOptions   渲染参数（未传入的字段使用 app.fc.* 默认值）
 * @param warnings        非致命告警（例如批量模式下输出文件名冲突）
 */
public record SourceResolutionResult(
        String sourcePath,
        String outputPath,
        boolean batch,
        boolean outputPrepared,
        int fileCount,
        List<ResolvedFile> files,
        RenderOptions renderOptions,
        List<String> warnings
) {
}
