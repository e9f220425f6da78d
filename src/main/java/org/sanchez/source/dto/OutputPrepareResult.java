package org.sanchez.source.dto;

/**
 * {@code fc_prepare_output} 的返回结果。
 *
 * @param outputPath    输出路径（原样返回）
 * @param batch         是否批量模式（非批量模式不会创建任何目录）
 * @param existedBefore 调用前输出目录是否已存在
 * @param directory     调用后输出路径是否为目录
 */
public record OutputPrepareResult(
        String outputPath,
        boolean batch,
        boolean existedBefore,
        boolean directory
) {
}
