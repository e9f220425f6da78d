package org.sanchez.mcp;

import org.sanchez.render.RenderOptionFactory;
import org.sanchez.render.RenderOptions;
import org.sanchez.source.SourceResolver;
import org.sanchez.source.dto.OutputPrepareResult;
import org.sanchez.source.dto.ResolutionRequest;
import org.sanchez.source.dto.ResolvedFile;
import org.sanchez.source.dto.SourceResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批量伪彩色处理的源文件解析工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>解析源路径（单文件/目录/glob）并给出每个文件的输出路径（{@code fc_resolve_sources}）。</li>
 *   <li>批量模式下准备输出目录（{@code fc_prepare_output}）。</li>
 * </ul>
 * <p>
 * 相对的源路径和输出路径都以 {@code app.fc.working-directory} 为基准。
 */
@Component
public class SourceMcpTools {

    private static final Logger log = LoggerFactory.getLogger(SourceMcpTools.class);

    /**
     * 冲突告警最多返回的条数，避免大批量时返回体过大。
     */
    private static final int MAX_COLLISION_WARNINGS = 50;

    private final SourceResolver sourceResolver;
    private final RenderOptionFactory renderOptionFactory;

    public SourceMcpTools(SourceResolver sourceResolver, RenderOptionFactory renderOptionFactory) {
        this.sourceResolver = sourceResolver;
        this.renderOptionFactory = renderOptionFactory;
    }

    @Tool(
            name = "fc_resolve_sources",
            description = "把源路径（单个文件、目录或 glob，例如 source/**/*IR.jpg）解析成按路径排序的文件列表，并给出每个文件的输出路径。"
    )
    /**
     * 解析源文件列表。
     * <p>
     * 说明：
     * <ul>
     *   <li>非批量模式只返回源路径本身（不检查是否存在），输出路径即 {@code outputPath}。</li>
     *   <li>批量模式输出文件名为 {@code <文件名>-fc<扩展名>}；不同子目录下的同名文件会冲突，冲突会写入 warnings。</li>
     * </ul>
     */
    public SourceResolutionResult resolveSources(
            @ToolParam(description = "源路径：文件、目录或 glob（相对 app.fc.working-directory 或绝对路径）") String sourcePath,
            @ToolParam(required = false, description = "输出路径：单文件模式为输出文件，批量模式为输出目录（批量模式必填）") String outputPath,
            @ToolParam(required = false, description = "是否批量模式（默认 false）") Boolean batch,
            @ToolParam(required = false, description = "批量模式下是否同时创建输出目录（默认 false）") Boolean prepareOutput,
            @ToolParam(required = false, description = "亮度（默认 app.fc.default-brightness）") Float brightness,
            @ToolParam(required = false, description = "饱和度（默认 app.fc.default-saturation）") Float saturation,
            @ToolParam(required = false, description = "着色，十六进制颜色（默认 app.fc.default-tint）") String tint
    ) {
        ResolutionRequest request = toRequest(sourcePath, outputPath, batch);
        RenderOptions renderOptions = renderOptionFactory.toRenderOptions(brightness, saturation, tint);

        boolean prepared = false;
        if (request.batch() && Boolean.TRUE.equals(prepareOutput)) {
            ensureOutput(request);
            prepared = true;
        }

        List<ResolvedFile> files;
        try {
            files = sourceResolver.resolve(request);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("源目录不存在：" + e.getFile(), e);
        } catch (IOException e) {
            throw new IllegalStateException("解析源文件失败：" + sourcePath, e);
        }
        log.info("源路径 {} 解析到 {} 个文件（batch={}）", sourcePath, files.size(), request.batch());

        List<String> warnings = request.batch() ? collisionWarnings(files) : List.of();
        return new SourceResolutionResult(
                sourcePath,
                outputPath,
                request.batch(),
                prepared,
                files.size(),
                files,
                renderOptions,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "fc_prepare_output",
            description = "批量模式下确保输出目录存在（会创建缺失的父目录，可重复调用）；非批量模式不做任何事。"
    )
    public OutputPrepareResult prepareOutput(
            @ToolParam(description = "输出目录（相对 app.fc.working-directory 或绝对路径）") String outputPath,
            @ToolParam(required = false, description = "是否批量模式（默认 true）") Boolean batch
    ) {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：outputPath 不能为空");
        }
        boolean batchResolved = (batch == null) || batch;
        Path target = resolveAgainstWorkingDirectory(outputPath);
        boolean existedBefore = Files.isDirectory(target);
        // sourcePath 在这里不参与，只用于满足请求的非空约束
        ResolutionRequest request = new ResolutionRequest(".", target.toString(), batchResolved);
        ensureOutput(request);
        return new OutputPrepareResult(outputPath, batchResolved, existedBefore, Files.isDirectory(target));
    }

    private void ensureOutput(ResolutionRequest request) {
        try {
            sourceResolver.prepareOutput(request);
        } catch (IOException e) {
            throw new IllegalStateException("创建输出目录失败：" + request.outputPath(), e);
        }
    }

    private ResolutionRequest toRequest(String sourcePath, String outputPath, Boolean batch) {
        boolean batchResolved = Boolean.TRUE.equals(batch);
        String outputResolved = (outputPath == null || outputPath.isBlank())
                ? outputPath
                : resolveAgainstWorkingDirectory(outputPath).toString();
        return new ResolutionRequest(sourcePath, outputResolved, batchResolved);
    }

    private Path resolveAgainstWorkingDirectory(String path) {
        return sourceResolver.getWorkingDirectory().resolve(path).normalize();
    }

    /**
     * 批量模式下多个源文件映射到同一个输出路径时给出告警（不改名，保持输出规则不变）。
     */
    static List<String> collisionWarnings(List<ResolvedFile> files) {
        Map<String, List<String>> byOutput = new LinkedHashMap<>();
        for (ResolvedFile file : files) {
            byOutput.computeIfAbsent(file.outputPath(), k -> new ArrayList<>()).add(file.sourceAbsolutePath());
        }
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : byOutput.entrySet()) {
            if (entry.getValue().size() < 2) {
                continue;
            }
            if (warnings.size() >= MAX_COLLISION_WARNINGS) {
                warnings.add("输出冲突过多，仅显示前 " + MAX_COLLISION_WARNINGS + " 条。");
                break;
            }
            warnings.add("输出文件冲突，后处理的文件会覆盖先处理的：" + entry.getKey() + " <- " + entry.getValue());
        }
        return warnings;
    }
}
