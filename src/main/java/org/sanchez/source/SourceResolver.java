package org.sanchez.source;

import org.sanchez.source.dto.ResolutionRequest;
import org.sanchez.source.dto.ResolvedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Predicate;

/**
 * 源文件解析器：把用户传入的源路径（单个文件、目录或 glob 模式）解析成确定顺序的文件列表，并推导每个文件的输出路径。
 * <p>
 * 解析规则：
 * <ul>
 *   <li>非批量模式：直接返回源路径的绝对形式，不检查是否存在。</li>
 *   <li>批量模式且源路径是已存在的目录：递归列出目录下全部文件。</li>
 *   <li>其它情况按 glob 处理：{@code *} 匹配段内任意字符，{@code ?} 匹配段内单个字符，{@code **} 匹配任意层目录。
 *       其它字符（包括 {@code [a-z]}、{@code {a,b}}）都按普通字符匹配。</li>
 * </ul>
 * <p>
 * 注意：
 * <ul>
 *   <li>结果按完整路径字符串排序（{@link String#compareTo}，与区域设置无关）。</li>
 *   <li>批量模式输出到同一个目录，不同子目录下的同名文件会得到相同的输出路径；这里不做改名，只由调用方报告。</li>
 *   <li>相对的源路径和输出路径都以 {@code workingDirectory} 为基准（非批量模式的输出路径除外，原样返回）。</li>
 *   <li>每次调用都读取当前文件系统状态，不做缓存。</li>
 * </ul>
 */
public class SourceResolver {

    /**
     * 批量模式下输出文件名追加的后缀。
     */
    public static final String BATCH_FILE_SUFFIX = "-fc";

    private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

    private static final Comparator<Path> FULL_PATH_ORDER = Comparator.comparing(Path::toString);

    private final Path workingDirectory;

    /**
     * @param workingDirectory 相对源路径的解析基准目录
     */
    public SourceResolver(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * 批量模式下确保输出目录存在（包括缺失的父目录）；可重复调用。
     */
    public void prepareOutput(ResolutionRequest request) throws IOException {
        if (!request.batch()) {
            return;
        }
        Path outputDirectory = workingDirectory.resolve(request.outputPath()).normalize();
        if (Files.isDirectory(outputDirectory)) {
            return;
        }
        Files.createDirectories(outputDirectory);
        log.info("已创建输出目录：{}", outputDirectory);
    }

    /**
     * 计算某个源文件的输出路径。
     * <p>
     * 非批量模式原样返回 {@code outputPath}（空白字符串也原样返回，只有未提供时返回 null）；批量模式为
     * {@code outputPath/<文件名（不含扩展名）>-fc<扩展名>}，相对的 {@code outputPath} 以 {@code workingDirectory} 为基准。
     */
    public Path getOutputFilename(ResolutionRequest request, Path sourceFile) {
        if (!request.batch()) {
            return (request.outputPath() == null) ? null : Path.of(request.outputPath());
        }
        String name = fileName(sourceFile);
        int dot = name.lastIndexOf('.');
        String stem = (dot < 0) ? name : name.substring(0, dot);
        String extension = (dot < 0 || dot == name.length() - 1) ? "" : name.substring(dot);
        return workingDirectory.resolve(request.outputPath()).normalize().resolve(stem + BATCH_FILE_SUFFIX + extension);
    }

    /**
     * 返回待处理的源文件列表（绝对路径，按完整路径排序）。
     *
     * @throws NoSuchFileException         批量模式下扫描的目录（或 glob 基准目录）不存在
     * @throws InvalidSourceGlobException  glob 模式无法编译
     * @throws IOException                 遍历目录失败（例如没有读权限）
     */
    public List<Path> getSourceFiles(ResolutionRequest request) throws IOException {
        String absolutePath = toAbsolutePath(request.sourcePath());

        if (!request.batch()) {
            return List.of(toPath(absolutePath));
        }

        Path literal = toPathOrNull(absolutePath);
        if (literal != null && Files.isDirectory(literal)) {
            List<Path> files = listFiles(literal, file -> true);
            log.debug("目录 {} 下共 {} 个文件", literal, files.size());
            return files;
        }

        SourceGlob glob = compileGlob(absolutePath);
        List<Path> files = listFiles(glob.scanRoot(), glob::matches);
        log.debug("glob {} 在 {} 下匹配到 {} 个文件", glob.pattern(), glob.scanRoot(), files.size());
        return files;
    }

    /**
     * 按 glob 规则编译源路径（不访问文件系统）。
     */
    SourceGlob toGlob(String sourcePath) {
        return compileGlob(toAbsolutePath(sourcePath));
    }

    private SourceGlob compileGlob(String absolutePath) {
        String globBase = computeGlobBase(absolutePath);
        String pattern = normalizeSeparators(absolutePath);
        String relative = pattern.substring(normalizeSeparators(globBase).length());
        if (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return SourceGlob.compile(toScanRoot(globBase), relative);
    }

    /**
     * 解析源文件并为每个文件计算输出路径，顺序与 {@link #getSourceFiles} 一致。
     */
    public List<ResolvedFile> resolve(ResolutionRequest request) throws IOException {
        List<Path> sources = getSourceFiles(request);
        List<ResolvedFile> result = new ArrayList<>(sources.size());
        for (Path source : sources) {
            Path output = getOutputFilename(request, source);
            result.add(new ResolvedFile(source.toString(), (output == null) ? null : output.toString()));
        }
        return result;
    }

    /**
     * 计算 glob 基准目录：从头开始保留不含 {@code *}/{@code ?} 的路径段，遇到第一个含通配符的段即停止，
     * 再用平台分隔符拼接。第一个段就含通配符时返回空字符串；没有通配符时返回整个路径。
     */
    static String computeGlobBase(String path) {
        String[] segments = normalizeSeparators(path).split("/", -1);
        List<String> literal = new ArrayList<>(segments.length);
        for (String segment : segments) {
            if (hasWildcard(segment)) {
                break;
            }
            literal.add(segment);
        }
        return String.join(File.separator, literal);
    }

    /**
     * 把源路径转成绝对路径字符串（平台分隔符），并折叠 {@code .}/{@code ..}。
     * <p>
     * 只有不含通配符的前缀部分交给 {@link Path} 解析，因为部分平台（Windows）不允许 {@code *}/{@code ?} 出现在路径中；
     * 通配符部分逐段折叠，{@code ..} 越过通配符部分时继续回退前缀。
     */
    private String toAbsolutePath(String sourcePath) {
        String normalized = normalizeSeparators(sourcePath);
        int patternStart = wildcardSegmentStart(normalized);
        String literal = (patternStart < 0) ? normalized : normalized.substring(0, patternStart);

        Path base = workingDirectory.resolve(toPath(literal)).normalize();
        if (patternStart < 0) {
            return base.toString();
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : normalized.substring(patternStart).split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                } else if (base.getParent() != null) {
                    base = base.getParent();
                }
                continue;
            }
            segments.addLast(segment);
        }
        String prefix = base.toString();
        if (segments.isEmpty()) {
            return prefix;
        }
        if (!prefix.endsWith(File.separator)) {
            prefix = prefix + File.separator;
        }
        return prefix + String.join(File.separator, segments);
    }

    private Path toScanRoot(String globBase) {
        // 第一个段就是通配符（例如 /*.jpg）时基准为空，扫描文件系统根目录
        Path candidate = toPath(globBase.isEmpty() ? File.separator : globBase);
        if (!candidate.isAbsolute()) {
            // Windows 盘符（C:）需要补上分隔符才是根目录
            candidate = toPath(globBase + File.separator);
        }
        return candidate.isAbsolute() ? candidate : workingDirectory.resolve(candidate);
    }

    private static List<Path> listFiles(Path root, Predicate<Path> filter) throws IOException {
        if (!Files.exists(root)) {
            throw new NoSuchFileException(root.toString(), null, "源目录不存在");
        }
        List<Path> files = new ArrayList<>();
        // walkFileTree 是深度优先遍历；默认不跟随目录链接，遍历失败直接抛出
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                boolean regular = attrs.isRegularFile() || (attrs.isSymbolicLink() && Files.isRegularFile(file));
                if (regular && filter.test(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(FULL_PATH_ORDER);
        return files;
    }

    /**
     * 返回第一个含通配符的路径段的起始下标（路径需使用 / 分隔）；没有通配符返回 -1。
     */
    private static int wildcardSegmentStart(String path) {
        int start = 0;
        while (start <= path.length()) {
            int end = path.indexOf('/', start);
            if (end < 0) {
                end = path.length();
            }
            if (hasWildcard(path.substring(start, end))) {
                return start;
            }
            start = end + 1;
        }
        return -1;
    }

    private static boolean hasWildcard(String segment) {
        return segment.indexOf('*') >= 0 || segment.indexOf('?') >= 0;
    }

    private static Path toPath(String path) {
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("源路径不合法：" + path, e);
        }
    }

    private static Path toPathOrNull(String path) {
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            // 含平台非法字符（例如 Windows 下的 *）的路径不可能是已存在的目录，交给 glob 分支
            return null;
        }
    }

    private static String normalizeSeparators(String path) {
        return path.replace('\\', '/');
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return (name != null) ? name.toString() : path.toString();
    }
}
