package org.sanchez.source;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;

/**
 * 编译后的源路径 glob：扫描根目录 + 相对扫描根目录的模式。
 * <p>
 * 只对扫描根目录以下的相对路径做匹配，扫描根目录本身按普通路径处理，
 * 因此其中的 {@code {}}、{@code [ ]}、{@code :} 等字符不会被当成语法。
 * <p>
 * 模式部分只有 {@code *}、{@code ?} 和整段的 {@code **} 有特殊含义，其它字符在交给 {@link PathMatcher} 之前全部转义；
 * 整段 {@code **} 可以匹配零层目录。
 */
final class SourceGlob {

    private final Path scanRoot;
    private final String pattern;
    private final PathMatcher matcher;

    private SourceGlob(Path scanRoot, String pattern, PathMatcher matcher) {
        this.scanRoot = scanRoot;
        this.pattern = pattern;
        this.matcher = matcher;
    }

    /**
     * @param scanRoot        扫描根目录（glob 基准目录）
     * @param relativePattern 相对扫描根目录的模式，使用 / 分隔；为空表示只匹配扫描根目录本身
     */
    static SourceGlob compile(Path scanRoot, String relativePattern) {
        if (relativePattern.isEmpty()) {
            return new SourceGlob(scanRoot, relativePattern, null);
        }
        try {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + toGlobSyntax(relativePattern));
            return new SourceGlob(scanRoot, relativePattern, matcher);
        } catch (IllegalArgumentException e) {
            throw new InvalidSourceGlobException(relativePattern, "glob 模式不合法", e);
        }
    }

    Path scanRoot() {
        return scanRoot;
    }

    String pattern() {
        return pattern;
    }

    boolean matches(Path file) {
        if (matcher == null) {
            return file.equals(scanRoot);
        }
        if (!file.startsWith(scanRoot) || file.equals(scanRoot)) {
            return false;
        }
        return matcher.matches(scanRoot.relativize(file));
    }

    /**
     * 转成 JDK glob 语法：转义 {@code \ [ ] { }}，整段 {@code **}（后面还有路径段时）改写成 {@code {**&#47;,}}。
     */
    static String toGlobSyntax(String relativePattern) {
        String[] segments = relativePattern.split("/", -1);
        StringBuilder glob = new StringBuilder(relativePattern.length() + 16);
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            boolean last = (i == segments.length - 1);
            if (segment.equals("**") && !last) {
                glob.append("{**/,}");
                continue;
            }
            for (char c : segment.toCharArray()) {
                if (c == '\\' || c == '[' || c == ']' || c == '{' || c == '}') {
                    glob.append('\\');
                }
                glob.append(c);
            }
            if (!last) {
                glob.append('/');
            }
        }
        return glob.toString();
    }
}
