package org.sanchez.source;

/**
 * 源路径作为 glob 模式时无法编译。
 */
public class InvalidSourceGlobException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String pattern;

    public InvalidSourceGlobException(String pattern, String message, Throwable cause) {
        super(message + "：" + pattern, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
