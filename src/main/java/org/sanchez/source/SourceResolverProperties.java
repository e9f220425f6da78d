package org.sanchez.source;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 源文件解析与渲染参数的配置（{@code app.fc.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #workingDirectory} 决定相对源路径的解析基准，默认是进程当前目录。</li>
 *   <li>渲染参数默认值只在调用方没有显式传值时生效。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.fc")
public class SourceResolverProperties {

    /**
     * 相对源路径的解析基准目录。
     */
    @NotBlank
    private String workingDirectory = ".";

    /**
     * 默认亮度（1.0 表示不调整）。
     */
    @DecimalMin("0.0")
    private float defaultBrightness = 1.0f;

    /**
     * 默认饱和度。
     */
    @DecimalMin("0.0")
    private float defaultSaturation = 0.7f;

    /**
     * 默认着色（十六进制颜色，支持 rgb / rrggbb / rrggbbaa，可带 #）。
     */
    @NotBlank
    private String defaultTint = "5ebfff";

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public float getDefaultBrightness() {
        return defaultBrightness;
    }

    public void setDefaultBrightness(float defaultBrightness) {
        this.defaultBrightness = defaultBrightness;
    }

    public float getDefaultSaturation() {
        return defaultSaturation;
    }

    public void setDefaultSaturation(float defaultSaturation) {
        this.defaultSaturation = defaultSaturation;
    }

    public String getDefaultTint() {
        return defaultTint;
    }

    public void setDefaultTint(String defaultTint) {
        this.defaultTint = defaultTint;
    }
}
