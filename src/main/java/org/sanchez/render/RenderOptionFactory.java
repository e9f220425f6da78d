package org.sanchez.render;

/**
 * 从命令行/工具参数构造 {@link RenderOptions}；未传入的字段使用配置默认值（{@code app.fc.default-*}）。
 */
public class RenderOptionFactory {

    private final float defaultBrightness;
    private final float defaultSaturation;
    private final TintColor defaultTint;

    public RenderOptionFactory(float defaultBrightness, float defaultSaturation, String defaultTint) {
        this.defaultBrightness = defaultBrightness;
        this.defaultSaturation = defaultSaturation;
        this.defaultTint = TintColor.fromHexString(defaultTint);
    }

    public RenderOptions toRenderOptions(Float brightness, Float saturation, String tint) {
        float resolvedBrightness = (brightness != null) ? brightness : defaultBrightness;
        float resolvedSaturation = (saturation != null) ? saturation : defaultSaturation;
        if (resolvedBrightness < 0 || resolvedSaturation < 0) {
            throw new IllegalArgumentException("参数错误：brightness/saturation 不能为负数");
        }
        TintColor resolvedTint = (tint == null || tint.isBlank()) ? defaultTint : TintColor.fromHexString(tint);
        return new RenderOptions(resolvedBrightness, resolvedSaturation, resolvedTint);
    }
}
