package org.sanchez.render;

/**
 * 渲染参数。
 *
 * @param brightness 亮度倍数
 * @param saturation 饱和度
 * @param tint       着色颜色
 */
public record RenderOptions(float brightness, float saturation, TintColor tint) {
}
