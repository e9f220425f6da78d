package org.sanchez.render;

import java.util.HexFormat;
import java.util.Locale;

/**
 * 着色颜色（RGBA，每个分量 0-255）。
 *
 * @param red   红
 * @param green 绿
 * @param blue  蓝
 * @param alpha 不透明度
 */
public record TintColor(int red, int green, int blue, int alpha) {

    public TintColor {
        checkComponent("red", red);
        checkComponent("green", green);
        checkComponent("blue", blue);
        checkComponent("alpha", alpha);
    }

    /**
     * 解析十六进制颜色：可带前缀 {@code #}，支持 {@code rgb}、{@code rrggbb}、{@code rrggbbaa}。
     */
    public static TintColor fromHexString(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("参数错误：tint 不能为空");
        }
        String value = hex.trim();
        if (value.startsWith("#")) {
            value = value.substring(1);
        }
        if (value.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (char c : value.toCharArray()) {
                expanded.append(c).append(c);
            }
            value = expanded.toString();
        }
        if (value.length() != 6 && value.length() != 8) {
            throw new IllegalArgumentException("颜色格式不合法（需要 rgb / rrggbb / rrggbbaa）：" + hex);
        }
        for (char c : value.toCharArray()) {
            if (!HexFormat.isHexDigit(c)) {
                throw new IllegalArgumentException("颜色格式不合法（包含非十六进制字符）：" + hex);
            }
        }
        int red = HexFormat.fromHexDigits(value, 0, 2);
        int green = HexFormat.fromHexDigits(value, 2, 4);
        int blue = HexFormat.fromHexDigits(value, 4, 6);
        int alpha = (value.length() == 8) ? HexFormat.fromHexDigits(value, 6, 8) : 255;
        return new TintColor(red, green, blue, alpha);
    }

    /**
     * 转成 {@code rrggbbaa} 形式的小写十六进制字符串。
     */
    public String toHexString() {
        return String.format(Locale.ROOT, "%02x%02x%02x%02x", red, green, blue, alpha);
    }

    private static void checkComponent(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("颜色分量超出范围（0-255）：" + name + "=" + value);
        }
    }
}
