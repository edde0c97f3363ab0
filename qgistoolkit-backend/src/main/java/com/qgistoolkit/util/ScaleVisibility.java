package com.qgistoolkit.util;

import org.w3c.dom.Element;

/**
 * Human-readable scale-based visibility of a {@code maplayer}.
 *
 * <p>Attributes on the layer element are read first ({@code hasScaleBasedVisibilityFlag="1"} with
 * {@code minScale}/{@code maxScale} or the older {@code minimumScale}/{@code maximumScale}); a
 * {@code scalebasedvisibility} child with {@code enabled="1"} is the fallback.
 */
public final class ScaleVisibility {
    public static final String ALWAYS_VISIBLE = "Always Visible";
    public static final String NO_MIN = "No Min (Visible Zoomed Out)";
    public static final String NO_MAX = "No Max (Visible Zoomed In)";

    private static final String UNSET = "0";

    private final String minScale;
    private final String maxScale;

    private ScaleVisibility(String minScale, String maxScale) {
        this.minScale = minScale;
        this.maxScale = maxScale;
    }

    public String getMinScale() {
        return minScale;
    }

    public String getMaxScale() {
        return maxScale;
    }

    public static ScaleVisibility of(Element mapLayer) {
        String min = UNSET;
        String max = UNSET;

        if ("1".equals(XmlElements.attribute(mapLayer, "hasScaleBasedVisibilityFlag"))) {
            min = firstPresent(mapLayer, "minScale", "minimumScale");
            max = firstPresent(mapLayer, "maxScale", "maximumScale");
        }

        if (UNSET.equals(min) && UNSET.equals(max)) {
            Element scaleElement = XmlElements.firstChild(mapLayer, "scalebasedvisibility");
            if (scaleElement != null && "1".equals(XmlElements.attribute(scaleElement, "enabled"))) {
                min = firstPresent(scaleElement, "minimumScale", "minimumscale");
                max = firstPresent(scaleElement, "maximumScale", "maximumscale");
            }
        }

        if (UNSET.equals(min) && UNSET.equals(max)) {
            return new ScaleVisibility(ALWAYS_VISIBLE, ALWAYS_VISIBLE);
        }
        try {
            String minText = UNSET.equals(min) ? NO_MIN : "1:" + (long) Double.parseDouble(min);
            String maxText = UNSET.equals(max) ? NO_MAX : "1:" + (long) Double.parseDouble(max);
            return new ScaleVisibility(minText, maxText);
        } catch (NumberFormatException e) {
            return new ScaleVisibility("Error parsing: " + min, "Error parsing: " + max);
        }
    }

    private static String firstPresent(Element element, String name, String fallbackName) {
        String value = XmlElements.attribute(element, name);
        if (value == null) {
            value = XmlElements.attribute(element, fallbackName);
        }
        return value != null ? value : UNSET;
    }
}
