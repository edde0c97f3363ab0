package com.qgistoolkit.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

/**
 * One {@code maplayer} entry of the flat layer list.
 *
 * <p>The raw element is kept so reassembly can copy renderer, style and other unmodelled metadata
 * verbatim.
 */
@Getter
@Builder
@ToString(exclude = "element")
public class MapLayer {
    private final String id;
    private final String name;
    private final String datasource;
    private final Element element;
}
