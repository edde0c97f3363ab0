package com.qgistoolkit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Index entry for one group path: direct layer references and child group paths, both in
 * document order.
 *
 * <p>When several sibling groups share a name they share one entry; {@code element} is the first
 * of them and supplies the attributes of rebuilt groups.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GroupEntry {
    private String name;
    private String path;
    private List<LayerRef> layers = new ArrayList<>();
    private List<String> groups = new ArrayList<>();

    @JsonIgnore
    private Element element;

    public GroupEntry(String name, String path, Element element) {
        this.name = name;
        this.path = path;
        this.element = element;
    }

    public void addChildPath(String childPath) {
        if (!groups.contains(childPath)) {
            groups.add(childPath);
        }
    }
}
