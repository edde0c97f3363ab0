package com.qgistoolkit.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LayerRef {
    private String id;
    private String name;
}
