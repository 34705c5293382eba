package org.arena.domain;

import lombok.Value;

/**
 * 扩展上报的模型：公开名称、上游模型 ID、类别
 */
@Value
public class ArenaModel {

    String name;
    String id;
    ModelCategory category;
}
