package org.arena.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import org.arena.domain.ModelCategory;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ArenaModelVO {
    private String id;
    private String object = "model";
    private Long created = 0L;
    private String ownedBy = "arena.ai";
    private ModelCategory category;

    public ArenaModelVO(String id, ModelCategory category) {
        this.id = id;
        this.category = category;
    }
}
