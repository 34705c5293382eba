package org.arena.service;

import org.arena.domain.ArenaModel;

import java.util.List;

public interface IModelCatalog {

    /**
     * 替换某个账号上报的模型集合，并重新计算全局并集
     */
    void register(String profileId, List<ArenaModel> models);

    void unregister(String profileId);

    /**
     * 按名称排序的全部模型
     */
    List<ArenaModel> listModels();

    /**
     * 先精确匹配（区分大小写），再模糊匹配
     *
     * @throws org.arena.domain.exception.ModelNotFoundException 没有足够相似的模型
     */
    ArenaModel resolve(String requestedName);
}
