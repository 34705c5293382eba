package org.arena.service.impl;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.arena.config.ArenaProperties;
import org.arena.domain.ArenaModel;
import org.arena.domain.exception.ModelNotFoundException;
import org.arena.service.IModelCatalog;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
public class ModelCatalogImpl implements IModelCatalog {

    private final double threshold;

    // profileId -> 该账号上报的模型，由 this 保护
    private final Map<String, Contribution> contributions = new HashMap<>();
    private long sequence;

    // 名称 -> 模型，按名称排序的只读快照
    private volatile Map<String, ArenaModel> union = Collections.emptyMap();

    public ModelCatalogImpl(ArenaProperties arenaProperties) {
        this.threshold = arenaProperties.getFuzzyThreshold();
    }

    @Override
    public synchronized void register(String profileId, List<ArenaModel> models) {
        contributions.put(profileId, new Contribution(++sequence, List.copyOf(models)));
        rebuild();
        log.debug("账号[{}]上报模型 {} 个，合并后共 {} 个", profileId, models.size(), union.size());
    }

    @Override
    public synchronized void unregister(String profileId) {
        if (contributions.remove(profileId) != null) {
            rebuild();
            log.info("移除账号[{}]上报的模型，剩余 {} 个", profileId, union.size());
        }
    }

    @Override
    public List<ArenaModel> listModels() {
        return new ArrayList<>(union.values());
    }

    @Override
    public ArenaModel resolve(String requestedName) {
        Map<String, ArenaModel> models = union;
        if (requestedName != null) {
            ArenaModel exact = models.get(requestedName);
            if (exact != null) {
                return exact;
            }
            String query = normalize(requestedName);
            if (!query.isEmpty()) {
                ArenaModel best = null;
                double bestScore = threshold;
                // 按名称顺序遍历，同分时保留字典序靠前的
                for (ArenaModel candidate : models.values()) {
                    double score = similarity(query, normalize(candidate.getName()));
                    if (score > bestScore || (best == null && score == bestScore)) {
                        best = candidate;
                        bestScore = score;
                    }
                }
                if (best != null) {
                    log.info("模型模糊匹配: {} -> {} (相似度 {})", requestedName, best.getName(),
                            String.format(Locale.ROOT, "%.2f", bestScore));
                    return best;
                }
            }
        }
        throw new ModelNotFoundException(requestedName, new ArrayList<>(models.keySet()));
    }

    private void rebuild() {
        List<Contribution> ordered = new ArrayList<>(contributions.values());
        ordered.sort(Comparator.comparingLong(Contribution::getSequence));
        // 后上报的覆盖先上报的类别
        Map<String, ArenaModel> merged = new TreeMap<>();
        for (Contribution contribution : ordered) {
            for (ArenaModel model : contribution.getModels()) {
                merged.put(model.getName(), model);
            }
        }
        union = Collections.unmodifiableMap(merged);
    }

    static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }

    /**
     * 相似度 [0, 1]：完全相同为 1；包含关系不低于 0.7；否则按编辑距离计算
     */
    static double similarity(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        int longer = Math.max(a.length(), b.length());
        int shorter = Math.min(a.length(), b.length());
        double containment = (a.contains(b) || b.contains(a)) ? 0.7 + 0.29 * shorter / longer : 0.0;
        double edit = 1.0 - (double) levenshtein(a, b) / longer;
        return Math.max(containment, edit);
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] tmp = previous;
            previous = current;
            current = tmp;
        }
        return previous[b.length()];
    }

    @Value
    private static class Contribution {
        long sequence;
        List<ArenaModel> models;
    }
}
