package org.arena.domain.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

@Getter
public class ModelNotFoundException extends ServiceException {

    private final String requestedModel;
    private final List<String> availableModels;

    public ModelNotFoundException(String requestedModel, List<String> availableModels) {
        super(HttpStatus.NOT_FOUND, "model_not_found", "模型不存在: " + requestedModel);
        this.requestedModel = requestedModel;
        this.availableModels = List.copyOf(availableModels);
    }
}
