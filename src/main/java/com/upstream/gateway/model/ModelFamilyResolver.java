package com.upstream.gateway.model;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * 根据模型名（和错误信息）推断模型家族
 */
@Component
public class ModelFamilyResolver {

    /**
     * 请求侧推断：模型名含 claude 即为 claude，其余一律按 gemini 处理
     */
    public ModelFamily resolve(String model) {
        if (model != null && model.toLowerCase(Locale.ROOT).contains("claude")) {
            return ModelFamily.CLAUDE;
        }
        return ModelFamily.GEMINI;
    }

    /**
     * 从模型名和上游错误信息中识别家族，识别不出返回 empty
     */
    public Optional<ModelFamily> detect(String message, String model) {
        String combined = ((model != null ? model : "") + " " + (message != null ? message : ""))
                .toLowerCase(Locale.ROOT);
        if (combined.contains("claude") || combined.contains("anthropic")) {
            return Optional.of(ModelFamily.CLAUDE);
        }
        if (combined.contains("gemini")) {
            return Optional.of(ModelFamily.GEMINI);
        }
        return Optional.empty();
    }
}
