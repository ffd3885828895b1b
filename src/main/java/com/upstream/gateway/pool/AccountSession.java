package com.upstream.gateway.pool;

import com.upstream.gateway.model.HeaderStyle;

/**
 * 一次上游调用所需的账号上下文
 *
 * @param account          选中的账号
 * @param accessToken      访问凭证（OpenAI 兼容账号为 API Key）
 * @param headerStyle      Antigravity 请求路径，其他 provider 为 null
 * @param projectId        Antigravity 项目 ID（缺省时使用默认项目），其他 provider 为 null
 * @param managedProjectId Antigravity 托管项目 ID，可为 null
 */
public record AccountSession(Account account, String accessToken, HeaderStyle headerStyle,
                             String projectId, String managedProjectId) {
}
