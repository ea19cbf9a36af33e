package com.overseer.domain.workflow.adapter.gateway;

/**
 * 会话回复读取端口。
 */
@FunctionalInterface
public interface IReplyReader {

    /**
     * 读取会话中最近一条 assistant 回复文本。
     *
     * @param sessionKey 会话 Key
     * @return 回复文本，会话中还没有 assistant 回复时返回 null
     */
    String readLatestReply(String sessionKey);
}
