package org.arena.stream;

/**
 * 推理内容的输出方式
 */
public enum ReasoningMode {
    /** 输出到 reasoning_content 字段 */
    FIELD,
    /** 拼接进 content，客户端不支持推理字段时使用，会丢失区分 */
    INLINE
}
