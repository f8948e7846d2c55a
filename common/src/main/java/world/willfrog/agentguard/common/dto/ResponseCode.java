package world.willfrog.agentguard.common.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 响应状态码，取值即 HTTP 状态码
 */
@Getter
@AllArgsConstructor
public enum ResponseCode {

    SUCCESS("200", "成功"),

    PARAM_ERROR("400", "参数错误"),

    /**
     * 准入拒绝，data 中携带具体拒绝码
     */
    ADMISSION_DENIED("403", "请求被拒绝"),

    DATA_NOT_FOUND("404", "数据未找到"),

    /**
     * 目标状态不允许该操作，例如暂停一个非 ACTIVE 的 agent
     */
    STATUS_CONFLICT("409", "状态冲突"),

    TOO_MANY_REQUESTS("429", "请求过于频繁"),

    SYSTEM_ERROR("500", "系统内部错误"),

    /**
     * 账本或缓存暂不可用，可重试
     */
    SERVICE_UNAVAILABLE("503", "服务不可用");

    private final String code;

    private final String message;

    public int httpStatus() {
        return Integer.parseInt(code);
    }
}
