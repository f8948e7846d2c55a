package world.willfrog.agentguard.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应包装类，code 与 HTTP 状态码一致
 * @param <T> 响应数据类型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseWrapper<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    private String code;

    private String message;

    private T data;

    private long timestamp;

    public static <T> ResponseWrapper<T> success(T data) {
        return success(data, ResponseCode.SUCCESS.getMessage());
    }

    public static <T> ResponseWrapper<T> success(T data, String message) {
        return of(ResponseCode.SUCCESS, message, data);
    }

    public static <T> ResponseWrapper<T> error(ResponseCode responseCode, String message) {
        return of(responseCode, message, null);
    }

    /**
     * 错误响应，附带结构化数据（例如准入拒绝详情）
     */
    public static <T> ResponseWrapper<T> error(ResponseCode responseCode, String message, T data) {
        return of(responseCode, message, data);
    }

    private static <T> ResponseWrapper<T> of(ResponseCode responseCode, String message, T data) {
        return ResponseWrapper.<T>builder()
                .code(responseCode.getCode())
                .message(message)
                .data(data)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
