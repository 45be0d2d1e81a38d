package world.willfrog.storeagent.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Unified response envelope.
 * @param <T> payload type
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

    /**
     * Request id for tracing, filled by callers that have one.
     */
    private String requestId;

    public static <T> ResponseWrapper<T> success(T data) {
        return success(data, ResponseCode.SUCCESS.getMessage());
    }

    public static <T> ResponseWrapper<T> success(T data, String message) {
        return ResponseWrapper.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .message(message)
                .data(data)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static <T> ResponseWrapper<T> error(ResponseCode responseCode) {
        return error(responseCode, responseCode.getMessage());
    }

    public static <T> ResponseWrapper<T> error(ResponseCode responseCode, String message) {
        return ResponseWrapper.<T>builder()
                .code(responseCode.getCode())
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static <T> ResponseWrapper<T> notFound(String message) {
        return error(ResponseCode.DATA_NOT_FOUND, message);
    }

    public static <T> ResponseWrapper<T> paramError(String message) {
        return error(ResponseCode.PARAM_ERROR, message);
    }

    public boolean isSuccess() {
        return ResponseCode.SUCCESS.getCode().equals(this.code);
    }
}
